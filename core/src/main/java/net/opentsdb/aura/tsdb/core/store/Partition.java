/*
 * This file is part of OpenTSDB.
 * Copyright (C) 2021  Yahoo.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.opentsdb.aura.tsdb.core.store;

import net.opentsdb.aura.tsdb.core.Granularity;
import net.opentsdb.aura.tsdb.core.MetricType;

import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The buckets of one series at one granularity, keyed by bucket start.
 *
 * <p>The pending set holds the starts of buckets written (or re-folded) since the rollup engine
 * last looked at them. It is the rollup cursor of the next coarser level.
 */
public class Partition {

  private final Granularity granularity;
  private final MetricType type;
  private final ConcurrentSkipListMap<Long, Bucket> buckets = new ConcurrentSkipListMap<>();
  private final ConcurrentSkipListSet<Long> pending = new ConcurrentSkipListSet<>();
  private final AtomicLong rolledUpThrough = new AtomicLong(Long.MIN_VALUE);

  public Partition(final Granularity granularity, final MetricType type) {
    this.granularity = granularity;
    this.type = type;
  }

  public Granularity getGranularity() {
    return granularity;
  }

  public Bucket get(final long start) {
    return buckets.get(start);
  }

  public Bucket getOrCreate(final long start) {
    return buckets.computeIfAbsent(
        start, s -> new Bucket(granularity.getLevel(), s, granularity.getWidth(), type));
  }

  /** @return live view of the buckets starting in [from, to) */
  public NavigableMap<Long, Bucket> range(final long from, final long to) {
    if (to <= from) {
      return new ConcurrentSkipListMap<>();
    }
    return buckets.subMap(from, true, to, false);
  }

  public boolean hasBuckets(final long from, final long to) {
    return !range(from, to).isEmpty();
  }

  /** @return live view of the buckets whose end is at or before the expiry horizon */
  public NavigableMap<Long, Bucket> expired(final long now) {
    long lastExpiredStart = granularity.expiryHorizon(now) - granularity.getWidth();
    return buckets.headMap(lastExpiredStart, true);
  }

  /** Second phase of eviction: unlinks a bucket that was already marked evicted. */
  public boolean unlink(final Bucket bucket) {
    pending.remove(bucket.getStart());
    return buckets.remove(bucket.getStart(), bucket);
  }

  public void markPending(final long start) {
    pending.add(start);
  }

  public boolean clearPending(final long start) {
    return pending.remove(start);
  }

  public NavigableSet<Long> pending() {
    return pending;
  }

  public long getRolledUpThrough() {
    return rolledUpThrough.get();
  }

  public void advanceRolledUpThrough(final long end) {
    rolledUpThrough.accumulateAndGet(end, Math::max);
  }

  public int size() {
    return buckets.size();
  }

  public boolean isEmpty() {
    return buckets.isEmpty();
  }
}
