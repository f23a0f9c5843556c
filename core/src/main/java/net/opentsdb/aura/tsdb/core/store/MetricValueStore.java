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

import com.google.common.base.Preconditions;
import net.opentsdb.aura.tsdb.core.BucketExpiredException;
import net.opentsdb.aura.tsdb.core.Granularities;
import net.opentsdb.aura.tsdb.core.Granularity;
import net.opentsdb.aura.tsdb.core.MetricType;
import net.opentsdb.aura.tsdb.core.Payload;

import java.util.Iterator;
import java.util.NavigableSet;
import java.util.NoSuchElementException;

/** Per series storage: one {@link Partition} per granularity level. */
public class MetricValueStore {

  private final MetricType type;
  private final Granularities granularities;
  private final Partition[] partitions;

  public MetricValueStore(final MetricType type, final Granularities granularities) {
    this.type = type;
    this.granularities = granularities;
    this.partitions = new Partition[granularities.size()];
    for (int i = 0; i < partitions.length; i++) {
      partitions[i] = new Partition(granularities.get(i), type);
    }
  }

  public MetricType getType() {
    return type;
  }

  public Granularities getGranularities() {
    return granularities;
  }

  public Partition partition(final int level) {
    return partitions[level];
  }

  public int levels() {
    return partitions.length;
  }

  /**
   * Merges one sample into the raw bucket covering {@code timestamp}. Late samples land in their
   * historical bucket as long as it is within retention.
   *
   * @throws BucketExpiredException when the bucket is past the raw retention horizon or already
   *     evicted.
   */
  public void appendRaw(
      final long timestamp, final Payload payload, final long bitmask, final long now)
      throws BucketExpiredException {
    Preconditions.checkArgument(
        type.accepts(payload), "Payload %s does not match the %s series", payload, type);
    Granularity raw = granularities.raw();
    long start = raw.bucketStart(timestamp);
    if (raw.isExpired(start, now)) {
      throw new BucketExpiredException(timestamp, start, raw.getWidth());
    }
    Partition partition = partitions[0];
    Bucket bucket = partition.getOrCreate(start);
    if (!bucket.merge(bitmask, payload, timestamp)) {
      // lost the race with eviction
      partition.unlink(bucket);
      throw new BucketExpiredException(timestamp, start, raw.getWidth());
    }
    if (partitions.length > 1) {
      partition.markPending(start);
    }
  }

  /**
   * Lazily reads the records of every bucket overlapping [start, end) at {@code level}, ordered by
   * bucket start then by bitmask. Each call to {@code iterator()} restarts the read; buckets are
   * snapshotted one at a time as the iteration reaches them.
   */
  public Iterable<BucketRecord> read(final int level, final long start, final long end) {
    final Partition partition = partitions[level];
    final long from = partition.getGranularity().bucketStart(start);
    return () -> new RecordIterator(partition.range(from, end).values().iterator());
  }

  /** @return live, ascending view of the starts of the buckets overlapping [start, end) at {@code level} */
  public NavigableSet<Long> bucketStarts(final int level, final long start, final long end) {
    Partition partition = partitions[level];
    return partition.range(partition.getGranularity().bucketStart(start), end).navigableKeySet();
  }

  public long bucketCount() {
    long count = 0;
    for (int i = 0; i < partitions.length; i++) {
      count += partitions[i].size();
    }
    return count;
  }

  public boolean isEmpty() {
    for (int i = 0; i < partitions.length; i++) {
      if (!partitions[i].isEmpty()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return "MetricValueStore{" + type + ", buckets=" + bucketCount() + "}";
  }

  private static class RecordIterator implements Iterator<BucketRecord> {

    private final Iterator<Bucket> buckets;
    private BucketSnapshot current;
    private int index;

    RecordIterator(final Iterator<Bucket> buckets) {
      this.buckets = buckets;
    }

    @Override
    public boolean hasNext() {
      while (current == null || index >= current.size()) {
        if (!buckets.hasNext()) {
          return false;
        }
        current = buckets.next().snapshot();
        index = 0;
      }
      return true;
    }

    @Override
    public BucketRecord next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return current.record(index++);
    }
  }
}
