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

package net.opentsdb.aura.tsdb.core.retention;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import net.opentsdb.aura.tsdb.core.Granularity;
import net.opentsdb.aura.tsdb.core.store.Bucket;
import net.opentsdb.aura.tsdb.core.store.MetricValueStore;
import net.opentsdb.aura.tsdb.core.store.Partition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Evicts buckets past the retention of their level.
 *
 * <p>A bucket is only evicted once its current content is represented at the next coarser level:
 * the coarser bucket must have folded it at its latest revision, and a coarser bucket is kept as
 * long as any finer bucket of its interval is alive. Eviction is deferred, never forced.
 */
public class RetentionManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetentionManager.class);

  private final Counter evictedCounter;
  private final Counter deferredCounter;
  private final Timer sweepTimer;

  public RetentionManager(final MeterRegistry registry) {
    this.evictedCounter = registry.counter("retention.evicted.count");
    this.deferredCounter = registry.counter("retention.deferred.count");
    this.sweepTimer = registry.timer("retention.sweep.time");
  }

  /** @return number of buckets evicted across all stores. */
  public int sweep(final Iterable<MetricValueStore> stores, final long now) {
    long begin = System.nanoTime();
    int evicted = 0;
    for (MetricValueStore store : stores) {
      try {
        evicted += expire(store, now);
      } catch (RuntimeException e) {
        LOGGER.error("Error expiring store {}", store, e);
      }
    }
    sweepTimer.record(System.nanoTime() - begin, TimeUnit.NANOSECONDS);
    if (evicted > 0) {
      LOGGER.debug("Retention at {} evicted {} buckets", now, evicted);
    }
    return evicted;
  }

  /** Evicts the expired buckets of one store, finest level first. */
  public int expire(final MetricValueStore store, final long now) {
    int evicted = 0;
    for (int level = 0; level < store.levels(); level++) {
      evicted += expireLevel(store, level, now);
    }
    return evicted;
  }

  private int expireLevel(final MetricValueStore store, final int level, final long now) {
    Partition partition = store.partition(level);
    Partition finer = level > 0 ? store.partition(level - 1) : null;
    Partition coarser = level < store.levels() - 1 ? store.partition(level + 1) : null;

    int evicted = 0;
    for (Bucket bucket : partition.expired(now).values()) {
      if (finer != null && finer.hasBuckets(bucket.getStart(), bucket.getEnd())) {
        deferredCounter.increment();
        continue;
      }
      Bucket target = null;
      if (coarser != null) {
        Granularity coarse = coarser.getGranularity();
        target = coarser.get(coarse.bucketStart(bucket.getStart()));
        if (target == null) {
          deferredCounter.increment();
          continue;
        }
      }
      if (!bucket.evictIfFolded(target)) {
        deferredCounter.increment();
        continue;
      }
      partition.unlink(bucket);
      if (target != null) {
        target.finalizeContribution(bucket.getStart());
      }
      evictedCounter.increment();
      evicted++;
    }
    return evicted;
  }
}
