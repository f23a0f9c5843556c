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

package net.opentsdb.aura.tsdb.core.downsample;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import net.opentsdb.aura.tsdb.core.Granularity;
import net.opentsdb.aura.tsdb.core.RollupInvariantException;
import net.opentsdb.aura.tsdb.core.store.Bucket;
import net.opentsdb.aura.tsdb.core.store.BucketSnapshot;
import net.opentsdb.aura.tsdb.core.store.MetricValueStore;
import net.opentsdb.aura.tsdb.core.store.Partition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableSet;
import java.util.concurrent.TimeUnit;

/**
 * Folds closed buckets of each level into the next coarser level.
 *
 * <p>A coarse interval is eligible once its end is at or before {@code now}. For every eligible
 * interval the finer buckets written since the last fold are snapshotted and handed to the coarse
 * bucket, which replaces their previous contributions. Running a sweep twice without new writes
 * changes nothing. Levels are processed finest first so a single sweep can carry data all the way
 * up once the coarser intervals close.
 */
public class RollupEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(RollupEngine.class);

  private final Counter foldedCounter;
  private final Counter failureCounter;
  private final Counter invariantCounter;
  private final Timer sweepTimer;

  public RollupEngine(final MeterRegistry registry) {
    this.foldedCounter = registry.counter("rollup.bucket.count");
    this.failureCounter = registry.counter("rollup.failure.count");
    this.invariantCounter = registry.counter("rollup.invariant.count");
    this.sweepTimer = registry.timer("rollup.sweep.time");
  }

  /**
   * Rolls up every store.
   *
   * @return number of coarse buckets whose aggregate changed.
   */
  public int sweep(final Iterable<MetricValueStore> stores, final long now) {
    long begin = System.nanoTime();
    int changed = 0;
    int failed = 0;
    for (MetricValueStore store : stores) {
      try {
        changed += rollup(store, now);
      } catch (RuntimeException e) {
        failed++;
        LOGGER.error("Error rolling up store {}", store, e);
      }
    }
    sweepTimer.record(System.nanoTime() - begin, TimeUnit.NANOSECONDS);
    if (changed > 0 || failed > 0) {
      LOGGER.debug("Rollup at {} changed {} buckets, {} stores failed", now, changed, failed);
    }
    return changed;
  }

  /** @return number of coarse buckets of this store whose aggregate changed. */
  public int rollup(final MetricValueStore store, final long now) {
    int changed = 0;
    for (int level = 1; level < store.levels(); level++) {
      changed += foldLevel(store, level, now);
    }
    return changed;
  }

  /**
   * @return end of the latest coarse interval folded into {@code level}, {@code Long.MIN_VALUE}
   *     if nothing was folded yet.
   */
  public long rolledUpThrough(final MetricValueStore store, final int level) {
    return store.partition(level).getRolledUpThrough();
  }

  /** Folds pending buckets of {@code level - 1} into {@code level}. */
  int foldLevel(final MetricValueStore store, final int level, final long now) {
    Partition finer = store.partition(level - 1);
    Partition coarser = store.partition(level);
    Granularity coarse = coarser.getGranularity();
    boolean coarsest = level == store.levels() - 1;

    NavigableSet<Long> pending = finer.pending();
    int changed = 0;
    Iterator<Long> iterator = pending.iterator();
    List<Long> group = new ArrayList<>();
    long groupStart = Long.MIN_VALUE;
    while (iterator.hasNext()) {
      long finerStart = iterator.next();
      long coarseStart = coarse.bucketStart(finerStart);
      if (coarse.bucketEnd(coarseStart) > now) {
        // pending is ordered, nothing further along is eligible either
        break;
      }
      if (coarseStart != groupStart && !group.isEmpty()) {
        if (fold(finer, coarser, groupStart, group, coarsest)) {
          changed++;
        }
        group.clear();
      }
      groupStart = coarseStart;
      group.add(finerStart);
    }
    if (!group.isEmpty() && fold(finer, coarser, groupStart, group, coarsest)) {
      changed++;
    }
    return changed;
  }

  private boolean fold(
      final Partition finer,
      final Partition coarser,
      final long coarseStart,
      final List<Long> finerStarts,
      final boolean coarsest) {
    // clear before snapshotting: a write racing with us re-marks the bucket for the next sweep
    for (int i = 0; i < finerStarts.size(); i++) {
      finer.clearPending(finerStarts.get(i));
    }
    try {
      List<BucketSnapshot> snapshots = new ArrayList<>(finerStarts.size());
      for (int i = 0; i < finerStarts.size(); i++) {
        Bucket bucket = finer.get(finerStarts.get(i));
        if (bucket == null) {
          continue;
        }
        BucketSnapshot snapshot = bucket.snapshot();
        if (snapshot != null) {
          snapshots.add(snapshot);
        }
      }
      if (snapshots.isEmpty()) {
        return false;
      }
      Bucket target = coarser.getOrCreate(coarseStart);
      boolean changed = target.fold(snapshots);
      coarser.advanceRolledUpThrough(target.getEnd());
      if (changed) {
        foldedCounter.increment();
        if (!coarsest) {
          coarser.markPending(coarseStart);
        }
      }
      return changed;
    } catch (RollupInvariantException e) {
      invariantCounter.increment();
      LOGGER.error("Rollup invariant violated folding into {}", coarser.getGranularity(), e);
      return false;
    } catch (RuntimeException e) {
      for (int i = 0; i < finerStarts.size(); i++) {
        finer.markPending(finerStarts.get(i));
      }
      failureCounter.increment();
      throw e;
    }
  }
}
