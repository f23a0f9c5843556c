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

import com.google.common.primitives.UnsignedLongs;
import gnu.trove.map.hash.TLongObjectHashMap;
import gnu.trove.set.hash.TLongHashSet;
import net.opentsdb.aura.tsdb.core.MetricType;
import net.opentsdb.aura.tsdb.core.Payload;
import net.opentsdb.aura.tsdb.core.RollupInvariantException;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A fixed width, aligned time interval of one series at one granularity. Holds one aggregate per
 * distinct secondary tag bitmask.
 *
 * <p>Every mutation and every snapshot runs inside this bucket's own lock, so concurrent writers
 * to the same bucket merge correctly and readers never observe a half-applied merge. Unrelated
 * buckets never contend.
 *
 * <p>Buckets of coarser levels also remember which finer buckets were folded into them, and at
 * which revision. Re-folding the same revision is a no-op; a newer revision (a late sample)
 * replaces the previous contribution. Once retention evicts a finer bucket its contribution is
 * finalized into a sealed base and the snapshot is released.
 */
public class Bucket {

  private final int level;
  private final long start;
  private final int width;
  private final MetricType type;
  private final ReentrantLock lock = new ReentrantLock();
  private final TLongObjectHashMap<AggregateState> records = new TLongObjectHashMap<>();

  private long revision;
  private boolean evicted;

  private TLongObjectHashMap<BucketSnapshot> contributions;
  private TLongObjectHashMap<AggregateState> sealed;
  private TLongHashSet finalized;

  public Bucket(final int level, final long start, final int width, final MetricType type) {
    this.level = level;
    this.start = start;
    this.width = width;
    this.type = type;
  }

  public int getLevel() {
    return level;
  }

  public long getStart() {
    return start;
  }

  public long getEnd() {
    return start + width;
  }

  public boolean isClosed(final long now) {
    return getEnd() <= now;
  }

  /**
   * Merges one raw sample into the record for {@code bitmask}.
   *
   * @return false if the bucket was evicted and the sample was not applied.
   */
  public boolean merge(final long bitmask, final Payload payload, final long timestamp) {
    lock.lock();
    try {
      if (evicted) {
        return false;
      }
      AggregateState state = records.get(bitmask);
      if (state == null) {
        state = type.newState();
        records.put(bitmask, state);
      }
      state.add(payload, timestamp);
      revision++;
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** @return a copy of the records, or null once evicted. */
  public BucketSnapshot snapshot() {
    lock.lock();
    try {
      if (evicted) {
        return null;
      }
      long[] bitmasks = records.keys();
      UnsignedLongs.sort(bitmasks);
      AggregateState[] states = new AggregateState[bitmasks.length];
      for (int i = 0; i < bitmasks.length; i++) {
        states[i] = records.get(bitmasks[i]).copy();
      }
      return new BucketSnapshot(start, revision, bitmasks, states);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Folds finer bucket snapshots into this bucket and recomputes the aggregate when any
   * contribution changed.
   *
   * @return true when the aggregate changed, false when every snapshot was already folded at the
   *     same revision or this bucket is evicted.
   * @throws RollupInvariantException when a finer bucket is folded at an older revision than the
   *     one already incorporated, or after it was finalized.
   */
  public boolean fold(final List<BucketSnapshot> finer) {
    lock.lock();
    try {
      if (evicted) {
        return false;
      }
      if (contributions == null) {
        contributions = new TLongObjectHashMap<>();
      }
      // validate everything first so a violation leaves the bucket untouched
      boolean changed = false;
      for (int i = 0; i < finer.size(); i++) {
        BucketSnapshot snapshot = finer.get(i);
        long finerStart = snapshot.getStart();
        if (finerStart < start || finerStart >= getEnd()) {
          throw new RollupInvariantException(
              "Finer bucket " + finerStart + " is outside of " + this);
        }
        if (finalized != null && finalized.contains(finerStart)) {
          throw new RollupInvariantException(
              "Finer bucket " + finerStart + " was already finalized into " + this);
        }
        BucketSnapshot previous = contributions.get(finerStart);
        if (previous == null || previous.getRevision() < snapshot.getRevision()) {
          changed = true;
        } else if (previous.getRevision() > snapshot.getRevision()) {
          throw new RollupInvariantException(
              "Finer bucket "
                  + finerStart
                  + " revision went back from "
                  + previous.getRevision()
                  + " to "
                  + snapshot.getRevision()
                  + " in "
                  + this);
        }
      }
      if (!changed) {
        return false;
      }
      for (int i = 0; i < finer.size(); i++) {
        BucketSnapshot snapshot = finer.get(i);
        contributions.put(snapshot.getStart(), snapshot);
      }
      recompute();
      revision++;
      return true;
    } finally {
      lock.unlock();
    }
  }

  private void recompute() {
    records.clear();
    if (sealed != null) {
      sealed.forEachEntry(
          (bitmask, state) -> {
            records.put(bitmask, state.copy());
            return true;
          });
    }
    contributions.forEachValue(
        snapshot -> {
          mergeInto(records, snapshot);
          return true;
        });
  }

  private static void mergeInto(
      final TLongObjectHashMap<AggregateState> target, final BucketSnapshot snapshot) {
    for (int i = 0; i < snapshot.size(); i++) {
      long bitmask = snapshot.bitmask(i);
      AggregateState existing = target.get(bitmask);
      if (existing == null) {
        target.put(bitmask, snapshot.state(i).copy());
      } else {
        existing.merge(snapshot.state(i));
      }
    }
  }

  /** @return the revision of the finer bucket folded in, -1 if it was never folded. */
  public long foldedRevision(final long finerStart) {
    lock.lock();
    try {
      if (contributions == null) {
        return -1;
      }
      BucketSnapshot snapshot = contributions.get(finerStart);
      return snapshot == null ? -1 : snapshot.getRevision();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Called once the finer bucket has been evicted: its contribution becomes part of the sealed
   * base and can no longer change.
   */
  public void finalizeContribution(final long finerStart) {
    lock.lock();
    try {
      if (evicted || contributions == null) {
        return;
      }
      BucketSnapshot snapshot = contributions.remove(finerStart);
      if (snapshot == null) {
        return;
      }
      if (sealed == null) {
        sealed = new TLongObjectHashMap<>();
        finalized = new TLongHashSet();
      }
      mergeInto(sealed, snapshot);
      finalized.add(finerStart);
    } finally {
      lock.unlock();
    }
  }

  /**
   * First phase of eviction. Marks the bucket evicted, provided its current revision has been
   * folded into {@code coarser}. Pass null for the coarsest level.
   *
   * @return true if the bucket is now evicted and can be unlinked.
   */
  public boolean evictIfFolded(final Bucket coarser) {
    lock.lock();
    try {
      if (evicted) {
        return false;
      }
      if (coarser != null && coarser.foldedRevision(start) != revision) {
        return false;
      }
      evicted = true;
      records.clear();
      contributions = null;
      sealed = null;
      finalized = null;
      return true;
    } finally {
      lock.unlock();
    }
  }

  public boolean isEvicted() {
    lock.lock();
    try {
      return evicted;
    } finally {
      lock.unlock();
    }
  }

  public long getRevision() {
    lock.lock();
    try {
      return revision;
    } finally {
      lock.unlock();
    }
  }

  /** @return number of finer buckets whose snapshots are still held. */
  public int pendingContributions() {
    lock.lock();
    try {
      return contributions == null ? 0 : contributions.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "Bucket{G" + level + ", [" + start + ", " + getEnd() + ")}";
  }
}
