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

/**
 * A consistent copy of a bucket's records taken inside its critical section. Records are ordered
 * by bitmask, compared unsigned.
 */
public class BucketSnapshot {

  private final long start;
  private final long revision;
  private final long[] bitmasks;
  private final AggregateState[] states;

  BucketSnapshot(
      final long start, final long revision, final long[] bitmasks, final AggregateState[] states) {
    this.start = start;
    this.revision = revision;
    this.bitmasks = bitmasks;
    this.states = states;
  }

  public long getStart() {
    return start;
  }

  public long getRevision() {
    return revision;
  }

  public int size() {
    return bitmasks.length;
  }

  public long bitmask(final int index) {
    return bitmasks[index];
  }

  /** The returned state belongs to the snapshot. Copy it before mutating. */
  public AggregateState state(final int index) {
    return states[index];
  }

  public BucketRecord record(final int index) {
    return new BucketRecord(start, bitmasks[index], states[index]);
  }
}
