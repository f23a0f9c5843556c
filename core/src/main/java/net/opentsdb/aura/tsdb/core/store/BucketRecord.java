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

import net.opentsdb.aura.tsdb.core.downsample.GaugeReducer;

/** One (bucketStart, bitmask, aggregate) triple produced by the read path. */
public class BucketRecord {

  private final long bucketStart;
  private final long bitmask;
  private final AggregateState state;

  public BucketRecord(final long bucketStart, final long bitmask, final AggregateState state) {
    this.bucketStart = bucketStart;
    this.bitmask = bitmask;
    this.state = state;
  }

  public long getBucketStart() {
    return bucketStart;
  }

  public long getBitmask() {
    return bitmask;
  }

  public AggregateState getState() {
    return state;
  }

  public double value(final GaugeReducer reducer) {
    return state.value(reducer);
  }

  public boolean isDegraded() {
    return state.isDegraded();
  }

  @Override
  public String toString() {
    return "BucketRecord{start="
        + bucketStart
        + ", bitmask="
        + Long.toBinaryString(bitmask)
        + ", state="
        + state
        + "}";
  }
}
