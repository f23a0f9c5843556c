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

import net.opentsdb.aura.tsdb.core.MetricType;
import net.opentsdb.aura.tsdb.core.Payload;
import net.opentsdb.aura.tsdb.core.downsample.GaugeReducer;

/**
 * Mergeable aggregate kept per (bucket, secondary tag bitmask). Instances are mutated only inside
 * the owning bucket's critical section; everything handed to readers is a {@link #copy()}.
 */
public abstract class AggregateState {

  public abstract MetricType type();

  /** Folds one raw sample in. The payload shape was validated by the caller. */
  public abstract void add(Payload payload, long timestamp);

  /** Folds another state of the same type in. */
  public abstract void merge(AggregateState other);

  public abstract AggregateState copy();

  /**
   * @param reducer only consulted by gauges
   * @return the read time value of this record
   */
  public abstract double value(GaugeReducer reducer);

  /** @return true when an accumulator saturated and the value lost precision. */
  public boolean isDegraded() {
    return false;
  }

  protected void checkSameType(final AggregateState other) {
    if (other.type() != type()) {
      throw new IllegalArgumentException("Can not merge " + other.type() + " into " + type());
    }
  }
}
