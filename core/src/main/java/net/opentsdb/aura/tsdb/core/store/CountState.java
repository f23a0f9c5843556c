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

public class CountState extends AggregateState {

  private long sum; // unsigned
  private boolean degraded;

  @Override
  public MetricType type() {
    return MetricType.COUNT;
  }

  @Override
  public void add(final Payload payload, final long timestamp) {
    accumulate(((Payload.Count) payload).getCount());
  }

  @Override
  public void merge(final AggregateState other) {
    checkSameType(other);
    CountState that = (CountState) other;
    accumulate(that.sum);
    degraded |= that.degraded;
  }

  private void accumulate(final long value) {
    if (Accumulators.overflows(sum, value)) {
      degraded = true;
    }
    sum = Accumulators.add(sum, value);
  }

  @Override
  public CountState copy() {
    CountState copy = new CountState();
    copy.sum = sum;
    copy.degraded = degraded;
    return copy;
  }

  @Override
  public double value(final GaugeReducer reducer) {
    return Accumulators.toDouble(sum);
  }

  /** @return the sum as an unsigned 64 bit value */
  public long getSum() {
    return sum;
  }

  @Override
  public boolean isDegraded() {
    return degraded;
  }

  @Override
  public String toString() {
    return "CountState{sum=" + Accumulators.toString(sum) + ", degraded=" + degraded + "}";
  }
}
