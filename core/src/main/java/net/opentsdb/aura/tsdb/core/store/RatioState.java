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
 * Numerator and denominator accumulate independently. The ratio is only computed at read time, so
 * merged values are always sum(numerators) / sum(denominators) and never an average of ratios.
 */
public class RatioState extends AggregateState {

  private long numerator; // unsigned
  private long denominator; // unsigned
  private boolean degraded;

  @Override
  public MetricType type() {
    return MetricType.RATIO;
  }

  @Override
  public void add(final Payload payload, final long timestamp) {
    Payload.Ratio ratio = (Payload.Ratio) payload;
    accumulate(ratio.getNumerator(), ratio.getDenominator());
  }

  @Override
  public void merge(final AggregateState other) {
    checkSameType(other);
    RatioState that = (RatioState) other;
    accumulate(that.numerator, that.denominator);
    degraded |= that.degraded;
  }

  private void accumulate(final long num, final long den) {
    if (Accumulators.overflows(numerator, num) || Accumulators.overflows(denominator, den)) {
      degraded = true;
    }
    numerator = Accumulators.add(numerator, num);
    denominator = Accumulators.add(denominator, den);
  }

  @Override
  public RatioState copy() {
    RatioState copy = new RatioState();
    copy.numerator = numerator;
    copy.denominator = denominator;
    copy.degraded = degraded;
    return copy;
  }

  /** @return numerator / denominator, NaN when the denominator is zero. */
  @Override
  public double value(final GaugeReducer reducer) {
    if (denominator == 0) {
      return Double.NaN;
    }
    return Accumulators.toDouble(numerator) / Accumulators.toDouble(denominator);
  }

  public long getNumerator() {
    return numerator;
  }

  public long getDenominator() {
    return denominator;
  }

  @Override
  public boolean isDegraded() {
    return degraded;
  }

  @Override
  public String toString() {
    return "RatioState{"
        + Accumulators.toString(numerator)
        + "/"
        + Accumulators.toString(denominator)
        + ", degraded="
        + degraded
        + "}";
  }
}
