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
 * Keeps enough of the samples to answer every {@link GaugeReducer}: sum and count for the average,
 * min, max and the latest value by timestamp. Equal timestamps resolve to the later write. A
 * {@link GaugeHistogram} of the samples backs percentile reads.
 */
public class GaugeState extends AggregateState {

  private double sum;
  private long count;
  private double min = Double.POSITIVE_INFINITY;
  private double max = Double.NEGATIVE_INFINITY;
  private double last = Double.NaN;
  private long lastTimestamp = Long.MIN_VALUE;
  private GaugeHistogram histogram = new GaugeHistogram();

  @Override
  public MetricType type() {
    return MetricType.GAUGE;
  }

  @Override
  public void add(final Payload payload, final long timestamp) {
    double value = ((Payload.Gauge) payload).getValue();
    sum += value;
    count++;
    min = Math.min(min, value);
    max = Math.max(max, value);
    histogram.add(value);
    if (timestamp >= lastTimestamp) {
      last = value;
      lastTimestamp = timestamp;
    }
  }

  @Override
  public void merge(final AggregateState other) {
    checkSameType(other);
    GaugeState that = (GaugeState) other;
    if (that.count == 0) {
      return;
    }
    sum += that.sum;
    count += that.count;
    min = Math.min(min, that.min);
    max = Math.max(max, that.max);
    histogram.merge(that.histogram);
    if (that.lastTimestamp >= lastTimestamp) {
      last = that.last;
      lastTimestamp = that.lastTimestamp;
    }
  }

  @Override
  public GaugeState copy() {
    GaugeState copy = new GaugeState();
    copy.sum = sum;
    copy.count = count;
    copy.min = min;
    copy.max = max;
    copy.last = last;
    copy.lastTimestamp = lastTimestamp;
    copy.histogram = histogram.copy();
    return copy;
  }

  @Override
  public double value(final GaugeReducer reducer) {
    if (count == 0) {
      return Double.NaN;
    }
    return reducer.reduce(this);
  }

  /**
   * @param percentile in (0, 100]
   * @return the approximate percentile clamped to [min, max], NaN when empty
   */
  public double percentile(final double percentile) {
    double value = histogram.percentile(percentile);
    if (Double.isNaN(value)) {
      return value;
    }
    return Math.max(min, Math.min(max, value));
  }

  public double getSum() {
    return sum;
  }

  public long getCount() {
    return count;
  }

  public double getMin() {
    return min;
  }

  public double getMax() {
    return max;
  }

  public double getLast() {
    return last;
  }

  public long getLastTimestamp() {
    return lastTimestamp;
  }

  public double getAverage() {
    return count == 0 ? Double.NaN : sum / count;
  }

  @Override
  public String toString() {
    return "GaugeState{sum="
        + sum
        + ", count="
        + count
        + ", min="
        + min
        + ", max="
        + max
        + ", last="
        + last
        + "@"
        + lastTimestamp
        + "}";
  }
}
