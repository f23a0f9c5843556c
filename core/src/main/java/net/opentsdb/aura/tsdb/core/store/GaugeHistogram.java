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
import gnu.trove.map.hash.TIntLongHashMap;

import java.util.Arrays;

/**
 * Sparse log-linear histogram of gauge samples. Each binary exponent is split into
 * {@link #SUB_BUCKETS} linear bins so a bin midpoint is within 1/64 of the value it stands for.
 * Two histograms always share the same bin boundaries, so merging is exact and rollups answer
 * percentiles as well as the raw buckets they were folded from.
 */
public class GaugeHistogram {

  public static final int SUB_BUCKETS = 32;

  private final TIntLongHashMap positive;
  private final TIntLongHashMap negative;
  private long zeros;
  private long count;

  public GaugeHistogram() {
    this(new TIntLongHashMap(), new TIntLongHashMap(), 0, 0);
  }

  private GaugeHistogram(
      final TIntLongHashMap positive,
      final TIntLongHashMap negative,
      final long zeros,
      final long count) {
    this.positive = positive;
    this.negative = negative;
    this.zeros = zeros;
    this.count = count;
  }

  /** NaN samples are not counted. */
  public void add(final double value) {
    if (Double.isNaN(value)) {
      return;
    }
    if (value > 0) {
      positive.adjustOrPutValue(index(value), 1, 1);
    } else if (value < 0) {
      negative.adjustOrPutValue(index(-value), 1, 1);
    } else {
      zeros++;
    }
    count++;
  }

  public void merge(final GaugeHistogram other) {
    for (int bin : other.positive.keys()) {
      long n = other.positive.get(bin);
      positive.adjustOrPutValue(bin, n, n);
    }
    for (int bin : other.negative.keys()) {
      long n = other.negative.get(bin);
      negative.adjustOrPutValue(bin, n, n);
    }
    zeros += other.zeros;
    count += other.count;
  }

  public GaugeHistogram copy() {
    return new GaugeHistogram(
        new TIntLongHashMap(positive), new TIntLongHashMap(negative), zeros, count);
  }

  public long getCount() {
    return count;
  }

  /**
   * Nearest rank percentile: the midpoint of the bin holding the sample of rank
   * {@code ceil(p / 100 * count)}.
   *
   * @param percentile in (0, 100]
   * @return the approximate value, NaN when empty
   */
  public double percentile(final double percentile) {
    Preconditions.checkArgument(
        percentile > 0 && percentile <= 100, "Percentile must be in (0, 100]: %s", percentile);
    if (count == 0) {
      return Double.NaN;
    }
    long rank = Math.max(1, Math.min(count, (long) Math.ceil(percentile / 100.0 * count)));

    // most negative first: larger bins of the negative side hold larger magnitudes
    int[] bins = negative.keys();
    Arrays.sort(bins);
    for (int i = bins.length - 1; i >= 0; i--) {
      rank -= negative.get(bins[i]);
      if (rank <= 0) {
        return -midpoint(bins[i]);
      }
    }
    rank -= zeros;
    if (rank <= 0) {
      return 0;
    }
    bins = positive.keys();
    Arrays.sort(bins);
    for (int bin : bins) {
      rank -= positive.get(bin);
      if (rank <= 0) {
        return midpoint(bin);
      }
    }
    throw new IllegalStateException("Histogram bins do not add up to " + count);
  }

  static int index(final double magnitude) {
    int exponent =
        Math.max(Double.MIN_EXPONENT, Math.min(Double.MAX_EXPONENT, Math.getExponent(magnitude)));
    double fraction = magnitude / Math.scalb(1.0, exponent);
    int sub = (int) ((fraction - 1.0) * SUB_BUCKETS);
    return exponent * SUB_BUCKETS + Math.max(0, Math.min(SUB_BUCKETS - 1, sub));
  }

  static double midpoint(final int bin) {
    int exponent = Math.floorDiv(bin, SUB_BUCKETS);
    int sub = Math.floorMod(bin, SUB_BUCKETS);
    return Math.scalb(1.0 + (sub + 0.5) / SUB_BUCKETS, exponent);
  }

  @Override
  public String toString() {
    return "GaugeHistogram{count="
        + count
        + ", bins="
        + (positive.size() + negative.size())
        + ", zeros="
        + zeros
        + "}";
  }
}
