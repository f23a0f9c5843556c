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

package net.opentsdb.aura.tsdb.core;

import com.google.common.base.Preconditions;

/**
 * The value carried by one sample. There is one case per {@link MetricType} and the case is
 * validated against the series type on every write.
 */
public abstract class Payload {

  private Payload() {}

  public abstract MetricType type();

  public static Gauge gauge(final double value) {
    return new Gauge(value);
  }

  public static Count count(final long count) {
    Preconditions.checkArgument(count >= 0, "Count must be non negative: %s", count);
    return new Count(count);
  }

  public static Ratio ratio(final long numerator, final long denominator) {
    Preconditions.checkArgument(numerator >= 0, "Numerator must be non negative: %s", numerator);
    Preconditions.checkArgument(
        denominator >= 0, "Denominator must be non negative: %s", denominator);
    return new Ratio(numerator, denominator);
  }

  public static final class Gauge extends Payload {
    private final double value;

    private Gauge(final double value) {
      this.value = value;
    }

    public double getValue() {
      return value;
    }

    @Override
    public MetricType type() {
      return MetricType.GAUGE;
    }

    @Override
    public String toString() {
      return "Gauge{" + value + "}";
    }
  }

  public static final class Count extends Payload {
    private final long count;

    private Count(final long count) {
      this.count = count;
    }

    public long getCount() {
      return count;
    }

    @Override
    public MetricType type() {
      return MetricType.COUNT;
    }

    @Override
    public String toString() {
      return "Count{" + count + "}";
    }
  }

  public static final class Ratio extends Payload {
    private final long numerator;
    private final long denominator;

    private Ratio(final long numerator, final long denominator) {
      this.numerator = numerator;
      this.denominator = denominator;
    }

    public long getNumerator() {
      return numerator;
    }

    public long getDenominator() {
      return denominator;
    }

    @Override
    public MetricType type() {
      return MetricType.RATIO;
    }

    @Override
    public String toString() {
      return "Ratio{" + numerator + "/" + denominator + "}";
    }
  }
}
