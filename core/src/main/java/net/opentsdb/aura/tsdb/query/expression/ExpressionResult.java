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

package net.opentsdb.aura.tsdb.query.expression;

import net.opentsdb.aura.tsdb.query.GroupResult;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Either a single value, when the expression reads no query, or one time series of values per
 * group. Timestamps are the bucket or window starts of the underlying queries.
 */
public class ExpressionResult {

  private final boolean scalar;
  private final double value;
  private final SortedMap<SortedMap<String, String>, SortedMap<Long, Double>> groups;

  private ExpressionResult(
      final boolean scalar,
      final double value,
      final SortedMap<SortedMap<String, String>, SortedMap<Long, Double>> groups) {
    this.scalar = scalar;
    this.value = value;
    this.groups = groups;
  }

  public static ExpressionResult scalar(final double value) {
    return new ExpressionResult(true, value, Collections.emptySortedMap());
  }

  public static ExpressionResult grouped(
      final SortedMap<SortedMap<String, String>, SortedMap<Long, Double>> groups) {
    return new ExpressionResult(false, Double.NaN, Collections.unmodifiableSortedMap(groups));
  }

  static TreeMap<SortedMap<String, String>, SortedMap<Long, Double>> newGroups() {
    return new TreeMap<>(GroupResult.GROUP_ORDER);
  }

  public boolean isScalar() {
    return scalar;
  }

  public double getValue() {
    if (!scalar) {
      throw new IllegalStateException("Grouped result has no single value");
    }
    return value;
  }

  /** @return values per group ordered by group, empty for a scalar */
  public SortedMap<SortedMap<String, String>, SortedMap<Long, Double>> getGroups() {
    return groups;
  }

  /** @return the values of {@code group}, empty when the group is not in the result */
  public SortedMap<Long, Double> getValues(final SortedMap<String, String> group) {
    SortedMap<Long, Double> values = groups.get(group);
    return values == null ? Collections.emptySortedMap() : values;
  }

  @Override
  public String toString() {
    return scalar ? "ExpressionResult{" + value + "}" : "ExpressionResult{" + groups + "}";
  }
}
