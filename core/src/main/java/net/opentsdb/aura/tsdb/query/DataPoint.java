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

package net.opentsdb.aura.tsdb.query;

import net.opentsdb.aura.tsdb.core.store.AggregateState;

import java.util.SortedMap;

/**
 * One value of a query result: a bucket, optionally broken down by secondary tags. The raw
 * aggregate is kept alongside the reduced value so callers can read sums, counts and ratio
 * components.
 */
public class DataPoint {

  private final long timestamp;
  private final SortedMap<String, String> tags;
  private final double value;
  private final AggregateState state;

  public DataPoint(
      final long timestamp,
      final SortedMap<String, String> tags,
      final double value,
      final AggregateState state) {
    this.timestamp = timestamp;
    this.tags = tags;
    this.value = value;
    this.state = state;
  }

  /** @return the bucket start, epoch seconds */
  public long getTimestamp() {
    return timestamp;
  }

  /** @return the secondary tags of the record, null when tags were collapsed */
  public SortedMap<String, String> getTags() {
    return tags;
  }

  public double getValue() {
    return value;
  }

  public AggregateState getState() {
    return state;
  }

  public boolean isDegraded() {
    return state.isDegraded();
  }

  @Override
  public String toString() {
    return "DataPoint{"
        + timestamp
        + (tags == null ? "" : ", " + tags)
        + ", "
        + value
        + (isDegraded() ? ", degraded" : "")
        + "}";
  }
}
