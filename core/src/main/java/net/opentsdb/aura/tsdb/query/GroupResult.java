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

import net.opentsdb.aura.tsdb.core.MetricType;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/** The merged points of every record sharing one combination of group-by tag values. */
public class GroupResult {

  /** Orders groups entry by entry, key first. Groups with the same key set order by values. */
  public static final Comparator<SortedMap<String, String>> GROUP_ORDER =
      (a, b) -> {
        Iterator<Map.Entry<String, String>> left = a.entrySet().iterator();
        Iterator<Map.Entry<String, String>> right = b.entrySet().iterator();
        while (left.hasNext() && right.hasNext()) {
          Map.Entry<String, String> l = left.next();
          Map.Entry<String, String> r = right.next();
          int cmp = l.getKey().compareTo(r.getKey());
          if (cmp == 0) {
            cmp = l.getValue().compareTo(r.getValue());
          }
          if (cmp != 0) {
            return cmp;
          }
        }
        return Integer.compare(a.size(), b.size());
      };

  private final SortedMap<String, String> group;
  private final MetricType type;
  private final List<DataPoint> dataPoints;

  public GroupResult(
      final SortedMap<String, String> group,
      final MetricType type,
      final List<DataPoint> dataPoints) {
    this.group = group;
    this.type = type;
    this.dataPoints = dataPoints;
  }

  /** @return the group-by key to value mapping, empty when grouped by no keys */
  public SortedMap<String, String> getGroup() {
    return group;
  }

  public MetricType getType() {
    return type;
  }

  public List<DataPoint> getDataPoints() {
    return dataPoints;
  }

  @Override
  public String toString() {
    return "GroupResult{" + group + ", " + type + ", " + dataPoints + "}";
  }
}
