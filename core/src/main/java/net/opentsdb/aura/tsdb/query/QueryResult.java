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

import java.util.Collections;
import java.util.List;

public class QueryResult {

  private final int granularitySeconds;
  private final List<SeriesResult> series;
  private final List<GroupResult> groups;
  private final List<Gap> gaps;

  public QueryResult(
      final int granularitySeconds,
      final List<SeriesResult> series,
      final List<GroupResult> groups,
      final List<Gap> gaps) {
    this.granularitySeconds = granularitySeconds;
    this.series = series;
    this.groups = groups;
    this.gaps = gaps;
  }

  /** No series matched the primary filter. */
  public static QueryResult empty(final int granularitySeconds) {
    return new QueryResult(
        granularitySeconds,
        Collections.emptyList(),
        Collections.emptyList(),
        Collections.emptyList());
  }

  public int getGranularitySeconds() {
    return granularitySeconds;
  }

  public List<SeriesResult> getSeries() {
    return series;
  }

  /**
   * @return the merged groups ordered by their tag values, empty unless the query was grouped. The
   *     series of a grouped query carry their gaps but no points.
   */
  public List<GroupResult> getGroups() {
    return groups;
  }

  /** @return sub-ranges where none of the matched series has a bucket */
  public List<Gap> getGaps() {
    return gaps;
  }

  public boolean isEmpty() {
    return series.isEmpty();
  }

  @Override
  public String toString() {
    return "QueryResult{"
        + granularitySeconds
        + "s, "
        + series
        + (groups.isEmpty() ? "" : ", groups=" + groups)
        + ", gaps="
        + gaps
        + "}";
  }
}
