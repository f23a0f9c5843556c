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

import java.util.List;
import java.util.SortedMap;

public class SeriesResult {

  private final int seriesId;
  private final SortedMap<String, String> primaryTags;
  private final MetricType type;
  private final List<DataPoint> dataPoints;
  private final List<Gap> gaps;

  public SeriesResult(
      final int seriesId,
      final SortedMap<String, String> primaryTags,
      final MetricType type,
      final List<DataPoint> dataPoints,
      final List<Gap> gaps) {
    this.seriesId = seriesId;
    this.primaryTags = primaryTags;
    this.type = type;
    this.dataPoints = dataPoints;
    this.gaps = gaps;
  }

  public int getSeriesId() {
    return seriesId;
  }

  public SortedMap<String, String> getPrimaryTags() {
    return primaryTags;
  }

  public MetricType getType() {
    return type;
  }

  public List<DataPoint> getDataPoints() {
    return dataPoints;
  }

  public List<Gap> getGaps() {
    return gaps;
  }

  @Override
  public String toString() {
    return "SeriesResult{" + primaryTags + ", " + type + ", " + dataPoints + ", gaps=" + gaps + "}";
  }
}
