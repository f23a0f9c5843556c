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

import com.google.common.collect.ImmutableSortedSet;
import net.opentsdb.aura.tsdb.core.downsample.GaugeReducer;
import net.opentsdb.aura.tsdb.meta.PrimaryFilter;
import net.opentsdb.aura.tsdb.meta.SecondaryFilter;

/**
 * What to read: series selected by primary tags, records selected by secondary tags, a time range
 * [start, end) in epoch seconds and the granularity width to read at. Optionally records are merged
 * into groups by tag keys, buckets are merged into wider windows and gauges read as a percentile.
 */
public class QuerySpec {

  private final PrimaryFilter primaryFilter;
  private final SecondaryFilter secondaryFilter;
  private final long start;
  private final long end;
  private final int granularitySeconds;
  private final boolean breakdown;
  private final GaugeReducer reducer;
  private final ImmutableSortedSet<String> groupBy;
  private final double percentile;
  private final int windowSeconds;

  private QuerySpec(final Builder builder) {
    this.primaryFilter = builder.primaryFilter;
    this.secondaryFilter = builder.secondaryFilter;
    this.start = builder.start;
    this.end = builder.end;
    this.granularitySeconds = builder.granularitySeconds;
    this.breakdown = builder.breakdown;
    this.reducer = builder.reducer;
    this.groupBy = builder.groupBy;
    this.percentile = builder.percentile;
    this.windowSeconds = builder.windowSeconds;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder builder =
        new Builder()
            .primaryFilter(primaryFilter)
            .secondaryFilter(secondaryFilter)
            .timeRange(start, end)
            .granularity(granularitySeconds)
            .breakdown(breakdown)
            .reducer(reducer)
            .percentile(percentile)
            .window(windowSeconds);
    builder.groupBy = groupBy;
    return builder;
  }

  public PrimaryFilter getPrimaryFilter() {
    return primaryFilter;
  }

  public SecondaryFilter getSecondaryFilter() {
    return secondaryFilter;
  }

  public long getStart() {
    return start;
  }

  public long getEnd() {
    return end;
  }

  public int getGranularitySeconds() {
    return granularitySeconds;
  }

  public boolean isBreakdown() {
    return breakdown;
  }

  /** @return the gauge reducer for this query, null for the engine default */
  public GaugeReducer getReducer() {
    return reducer;
  }

  public boolean isGrouped() {
    return groupBy != null;
  }

  /** @return the tag keys to group by, empty for a single group, null when not grouped */
  public ImmutableSortedSet<String> getGroupBy() {
    return groupBy;
  }

  /** @return the gauge percentile in (0, 100], 0 to use the reducer */
  public double getPercentile() {
    return percentile;
  }

  /** @return the width buckets are merged into, 0 for one point per bucket */
  public int getWindowSeconds() {
    return windowSeconds;
  }

  @Override
  public String toString() {
    return "QuerySpec{"
        + primaryFilter
        + ", "
        + secondaryFilter
        + ", ["
        + start
        + ", "
        + end
        + "), "
        + granularitySeconds
        + "s"
        + (breakdown ? ", breakdown" : "")
        + (reducer == null ? "" : ", " + reducer)
        + (groupBy == null ? "" : ", groupBy=" + groupBy)
        + (percentile > 0 ? ", p" + percentile : "")
        + (windowSeconds > 0 ? ", window=" + windowSeconds + "s" : "")
        + "}";
  }

  public static class Builder {
    private PrimaryFilter primaryFilter = PrimaryFilter.MATCH_ALL;
    private SecondaryFilter secondaryFilter = SecondaryFilter.MATCH_ALL;
    private long start;
    private long end;
    private int granularitySeconds;
    private boolean breakdown;
    private GaugeReducer reducer;
    private ImmutableSortedSet<String> groupBy;
    private double percentile;
    private int windowSeconds;

    public Builder primaryFilter(final PrimaryFilter primaryFilter) {
      this.primaryFilter = primaryFilter == null ? PrimaryFilter.MATCH_ALL : primaryFilter;
      return this;
    }

    public Builder secondaryFilter(final SecondaryFilter secondaryFilter) {
      this.secondaryFilter = secondaryFilter == null ? SecondaryFilter.MATCH_ALL : secondaryFilter;
      return this;
    }

    public Builder timeRange(final long start, final long end) {
      this.start = start;
      this.end = end;
      return this;
    }

    public Builder granularity(final int granularitySeconds) {
      this.granularitySeconds = granularitySeconds;
      return this;
    }

    public Builder breakdown(final boolean breakdown) {
      this.breakdown = breakdown;
      return this;
    }

    public Builder reducer(final GaugeReducer reducer) {
      this.reducer = reducer;
      return this;
    }

    /** Merges matching records into one group per distinct value combination of {@code keys}. */
    public Builder groupBy(final String... keys) {
      this.groupBy = ImmutableSortedSet.copyOf(keys);
      return this;
    }

    public Builder percentile(final double percentile) {
      this.percentile = percentile;
      return this;
    }

    public Builder window(final int windowSeconds) {
      this.windowSeconds = windowSeconds;
      return this;
    }

    public QuerySpec build() {
      return new QuerySpec(this);
    }
  }
}
