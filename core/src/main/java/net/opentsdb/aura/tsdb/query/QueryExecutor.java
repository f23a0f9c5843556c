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
import com.google.common.primitives.UnsignedLongs;
import gnu.trove.list.array.TLongArrayList;
import gnu.trove.map.hash.TLongObjectHashMap;
import gnu.trove.set.hash.TLongHashSet;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import net.opentsdb.aura.tsdb.core.Granularities;
import net.opentsdb.aura.tsdb.core.Granularity;
import net.opentsdb.aura.tsdb.core.MetricType;
import net.opentsdb.aura.tsdb.core.QueryException;
import net.opentsdb.aura.tsdb.core.downsample.GaugeReducer;
import net.opentsdb.aura.tsdb.core.store.AggregateState;
import net.opentsdb.aura.tsdb.core.store.BucketRecord;
import net.opentsdb.aura.tsdb.core.store.GaugeState;
import net.opentsdb.aura.tsdb.meta.SecondaryFilter;
import net.opentsdb.aura.tsdb.meta.SecondaryTagCodec;
import net.opentsdb.aura.tsdb.meta.Series;
import net.opentsdb.aura.tsdb.meta.SeriesCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Reads a {@link QuerySpec}: narrows series by primary tags, reads their buckets at the requested
 * granularity, filters records by secondary tags and either collapses them per bucket, returns
 * them per tag combination or merges them into groups. Never reads other granularities to fill a
 * hole; holes are reported as {@link Gap}s.
 */
public class QueryExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(QueryExecutor.class);

  /** Marks a bitmask whose records lack one of the group-by keys. */
  private static final SortedMap<String, String> NO_GROUP =
      Collections.unmodifiableSortedMap(new TreeMap<>());

  private final SeriesCatalog catalog;
  private final SecondaryTagCodec codec;
  private final Granularities granularities;
  private final GaugeReducer defaultReducer;
  private final Counter queryCounter;
  private final Counter emptyCounter;
  private final Timer queryTimer;

  public QueryExecutor(
      final SeriesCatalog catalog,
      final SecondaryTagCodec codec,
      final Granularities granularities,
      final GaugeReducer defaultReducer,
      final MeterRegistry registry) {
    this.catalog = catalog;
    this.codec = codec;
    this.granularities = granularities;
    this.defaultReducer = defaultReducer;
    this.queryCounter = registry.counter("query.count");
    this.emptyCounter = registry.counter("query.empty.count");
    this.queryTimer = registry.timer("query.time");
  }

  public QueryResult execute(final QuerySpec spec) throws QueryException {
    Granularity granularity = validate(spec);
    long begin = System.nanoTime();
    try {
      queryCounter.increment();
      List<Series> candidates = catalog.findByPrimaryFilter(spec.getPrimaryFilter());
      if (candidates.isEmpty()) {
        emptyCounter.increment();
        LOGGER.debug("No series found for {}", spec);
        return QueryResult.empty(granularity.getWidth());
      }
      MetricType groupType = spec.isGrouped() ? singleType(candidates) : null;

      SecondaryFilter.Compiled filter = spec.getSecondaryFilter().compile(codec);
      if (filter.isUnsatisfiable()) {
        LOGGER.debug("Secondary filter of {} matches no tags, reading bucket starts only", spec);
      }
      Reader reader =
          new Reader(
              granularity,
              spec,
              filter,
              spec.getReducer() == null ? defaultReducer : spec.getReducer());
      TLongHashSet anyPresent = new TLongHashSet();

      List<SeriesResult> results = new ArrayList<>(candidates.size());
      for (Series series : candidates) {
        long[] present = present(series, granularity, spec);
        anyPresent.addAll(present);
        List<DataPoint> points = Collections.emptyList();
        if (!filter.isUnsatisfiable()) {
          if (spec.isGrouped()) {
            reader.group(series);
          } else {
            points = reader.read(series);
          }
        }
        results.add(
            new SeriesResult(
                series.getId(),
                series.getPrimaryTags(),
                series.getType(),
                points,
                gaps(granularity.getWidth(), spec.getStart(), spec.getEnd(), present)));
      }

      long[] present = anyPresent.toArray();
      Arrays.sort(present);
      return new QueryResult(
          granularity.getWidth(),
          Collections.unmodifiableList(results),
          spec.isGrouped() ? reader.groupResults(groupType) : Collections.emptyList(),
          gaps(granularity.getWidth(), spec.getStart(), spec.getEnd(), present));
    } finally {
      queryTimer.record(System.nanoTime() - begin, TimeUnit.NANOSECONDS);
    }
  }

  private Granularity validate(final QuerySpec spec) throws QueryException {
    if (spec.getEnd() <= spec.getStart()) {
      throw new QueryException(
          "Query end " + spec.getEnd() + " must be after start " + spec.getStart());
    }
    Granularity granularity = granularities.byWidth(spec.getGranularitySeconds());
    if (granularity == null) {
      throw new QueryException(
          "Granularity "
              + spec.getGranularitySeconds()
              + "s is not configured, known: "
              + granularities);
    }
    if (spec.isGrouped() && spec.isBreakdown()) {
      throw new QueryException("A query can either group by tags or break down, not both");
    }
    if (spec.getWindowSeconds() < 0 || spec.getWindowSeconds() % granularity.getWidth() != 0) {
      throw new QueryException(
          "Window "
              + spec.getWindowSeconds()
              + "s must be a positive multiple of the "
              + granularity.getWidth()
              + "s granularity");
    }
    double percentile = spec.getPercentile();
    if (percentile != 0 && !(percentile > 0 && percentile <= 100)) {
      throw new QueryException("Percentile must be in (0, 100]: " + percentile);
    }
    return granularity;
  }

  private static MetricType singleType(final List<Series> candidates) throws QueryException {
    MetricType type = candidates.get(0).getType();
    for (Series series : candidates) {
      if (series.getType() != type) {
        throw new QueryException(
            "Can not group series of different metric types: "
                + type
                + " and "
                + series.getType()
                + " of "
                + series);
      }
    }
    return type;
  }

  private static long[] present(
      final Series series, final Granularity granularity, final QuerySpec spec) {
    TLongArrayList present = new TLongArrayList();
    for (Long start :
        series.getStore().bucketStarts(granularity.getLevel(), spec.getStart(), spec.getEnd())) {
      present.add(start);
    }
    return present.toArray();
  }

  /**
   * The parts of [start, end) not covered by a bucket starting at one of {@code sortedStarts}.
   * Visits present buckets only, so the cost does not depend on the width of the range.
   */
  static List<Gap> gaps(
      final int width, final long start, final long end, final long[] sortedStarts) {
    Gap.Collector collector = new Gap.Collector();
    long cursor = start;
    for (long bucketStart : sortedStarts) {
      if (bucketStart > cursor) {
        collector.add(cursor, Math.min(bucketStart, end));
      }
      long bucketEnd = bucketStart > Long.MAX_VALUE - width ? Long.MAX_VALUE : bucketStart + width;
      cursor = Math.max(cursor, Math.min(bucketEnd, end));
      if (cursor >= end) {
        break;
      }
    }
    if (cursor < end) {
      collector.add(cursor, end);
    }
    return collector.build();
  }

  /** Per query read state: decoded tags and the groups merged so far. */
  private class Reader {

    private final Granularity granularity;
    private final QuerySpec spec;
    private final SecondaryFilter.Compiled filter;
    private final GaugeReducer reducer;
    private final TLongObjectHashMap<SortedMap<String, String>> decoded =
        new TLongObjectHashMap<>();
    private final TreeMap<SortedMap<String, String>, TreeMap<Long, AggregateState>> groups =
        new TreeMap<>(GroupResult.GROUP_ORDER);

    Reader(
        final Granularity granularity,
        final QuerySpec spec,
        final SecondaryFilter.Compiled filter,
        final GaugeReducer reducer) {
      this.granularity = granularity;
      this.spec = spec;
      this.filter = filter;
      this.reducer = reducer;
    }

    private Iterable<BucketRecord> records(final Series series) {
      return series.getStore().read(granularity.getLevel(), spec.getStart(), spec.getEnd());
    }

    private boolean matches(final BucketRecord record) {
      return filter.matchesAll() || filter.matches(record.getBitmask());
    }

    private long slot(final long bucketStart) {
      int window = spec.getWindowSeconds();
      return window == 0 ? bucketStart : bucketStart - Math.floorMod(bucketStart, (long) window);
    }

    private double value(final AggregateState state) {
      if (spec.getPercentile() > 0 && state instanceof GaugeState) {
        return ((GaugeState) state).percentile(spec.getPercentile());
      }
      return state.value(reducer);
    }

    private SortedMap<String, String> decode(final long bitmask) {
      SortedMap<String, String> tags = decoded.get(bitmask);
      if (tags == null) {
        tags = codec.decode(bitmask);
        decoded.put(bitmask, tags);
      }
      return tags;
    }

    /** Collapsed or broken down points of one series. Records arrive ordered by bucket start. */
    List<DataPoint> read(final Series series) {
      List<DataPoint> points = new ArrayList<>();
      long current = 0;
      AggregateState merged = null;
      TreeMap<Long, AggregateState> byMask = new TreeMap<>(UnsignedLongs::compare);
      for (BucketRecord record : records(series)) {
        if (!matches(record)) {
          continue;
        }
        long slot = slot(record.getBucketStart());
        if (spec.isBreakdown()) {
          if (!byMask.isEmpty() && slot != current) {
            flush(current, byMask, points);
          }
          current = slot;
          AggregateState state = byMask.get(record.getBitmask());
          if (state == null) {
            byMask.put(record.getBitmask(), record.getState().copy());
          } else {
            state.merge(record.getState());
          }
          continue;
        }
        if (merged != null && slot != current) {
          points.add(new DataPoint(current, null, value(merged), merged));
          merged = null;
        }
        if (merged == null) {
          current = slot;
          merged = record.getState().copy();
        } else {
          merged.merge(record.getState());
        }
      }
      if (merged != null) {
        points.add(new DataPoint(current, null, value(merged), merged));
      }
      if (!byMask.isEmpty()) {
        flush(current, byMask, points);
      }
      return Collections.unmodifiableList(points);
    }

    private void flush(
        final long slot, final TreeMap<Long, AggregateState> byMask, final List<DataPoint> points) {
      for (Map.Entry<Long, AggregateState> entry : byMask.entrySet()) {
        points.add(
            new DataPoint(slot, decode(entry.getKey()), value(entry.getValue()), entry.getValue()));
      }
      byMask.clear();
    }

    /** Merges the matching records of one series into their groups. */
    void group(final Series series) {
      ImmutableSortedSet<String> keys = spec.getGroupBy();
      TLongObjectHashMap<SortedMap<String, String>> groupOf = new TLongObjectHashMap<>();
      for (BucketRecord record : records(series)) {
        if (!matches(record)) {
          continue;
        }
        SortedMap<String, String> group = groupOf.get(record.getBitmask());
        if (group == null) {
          group = groupKey(series, record.getBitmask(), keys);
          groupOf.put(record.getBitmask(), group);
        }
        if (group == NO_GROUP) {
          continue;
        }
        TreeMap<Long, AggregateState> slots = groups.get(group);
        if (slots == null) {
          slots = new TreeMap<>();
          groups.put(group, slots);
        }
        long slot = slot(record.getBucketStart());
        AggregateState state = slots.get(slot);
        if (state == null) {
          slots.put(slot, record.getState().copy());
        } else {
          state.merge(record.getState());
        }
      }
    }

    /** Primary tags win over secondary tags of the same key. */
    private SortedMap<String, String> groupKey(
        final Series series, final long bitmask, final ImmutableSortedSet<String> keys) {
      TreeMap<String, String> group = new TreeMap<>();
      SortedMap<String, String> secondary = null;
      for (String key : keys) {
        String value = series.getPrimaryTags().get(key);
        if (value == null) {
          if (secondary == null) {
            secondary = decode(bitmask);
          }
          value = secondary.get(key);
        }
        if (value == null) {
          return NO_GROUP;
        }
        group.put(key, value);
      }
      return Collections.unmodifiableSortedMap(group);
    }

    List<GroupResult> groupResults(final MetricType type) {
      List<GroupResult> results = new ArrayList<>(groups.size());
      for (Map.Entry<SortedMap<String, String>, TreeMap<Long, AggregateState>> entry :
          groups.entrySet()) {
        List<DataPoint> points = new ArrayList<>(entry.getValue().size());
        for (Map.Entry<Long, AggregateState> slot : entry.getValue().entrySet()) {
          points.add(new DataPoint(slot.getKey(), null, value(slot.getValue()), slot.getValue()));
        }
        results.add(new GroupResult(entry.getKey(), type, Collections.unmodifiableList(points)));
      }
      LOGGER.debug("Merged {} groups by {} for {}", results.size(), spec.getGroupBy(), spec);
      return Collections.unmodifiableList(results);
    }
  }
}
