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

import com.google.common.collect.ImmutableMap;
import gnu.trove.set.hash.TLongHashSet;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.opentsdb.aura.tsdb.core.coordination.ManualClock;
import net.opentsdb.aura.tsdb.core.store.BucketRecord;
import net.opentsdb.aura.tsdb.core.store.CountState;
import net.opentsdb.aura.tsdb.meta.PrimaryFilter;
import net.opentsdb.aura.tsdb.meta.Series;
import net.opentsdb.aura.tsdb.query.DataPoint;
import net.opentsdb.aura.tsdb.query.QueryResult;
import net.opentsdb.aura.tsdb.query.QuerySpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TimeSeriesEngineTest {

  // aligned to the hour
  private static final long T0 = 1_080_000;
  private static final Map<String, String> CPU = ImmutableMap.of("metric", "cpu", "host", "a");

  private SimpleMeterRegistry registry;
  private ManualClock clock;
  private TimeSeriesEngine engine;

  @BeforeEach
  void beforeEach() {
    registry = new SimpleMeterRegistry();
    clock = new ManualClock(T0);
    engine = new TimeSeriesEngine(config(64), registry, clock);
  }

  @AfterEach
  void afterEach() {
    engine.close();
  }

  private static EngineConfig config(final int bits) {
    EngineConfig config = new EngineConfig();
    config.secondaryBitWidth = bits;
    config.backgroundSweeps = false;
    return config;
  }

  private QueryResult query(final Map<String, String> primary, final int granularity)
      throws QueryException {
    return engine.query(
        QuerySpec.newBuilder()
            .primaryFilter(PrimaryFilter.equalTo(primary))
            .timeRange(T0 - 3600, T0 + 3600)
            .granularity(granularity)
            .build());
  }

  @Test
  void typeMismatchLeavesFirstSeriesAlone() throws Exception {
    engine.writeGauge(CPU, null, T0, 42.0);
    MetricTypeMismatchException e =
        assertThrows(MetricTypeMismatchException.class, () -> engine.writeCount(CPU, null, T0, 1));
    assertEquals(MetricType.GAUGE, e.getExisting());

    Series series = engine.getCatalog().lookup(CPU).get();
    assertEquals(MetricType.GAUGE, series.getType());
    assertEquals(1, engine.getCatalog().size());
    List<DataPoint> points = query(CPU, 10).getSeries().get(0).getDataPoints();
    assertEquals(1, points.size());
    assertEquals(42.0, points.get(0).getValue());
    assertEquals(
        1.0, registry.counter("write.failure.count", "reason", "type_mismatch").count());
  }

  @Test
  void mismatchCheckedBeforeSecondaryTagsAreEncoded() throws Exception {
    engine.writeGauge(CPU, null, T0, 1.0);
    assertThrows(
        MetricTypeMismatchException.class,
        () -> engine.writeCount(CPU, ImmutableMap.of("env", "prod"), T0, 1));
    assertEquals(0, engine.getCodec().assignedBits());
  }

  @Test
  void tagSpaceExhaustedRejectsWrite() throws Exception {
    engine.close();
    engine = new TimeSeriesEngine(config(2), registry, clock);
    engine.writeCount(CPU, ImmutableMap.of("env", "prod"), T0, 1);
    engine.writeCount(CPU, ImmutableMap.of("env", "dev"), T0, 1);

    assertThrows(
        TagSpaceExhaustedException.class,
        () -> engine.writeCount(CPU, ImmutableMap.of("env", "qa"), T0, 1));
    assertThrows(
        TagSpaceExhaustedException.class,
        () -> engine.writeCount(ImmutableMap.of("host", "new"), ImmutableMap.of("env", "qa"), T0, 1));
    // nothing of the rejected writes was kept
    assertFalse(engine.getCatalog().lookup(ImmutableMap.of("host", "new")).isPresent());
    CountState state =
        (CountState) query(CPU, 10).getSeries().get(0).getDataPoints().get(0).getState();
    assertEquals(2L, state.getSum());
    assertEquals(
        2.0, registry.counter("write.failure.count", "reason", "tag_space_exhausted").count());
  }

  @Test
  void expiredSampleIsDropped() throws Exception {
    // raw retention defaults to six hours
    assertThrows(BucketExpiredException.class, () -> engine.writeCount(CPU, null, T0 - 21_610, 1));
    assertFalse(engine.getCatalog().lookup(CPU).isPresent());
    assertEquals(1.0, registry.counter("write.failure.count", "reason", "bucket_expired").count());

    engine.writeCount(CPU, null, T0 - 21_600, 1);
    assertTrue(engine.getCatalog().lookup(CPU).isPresent());
  }

  @Test
  void wrongPayloadShape() {
    assertThrows(
        IllegalArgumentException.class,
        () -> engine.write(CPU, null, MetricType.COUNT, T0, Payload.gauge(1.0)));
    assertThrows(IllegalArgumentException.class, () -> engine.writeCount(CPU, null, T0, -1));
    assertThrows(
        IllegalArgumentException.class, () -> engine.write(CPU, null, null, T0, Payload.count(1)));
  }

  @Test
  void writeRollupExpireQuery() throws Exception {
    engine.writeCount(CPU, ImmutableMap.of("env", "prod"), T0, 3);
    engine.writeCount(CPU, ImmutableMap.of("env", "prod"), T0 + 1, 4);
    engine.writeRatio(
        ImmutableMap.of("metric", "errors", "host", "a"), null, T0, 1, 4);
    assertEquals(3.0, registry.counter("datapoint.count").count());
    assertEquals(2.0, registry.get("timeseries.count").gauge().value());

    clock.set(T0 + 3600);
    assertTrue(engine.rollup());
    assertEquals(7.0, query(CPU, 60).getSeries().get(0).getDataPoints().get(0).getValue());
    assertEquals(7.0, query(CPU, 3600).getSeries().get(0).getDataPoints().get(0).getValue());
    assertEquals(T0 + 60, engine.rolledUpThrough(CPU, 1));
    assertEquals(
        0.25,
        query(ImmutableMap.of("metric", "errors"), 3600)
            .getSeries()
            .get(0)
            .getDataPoints()
            .get(0)
            .getValue());

    // raw data is gone after six hours, the minutes remain
    clock.set(T0 + 21_600 + 10);
    assertTrue(engine.expire());
    assertTrue(query(CPU, 10).getSeries().get(0).getDataPoints().isEmpty());
    assertEquals(7.0, query(CPU, 60).getSeries().get(0).getDataPoints().get(0).getValue());
    assertEquals(Long.MIN_VALUE, engine.rolledUpThrough(ImmutableMap.of("host", "zz"), 1));
  }

  @Test
  void deleteSeries() throws Exception {
    engine.writeGauge(CPU, null, T0, 1.0);
    int id = engine.getCatalog().lookup(CPU).get().getId();

    assertTrue(engine.deleteSeries(CPU));
    assertFalse(engine.deleteSeries(CPU));
    assertTrue(query(CPU, 10).isEmpty());

    engine.writeCount(CPU, null, T0, 1);
    Series again = engine.getCatalog().lookup(CPU).get();
    assertNotEquals(id, again.getId());
    assertEquals(MetricType.COUNT, again.getType());
  }

  @Test
  void concurrentWritersShareOneSeries() throws Exception {
    int threads = 8;
    int writes = 1000;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      final Map<String, String> secondary = ImmutableMap.of("worker", "w" + (t % 4));
      futures.add(
          executor.submit(
              () -> {
                start.await();
                for (int i = 0; i < writes; i++) {
                  engine.writeCount(CPU, secondary, T0 + (i % 30), 1);
                }
                return null;
              }));
    }
    start.countDown();
    for (Future<?> future : futures) {
      future.get(30, TimeUnit.SECONDS);
    }
    executor.shutdown();

    assertEquals(1, engine.getCatalog().size());
    assertEquals(4, engine.getCodec().assignedBits());
    double total = 0;
    for (DataPoint point : query(CPU, 10).getSeries().get(0).getDataPoints()) {
      total += point.getValue();
    }
    assertEquals(threads * writes, total);

    clock.set(T0 + 60);
    engine.rollup();
    List<DataPoint> minute = query(CPU, 60).getSeries().get(0).getDataPoints();
    assertEquals(1, minute.size());
    assertEquals(threads * writes, minute.get(0).getValue());
  }

  @Test
  void rollupAndQueryWhileWriting() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(2);
    CountDownLatch start = new CountDownLatch(1);
    Future<?> writer =
        executor.submit(
            () -> {
              start.await();
              for (int i = 0; i < 5000; i++) {
                engine.writeCount(CPU, null, T0 + (i % 120), 1);
              }
              return null;
            });
    Future<?> sweeper =
        executor.submit(
            () -> {
              start.await();
              for (int i = 0; i < 200; i++) {
                engine.rollup();
                query(CPU, 10);
              }
              return null;
            });
    start.countDown();
    writer.get(30, TimeUnit.SECONDS);
    sweeper.get(30, TimeUnit.SECONDS);
    executor.shutdown();

    clock.set(T0 + 3600);
    engine.rollup();
    assertEquals(5000.0, query(CPU, 3600).getSeries().get(0).getDataPoints().get(0).getValue());
    assertEquals(0.0, registry.counter("rollup.invariant.count").count());
  }

  @Test
  void racingFirstWritersOfDifferentTypesAssignBitsForWinnersOnly() throws Exception {
    int writers = 8;
    ExecutorService executor = Executors.newFixedThreadPool(writers);
    try {
      for (int round = 0; round < 50; round++) {
        TimeSeriesEngine fresh = new TimeSeriesEngine(config(64), new SimpleMeterRegistry(), clock);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
          final int writer = w;
          futures.add(
              executor.submit(
                  () -> {
                    start.await();
                    Map<String, String> secondary = ImmutableMap.of("writer", "w" + writer);
                    try {
                      if (writer % 2 == 0) {
                        fresh.writeGauge(CPU, secondary, T0, 1.0);
                      } else {
                        fresh.writeCount(CPU, secondary, T0, 1);
                      }
                      accepted.incrementAndGet();
                    } catch (MetricTypeMismatchException e) {
                      // lost the race for the series type
                    }
                    return null;
                  }));
        }
        start.countDown();
        for (Future<?> future : futures) {
          future.get(30, TimeUnit.SECONDS);
        }
        assertEquals(writers / 2, accepted.get());
        assertEquals(accepted.get(), fresh.getCodec().assignedBits());
        fresh.close();
      }
    } finally {
      executor.shutdown();
    }
  }

  @Test
  void writeRacingDeleteLandsInALiveSeries() throws Exception {
    int writes = 20_000;
    AtomicBoolean done = new AtomicBoolean();
    TLongHashSet seen = new TLongHashSet();
    ExecutorService executor = Executors.newSingleThreadExecutor();
    Future<?> deleter =
        executor.submit(
            () -> {
              while (!done.get()) {
                Optional<Series> series = engine.getCatalog().lookup(CPU);
                if (series.isPresent() && engine.deleteSeries(CPU)) {
                  // anything appended after this point is lost with the series
                  collect(series.get(), writes, seen);
                }
              }
              return null;
            });
    try {
      for (int i = 0; i < writes; i++) {
        engine.writeCount(CPU, null, T0 + 10L * i, 1);
      }
    } finally {
      done.set(true);
    }
    deleter.get(30, TimeUnit.SECONDS);
    executor.shutdown();

    Optional<Series> live = engine.getCatalog().lookup(CPU);
    if (live.isPresent()) {
      collect(live.get(), writes, seen);
    }
    for (int i = 0; i < writes; i++) {
      assertTrue(seen.contains(T0 + 10L * i), "sample " + i + " was lost");
    }
  }

  private static void collect(final Series series, final int writes, final TLongHashSet seen) {
    for (BucketRecord record : series.getStore().read(0, T0, T0 + 10L * writes)) {
      seen.add(record.getBucketStart());
    }
  }

  @Test
  void backgroundSweepsStartAndStop() {
    EngineConfig config = new EngineConfig();
    config.rollupFrequencySeconds = 1;
    TimeSeriesEngine background = new TimeSeriesEngine(config);
    assertSame(config, background.getConfig());
    assertEquals(3, background.granularities().size());
    background.close();
  }
}
