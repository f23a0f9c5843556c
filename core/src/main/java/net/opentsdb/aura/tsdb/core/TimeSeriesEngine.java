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
import com.google.common.util.concurrent.Striped;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.opentsdb.aura.tsdb.core.coordination.Gate;
import net.opentsdb.aura.tsdb.core.coordination.GatedSweep;
import net.opentsdb.aura.tsdb.core.coordination.WallClock;
import net.opentsdb.aura.tsdb.core.downsample.RollupEngine;
import net.opentsdb.aura.tsdb.core.retention.RetentionManager;
import net.opentsdb.aura.tsdb.meta.SecondaryTagCodec;
import net.opentsdb.aura.tsdb.meta.Series;
import net.opentsdb.aura.tsdb.meta.SeriesCatalog;
import net.opentsdb.aura.tsdb.meta.TagDictionary;
import net.opentsdb.aura.tsdb.query.QueryExecutor;
import net.opentsdb.aura.tsdb.query.QueryResult;
import net.opentsdb.aura.tsdb.query.QuerySpec;
import net.opentsdb.aura.tsdb.query.expression.Expression;
import net.opentsdb.aura.tsdb.query.expression.ExpressionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

/**
 * Entry point of the engine: ingest, query and admin operations over one set of shared
 * structures. Owns the tag dictionary, the secondary tag codec, the series catalog and the
 * background rollup and retention sweeps.
 */
public class TimeSeriesEngine implements Closeable {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimeSeriesEngine.class);

  private final EngineConfig config;
  private final Granularities granularities;
  private final TagDictionary dictionary;
  private final SecondaryTagCodec codec;
  private final SeriesCatalog catalog;
  private final RollupEngine rollupEngine;
  private final RetentionManager retentionManager;
  private final QueryExecutor queryExecutor;
  private final MeterRegistry registry;
  private final WallClock clock;

  private final Striped<Lock> creationLocks = Striped.lock(64);
  private final Gate gate = new Gate();
  private final GatedSweep rollupSweep;
  private final GatedSweep retentionSweep;
  private final ScheduledExecutorService scheduledExecutorService;

  private final Counter datapointCounter;

  public TimeSeriesEngine(final EngineConfig config) {
    this(config, new SimpleMeterRegistry(), WallClock.SYSTEM);
  }

  public TimeSeriesEngine(
      final EngineConfig config, final MeterRegistry registry, final WallClock clock) {
    config.validate();
    this.config = config;
    this.granularities = config.toGranularities();
    this.registry = registry;
    this.clock = clock;
    this.dictionary = new TagDictionary(config.maxDictionaryCodes);
    this.codec = new SecondaryTagCodec(dictionary, config.secondaryBitWidth);
    this.catalog = new SeriesCatalog(dictionary, granularities);
    this.rollupEngine = new RollupEngine(registry);
    this.retentionManager = new RetentionManager(registry);
    this.queryExecutor =
        new QueryExecutor(catalog, codec, granularities, config.gaugeReducer, registry);

    this.datapointCounter = registry.counter("datapoint.count");
    registry.gauge("timeseries.count", catalog, SeriesCatalog::size);
    registry.gauge("dictionary.size", dictionary, TagDictionary::size);
    registry.gauge("secondary.bits.assigned", codec, SecondaryTagCodec::assignedBits);

    this.rollupSweep =
        new GatedSweep(gate, Gate.KEY.ROLLUP, clock, now -> rollupEngine.sweep(catalog.stores(), now));
    this.retentionSweep =
        new GatedSweep(
            gate, Gate.KEY.RETENTION, clock, now -> retentionManager.sweep(catalog.stores(), now));

    if (config.backgroundSweeps) {
      this.scheduledExecutorService =
          Executors.newScheduledThreadPool(
              2,
              new ThreadFactoryBuilder().setNameFormat("tsdb-sweep-%d").setDaemon(true).build());
      scheduledExecutorService.scheduleAtFixedRate(
          rollupSweep,
          config.rollupFrequencySeconds,
          config.rollupFrequencySeconds,
          TimeUnit.SECONDS);
      scheduledExecutorService.scheduleAtFixedRate(
          retentionSweep,
          config.retentionFrequencySeconds,
          config.retentionFrequencySeconds,
          TimeUnit.SECONDS);
    } else {
      this.scheduledExecutorService = null;
    }
    LOGGER.info(
        "Started engine with granularities {}, {} secondary bits, {} gauge reducer, background sweeps {}",
        granularities,
        config.secondaryBitWidth,
        config.gaugeReducer,
        config.backgroundSweeps);
  }

  /**
   * Writes one sample. A rejected write leaves every structure as it was, except for tag strings
   * a series creation may have interned.
   *
   * @throws WriteException when the sample is rejected
   * @throws IllegalArgumentException when the payload does not match {@code type}
   */
  public void write(
      final Map<String, String> primaryTags,
      final Map<String, String> secondaryTags,
      final MetricType type,
      final long timestamp,
      final Payload payload)
      throws WriteException {
    Preconditions.checkNotNull(primaryTags, "primaryTags");
    Preconditions.checkArgument(
        type != null && type.accepts(payload), "Payload %s does not match type %s", payload, type);
    try {
      doWrite(
          primaryTags,
          secondaryTags == null ? Collections.<String, String>emptyMap() : secondaryTags,
          type,
          timestamp,
          payload);
      datapointCounter.increment();
    } catch (WriteException e) {
      registry.counter("write.failure.count", "reason", e.reason()).increment();
      if (e instanceof BucketExpiredException) {
        LOGGER.debug("Dropped sample of {} by retention policy: {}", primaryTags, e.getMessage());
      } else {
        LOGGER.warn("Rejected sample of {}: {}", primaryTags, e.getMessage());
      }
      throw e;
    }
  }

  private void doWrite(
      final Map<String, String> primaryTags,
      final Map<String, String> secondaryTags,
      final MetricType type,
      final long timestamp,
      final Payload payload)
      throws WriteException {
    long now = clock.epochSeconds();
    Granularity raw = granularities.raw();
    long start = raw.bucketStart(timestamp);
    if (raw.isExpired(start, now)) {
      throw new BucketExpiredException(timestamp, start, raw.getWidth());
    }

    Series series = catalog.lookup(primaryTags).orElse(null);
    long bitmask = 0;
    boolean encoded = false;
    if (series != null && !series.isDeleted()) {
      checkType(series, type);
      bitmask = codec.encode(secondaryTags);
      encoded = true;
    } else {
      series = null;
    }

    while (true) {
      if (series == null) {
        // creators of one tag set serialize so a losing type never assigns secondary bits
        Lock lock = creationLocks.get(primaryTags);
        lock.lock();
        try {
          Optional<Series> current = catalog.lookup(primaryTags);
          if (current.isPresent()) {
            checkType(current.get(), type);
          }
          if (!encoded) {
            bitmask = codec.encode(secondaryTags);
            encoded = true;
          }
          series = catalog.resolveOrCreate(primaryTags, type);
        } finally {
          lock.unlock();
        }
      }
      series.getStore().appendRaw(timestamp, payload, bitmask, now);
      if (!series.isDeleted()) {
        return;
      }
      LOGGER.debug("Series {} was deleted during the write, retrying", series);
      series = null;
    }
  }

  private static void checkType(final Series series, final MetricType type)
      throws MetricTypeMismatchException {
    if (series.getType() != type) {
      throw new MetricTypeMismatchException(series.getPrimaryTags(), series.getType(), type);
    }
  }

  public void writeGauge(
      final Map<String, String> primaryTags,
      final Map<String, String> secondaryTags,
      final long timestamp,
      final double value)
      throws WriteException {
    write(primaryTags, secondaryTags, MetricType.GAUGE, timestamp, Payload.gauge(value));
  }

  public void writeCount(
      final Map<String, String> primaryTags,
      final Map<String, String> secondaryTags,
      final long timestamp,
      final long count)
      throws WriteException {
    write(primaryTags, secondaryTags, MetricType.COUNT, timestamp, Payload.count(count));
  }

  public void writeRatio(
      final Map<String, String> primaryTags,
      final Map<String, String> secondaryTags,
      final long timestamp,
      final long numerator,
      final long denominator)
      throws WriteException {
    write(
        primaryTags,
        secondaryTags,
        MetricType.RATIO,
        timestamp,
        Payload.ratio(numerator, denominator));
  }

  public QueryResult query(final QuerySpec spec) throws QueryException {
    return queryExecutor.execute(spec);
  }

  /** Evaluates {@code expression} with every query it reads limited to [start, end). */
  public ExpressionResult evaluate(final Expression expression, final long start, final long end)
      throws QueryException {
    if (end <= start) {
      throw new QueryException("Expression end " + end + " must be after start " + start);
    }
    LOGGER.debug("Evaluating {} over [{}, {})", expression, start, end);
    return expression.evaluate(queryExecutor, start, end);
  }

  /** @return true if a series was deleted */
  public boolean deleteSeries(final Map<String, String> primaryTags) {
    return catalog.delete(primaryTags);
  }

  /**
   * Runs a rollup sweep now.
   *
   * @return false if another sweep was running
   */
  public boolean rollup() {
    return rollupSweep.tryToRun();
  }

  /**
   * Runs a retention sweep now.
   *
   * @return false if another sweep was running
   */
  public boolean expire() {
    return retentionSweep.tryToRun();
  }

  /**
   * @return end of the latest interval rolled up into {@code level} for the series, {@code
   *     Long.MIN_VALUE} when nothing was rolled up or the series does not exist.
   */
  public long rolledUpThrough(final Map<String, String> primaryTags, final int level) {
    Optional<Series> series = catalog.lookup(primaryTags);
    return series.isPresent()
        ? rollupEngine.rolledUpThrough(series.get().getStore(), level)
        : Long.MIN_VALUE;
  }

  public Granularities granularities() {
    return granularities;
  }

  public MeterRegistry stats() {
    return registry;
  }

  public EngineConfig getConfig() {
    return config;
  }

  public SeriesCatalog getCatalog() {
    return catalog;
  }

  public SecondaryTagCodec getCodec() {
    return codec;
  }

  @Override
  public void close() {
    if (scheduledExecutorService == null) {
      return;
    }
    scheduledExecutorService.shutdown();
    try {
      if (!scheduledExecutorService.awaitTermination(5, TimeUnit.SECONDS)) {
        LOGGER.warn("Sweeps did not stop in time, interrupting");
        scheduledExecutorService.shutdownNow();
      }
    } catch (InterruptedException e) {
      scheduledExecutorService.shutdownNow();
      Thread.currentThread().interrupt();
    }
    LOGGER.info("Engine closed");
  }
}
