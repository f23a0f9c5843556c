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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.opentsdb.aura.tsdb.core.EngineConfig;
import net.opentsdb.aura.tsdb.core.QueryException;
import net.opentsdb.aura.tsdb.core.TimeSeriesEngine;
import net.opentsdb.aura.tsdb.core.coordination.ManualClock;
import net.opentsdb.aura.tsdb.meta.PrimaryFilter;
import net.opentsdb.aura.tsdb.query.QuerySpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.SortedMap;

import static net.opentsdb.aura.tsdb.query.expression.Expression.arithmetic;
import static net.opentsdb.aura.tsdb.query.expression.Expression.constant;
import static net.opentsdb.aura.tsdb.query.expression.Expression.function;
import static net.opentsdb.aura.tsdb.query.expression.Expression.query;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ExpressionTest {

  private static final long T0 = 100_000;
  private static final SortedMap<String, String> HOST_A = ImmutableSortedMap.of("host", "a");
  private static final SortedMap<String, String> HOST_B = ImmutableSortedMap.of("host", "b");

  private TimeSeriesEngine engine;

  @BeforeEach
  void beforeEach() throws Exception {
    EngineConfig config = new EngineConfig();
    config.backgroundSweeps = false;
    engine = new TimeSeriesEngine(config, new SimpleMeterRegistry(), new ManualClock(T0 + 100));

    write("used", "a", T0, 30);
    write("used", "b", T0, 10);
    write("used", "a", T0 + 10, 45);
    write("total", "a", T0, 60);
    write("total", "b", T0, 40);
    write("total", "c", T0, 80);
  }

  @AfterEach
  void afterEach() {
    engine.close();
  }

  private void write(final String metric, final String host, final long timestamp, final long n)
      throws Exception {
    engine.writeCount(ImmutableMap.of("metric", metric, "host", host), null, timestamp, n);
  }

  private static Expression byHost(final String metric) {
    return query(
        QuerySpec.newBuilder()
            .primaryFilter(PrimaryFilter.equalTo(ImmutableMap.of("metric", metric)))
            .granularity(10)
            .groupBy("host")
            .build());
  }

  private ExpressionResult evaluate(final Expression expression) throws QueryException {
    return engine.evaluate(expression, T0, T0 + 20);
  }

  @Test
  void ratioOfMatchingGroups() throws Exception {
    ExpressionResult result =
        evaluate(
            arithmetic(
                ArithmeticOperator.MULTIPLY,
                arithmetic(ArithmeticOperator.DIVIDE, byHost("used"), byHost("total")),
                constant(100)));

    assertFalse(result.isScalar());
    // host=c only has a total
    assertEquals(2, result.getGroups().size());
    assertEquals(ImmutableSortedMap.of(T0, 50.0), result.getValues(HOST_A));
    assertEquals(ImmutableSortedMap.of(T0, 25.0), result.getValues(HOST_B));
  }

  @Test
  void leafWithoutGroupByIsOneGroup() throws Exception {
    Expression total =
        query(
            QuerySpec.newBuilder()
                .primaryFilter(PrimaryFilter.equalTo(ImmutableMap.of("metric", "total")))
                .granularity(10)
                .build());
    ExpressionResult result = evaluate(arithmetic(ArithmeticOperator.SUBTRACT, total, constant(1)));

    assertEquals(1, result.getGroups().size());
    assertEquals(
        ImmutableSortedMap.of(T0, 179.0), result.getValues(ImmutableSortedMap.<String, String>of()));
  }

  @Test
  void functionsDropPointsOutsideTheirDomain() throws Exception {
    ExpressionResult result =
        evaluate(
            function(
                MathFunction.SQRT,
                arithmetic(ArithmeticOperator.SUBTRACT, byHost("used"), constant(14))));

    assertEquals(ImmutableSortedMap.of(T0, 4.0, T0 + 10, Math.sqrt(31)), result.getValues(HOST_A));
    assertTrue(result.getGroups().containsKey(HOST_B));
    assertTrue(result.getValues(HOST_B).isEmpty());

    ExpressionResult max = evaluate(function(MathFunction.MAX, byHost("used"), byHost("total")));
    assertEquals(ImmutableSortedMap.of(T0, 60.0), max.getValues(HOST_A));
  }

  @Test
  void constantsOnlyAreScalar() throws Exception {
    ExpressionResult result =
        evaluate(
            function(
                MathFunction.POWER,
                arithmetic(ArithmeticOperator.ADD, constant(1), constant(2)),
                constant(2)));
    assertTrue(result.isScalar());
    assertEquals(9.0, result.getValue());
    assertTrue(result.getGroups().isEmpty());
  }

  @Test
  void leavesReadTheEvaluatedRange() throws Exception {
    ExpressionResult result = engine.evaluate(byHost("used"), T0 + 10, T0 + 20);
    assertEquals(ImmutableSortedMap.of(T0 + 10, 45.0), result.getValues(HOST_A));
    assertTrue(result.getValues(HOST_B).isEmpty());
  }

  @Test
  void invalidExpressions() {
    assertThrows(IllegalArgumentException.class, () -> function(MathFunction.MIN, constant(1)));
    assertThrows(QueryException.class, () -> engine.evaluate(constant(1), T0, T0));
    assertThrows(IllegalStateException.class, () -> evaluate(byHost("used")).getValue());
  }

  @Test
  void mathFunctions() {
    assertEquals(-3.0, MathFunction.ROUND.apply(-2.5));
    assertEquals(3.0, MathFunction.ROUND.apply(2.5));
    assertEquals(3.0, MathFunction.LOG_BASE.apply(8, 2), 1e-12);
    assertTrue(Double.isNaN(MathFunction.LOG.apply(0)));
    assertTrue(Double.isNaN(MathFunction.LOG_BASE.apply(8, -2)));
    assertTrue(Double.isNaN(MathFunction.ABS.apply(1, 2)));
    assertEquals(2.0, MathFunction.ABS.apply(-2));
  }
}
