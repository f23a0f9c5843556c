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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import net.opentsdb.aura.tsdb.core.QueryException;
import net.opentsdb.aura.tsdb.query.DataPoint;
import net.opentsdb.aura.tsdb.query.GroupResult;
import net.opentsdb.aura.tsdb.query.QueryExecutor;
import net.opentsdb.aura.tsdb.query.QueryResult;
import net.opentsdb.aura.tsdb.query.QuerySpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;

/**
 * A tree of queries, constants, arithmetic and functions evaluated over one time range. Query
 * leaves are always read grouped; a leaf without group-by keys yields a single group with no tags.
 * Combining grouped operands keeps only the groups present in every operand, and within a group
 * only the timestamps present in every operand. Constants apply to every point. Points whose value
 * is NaN are dropped.
 */
public abstract class Expression {

  public static Expression query(final QuerySpec spec) {
    return new Query(Preconditions.checkNotNull(spec));
  }

  public static Expression constant(final double value) {
    return new Constant(value);
  }

  public static Expression arithmetic(
      final ArithmeticOperator operator, final Expression left, final Expression right) {
    return new Combination(
        operator.getSymbol(),
        ImmutableList.of(left, right),
        args -> operator.apply(args[0], args[1]));
  }

  public static Expression function(final MathFunction function, final Expression... args) {
    Preconditions.checkArgument(
        args.length == function.getArity(),
        "%s takes %s arguments, got %s",
        function,
        function.getArity(),
        args.length);
    return new Combination(function.name(), ImmutableList.copyOf(args), function::apply);
  }

  /**
   * @param start inclusive, epoch seconds, replaces the range of every query leaf
   * @param end exclusive, epoch seconds
   */
  public abstract ExpressionResult evaluate(QueryExecutor executor, long start, long end)
      throws QueryException;

  private static class Constant extends Expression {
    private final double value;

    Constant(final double value) {
      this.value = value;
    }

    @Override
    public ExpressionResult evaluate(
        final QueryExecutor executor, final long start, final long end) {
      return ExpressionResult.scalar(value);
    }

    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  private static class Query extends Expression {
    private final QuerySpec spec;

    Query(final QuerySpec spec) {
      this.spec = spec;
    }

    @Override
    public ExpressionResult evaluate(
        final QueryExecutor executor, final long start, final long end) throws QueryException {
      QuerySpec.Builder builder = spec.toBuilder().timeRange(start, end).breakdown(false);
      if (!spec.isGrouped()) {
        builder.groupBy();
      }
      QueryResult result = executor.execute(builder.build());
      TreeMap<SortedMap<String, String>, SortedMap<Long, Double>> groups =
          ExpressionResult.newGroups();
      for (GroupResult group : result.getGroups()) {
        TreeMap<Long, Double> values = new TreeMap<>();
        for (DataPoint point : group.getDataPoints()) {
          if (!Double.isNaN(point.getValue())) {
            values.put(point.getTimestamp(), point.getValue());
          }
        }
        groups.put(group.getGroup(), values);
      }
      return ExpressionResult.grouped(groups);
    }

    @Override
    public String toString() {
      return spec.toString();
    }
  }

  /** Applies a function to operands matched by group and timestamp. */
  private static class Combination extends Expression {
    private final String name;
    private final List<Expression> operands;
    private final ToDoubleFunction<double[]> function;

    Combination(
        final String name,
        final List<Expression> operands,
        final ToDoubleFunction<double[]> function) {
      this.name = name;
      this.operands = operands;
      this.function = function;
    }

    @Override
    public ExpressionResult evaluate(
        final QueryExecutor executor, final long start, final long end) throws QueryException {
      List<ExpressionResult> results = new ArrayList<>(operands.size());
      ExpressionResult driver = null;
      for (Expression operand : operands) {
        ExpressionResult result = operand.evaluate(executor, start, end);
        results.add(result);
        if (driver == null && !result.isScalar()) {
          driver = result;
        }
      }

      double[] args = new double[results.size()];
      if (driver == null) {
        for (int i = 0; i < args.length; i++) {
          args[i] = results.get(i).getValue();
        }
        return ExpressionResult.scalar(function.applyAsDouble(args));
      }

      TreeMap<SortedMap<String, String>, SortedMap<Long, Double>> groups =
          ExpressionResult.newGroups();
      for (Map.Entry<SortedMap<String, String>, SortedMap<Long, Double>> group :
          driver.getGroups().entrySet()) {
        if (!isInEveryOperand(group.getKey(), results)) {
          continue;
        }
        TreeMap<Long, Double> values = new TreeMap<>();
        points:
        for (Map.Entry<Long, Double> point : group.getValue().entrySet()) {
          for (int i = 0; i < args.length; i++) {
            ExpressionResult result = results.get(i);
            if (result.isScalar()) {
              args[i] = result.getValue();
              continue;
            }
            Double value = result.getValues(group.getKey()).get(point.getKey());
            if (value == null) {
              continue points;
            }
            args[i] = value;
          }
          double value = function.applyAsDouble(args);
          if (!Double.isNaN(value)) {
            values.put(point.getKey(), value);
          }
        }
        groups.put(group.getKey(), values);
      }
      return ExpressionResult.grouped(groups);
    }

    private static boolean isInEveryOperand(
        final SortedMap<String, String> group, final List<ExpressionResult> results) {
      for (ExpressionResult result : results) {
        if (!result.isScalar() && !result.getGroups().containsKey(group)) {
          return false;
        }
      }
      return true;
    }

    @Override
    public String toString() {
      return name + operands;
    }
  }
}
