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

/** Binary operators over two values. Division by zero follows IEEE 754. */
public enum ArithmeticOperator {
  ADD("+") {
    @Override
    public double apply(final double left, final double right) {
      return left + right;
    }
  },
  SUBTRACT("-") {
    @Override
    public double apply(final double left, final double right) {
      return left - right;
    }
  },
  MULTIPLY("*") {
    @Override
    public double apply(final double left, final double right) {
      return left * right;
    }
  },
  DIVIDE("/") {
    @Override
    public double apply(final double left, final double right) {
      return left / right;
    }
  };

  private final String symbol;

  ArithmeticOperator(final String symbol) {
    this.symbol = symbol;
  }

  public abstract double apply(double left, double right);

  public String getSymbol() {
    return symbol;
  }
}
