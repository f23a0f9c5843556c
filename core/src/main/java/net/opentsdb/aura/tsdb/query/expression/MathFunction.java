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

/**
 * Functions over one or two values. Arguments outside a function's domain yield NaN, which drops
 * the point from the result.
 */
public enum MathFunction {
  ABS(1) {
    @Override
    double compute(final double[] args) {
      return Math.abs(args[0]);
    }
  },
  MAX(2) {
    @Override
    double compute(final double[] args) {
      return Math.max(args[0], args[1]);
    }
  },
  MIN(2) {
    @Override
    double compute(final double[] args) {
      return Math.min(args[0], args[1]);
    }
  },
  /** Half away from zero. */
  ROUND(1) {
    @Override
    double compute(final double[] args) {
      return Math.signum(args[0]) * Math.floor(Math.abs(args[0]) + 0.5);
    }
  },
  CEIL(1) {
    @Override
    double compute(final double[] args) {
      return Math.ceil(args[0]);
    }
  },
  FLOOR(1) {
    @Override
    double compute(final double[] args) {
      return Math.floor(args[0]);
    }
  },
  SQRT(1) {
    @Override
    double compute(final double[] args) {
      return args[0] < 0 ? Double.NaN : Math.sqrt(args[0]);
    }
  },
  SQUARE(1) {
    @Override
    double compute(final double[] args) {
      return args[0] * args[0];
    }
  },
  POWER(2) {
    @Override
    double compute(final double[] args) {
      return Math.pow(args[0], args[1]);
    }
  },
  EXP(1) {
    @Override
    double compute(final double[] args) {
      return Math.exp(args[0]);
    }
  },
  LOG(1) {
    @Override
    double compute(final double[] args) {
      return args[0] <= 0 ? Double.NaN : Math.log(args[0]);
    }
  },
  /** Logarithm of the first argument in the base of the second. */
  LOG_BASE(2) {
    @Override
    double compute(final double[] args) {
      if (args[0] <= 0 || args[1] <= 0) {
        return Double.NaN;
      }
      return Math.log(args[0]) / Math.log(args[1]);
    }
  },
  SIN(1) {
    @Override
    double compute(final double[] args) {
      return Math.sin(args[0]);
    }
  },
  COS(1) {
    @Override
    double compute(final double[] args) {
      return Math.cos(args[0]);
    }
  },
  TAN(1) {
    @Override
    double compute(final double[] args) {
      return Math.tan(args[0]);
    }
  };

  private final int arity;

  MathFunction(final int arity) {
    this.arity = arity;
  }

  public int getArity() {
    return arity;
  }

  /** @return the result, NaN outside the domain or for a wrong number of arguments */
  public double apply(final double... args) {
    if (args.length != arity) {
      return Double.NaN;
    }
    return compute(args);
  }

  abstract double compute(double[] args);
}
