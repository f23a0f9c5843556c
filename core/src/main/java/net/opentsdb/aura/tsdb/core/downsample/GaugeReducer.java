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

package net.opentsdb.aura.tsdb.core.downsample;

import net.opentsdb.aura.tsdb.core.store.GaugeState;

/**
 * How a gauge record collapses to a single value. Rollups keep the full {@link GaugeState}, so the
 * reducer is applied at read time and can be changed per query.
 */
public enum GaugeReducer {
  average {
    @Override
    public double reduce(final GaugeState state) {
      return state.getAverage();
    }
  },
  last {
    @Override
    public double reduce(final GaugeState state) {
      return state.getLast();
    }
  },
  min {
    @Override
    public double reduce(final GaugeState state) {
      return state.getMin();
    }
  },
  max {
    @Override
    public double reduce(final GaugeState state) {
      return state.getMax();
    }
  };

  public abstract double reduce(GaugeState state);

  public static GaugeReducer forName(final String name) {
    String lower = name.toLowerCase();
    if ("avg".equals(lower)) {
      return average;
    }
    return valueOf(lower);
  }
}
