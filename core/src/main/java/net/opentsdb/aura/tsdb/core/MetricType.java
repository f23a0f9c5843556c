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

import net.opentsdb.aura.tsdb.core.store.AggregateState;
import net.opentsdb.aura.tsdb.core.store.CountState;
import net.opentsdb.aura.tsdb.core.store.GaugeState;
import net.opentsdb.aura.tsdb.core.store.RatioState;

/** Fixed at series creation. Dispatches to the aggregate state kept for every record. */
public enum MetricType {
  GAUGE {
    @Override
    public AggregateState newState() {
      return new GaugeState();
    }
  },
  COUNT {
    @Override
    public AggregateState newState() {
      return new CountState();
    }
  },
  RATIO {
    @Override
    public AggregateState newState() {
      return new RatioState();
    }
  };

  public abstract AggregateState newState();

  public boolean accepts(final Payload payload) {
    return payload != null && payload.type() == this;
  }

  public static MetricType forName(final String name) {
    return valueOf(name.toUpperCase());
  }
}
