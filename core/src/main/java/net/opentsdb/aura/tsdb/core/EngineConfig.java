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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.opentsdb.aura.tsdb.core.downsample.GaugeReducer;
import net.opentsdb.aura.tsdb.meta.SecondaryTagCodec;

import java.io.IOException;
import java.io.InputStream;

/** Engine settings. Fixed once the engine is constructed. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Bucket widths, finest first. Each must be a multiple of the previous one. */
  public int[] granularitySeconds = {10, 60, 3600};

  /** Max age per granularity, never shorter than the finer level's. */
  public int[] retentionSeconds = {6 * 3600, 7 * 24 * 3600, 90 * 24 * 3600};

  public int secondaryBitWidth = 64;
  public GaugeReducer gaugeReducer = GaugeReducer.average;
  public int maxDictionaryCodes = Integer.MAX_VALUE;

  public int rollupFrequencySeconds = 10;
  public int retentionFrequencySeconds = 60;
  public boolean backgroundSweeps = true;

  public static EngineConfig fromJson(final InputStream in) throws IOException {
    EngineConfig config = MAPPER.readValue(in, EngineConfig.class);
    config.validate();
    return config;
  }

  /** @throws IllegalArgumentException on an unusable configuration */
  public void validate() {
    toGranularities();
    if (secondaryBitWidth < 1 || secondaryBitWidth > SecondaryTagCodec.MAX_WIDTH) {
      throw new IllegalArgumentException(
          "secondaryBitWidth must be in [1, "
              + SecondaryTagCodec.MAX_WIDTH
              + "]: "
              + secondaryBitWidth);
    }
    if (gaugeReducer == null) {
      throw new IllegalArgumentException("gaugeReducer is required");
    }
    if (maxDictionaryCodes < 1) {
      throw new IllegalArgumentException("maxDictionaryCodes must be positive: " + maxDictionaryCodes);
    }
    if (backgroundSweeps && (rollupFrequencySeconds < 1 || retentionFrequencySeconds < 1)) {
      throw new IllegalArgumentException(
          "Sweep frequencies must be positive: rollup "
              + rollupFrequencySeconds
              + "s retention "
              + retentionFrequencySeconds
              + "s");
    }
  }

  public Granularities toGranularities() {
    if (granularitySeconds == null || retentionSeconds == null) {
      throw new IllegalArgumentException("granularitySeconds and retentionSeconds are required");
    }
    return Granularities.of(granularitySeconds, retentionSeconds);
  }
}
