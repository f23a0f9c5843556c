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

import java.util.Map;

public class MetricTypeMismatchException extends WriteException {

  private final MetricType existing;
  private final MetricType requested;

  public MetricTypeMismatchException(
      final Map<String, String> primaryTags,
      final MetricType existing,
      final MetricType requested) {
    super(
        "Series "
            + primaryTags
            + " was created as "
            + existing
            + " and can not accept "
            + requested);
    this.existing = existing;
    this.requested = requested;
  }

  public MetricType getExisting() {
    return existing;
  }

  public MetricType getRequested() {
    return requested;
  }

  @Override
  public String reason() {
    return "type_mismatch";
  }
}
