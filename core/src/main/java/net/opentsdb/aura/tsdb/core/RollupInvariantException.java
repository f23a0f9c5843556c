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

/**
 * An internal rollup invariant was violated, e.g. a finer bucket would be folded twice into the
 * same coarser bucket. Fatal to the fold that detected it. Never corrected silently.
 */
public class RollupInvariantException extends RuntimeException {

  public RollupInvariantException(final String message) {
    super(message);
  }
}
