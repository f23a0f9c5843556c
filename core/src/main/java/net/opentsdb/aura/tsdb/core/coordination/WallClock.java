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

package net.opentsdb.aura.tsdb.core.coordination;

/**
 * Source of "now" for expiry, bucket closing and rollup eligibility. Tests substitute a manual
 * clock.
 */
public interface WallClock {

    WallClock SYSTEM = () -> System.currentTimeMillis() / 1000;

    /** @return the current time in epoch seconds */
    long epochSeconds();
}
