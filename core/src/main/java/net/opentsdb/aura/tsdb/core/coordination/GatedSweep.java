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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.LongToIntFunction;

/**
 * Runs a sweep behind a {@link Gate}. Used both by the background scheduler and by the admin
 * calls, so the two never overlap.
 */
public class GatedSweep implements Runnable {

    private static final Logger LOGGER = LoggerFactory.getLogger(GatedSweep.class);

    private final Gate gate;
    private final Gate.KEY key;
    private final WallClock clock;
    private final LongToIntFunction sweep;

    public GatedSweep(Gate gate, Gate.KEY key, WallClock clock, LongToIntFunction sweep) {
        this.gate = gate;
        this.key = key;
        this.clock = clock;
        this.sweep = sweep;
    }

    /**
     * @return false if another sweep held the gate and this one did not run
     */
    public boolean tryToRun() {
        if (!gate.open(key)) {
            LOGGER.debug("Gate busy for key: {} {}", key, gate);
            return false;
        }
        try {
            sweep.applyAsInt(clock.epochSeconds());
            return true;
        } finally {
            gate.close(key);
        }
    }

    /**
     * Scheduler entry point. An exception escaping a scheduled task would cancel every later
     * run, so failures are logged here instead.
     */
    @Override
    public void run() {
        try {
            tryToRun();
        } catch (Throwable t) {
            LOGGER.error("Error running {} sweep", key, t);
        }
    }

    @Override
    public String toString() {
        return "GatedSweep{" + key + ", " + gate + "}";
    }
}
