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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Admits one background sweep at a time. Rollup and retention never run concurrently, and
 * neither runs twice at once.
 */
public class Gate {
    public enum KEY {
        FREE, ROLLUP, RETENTION;
    }
    private final AtomicInteger gate = new AtomicInteger(KEY.FREE.ordinal());

    /**
     * Acquire only when things are free.
     * @param key the sweep asking for the gate
     * @return true if the caller now holds the gate
     */
    public boolean open(KEY key) {
        if (key == KEY.FREE) {
            throw new IllegalArgumentException("Can not open the gate with " + key);
        }
        return gate.compareAndSet(KEY.FREE.ordinal(), key.ordinal());
    }

    /**
     * Only the holder can release. A release by anyone else is a no-op.
     */
    public boolean close(KEY key) {
        return gate.compareAndSet(key.ordinal(), KEY.FREE.ordinal());
    }

    public KEY current() {
        return KEY.values()[gate.get()];
    }

    @Override
    public String toString() {
        return "Gate current state: " + current().name();
    }
}
