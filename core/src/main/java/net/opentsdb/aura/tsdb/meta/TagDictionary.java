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

package net.opentsdb.aura.tsdb.meta;

import com.google.common.base.Preconditions;
import net.opentsdb.aura.tsdb.core.CodeSpaceExhaustedException;

import java.util.Arrays;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Interns tag keys and values to dense int codes. Keys and values share one code space. A string
 * keeps its code for the lifetime of the dictionary; codes are never reused.
 *
 * <p>Lookups are lock free. Interning a new string takes the dictionary monitor.
 */
public class TagDictionary {

  public static final int NOT_FOUND = -1;

  private static final int INITIAL_CAPACITY = 1024;

  private final ConcurrentHashMap<String, Integer> codes = new ConcurrentHashMap<>();
  private final int maxCodes;
  private volatile String[] strings = new String[INITIAL_CAPACITY];
  private volatile int size;

  public TagDictionary() {
    this(Integer.MAX_VALUE);
  }

  public TagDictionary(final int maxCodes) {
    Preconditions.checkArgument(maxCodes > 0, "maxCodes must be positive: %s", maxCodes);
    this.maxCodes = maxCodes;
  }

  /**
   * @return the code of {@code string}, assigning the next free one on first sight.
   * @throws CodeSpaceExhaustedException when the dictionary already holds {@code maxCodes}
   *     strings.
   */
  public int intern(final String string) throws CodeSpaceExhaustedException {
    Preconditions.checkNotNull(string, "Tag strings can not be null");
    Integer code = codes.get(string);
    if (code != null) {
      return code;
    }
    synchronized (this) {
      code = codes.get(string);
      if (code != null) {
        return code;
      }
      int next = size;
      if (next >= maxCodes) {
        throw new CodeSpaceExhaustedException(maxCodes);
      }
      String[] current = strings;
      if (next == current.length) {
        int capacity = (int) Math.min((long) current.length << 1, Integer.MAX_VALUE - 8);
        current = Arrays.copyOf(current, capacity);
        strings = current;
      }
      current[next] = string;
      // publish the reverse entry before the forward one
      size = next + 1;
      codes.put(string, next);
      return next;
    }
  }

  /** @return the code of {@code string} or {@link #NOT_FOUND}. Never assigns. */
  public int lookup(final String string) {
    if (string == null) {
      return NOT_FOUND;
    }
    Integer code = codes.get(string);
    return code == null ? NOT_FOUND : code;
  }

  /** @throws IllegalArgumentException if the code was never assigned. */
  public String resolve(final int code) {
    int n = size;
    if (code < 0 || code >= n) {
      throw new IllegalArgumentException("Unknown tag code: " + code);
    }
    return strings[code];
  }

  public int size() {
    return size;
  }

  public int getMaxCodes() {
    return maxCodes;
  }
}
