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

import java.util.Arrays;

/**
 * Canonical identity of a series: its primary (key code, value code) pairs sorted by key code.
 * Equal tag maps produce equal sets whatever order they were given in.
 */
public final class PrimaryTagSet {

  public static final PrimaryTagSet EMPTY = new PrimaryTagSet(new int[0]);

  // interleaved key, value codes
  private final int[] pairs;
  private final int hash;

  private PrimaryTagSet(final int[] pairs) {
    this.pairs = pairs;
    this.hash = Arrays.hashCode(pairs);
  }

  /** @param keys key codes, distinct; {@code values[i]} is the value of {@code keys[i]} */
  public static PrimaryTagSet of(final int[] keys, final int[] values) {
    if (keys.length != values.length) {
      throw new IllegalArgumentException(
          "Tag key and value counts differ: " + keys.length + " vs " + values.length);
    }
    if (keys.length == 0) {
      return EMPTY;
    }
    long[] sorted = new long[keys.length];
    for (int i = 0; i < keys.length; i++) {
      sorted[i] = ((long) keys[i] << 32) | (values[i] & 0xFFFFFFFFL);
    }
    Arrays.sort(sorted);
    int[] pairs = new int[keys.length * 2];
    for (int i = 0; i < sorted.length; i++) {
      int key = (int) (sorted[i] >>> 32);
      if (i > 0 && key == pairs[(i - 1) * 2]) {
        throw new IllegalArgumentException("Duplicate tag key code: " + key);
      }
      pairs[i * 2] = key;
      pairs[i * 2 + 1] = (int) sorted[i];
    }
    return new PrimaryTagSet(pairs);
  }

  public int size() {
    return pairs.length / 2;
  }

  public int keyCode(final int index) {
    return pairs[index * 2];
  }

  public int valueCode(final int index) {
    return pairs[index * 2 + 1];
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PrimaryTagSet)) {
      return false;
    }
    PrimaryTagSet other = (PrimaryTagSet) o;
    return hash == other.hash && Arrays.equals(pairs, other.pairs);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return "PrimaryTagSet" + Arrays.toString(pairs);
  }
}
