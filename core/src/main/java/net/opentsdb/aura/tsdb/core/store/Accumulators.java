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

package net.opentsdb.aura.tsdb.core.store;

import com.google.common.primitives.UnsignedLong;

/** Unsigned 64 bit saturating arithmetic for count and ratio accumulators. */
final class Accumulators {

  static final long SATURATED = -1L; // 2^64 - 1 unsigned

  private Accumulators() {}

  static boolean overflows(final long a, final long b) {
    return Long.compareUnsigned(a + b, a) < 0;
  }

  static long add(final long a, final long b) {
    return overflows(a, b) ? SATURATED : a + b;
  }

  static double toDouble(final long unsigned) {
    return UnsignedLong.fromLongBits(unsigned).doubleValue();
  }

  static String toString(final long unsigned) {
    return Long.toUnsignedString(unsigned);
  }
}
