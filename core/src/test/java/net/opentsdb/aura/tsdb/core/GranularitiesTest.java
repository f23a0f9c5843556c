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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GranularitiesTest {

  @Test
  void chain() {
    Granularities granularities =
        Granularities.of(new int[] {10, 60, 3600}, new int[] {3600, 86400, 604800});
    assertEquals(3, granularities.size());
    assertTrue(granularities.raw().isRaw());
    assertEquals(60, granularities.get(1).getWidth());
    assertEquals(2, granularities.byWidth(3600).getLevel());
    assertNull(granularities.byWidth(300));
    assertTrue(granularities.isCoarsest(2));
    assertFalse(granularities.isCoarsest(1));
  }

  @Test
  void alignment() {
    Granularity minute = new Granularity(1, 60, 3600);
    assertEquals(960, minute.bucketStart(1000));
    assertEquals(960, minute.bucketStart(960));
    assertEquals(1020, minute.bucketEnd(960));
    assertEquals(-60, minute.bucketStart(-1));
  }

  @Test
  void expiry() {
    Granularity raw = new Granularity(0, 10, 60);
    assertFalse(raw.isExpired(1000, 1069));
    assertTrue(raw.isExpired(1000, 1070));
    assertEquals(1010, raw.expiryHorizon(1070));
  }

  @Test
  void rejectsBadChains() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Granularities.of(new int[] {60, 10}, new int[] {60, 60}));
    assertThrows(
        IllegalArgumentException.class,
        () -> Granularities.of(new int[] {10, 25}, new int[] {60, 60}));
    assertThrows(
        IllegalArgumentException.class,
        () -> Granularities.of(new int[] {10, 60}, new int[] {3600, 60}));
    assertThrows(
        IllegalArgumentException.class,
        () -> Granularities.of(new int[] {10, 60}, new int[] {3600}));
    assertThrows(IllegalArgumentException.class, () -> Granularities.of(new int[0], new int[0]));
    assertThrows(
        IllegalArgumentException.class, () -> Granularities.of(new int[] {0}, new int[] {60}));
  }
}
