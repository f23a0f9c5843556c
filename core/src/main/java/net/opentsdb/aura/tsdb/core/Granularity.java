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
 * One level of the granularity chain. Buckets of a level are aligned to multiples of its width
 * and expire once their end is older than {@code now - retention}.
 */
public class Granularity {

  private final int level;
  private final int width;
  private final int retention;

  public Granularity(final int level, final int width, final int retention) {
    this.level = level;
    this.width = width;
    this.retention = retention;
  }

  public int getLevel() {
    return level;
  }

  /** @return bucket width in seconds */
  public int getWidth() {
    return width;
  }

  /** @return max age of a bucket in seconds */
  public int getRetention() {
    return retention;
  }

  public boolean isRaw() {
    return level == 0;
  }

  public long bucketStart(final long timestamp) {
    return timestamp - Math.floorMod(timestamp, (long) width);
  }

  public long bucketEnd(final long bucketStart) {
    return bucketStart + width;
  }

  /** Buckets ending at or before this time are past retention. */
  public long expiryHorizon(final long now) {
    return now - retention;
  }

  public boolean isExpired(final long bucketStart, final long now) {
    return bucketEnd(bucketStart) <= expiryHorizon(now);
  }

  @Override
  public String toString() {
    return "G" + level + "{width=" + width + "s, retention=" + retention + "s}";
  }
}
