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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Iterator;
import java.util.List;

/** The ordered granularity chain G0 (raw) &lt; G1 &lt; ... */
public class Granularities implements Iterable<Granularity> {

  private final List<Granularity> levels;

  private Granularities(final List<Granularity> levels) {
    this.levels = levels;
  }

  public static Granularities of(final int[] widths, final int[] retentions) {
    Preconditions.checkArgument(widths != null && widths.length > 0, "No granularities configured");
    Preconditions.checkArgument(
        retentions != null && retentions.length == widths.length,
        "Expected one retention per granularity");
    ImmutableList.Builder<Granularity> builder = ImmutableList.builder();
    for (int i = 0; i < widths.length; i++) {
      Preconditions.checkArgument(widths[i] > 0, "Granularity width must be positive: %s", widths[i]);
      Preconditions.checkArgument(
          retentions[i] > 0, "Retention must be positive: %s", retentions[i]);
      if (i > 0) {
        Preconditions.checkArgument(
            widths[i] > widths[i - 1],
            "Granularities must be strictly increasing: %s <= %s",
            widths[i],
            widths[i - 1]);
        Preconditions.checkArgument(
            widths[i] % widths[i - 1] == 0,
            "Granularity %s is not a multiple of %s",
            widths[i],
            widths[i - 1]);
        Preconditions.checkArgument(
            retentions[i] >= retentions[i - 1],
            "Retention of %ss granularity (%s) is shorter than the retention of the finer %ss granularity (%s)",
            widths[i],
            retentions[i],
            widths[i - 1],
            retentions[i - 1]);
      }
      builder.add(new Granularity(i, widths[i], retentions[i]));
    }
    return new Granularities(builder.build());
  }

  public Granularity raw() {
    return levels.get(0);
  }

  public Granularity get(final int level) {
    return levels.get(level);
  }

  public int size() {
    return levels.size();
  }

  public boolean isCoarsest(final int level) {
    return level == levels.size() - 1;
  }

  /** @return the level with that width, or null when it is not configured. */
  public Granularity byWidth(final int widthSeconds) {
    for (int i = 0; i < levels.size(); i++) {
      if (levels.get(i).getWidth() == widthSeconds) {
        return levels.get(i);
      }
    }
    return null;
  }

  @Override
  public Iterator<Granularity> iterator() {
    return levels.iterator();
  }

  @Override
  public String toString() {
    return levels.toString();
  }
}
