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

package net.opentsdb.aura.tsdb.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A sub-range [start, end) of a query with no bucket at the requested granularity. Reported, not
 * raised: callers may retry the range at a finer granularity.
 */
public class Gap {

  private final long start;
  private final long end;

  public Gap(final long start, final long end) {
    this.start = start;
    this.end = end;
  }

  public long getStart() {
    return start;
  }

  public long getEnd() {
    return end;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Gap)) {
      return false;
    }
    Gap other = (Gap) o;
    return start == other.start && end == other.end;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(start) * 31 + Long.hashCode(end);
  }

  @Override
  public String toString() {
    return "Gap[" + start + ", " + end + ")";
  }

  /** Collects gaps in ascending order, coalescing adjacent ones. */
  static class Collector {
    private final List<Gap> gaps = new ArrayList<>();

    void add(final long start, final long end) {
      if (end <= start) {
        return;
      }
      int last = gaps.size() - 1;
      if (last >= 0 && gaps.get(last).end == start) {
        gaps.set(last, new Gap(gaps.get(last).start, end));
      } else {
        gaps.add(new Gap(start, end));
      }
    }

    List<Gap> build() {
      return Collections.unmodifiableList(gaps);
    }
  }
}
