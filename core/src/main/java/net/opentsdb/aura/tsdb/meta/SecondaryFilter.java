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
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * A conjunction of clauses over secondary tags. Each clause is a set of pairs tested in its own
 * {@link FilterMode}; a sample matches when every clause does. "(a or b) and (c or d)" is two
 * {@link FilterMode#ANY} clauses.
 *
 * <p>Filters are built from strings and compiled against a {@link SecondaryTagCodec} for each
 * query, without assigning bits.
 */
public class SecondaryFilter {

  public static final SecondaryFilter MATCH_ALL = new SecondaryFilter(ImmutableList.of());

  private final List<Clause> clauses;

  private SecondaryFilter(final List<Clause> clauses) {
    this.clauses = clauses;
  }

  public static SecondaryFilter all(final Map<String, String> tags) {
    return newBuilder().all(tags).build();
  }

  public static SecondaryFilter any(final Tag... tags) {
    return newBuilder().any(tags).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** @return a filter requiring both this and {@code other}. */
  public SecondaryFilter and(final SecondaryFilter other) {
    return new SecondaryFilter(
        ImmutableList.<Clause>builder().addAll(clauses).addAll(other.clauses).build());
  }

  public List<Clause> getClauses() {
    return clauses;
  }

  public boolean isEmpty() {
    return clauses.isEmpty();
  }

  /** Resolves every clause to a mask. Read only on the codec. */
  public Compiled compile(final SecondaryTagCodec codec) {
    if (clauses.isEmpty()) {
      return Compiled.MATCH_ALL;
    }
    long[] masks = new long[clauses.size()];
    FilterMode[] modes = new FilterMode[clauses.size()];
    for (int i = 0; i < clauses.size(); i++) {
      Clause clause = clauses.get(i);
      long mask = 0;
      boolean unknown = false;
      for (Tag tag : clause.tags) {
        int bit = codec.lookupBit(tag.getKey(), tag.getValue());
        if (bit == SecondaryTagCodec.NOT_FOUND) {
          unknown = true;
        } else {
          mask |= 1L << bit;
        }
      }
      if (clause.mode == FilterMode.ALL && unknown) {
        // no sample can carry a pair that never got a bit
        return Compiled.MATCH_NONE;
      }
      if (clause.mode == FilterMode.ANY && mask == 0) {
        return Compiled.MATCH_NONE;
      }
      masks[i] = mask;
      modes[i] = clause.mode;
    }
    return new Compiled(masks, modes, false);
  }

  @Override
  public String toString() {
    return "SecondaryFilter" + clauses;
  }

  public static class Clause {
    private final List<Tag> tags;
    private final FilterMode mode;

    Clause(final List<Tag> tags, final FilterMode mode) {
      this.tags = tags;
      this.mode = mode;
    }

    public List<Tag> getTags() {
      return tags;
    }

    public FilterMode getMode() {
      return mode;
    }

    @Override
    public String toString() {
      return mode + tags.toString();
    }
  }

  public static class Builder {
    private final List<Clause> clauses = new ArrayList<>();

    public Builder all(final Map<String, String> tags) {
      List<Tag> list = new ArrayList<>(tags.size());
      for (Map.Entry<String, String> entry : tags.entrySet()) {
        list.add(Tag.of(entry.getKey(), entry.getValue()));
      }
      return clause(list, FilterMode.ALL);
    }

    public Builder all(final Tag... tags) {
      return clause(Arrays.asList(tags), FilterMode.ALL);
    }

    public Builder any(final Tag... tags) {
      return clause(Arrays.asList(tags), FilterMode.ANY);
    }

    public Builder clause(final List<Tag> tags, final FilterMode mode) {
      Preconditions.checkNotNull(mode, "mode");
      if (!tags.isEmpty()) {
        clauses.add(new Clause(ImmutableList.copyOf(tags), mode));
      }
      return this;
    }

    public SecondaryFilter build() {
      if (clauses.isEmpty()) {
        return MATCH_ALL;
      }
      return new SecondaryFilter(ImmutableList.copyOf(clauses));
    }
  }

  /** A filter resolved to bit masks. */
  public static class Compiled {

    static final Compiled MATCH_ALL = new Compiled(new long[0], new FilterMode[0], false);
    static final Compiled MATCH_NONE = new Compiled(new long[0], new FilterMode[0], true);

    private final long[] masks;
    private final FilterMode[] modes;
    private final boolean unsatisfiable;

    private Compiled(final long[] masks, final FilterMode[] modes, final boolean unsatisfiable) {
      this.masks = masks;
      this.modes = modes;
      this.unsatisfiable = unsatisfiable;
    }

    public boolean matches(final long bitmask) {
      if (unsatisfiable) {
        return false;
      }
      for (int i = 0; i < masks.length; i++) {
        if (!SecondaryTagCodec.matches(bitmask, masks[i], modes[i])) {
          return false;
        }
      }
      return true;
    }

    /** @return true when no bitmask can match, so reads can be skipped. */
    public boolean isUnsatisfiable() {
      return unsatisfiable;
    }

    public boolean matchesAll() {
      return !unsatisfiable && masks.length == 0;
    }
  }
}
