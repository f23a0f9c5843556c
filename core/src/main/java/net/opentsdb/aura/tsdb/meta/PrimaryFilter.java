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
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Selects series by primary tags. A conjunction of literal predicates, each either
 * {@code key in (values)} or {@code key not in (values)}. The empty filter selects every series.
 */
public class PrimaryFilter {

  public static final PrimaryFilter MATCH_ALL = newBuilder().build();

  private final List<Predicate> predicates;

  private PrimaryFilter(final List<Predicate> predicates) {
    this.predicates = predicates;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** @return a filter matching series carrying every one of {@code tags}. */
  public static PrimaryFilter equalTo(final Map<String, String> tags) {
    Builder builder = newBuilder();
    for (Map.Entry<String, String> entry : tags.entrySet()) {
      builder.where(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }

  public List<Predicate> getPredicates() {
    return predicates;
  }

  public boolean matchAll() {
    return predicates.isEmpty();
  }

  @Override
  public String toString() {
    return "PrimaryFilter" + predicates;
  }

  public enum Operator {
    IN {
      @Override
      public void aggregate(RoaringBitmap result, RoaringBitmap matched) {
        result.and(matched);
      }
    },
    NOT {
      @Override
      public void aggregate(RoaringBitmap result, RoaringBitmap matched) {
        result.andNot(matched);
      }
    };

    public abstract void aggregate(RoaringBitmap result, RoaringBitmap matched);
  }

  public static class Predicate {
    private final String tagKey;
    private final String[] tagValues;
    private final Operator operator;

    Predicate(final String tagKey, final String[] tagValues, final Operator operator) {
      this.tagKey = tagKey;
      this.tagValues = tagValues;
      this.operator = operator;
    }

    public String getTagKey() {
      return tagKey;
    }

    public String[] getTagValues() {
      return tagValues;
    }

    public Operator getOperator() {
      return operator;
    }

    /**
     * Narrows {@code result} with this predicate.
     *
     * @param valueMap value code to series bitmap for this predicate's key, null if the key was
     *     never indexed.
     */
    void apply(
        final RoaringBitmap result,
        final Map<Integer, RoaringBitmap> valueMap,
        final TagDictionary dictionary) {
      RoaringBitmap matched = new RoaringBitmap();
      if (valueMap != null) {
        for (int i = 0; i < tagValues.length; i++) {
          int code = dictionary.lookup(tagValues[i]);
          if (code == TagDictionary.NOT_FOUND) {
            continue;
          }
          RoaringBitmap valueRR = valueMap.get(code);
          if (valueRR != null) {
            matched.or(valueRR);
          }
        }
      }
      operator.aggregate(result, matched);
    }

    @Override
    public String toString() {
      return tagKey + (operator == Operator.NOT ? " not in " : " in ") + Arrays.toString(tagValues);
    }
  }

  public static class Builder {
    private final List<Predicate> predicates = new ArrayList<>();

    public Builder where(final String tagKey, final String... tagValues) {
      return add(tagKey, tagValues, Operator.IN);
    }

    public Builder whereNot(final String tagKey, final String... tagValues) {
      return add(tagKey, tagValues, Operator.NOT);
    }

    private Builder add(final String tagKey, final String[] tagValues, final Operator operator) {
      Preconditions.checkNotNull(tagKey, "tagKey");
      Preconditions.checkArgument(
          tagValues != null && tagValues.length > 0, "No values given for %s", tagKey);
      predicates.add(new Predicate(tagKey, tagValues.clone(), operator));
      return this;
    }

    public PrimaryFilter build() {
      return new PrimaryFilter(ImmutableList.copyOf(predicates));
    }
  }
}
