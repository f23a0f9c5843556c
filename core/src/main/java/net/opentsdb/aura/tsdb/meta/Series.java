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

import net.opentsdb.aura.tsdb.core.MetricType;
import net.opentsdb.aura.tsdb.core.store.MetricValueStore;

import java.util.SortedMap;

/** A time series: immutable identity and type, plus its value store. */
public class Series {

  private final int id;
  private final PrimaryTagSet tagSet;
  private final SortedMap<String, String> primaryTags;
  private final MetricType type;
  private final MetricValueStore store;
  private volatile boolean deleted;

  Series(
      final int id,
      final PrimaryTagSet tagSet,
      final SortedMap<String, String> primaryTags,
      final MetricType type,
      final MetricValueStore store) {
    this.id = id;
    this.tagSet = tagSet;
    this.primaryTags = primaryTags;
    this.type = type;
    this.store = store;
  }

  public int getId() {
    return id;
  }

  public PrimaryTagSet getTagSet() {
    return tagSet;
  }

  public SortedMap<String, String> getPrimaryTags() {
    return primaryTags;
  }

  public MetricType getType() {
    return type;
  }

  public MetricValueStore getStore() {
    return store;
  }

  public boolean isDeleted() {
    return deleted;
  }

  void markDeleted() {
    deleted = true;
  }

  @Override
  public String toString() {
    return "Series{id=" + id + ", " + type + ", " + primaryTags + "}";
  }
}
