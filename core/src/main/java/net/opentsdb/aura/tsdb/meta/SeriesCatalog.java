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
import com.google.common.collect.Iterables;
import net.opentsdb.aura.tsdb.core.CodeSpaceExhaustedException;
import net.opentsdb.aura.tsdb.core.Granularities;
import net.opentsdb.aura.tsdb.core.MetricType;
import net.opentsdb.aura.tsdb.core.MetricTypeMismatchException;
import net.opentsdb.aura.tsdb.core.store.MetricValueStore;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Maps primary tag sets to series. Creation is exactly once per distinct tag set under
 * concurrent first writers; the losers of the race get the winner's series. Series ids are dense
 * and never reused, even after a delete.
 *
 * <p>Keeps an inverted index of key code to value code to the bitmap of series ids carrying that
 * pair.
 */
public class SeriesCatalog {

  private static final Logger LOGGER = LoggerFactory.getLogger(SeriesCatalog.class);

  private final TagDictionary dictionary;
  private final Granularities granularities;
  private final ConcurrentHashMap<PrimaryTagSet, Series> series = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<Integer, Series> byId = new ConcurrentHashMap<>();
  private final AtomicInteger nextId = new AtomicInteger();

  private final Map<Integer, Map<Integer, RoaringBitmap>> indexMap = new HashMap<>();
  private final RoaringBitmap allSeries = new RoaringBitmap();
  private final ReentrantReadWriteLock indexLock = new ReentrantReadWriteLock();

  public SeriesCatalog(final TagDictionary dictionary, final Granularities granularities) {
    this.dictionary = dictionary;
    this.granularities = granularities;
  }

  /**
   * @return the series of {@code primaryTags}, created with {@code type} if it does not exist.
   * @throws MetricTypeMismatchException if the series exists with another type.
   */
  public Series resolveOrCreate(final Map<String, String> primaryTags, final MetricType type)
      throws MetricTypeMismatchException, CodeSpaceExhaustedException {
    Preconditions.checkNotNull(type, "type");
    int[] keys = new int[primaryTags.size()];
    int[] values = new int[primaryTags.size()];
    int i = 0;
    for (Map.Entry<String, String> entry : primaryTags.entrySet()) {
      keys[i] = dictionary.intern(entry.getKey());
      values[i] = dictionary.intern(entry.getValue());
      i++;
    }
    PrimaryTagSet tagSet = PrimaryTagSet.of(keys, values);
    Series resolved = series.computeIfAbsent(tagSet, k -> create(k, primaryTags, type));
    if (resolved.getType() != type) {
      throw new MetricTypeMismatchException(resolved.getPrimaryTags(), resolved.getType(), type);
    }
    return resolved;
  }

  private Series create(
      final PrimaryTagSet tagSet, final Map<String, String> primaryTags, final MetricType type) {
    int id = nextId.getAndIncrement();
    SortedMap<String, String> tags = Collections.unmodifiableSortedMap(new TreeMap<>(primaryTags));
    Series created = new Series(id, tagSet, tags, type, new MetricValueStore(type, granularities));
    byId.put(id, created);
    index(created);
    LOGGER.debug("Created {}", created);
    return created;
  }

  /** @return the series of {@code primaryTags} if it exists. Never creates or interns. */
  public Optional<Series> lookup(final Map<String, String> primaryTags) {
    PrimaryTagSet tagSet = find(primaryTags);
    return tagSet == null ? Optional.empty() : Optional.ofNullable(series.get(tagSet));
  }

  private PrimaryTagSet find(final Map<String, String> primaryTags) {
    int[] keys = new int[primaryTags.size()];
    int[] values = new int[primaryTags.size()];
    int i = 0;
    for (Map.Entry<String, String> entry : primaryTags.entrySet()) {
      keys[i] = dictionary.lookup(entry.getKey());
      values[i] = dictionary.lookup(entry.getValue());
      if (keys[i] == TagDictionary.NOT_FOUND || values[i] == TagDictionary.NOT_FOUND) {
        return null;
      }
      i++;
    }
    return PrimaryTagSet.of(keys, values);
  }

  /** @return the series with {@code seriesId}, null if unknown or deleted. */
  public Series get(final int seriesId) {
    return byId.get(seriesId);
  }

  /** @return series matching {@code filter}, ordered by id. */
  public List<Series> findByPrimaryFilter(final PrimaryFilter filter) {
    RoaringBitmap result;
    indexLock.readLock().lock();
    try {
      result = allSeries.clone();
      for (PrimaryFilter.Predicate predicate : filter.getPredicates()) {
        int keyCode = dictionary.lookup(predicate.getTagKey());
        Map<Integer, RoaringBitmap> valueMap =
            keyCode == TagDictionary.NOT_FOUND ? null : indexMap.get(keyCode);
        predicate.apply(result, valueMap, dictionary);
        if (result.isEmpty()) {
          break;
        }
      }
    } finally {
      indexLock.readLock().unlock();
    }
    List<Series> matched = new ArrayList<>(result.getCardinality());
    IntIterator ids = result.getIntIterator();
    while (ids.hasNext()) {
      Series s = byId.get(ids.next());
      if (s != null) {
        matched.add(s);
      }
    }
    return matched;
  }

  /**
   * Removes the series and its index entries. Data already read stays valid; new writes to the
   * same tags create a new series with a new id.
   *
   * @return true if a series was removed.
   */
  public boolean delete(final Map<String, String> primaryTags) {
    PrimaryTagSet tagSet = find(primaryTags);
    if (tagSet == null) {
      return false;
    }
    Series removed = series.remove(tagSet);
    if (removed == null) {
      return false;
    }
    removed.markDeleted();
    byId.remove(removed.getId());
    unindex(removed);
    LOGGER.info("Deleted {}", removed);
    return true;
  }

  private void index(final Series s) {
    PrimaryTagSet tagSet = s.getTagSet();
    indexLock.writeLock().lock();
    try {
      for (int i = 0; i < tagSet.size(); i++) {
        Map<Integer, RoaringBitmap> valueMap =
            indexMap.computeIfAbsent(tagSet.keyCode(i), k -> new HashMap<>());
        RoaringBitmap rr = valueMap.get(tagSet.valueCode(i));
        if (rr == null) {
          valueMap.put(tagSet.valueCode(i), RoaringBitmap.bitmapOf(s.getId()));
        } else {
          rr.add(s.getId());
        }
      }
      allSeries.add(s.getId());
    } finally {
      indexLock.writeLock().unlock();
    }
  }

  private void unindex(final Series s) {
    PrimaryTagSet tagSet = s.getTagSet();
    indexLock.writeLock().lock();
    try {
      for (int i = 0; i < tagSet.size(); i++) {
        Map<Integer, RoaringBitmap> valueMap = indexMap.get(tagSet.keyCode(i));
        if (valueMap == null) {
          continue;
        }
        RoaringBitmap rr = valueMap.get(tagSet.valueCode(i));
        if (rr != null) {
          rr.remove(s.getId());
          if (rr.isEmpty()) {
            valueMap.remove(tagSet.valueCode(i));
          }
        }
        if (valueMap.isEmpty()) {
          indexMap.remove(tagSet.keyCode(i));
        }
      }
      allSeries.remove(s.getId());
    } finally {
      indexLock.writeLock().unlock();
    }
  }

  public int size() {
    return series.size();
  }

  /** @return live view of the series, weakly consistent under concurrent creation. */
  public Collection<Series> series() {
    return Collections.unmodifiableCollection(series.values());
  }

  /** @return live view of every series' value store, for the sweeps. */
  public Iterable<MetricValueStore> stores() {
    return Iterables.transform(series.values(), Series::getStore);
  }

  public TagDictionary getDictionary() {
    return dictionary;
  }
}
