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

import com.google.common.collect.ImmutableMap;
import net.opentsdb.aura.tsdb.core.Granularities;
import net.opentsdb.aura.tsdb.core.MetricType;
import net.opentsdb.aura.tsdb.core.MetricTypeMismatchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SeriesCatalogTest {

  private static final Granularities GRANULARITIES =
      Granularities.of(new int[] {10, 60}, new int[] {3600, 86400});

  private SeriesCatalog catalog;

  @BeforeEach
  void beforeEach() {
    catalog = new SeriesCatalog(new TagDictionary(), GRANULARITIES);
  }

  @Test
  void sameSeriesForAnyTagOrder() throws Exception {
    Map<String, String> forward = new LinkedHashMap<>();
    forward.put("host", "web01");
    forward.put("dc", "den");
    forward.put("metric", "cpu");
    Map<String, String> reverse = new LinkedHashMap<>();
    reverse.put("metric", "cpu");
    reverse.put("dc", "den");
    reverse.put("host", "web01");

    Series first = catalog.resolveOrCreate(forward, MetricType.GAUGE);
    Series second = catalog.resolveOrCreate(reverse, MetricType.GAUGE);

    assertSame(first, second);
    assertEquals(first.getTagSet(), second.getTagSet());
    assertEquals(1, catalog.size());
    assertEquals(ImmutableMap.of("dc", "den", "host", "web01", "metric", "cpu"), first.getPrimaryTags());
  }

  @Test
  void distinctTagSetsGetDenseIds() throws Exception {
    Series a = catalog.resolveOrCreate(ImmutableMap.of("host", "a"), MetricType.COUNT);
    Series b = catalog.resolveOrCreate(ImmutableMap.of("host", "b"), MetricType.COUNT);
    Series empty = catalog.resolveOrCreate(Collections.emptyMap(), MetricType.COUNT);

    assertEquals(0, a.getId());
    assertEquals(1, b.getId());
    assertEquals(2, empty.getId());
    assertSame(b, catalog.get(1));
    assertEquals(2, b.getStore().levels());
  }

  @Test
  void typeMismatch() throws Exception {
    Series gauge = catalog.resolveOrCreate(ImmutableMap.of("host", "a"), MetricType.GAUGE);
    MetricTypeMismatchException e =
        assertThrows(
            MetricTypeMismatchException.class,
            () -> catalog.resolveOrCreate(ImmutableMap.of("host", "a"), MetricType.COUNT));
    assertEquals(MetricType.GAUGE, e.getExisting());
    assertEquals(MetricType.COUNT, e.getRequested());
    assertEquals("type_mismatch", e.reason());
    assertSame(gauge, catalog.lookup(ImmutableMap.of("host", "a")).get());
    assertEquals(1, catalog.size());
  }

  @Test
  void lookupNeverCreates() throws Exception {
    assertFalse(catalog.lookup(ImmutableMap.of("host", "a")).isPresent());
    assertEquals(0, catalog.size());
    assertEquals(0, catalog.getDictionary().size());

    catalog.resolveOrCreate(ImmutableMap.of("host", "a"), MetricType.GAUGE);
    assertTrue(catalog.lookup(ImmutableMap.of("host", "a")).isPresent());
    assertFalse(catalog.lookup(ImmutableMap.of("host", "b")).isPresent());
  }

  @Test
  void concurrentFirstWritersCreateOnce() throws Exception {
    int threads = 16;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    Set<Integer> ids = ConcurrentHashMap.newKeySet();
    List<Future<?>> futures = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      futures.add(
          executor.submit(
              () -> {
                start.await();
                for (int i = 0; i < 100; i++) {
                  Series s =
                      catalog.resolveOrCreate(
                          ImmutableMap.of("host", "h" + i, "dc", "den"), MetricType.COUNT);
                  if (i == 42) {
                    ids.add(s.getId());
                  }
                }
                return null;
              }));
    }
    start.countDown();
    for (Future<?> future : futures) {
      future.get(30, TimeUnit.SECONDS);
    }
    executor.shutdown();

    assertEquals(1, ids.size());
    assertEquals(100, catalog.size());
    assertEquals(100, catalog.findByPrimaryFilter(PrimaryFilter.MATCH_ALL).size());
  }

  @Test
  void findByPrimaryFilter() throws Exception {
    Series a = catalog.resolveOrCreate(ImmutableMap.of("host", "a", "dc", "den"), MetricType.GAUGE);
    Series b = catalog.resolveOrCreate(ImmutableMap.of("host", "b", "dc", "den"), MetricType.GAUGE);
    Series c = catalog.resolveOrCreate(ImmutableMap.of("host", "c", "dc", "lga"), MetricType.GAUGE);

    assertEquals(
        List.of(a, b), catalog.findByPrimaryFilter(PrimaryFilter.equalTo(ImmutableMap.of("dc", "den"))));
    assertEquals(
        List.of(b),
        catalog.findByPrimaryFilter(PrimaryFilter.equalTo(ImmutableMap.of("dc", "den", "host", "b"))));
    assertEquals(
        List.of(a, c),
        catalog.findByPrimaryFilter(PrimaryFilter.newBuilder().where("host", "a", "c", "zz").build()));
    assertEquals(
        List.of(c),
        catalog.findByPrimaryFilter(PrimaryFilter.newBuilder().whereNot("dc", "den").build()));
    assertEquals(
        List.of(b),
        catalog.findByPrimaryFilter(
            PrimaryFilter.newBuilder().where("dc", "den").whereNot("host", "a").build()));
    assertEquals(List.of(a, b, c), catalog.findByPrimaryFilter(PrimaryFilter.MATCH_ALL));

    assertTrue(
        catalog.findByPrimaryFilter(PrimaryFilter.equalTo(ImmutableMap.of("dc", "sjc"))).isEmpty());
    assertTrue(
        catalog.findByPrimaryFilter(PrimaryFilter.equalTo(ImmutableMap.of("rack", "r1"))).isEmpty());
    assertEquals(
        List.of(a, b, c),
        catalog.findByPrimaryFilter(PrimaryFilter.newBuilder().whereNot("rack", "r1").build()));
  }

  @Test
  void deleteRemovesFromIndexAndNeverReusesId() throws Exception {
    Series a = catalog.resolveOrCreate(ImmutableMap.of("host", "a"), MetricType.GAUGE);
    catalog.resolveOrCreate(ImmutableMap.of("host", "b"), MetricType.GAUGE);

    assertTrue(catalog.delete(ImmutableMap.of("host", "a")));
    assertFalse(catalog.delete(ImmutableMap.of("host", "a")));
    assertFalse(catalog.delete(ImmutableMap.of("host", "zz")));
    assertTrue(a.isDeleted());
    assertNull(catalog.get(a.getId()));
    assertTrue(
        catalog.findByPrimaryFilter(PrimaryFilter.equalTo(ImmutableMap.of("host", "a"))).isEmpty());
    assertEquals(1, catalog.findByPrimaryFilter(PrimaryFilter.MATCH_ALL).size());

    // recreated with another type and a fresh id
    Series again = catalog.resolveOrCreate(ImmutableMap.of("host", "a"), MetricType.COUNT);
    assertNotEquals(a.getId(), again.getId());
    assertEquals(2, again.getId());
  }

  @Test
  void predicateNeedsValues() {
    assertThrows(IllegalArgumentException.class, () -> PrimaryFilter.newBuilder().where("host"));
  }
}
