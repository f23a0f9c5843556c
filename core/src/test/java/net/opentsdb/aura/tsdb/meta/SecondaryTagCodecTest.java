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
import net.opentsdb.aura.tsdb.core.CodeSpaceExhaustedException;
import net.opentsdb.aura.tsdb.core.TagSpaceExhaustedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SecondaryTagCodecTest {

  private TagDictionary dictionary;
  private SecondaryTagCodec codec;

  @BeforeEach
  void beforeEach() {
    dictionary = new TagDictionary();
    codec = new SecondaryTagCodec(dictionary, 64);
  }

  @Test
  void decodeReversesEncode() throws Exception {
    Map<String, String> tags = ImmutableMap.of("env", "prod", "region", "us-east", "az", "1a");
    long mask = codec.encode(tags);

    assertEquals(3, Long.bitCount(mask));
    assertEquals(tags, codec.decode(mask));
    assertEquals(mask, codec.encode(ImmutableMap.of("az", "1a", "region", "us-east", "env", "prod")));
  }

  @Test
  void noTagsIsZero() throws Exception {
    assertEquals(0L, codec.encode(Collections.emptyMap()));
    assertEquals(0L, codec.encode(null));
    assertTrue(codec.decode(0L).isEmpty());
  }

  @Test
  void onePositionPerPair() throws Exception {
    long prod = codec.encode(ImmutableMap.of("env", "prod"));
    long staging = codec.encode(ImmutableMap.of("env", "staging"));
    long both = codec.encode(ImmutableMap.of("env", "prod", "tier", "staging"));

    assertEquals(1, Long.bitCount(prod));
    assertEquals(1, Long.bitCount(staging));
    assertNotEquals(prod, staging);
    assertEquals(prod, both & prod);
    assertEquals(3, codec.assignedBits());
  }

  @Test
  void exhaustionIsAtomic() throws Exception {
    SecondaryTagCodec narrow = new SecondaryTagCodec(dictionary, 2);
    long mask = narrow.encode(ImmutableMap.of("env", "prod", "region", "us"));
    int dictionarySize = dictionary.size();

    TagSpaceExhaustedException e =
        assertThrows(
            TagSpaceExhaustedException.class,
            () -> narrow.encode(ImmutableMap.of("env", "prod", "rack", "r7")));
    assertEquals(1, e.getRequired());
    assertEquals(2, e.getBitWidth());

    assertEquals(dictionarySize, dictionary.size());
    assertEquals(TagDictionary.NOT_FOUND, dictionary.lookup("rack"));
    assertEquals(TagDictionary.NOT_FOUND, dictionary.lookup("r7"));
    assertEquals(2, narrow.assignedBits());

    // known pairs keep encoding
    assertEquals(mask, narrow.encode(ImmutableMap.of("region", "us", "env", "prod")));
  }

  @Test
  void fullDictionaryAssignsNoBits() throws Exception {
    SecondaryTagCodec small = new SecondaryTagCodec(new TagDictionary(3), 64);
    assertThrows(
        CodeSpaceExhaustedException.class,
        () -> small.encode(ImmutableMap.of("k1", "v1", "k2", "v2")));
    assertEquals(0, small.assignedBits());
    assertEquals(SecondaryTagCodec.NOT_FOUND, small.lookupBit("k1", "v1"));

    // the pairs that fit still get bits in order
    assertEquals(1L, small.encode(ImmutableMap.of("k1", "v1")));
    assertEquals(1, small.assignedBits());
  }

  @Test
  void matchesAllAndAny() {
    long sample = 0b0110L;
    assertTrue(SecondaryTagCodec.matches(sample, 0b0010L, FilterMode.ALL));
    assertTrue(SecondaryTagCodec.matches(sample, 0b0110L, FilterMode.ALL));
    assertFalse(SecondaryTagCodec.matches(sample, 0b0011L, FilterMode.ALL));
    assertTrue(SecondaryTagCodec.matches(sample, 0b0011L, FilterMode.ANY));
    assertFalse(SecondaryTagCodec.matches(sample, 0b1001L, FilterMode.ANY));
    assertTrue(SecondaryTagCodec.matches(sample, 0L, FilterMode.ALL));
  }

  @Test
  void lookupNeverAssigns() throws Exception {
    codec.encode(ImmutableMap.of("env", "prod"));

    assertEquals(SecondaryTagCodec.NOT_FOUND, codec.lookupBit("env", "dev"));
    assertEquals(OptionalLong.empty(), codec.lookupMask(ImmutableMap.of("env", "dev")));
    assertTrue(codec.lookupMask(ImmutableMap.of("env", "prod")).isPresent());
    assertEquals(1, codec.assignedBits());
    assertEquals(TagDictionary.NOT_FOUND, dictionary.lookup("dev"));
  }

  @Test
  void decodeUnassignedBit() throws Exception {
    codec.encode(ImmutableMap.of("env", "prod"));
    assertThrows(IllegalArgumentException.class, () -> codec.decode(1L << 5));
  }

  @Test
  void widthBounds() {
    assertThrows(IllegalArgumentException.class, () -> new SecondaryTagCodec(dictionary, 0));
    assertThrows(IllegalArgumentException.class, () -> new SecondaryTagCodec(dictionary, 65));
  }

  @Test
  void fullWidth() throws Exception {
    for (int i = 0; i < 64; i++) {
      codec.encode(ImmutableMap.of("k", "v" + i));
    }
    long last = codec.encode(ImmutableMap.of("k", "v63"));
    assertEquals(Long.MIN_VALUE, last);
    assertEquals(ImmutableMap.of("k", "v63"), codec.decode(last));
    assertThrows(
        TagSpaceExhaustedException.class, () -> codec.encode(ImmutableMap.of("k", "v64")));
  }
}
