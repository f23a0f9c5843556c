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
import gnu.trove.map.hash.TLongIntHashMap;
import net.opentsdb.aura.tsdb.core.CodeSpaceExhaustedException;
import net.opentsdb.aura.tsdb.core.TagSpaceExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalLong;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Encodes a set of secondary (key, value) pairs into a fixed width bitmask. Each distinct pair
 * gets the next free bit the first time it is seen and keeps it for the lifetime of the codec.
 */
public class SecondaryTagCodec {

  private static final Logger LOGGER = LoggerFactory.getLogger(SecondaryTagCodec.class);

  public static final int MAX_WIDTH = Long.SIZE;
  public static final int NOT_FOUND = -1;

  private final TagDictionary dictionary;
  private final int bitWidth;
  private final TLongIntHashMap pairToBit;
  private final long[] bitToPair;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private int assigned;

  public SecondaryTagCodec(final TagDictionary dictionary, final int bitWidth) {
    Preconditions.checkArgument(
        bitWidth > 0 && bitWidth <= MAX_WIDTH,
        "Secondary bit width must be in [1, %s]: %s",
        MAX_WIDTH,
        bitWidth);
    this.dictionary = dictionary;
    this.bitWidth = bitWidth;
    this.pairToBit = new TLongIntHashMap(bitWidth * 2, 0.5f, -1L, NOT_FOUND);
    this.bitToPair = new long[bitWidth];
  }

  /**
   * Either every pair gets a bit or none does: when the new pairs would not fit, nothing is
   * assigned and nothing is interned. When the dictionary runs out of codes, strings interned
   * before the failure stay but no bit is assigned.
   *
   * @return the bitmask of {@code tags}, 0 for no tags.
   * @throws TagSpaceExhaustedException when the new pairs exceed the configured width.
   * @throws CodeSpaceExhaustedException when a new key or value can not be interned.
   */
  public long encode(final Map<String, String> tags)
      throws TagSpaceExhaustedException, CodeSpaceExhaustedException {
    if (tags == null || tags.isEmpty()) {
      return 0L;
    }
    lock.readLock().lock();
    try {
      OptionalLong known = lookupMaskLocked(tags);
      if (known.isPresent()) {
        return known.getAsLong();
      }
    } finally {
      lock.readLock().unlock();
    }

    lock.writeLock().lock();
    try {
      int missing = 0;
      for (Map.Entry<String, String> entry : tags.entrySet()) {
        if (lookupBitLocked(entry.getKey(), entry.getValue()) == NOT_FOUND) {
          missing++;
        }
      }
      if (assigned + missing > bitWidth) {
        LOGGER.warn(
            "Rejecting secondary tags {}, {} of {} bits assigned and {} new pairs",
            tags,
            assigned,
            bitWidth,
            missing);
        throw new TagSpaceExhaustedException(bitWidth, assigned, missing);
      }
      // intern everything first, a full dictionary must not leave bits behind
      long[] pairs = new long[tags.size()];
      int i = 0;
      for (Map.Entry<String, String> entry : tags.entrySet()) {
        pairs[i++] = pair(dictionary.intern(entry.getKey()), dictionary.intern(entry.getValue()));
      }
      long mask = 0;
      for (long pair : pairs) {
        int bit = pairToBit.get(pair);
        if (bit == NOT_FOUND) {
          bit = assigned++;
          pairToBit.put(pair, bit);
          bitToPair[bit] = pair;
        }
        mask |= 1L << bit;
      }
      return mask;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** @return the pairs of {@code bitmask} sorted by key. */
  public SortedMap<String, String> decode(final long bitmask) {
    TreeMap<String, String> tags = new TreeMap<>();
    lock.readLock().lock();
    try {
      long remaining = bitmask;
      while (remaining != 0) {
        int bit = Long.numberOfTrailingZeros(remaining);
        remaining &= remaining - 1;
        if (bit >= assigned) {
          throw new IllegalArgumentException(
              "Bit " + bit + " of " + Long.toHexString(bitmask) + " was never assigned");
        }
        long pair = bitToPair[bit];
        tags.put(dictionary.resolve(keyCode(pair)), dictionary.resolve(valueCode(pair)));
      }
    } finally {
      lock.readLock().unlock();
    }
    return Collections.unmodifiableSortedMap(tags);
  }

  public static boolean matches(final long bitmask, final long filterMask, final FilterMode mode) {
    return mode.matches(bitmask, filterMask);
  }

  /** @return the bit of the pair or {@link #NOT_FOUND}. Never assigns. */
  public int lookupBit(final String key, final String value) {
    lock.readLock().lock();
    try {
      return lookupBitLocked(key, value);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** @return the mask of {@code tags}, empty if any pair was never seen. Never assigns. */
  public OptionalLong lookupMask(final Map<String, String> tags) {
    lock.readLock().lock();
    try {
      return lookupMaskLocked(tags);
    } finally {
      lock.readLock().unlock();
    }
  }

  private OptionalLong lookupMaskLocked(final Map<String, String> tags) {
    long mask = 0;
    for (Map.Entry<String, String> entry : tags.entrySet()) {
      int bit = lookupBitLocked(entry.getKey(), entry.getValue());
      if (bit == NOT_FOUND) {
        return OptionalLong.empty();
      }
      mask |= 1L << bit;
    }
    return OptionalLong.of(mask);
  }

  private int lookupBitLocked(final String key, final String value) {
    int k = dictionary.lookup(key);
    if (k == TagDictionary.NOT_FOUND) {
      return NOT_FOUND;
    }
    int v = dictionary.lookup(value);
    if (v == TagDictionary.NOT_FOUND) {
      return NOT_FOUND;
    }
    return pairToBit.get(pair(k, v));
  }

  public int getBitWidth() {
    return bitWidth;
  }

  public int assignedBits() {
    lock.readLock().lock();
    try {
      return assigned;
    } finally {
      lock.readLock().unlock();
    }
  }

  private static long pair(final int keyCode, final int valueCode) {
    return ((long) keyCode << 32) | (valueCode & 0xFFFFFFFFL);
  }

  private static int keyCode(final long pair) {
    return (int) (pair >>> 32);
  }

  private static int valueCode(final long pair) {
    return (int) pair;
  }
}
