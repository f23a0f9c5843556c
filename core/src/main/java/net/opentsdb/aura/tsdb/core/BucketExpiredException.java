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

/** Thrown when a sample falls in a bucket that retention has expired or already evicted. */
public class BucketExpiredException extends WriteException {

  private final long timestamp;
  private final long bucketStart;

  public BucketExpiredException(final long timestamp, final long bucketStart, final int width) {
    super(
        "Bucket ["
            + bucketStart
            + ", "
            + (bucketStart + width)
            + ") for timestamp "
            + timestamp
            + " is past retention");
    this.timestamp = timestamp;
    this.bucketStart = bucketStart;
  }

  public long getTimestamp() {
    return timestamp;
  }

  public long getBucketStart() {
    return bucketStart;
  }

  @Override
  public String reason() {
    return "bucket_expired";
  }
}
