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

public class TagSpaceExhaustedException extends WriteException {

  private final int bitWidth;
  private final int required;

  public TagSpaceExhaustedException(final int bitWidth, final int assigned, final int required) {
    super(
        "Secondary tag space exhausted. width: "
            + bitWidth
            + " assigned: "
            + assigned
            + " new pairs: "
            + required);
    this.bitWidth = bitWidth;
    this.required = required;
  }

  public int getBitWidth() {
    return bitWidth;
  }

  public int getRequired() {
    return required;
  }

  @Override
  public String reason() {
    return "tag_space_exhausted";
  }
}
