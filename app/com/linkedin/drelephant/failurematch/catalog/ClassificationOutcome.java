/*
 * Copyright 2016 LinkedIn Corp.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */

package com.linkedin.drelephant.failurematch.catalog;

import java.util.Objects;

import static com.linkedin.drelephant.failurematch.util.Constant.*;


/**
 * Outcome of classifying one line : IGNORED , MATCHED(level , tag) or NONE.
 */
public final class ClassificationOutcome {
  private static final ClassificationOutcome NONE = new ClassificationOutcome(OutcomeType.NONE, 0, null);

  private final OutcomeType type;
  private final int level;
  private final String tag;

  private ClassificationOutcome(OutcomeType type, int level, String tag) {
    this.type = type;
    this.level = level;
    this.tag = tag;
  }

  /**
   * @param tag : tag of the ignore rule which applied
   */
  public static ClassificationOutcome ignored(String tag) {
    return new ClassificationOutcome(OutcomeType.IGNORED, 0, tag);
  }

  public static ClassificationOutcome matched(int level, String tag) {
    return new ClassificationOutcome(OutcomeType.MATCHED, level, tag);
  }

  public static ClassificationOutcome none() {
    return NONE;
  }

  public OutcomeType getType() {
    return type;
  }

  public boolean isIgnored() {
    return type == OutcomeType.IGNORED;
  }

  public boolean isMatched() {
    return type == OutcomeType.MATCHED;
  }

  /**
   * @return severity level of the matched rule , 0 unless MATCHED
   */
  public int getLevel() {
    return level;
  }

  /**
   * @return tag of the rule which produced the outcome , null for NONE
   */
  public String getTag() {
    return tag;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ClassificationOutcome that = (ClassificationOutcome) o;
    return level == that.level && type == that.type && Objects.equals(tag, that.tag);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, level, tag);
  }

  @Override
  public String toString() {
    return "ClassificationOutcome{" + "type=" + type + ", level=" + level + ", tag='" + tag + '\'' + '}';
  }
}
