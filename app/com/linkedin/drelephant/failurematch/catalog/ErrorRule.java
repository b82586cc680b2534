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

import java.util.regex.Pattern;

import static com.linkedin.drelephant.failurematch.util.Constant.*;


/**
 * Rule which classifies a line as an error (or a warning) with a severity level.
 */
public class ErrorRule extends RegexRule {
  public static final int MIN_LEVEL = 1;
  public static final int MAX_LEVEL = 10;

  private final RuleKind kind;
  private final int level;

  public ErrorRule(Pattern pattern, RuleKind kind, int level, String tag) {
    super(pattern, tag);
    if (kind != RuleKind.ERROR && kind != RuleKind.WARNING) {
      throw new IllegalArgumentException("Error rule " + tag + " cannot be of kind " + kind);
    }
    if (level < MIN_LEVEL || level > MAX_LEVEL) {
      throw new IllegalArgumentException(
          "Level of rule " + tag + " should be between " + MIN_LEVEL + " and " + MAX_LEVEL + " , found " + level);
    }
    this.kind = kind;
    this.level = level;
  }

  public ErrorRule(String regex, boolean caseInsensitive, int level, String tag) {
    this(compile(regex, caseInsensitive), RuleKind.ERROR, level, tag);
  }

  public static ErrorRule warning(String regex, boolean caseInsensitive, int level, String tag) {
    return new ErrorRule(compile(regex, caseInsensitive), RuleKind.WARNING, level, tag);
  }

  @Override
  public RuleKind getKind() {
    return kind;
  }

  @Override
  public int getLevel() {
    return level;
  }
}
