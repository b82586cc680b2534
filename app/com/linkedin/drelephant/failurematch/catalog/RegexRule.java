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

import com.linkedin.drelephant.failurematch.Rule;
import java.util.regex.Pattern;

import static com.linkedin.drelephant.failurematch.util.Constant.*;


/**
 * Rule identifies a line based on regex . The regex is searched anywhere in the line ,
 * anchors have to be part of the regex itself.
 */
public abstract class RegexRule implements Rule {
  private final Pattern pattern;
  private final String tag;

  protected RegexRule(Pattern pattern, String tag) {
    if (pattern == null) {
      throw new IllegalArgumentException("Pattern of rule " + tag + " is null");
    }
    if (tag == null || tag.trim().isEmpty()) {
      throw new IllegalArgumentException("Rule with pattern " + pattern.pattern() + " has no tag");
    }
    this.pattern = pattern;
    this.tag = tag;
  }

  static Pattern compile(String regex, boolean caseInsensitive) {
    return caseInsensitive ? Pattern.compile(regex, Pattern.CASE_INSENSITIVE) : Pattern.compile(regex);
  }

  @Override
  public boolean matches(String line) {
    return line != null && pattern.matcher(line).find();
  }

  public Pattern getPattern() {
    return pattern;
  }

  public boolean isCaseInsensitive() {
    return (pattern.flags() & Pattern.CASE_INSENSITIVE) != 0;
  }

  @Override
  public String getTag() {
    return tag;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + "kind=" + getKind() + ", level=" + getLevel() + ", tag='" + tag + '\''
        + ", pattern='" + pattern.pattern() + '\'' + '}';
  }
}
