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
 * Ignore rule with its own exception condition . For e.g a line containing simctrl
 * is noise unless it also reports a caught signal , in which case the line is
 * not ignored and goes on to error rule evaluation.
 */
public class ConditionalIgnoreRule extends RegexRule {
  private final Pattern exceptionPattern;

  public ConditionalIgnoreRule(Pattern pattern, Pattern exceptionPattern, String tag) {
    super(pattern, tag);
    if (exceptionPattern == null) {
      throw new IllegalArgumentException("Conditional ignore rule " + tag + " has no exception pattern");
    }
    this.exceptionPattern = exceptionPattern;
  }

  public ConditionalIgnoreRule(String regex, String exceptionRegex, boolean caseInsensitive, String tag) {
    this(compile(regex, caseInsensitive), compile(exceptionRegex, caseInsensitive), tag);
  }

  /**
   * @return true only if the ignore regex is found and the exception regex is not
   */
  @Override
  public boolean matches(String line) {
    return super.matches(line) && !isExempt(line);
  }

  /**
   * @param line : log line
   * @return true if the exception condition holds for the line
   */
  public boolean isExempt(String line) {
    return line != null && exceptionPattern.matcher(line).find();
  }

  public Pattern getExceptionPattern() {
    return exceptionPattern;
  }

  @Override
  public RuleKind getKind() {
    return RuleKind.IGNORE;
  }

  @Override
  public int getLevel() {
    return 0;
  }
}
