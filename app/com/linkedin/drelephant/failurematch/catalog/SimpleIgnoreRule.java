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
 * Marks a line as noise whenever its regex is found.
 */
public class SimpleIgnoreRule extends RegexRule {

  public SimpleIgnoreRule(Pattern pattern, String tag) {
    super(pattern, tag);
  }

  public SimpleIgnoreRule(String regex, boolean caseInsensitive, String tag) {
    this(compile(regex, caseInsensitive), tag);
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
