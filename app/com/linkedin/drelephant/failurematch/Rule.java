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

package com.linkedin.drelephant.failurematch;

import static com.linkedin.drelephant.failurematch.util.Constant.*;


/**
 * For rule based classification of log lines , there can be different rules to
 * classify a line . Current implementations are regex based ignore , conditional ignore
 * and error rules . Rules are immutable once loaded.
 */
public interface Rule {
  /**
   * This will contain the actual logic of the rule . For e.g for a conditional ignore
   * rule it checks the ignore regex and then its exception regex.
   * @param line : one log line without line terminator
   * @return true if the rule applies to the line
   */
  boolean matches(String line);

  RuleKind getKind();

  /**
   * Every error rule has a severity level between 1 and 10 , higher is more specific.
   * Ignore rules have level 0.
   */
  int getLevel();

  /**
   * Position tag which identifies the rule in results , for e.g builtin:segfault
   */
  String getTag();
}
