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

import com.linkedin.drelephant.failurematch.catalog.ClassificationOutcome;


/**
 * Every line classifier should implement this interface . Current implementation
 * is the rule based pattern catalog.
 */
public interface Classifier {

  /**
   * Classifies one line with warnings not treated as errors
   * @param line : log line
   * @return IGNORED , MATCHED with level and tag , or NONE
   */
  ClassificationOutcome classify(String line);

  /**
   *
   * @param line : log line
   * @param warningsAsErrors : if true , warning rules take part in the classification
   * @return IGNORED , MATCHED with level and tag , or NONE
   */
  ClassificationOutcome classify(String line, boolean warningsAsErrors);
}
