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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;


/**
 * Serialized form of one rule in the catalog definition.
 * unless is only valid for ignore rules and turns them into conditional ignore rules ,
 * level is only valid for error and warning rules.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RuleDefinition {
  private String pattern;
  private String unless;
  private Integer level;
  private String tag;
  private boolean caseInsensitive;
  private String description;

  /**
   * Added for serialize and deserialize into JSON
   */
  public RuleDefinition() {
  }

  public RuleDefinition(String pattern, Integer level, String tag, boolean caseInsensitive) {
    this.pattern = pattern;
    this.level = level;
    this.tag = tag;
    this.caseInsensitive = caseInsensitive;
  }
}
