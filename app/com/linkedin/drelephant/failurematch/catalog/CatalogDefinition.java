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

import java.util.ArrayList;
import java.util.List;
import lombok.Data;


/**
 * Versioned definition of the pattern catalog as stored in JSON.
 * Order of the rules inside each list is the catalog order.
 */
@Data
public class CatalogDefinition {
  private String version;
  private List<RuleDefinition> ignoreRules = new ArrayList<>();
  private List<RuleDefinition> errorRules = new ArrayList<>();
  private List<RuleDefinition> warningRules = new ArrayList<>();
}
