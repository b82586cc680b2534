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

/**
 * Thrown when the pattern catalog definition is missing or corrupt . This is fatal ,
 * classification cannot run without a valid catalog.
 */
public class CatalogDefinitionException extends RuntimeException {

  public CatalogDefinitionException(String message) {
    super(message);
  }

  public CatalogDefinitionException(String message, Throwable cause) {
    super(message, cause);
  }
}
