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
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.log4j.Logger;


/**
 * Holds the current pattern catalog . Readers take one snapshot with {@link #current()} per
 * scan , updates replace the whole catalog with a single atomic swap so a scan sees either
 * the old or the new catalog.
 */
public class CatalogHolder {
  private static final Logger logger = Logger.getLogger(CatalogHolder.class);
  private final AtomicReference<PatternCatalog> catalog;

  public CatalogHolder(PatternCatalog initialCatalog) {
    if (initialCatalog == null) {
      throw new IllegalArgumentException("Initial pattern catalog is null");
    }
    this.catalog = new AtomicReference<>(initialCatalog);
  }

  public PatternCatalog current() {
    return catalog.get();
  }

  /**
   * @param newCatalog : replacement catalog
   * @return the catalog which was replaced
   */
  public PatternCatalog swap(PatternCatalog newCatalog) {
    if (newCatalog == null) {
      throw new IllegalArgumentException("Pattern catalog to swap in is null");
    }
    PatternCatalog previous = catalog.getAndSet(newCatalog);
    logger.info(" Pattern catalog swapped from " + previous.getVersion() + " to " + newCatalog.getVersion());
    return previous;
  }

  /**
   * Appends reviewed rules to the current catalog . Concurrent promotions are applied one
   * after the other , none is lost.
   * @return the new current catalog
   */
  public PatternCatalog promote(final List<? extends Rule> reviewedRules, final String newVersion) {
    PatternCatalog updated = catalog.updateAndGet(current -> current.withAdditionalRules(reviewedRules, newVersion));
    logger.info(" Promoted " + reviewedRules.size() + " rules into pattern catalog " + updated.getVersion());
    return updated;
  }
}
