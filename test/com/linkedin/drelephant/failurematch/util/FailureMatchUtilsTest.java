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

package com.linkedin.drelephant.failurematch.util;

import org.apache.hadoop.conf.Configuration;
import org.junit.After;
import org.junit.Test;

import static com.linkedin.drelephant.failurematch.util.Constant.*;
import static com.linkedin.drelephant.failurematch.util.FailureMatchUtils.*;
import static com.linkedin.drelephant.failurematch.util.FailureMatchUtils.ConfigurationBuilder.*;
import static org.junit.Assert.*;


public class FailureMatchUtilsTest {

  @After
  public void tearDown() {
    buildConfigurations(loadConfiguration());
  }

  @Test
  public void testLoadConfiguration() {
    buildConfigurations(loadConfiguration());
    assertEquals(DEFAULT_CATALOG_RESOURCE, CATALOG_RESOURCE.getValue());
    assertEquals(Integer.valueOf(10), HISTORY_SIZE.getValue());
    assertEquals(Integer.valueOf(20), MIN_TRAINING_RECORDS.getValue());
    assertEquals(Float.valueOf(0.3f), BLEND_WEIGHT.getValue());
    assertEquals(Integer.valueOf(4), BATCH_THREADS.getValue());
    assertEquals(MIN_SUPPORT_NAME, MIN_SUPPORT.getConfigurationName());
    assertNotNull(MIN_SUPPORT.getDoc());
  }

  @Test
  public void testOverride() {
    Configuration configuration = new Configuration(false);
    configuration.setInt(MIN_SUPPORT_NAME, 7);
    configuration.set(WEIGHT_PRESET_NAME, "semantic_heavy");
    buildConfigurations(configuration);
    assertEquals(Integer.valueOf(7), MIN_SUPPORT.getValue());
    assertEquals("semantic_heavy", WEIGHT_PRESET.getValue());
    // everything else keeps its default
    assertEquals(Integer.valueOf(0), MAX_RESULTS.getValue());
    assertTrue(MIN_SUPPORT.isOverridden());
    assertFalse(MAX_RESULTS.isOverridden());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeValue() {
    Configuration configuration = new Configuration(false);
    configuration.setInt(MAX_RESULTS_NAME, -1);
    buildConfigurations(configuration);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testValueOutsideUnitInterval() {
    Configuration configuration = new Configuration(false);
    configuration.setFloat(BLEND_WEIGHT_NAME, 1.5f);
    buildConfigurations(configuration);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testResolvedBonusBelowOne() {
    Configuration configuration = new Configuration(false);
    configuration.setFloat(RESOLVED_BONUS_NAME, 0.9f);
    buildConfigurations(configuration);
  }

  @Test
  public void testContainsErrorIndicator() {
    assertTrue(containsErrorIndicator("Unable to open file /tmp/x"));
    assertTrue(containsErrorIndicator("bus FAIL at 20ns"));
    assertTrue(containsErrorIndicator("license checkout denied"));
    assertFalse(containsErrorIndicator("simulation complete"));
    assertFalse(containsErrorIndicator("   "));
    assertFalse(containsErrorIndicator(null));
  }
}
