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
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.Before;
import org.junit.Test;

import static com.linkedin.drelephant.failurematch.util.Constant.*;
import static org.junit.Assert.*;


public class PatternCatalogLoaderTest {
  private PatternCatalogLoader loader;

  @Before
  public void setup() {
    loader = new PatternCatalogLoader();
  }

  @Test
  public void testLoadBuiltinCatalog() {
    PatternCatalog catalog = loader.load(DEFAULT_CATALOG_RESOURCE);
    assertEquals("1.0.0", catalog.getVersion());
    assertEquals(27, catalog.getIgnoreRules().size());
    assertEquals(71, catalog.getErrorRules().size());
    assertEquals(1, catalog.getWarningRules().size());

    Rule first = catalog.getIgnoreRules().get(0);
    assertTrue(first instanceof ConditionalIgnoreRule);
    assertEquals("ignore:simctrl", first.getTag());
    for (Rule rule : catalog.getErrorRules()) {
      assertTrue(rule.getLevel() >= 4 && rule.getLevel() <= 10);
    }
  }

  @Test
  public void testLoadDefinition() {
    PatternCatalog catalog = loader.load(stream("{\"version\":\"2.1\","
        + "\"ignoreRules\":[{\"pattern\":\"heartbeat\",\"tag\":\"ignore:heartbeat\",\"caseInsensitive\":true}],"
        + "\"errorRules\":[{\"pattern\":\"TIMEOUT\",\"level\":6,\"tag\":\"custom:timeout\"}]}"), "inline");

    assertEquals("2.1", catalog.getVersion());
    assertEquals(2, catalog.size());
    assertTrue(catalog.classify("HEARTBEAT TIMEOUT").isIgnored());
    assertEquals(6, catalog.classify("watchdog TIMEOUT after 30s").getLevel());
    assertEquals(OutcomeType.NONE, catalog.classify("watchdog timeout after 30s").getType());
  }

  @Test(expected = CatalogDefinitionException.class)
  public void testInvalidJson() {
    loader.load(stream("{\"version\": \"1\", \"errorRules\": ["), "broken");
  }

  @Test(expected = CatalogDefinitionException.class)
  public void testMissingVersion() {
    loader.load(stream("{\"errorRules\":[{\"pattern\":\"ERROR\",\"level\":5,\"tag\":\"e\"}]}"), "no-version");
  }

  @Test(expected = CatalogDefinitionException.class)
  public void testInvalidRegex() {
    loader.load(stream("{\"version\":\"1\",\"errorRules\":[{\"pattern\":\"ERROR[\",\"level\":5,\"tag\":\"e\"}]}"),
        "bad-regex");
  }

  @Test(expected = CatalogDefinitionException.class)
  public void testLevelOutOfRange() {
    loader.load(stream("{\"version\":\"1\",\"errorRules\":[{\"pattern\":\"ERROR\",\"level\":42,\"tag\":\"e\"}]}"),
        "bad-level");
  }

  @Test(expected = CatalogDefinitionException.class)
  public void testErrorRuleWithoutLevel() {
    loader.load(stream("{\"version\":\"1\",\"errorRules\":[{\"pattern\":\"ERROR\",\"tag\":\"e\"}]}"), "no-level");
  }

  @Test(expected = CatalogDefinitionException.class)
  public void testDuplicateIgnoreTag() {
    loader.load(stream("{\"version\":\"1\",\"ignoreRules\":["
        + "{\"pattern\":\"a\",\"tag\":\"ignore:x\"},{\"pattern\":\"b\",\"tag\":\"ignore:x\"}]}"), "duplicate");
  }

  @Test(expected = CatalogDefinitionException.class)
  public void testMissingResource() {
    loader.load("does/not/exist/catalog.json");
  }

  private static InputStream stream(String json) {
    return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
  }
}
