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

package com.linkedin.drelephant.failurematch.normalizer;

import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.Assert.*;


public class TextNormalizerTest {
  private final Logger logger = LoggerFactory.getLogger(this.getClass());
  private TextNormalizer normalizer;

  @Before
  public void setup() {
    normalizer = new TextNormalizer();
  }

  @Test
  public void testStemming() {
    assertTrue(normalizer.isStemmingAvailable());
    TokenSet failing = normalizer.normalize("Test failing");
    TokenSet failed = normalizer.normalize("test failed");
    assertTrue(failing.getBaseTermSet().contains("fail"));
    assertEquals(failing.getBaseTermSet(), failed.getBaseTermSet());
    assertTrue(normalizer.normalize("two faults").getBaseTermSet().contains("fault"));
  }

  @Test
  public void testStopWordsAreRemoved() {
    TokenSet tokens = normalizer.normalize("the fault is in the driver");
    assertFalse(tokens.getBaseTermSet().contains("the"));
    assertFalse(tokens.getBaseTermSet().contains("is"));
    assertTrue(tokens.getBaseTermSet().contains("driver"));
  }

  @Test
  public void testTechnicalTokensAreKept() {
    TokenSet tokens = normalizer.normalize("NULL pointer at 0xDEADBEEF in init_hw()");
    logger.info("Normalized " + tokens);
    assertTrue(tokens.getTechnicalTerms().contains("0xdeadbeef"));
    assertTrue(tokens.getTechnicalTerms().contains("init_hw()"));
    assertTrue(tokens.getTechnicalTerms().contains("null"));
    assertTrue(tokens.getBaseTermSet().containsAll(tokens.getTechnicalTerms()));
  }

  @Test
  public void testSynonymExpansion() {
    TokenSet tokens = normalizer.normalize("segfault in dma engine");
    assertTrue(tokens.getBaseTermSet().contains("segfault"));
    assertTrue(tokens.getExpansionTerms().contains("crash"));
    assertFalse(tokens.getExpansionTerms().contains("segfault"));
    assertTrue(tokens.terms().contains("crash"));

    // synonym relation is symmetric
    assertTrue(normalizer.synonymsOf("crash").contains("segfault"));
    assertTrue(normalizer.synonymsOf("segfault").contains("crash"));
    assertTrue(normalizer.synonymsOf("scoreboard").isEmpty());
  }

  @Test
  public void testNormalizationIsIdempotent() {
    TokenSet once = normalizer.normalize("Segmentation fault while running tests , memory allocation failed at 0x7ffe");
    TokenSet twice = normalizer.normalize(once);
    assertEquals(once, twice);
    assertEquals(once.getBaseTerms(), twice.getBaseTerms());
  }

  @Test
  public void testEmptyText() {
    assertTrue(normalizer.normalize((String) null).isEmpty());
    assertTrue(normalizer.normalize("   ").isEmpty());
    assertTrue(normalizer.normalize(TokenSet.empty()).isEmpty());
    assertEquals(0, normalizer.normalize("").size());
  }

  @Test
  public void testFallbackTokenization() {
    TextNormalizer fallback = new TextNormalizer(null);
    assertFalse(fallback.isStemmingAvailable());

    TokenSet tokens = fallback.normalize("Failing tests on the DMA engine");
    assertTrue(tokens.getBaseTermSet().contains("failing"));
    assertTrue(tokens.getBaseTermSet().contains("engine"));
    assertTrue(tokens.getTechnicalTerms().contains("dma"));
    assertFalse(tokens.getBaseTermSet().contains("the"));
    assertTrue(tokens.getExpansionTerms().contains("fail"));
    assertTrue(tokens.getExpansionTerms().contains("error"));
  }
}
