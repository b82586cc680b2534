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

import com.google.common.collect.ImmutableList;
import com.linkedin.drelephant.failurematch.Rule;
import com.linkedin.drelephant.failurematch.util.FailureMatchUtils;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.drelephant.failurematch.util.Constant.*;
import static org.junit.Assert.*;


public class PatternCatalogTest {
  private final Logger logger = LoggerFactory.getLogger(this.getClass());
  private PatternCatalog builtinCatalog;

  @Before
  public void setup() {
    FailureMatchUtils.ConfigurationBuilder.buildConfigurations(FailureMatchUtils.loadConfiguration());
    builtinCatalog = new PatternCatalogLoader().load();
  }

  @Test
  public void testHighestLevelRuleWins() {
    PatternCatalog catalog = new PatternCatalog("test", ImmutableList.<Rule>of(
        new ErrorRule("error", true, 5, "generic"),
        new ErrorRule("out of memory", false, 8, "oom"),
        new ErrorRule("memory", false, 8, "memory")));

    ClassificationOutcome outcome = catalog.classify("fatal error : out of memory");
    assertTrue(outcome.isMatched());
    assertEquals(8, outcome.getLevel());
    // same level keeps the rule which comes first in the catalog
    assertEquals("oom", outcome.getTag());

    assertEquals(ClassificationOutcome.matched(5, "generic"), catalog.classify("ERROR while linking"));
    assertEquals(OutcomeType.NONE, catalog.classify("all tests passed").getType());
    assertEquals(OutcomeType.NONE, catalog.classify("   ").getType());
  }

  @Test
  public void testIgnoreRulesAreEvaluatedFirst() {
    PatternCatalog catalog = new PatternCatalog("test", ImmutableList.<Rule>of(
        new ErrorRule("UVM_ERROR", false, 9, "uvm_error"),
        new SimpleIgnoreRule("UVM_ERROR\\s*:\\s*0", true, "uvm_error_zero")));

    ClassificationOutcome outcome = catalog.classify("UVM_ERROR :    0");
    assertTrue(outcome.isIgnored());
    assertEquals("uvm_error_zero", outcome.getTag());
    assertEquals(9, catalog.classify("UVM_ERROR @ 100ns: scoreboard mismatch").getLevel());
  }

  @Test
  public void testConditionalIgnoreFallsThroughWhenExceptionHolds() {
    ClassificationOutcome caughtSignal = builtinCatalog.classify("simctrl: run failed: caught signal 11");
    assertFalse(caughtSignal.isIgnored());
    assertTrue(caughtSignal.isMatched());
    assertEquals("builtin:failed_signal", caughtSignal.getTag());

    // the symmetric case , exception condition does not hold
    ClassificationOutcome chatter = builtinCatalog.classify("simctrl: run failed: exit status 1");
    assertTrue(chatter.isIgnored());
    assertEquals("ignore:simctrl", chatter.getTag());
  }

  @Test
  public void testConditionalIgnoreRule() {
    ConditionalIgnoreRule rule =
        new ConditionalIgnoreRule("simctrl", "failed:\\s+caught\\s+signal\\s+\\d+", false, "ignore:simctrl");
    assertTrue(rule.matches("simctrl heartbeat"));
    assertFalse(rule.matches("simctrl failed: caught signal 6"));
    assertTrue(rule.isExempt("simctrl failed: caught signal 6"));
    assertFalse(rule.matches("some other line"));
    assertEquals(RuleKind.IGNORE, rule.getKind());
  }

  @Test
  public void testWarningRulesOnlyWhenWarningsAreErrors() {
    String line = "dma_engine.cpp:120: warning: unused variable 'status'";
    assertEquals(OutcomeType.NONE, builtinCatalog.classify(line).getType());

    ClassificationOutcome outcome = builtinCatalog.classify(line, true);
    assertTrue(outcome.isMatched());
    assertEquals(3, outcome.getLevel());
    assertEquals("builtin:warning", outcome.getTag());
  }

  @Test
  public void testBuiltinCatalogLevels() {
    assertEquals(10, builtinCatalog.classify("Segmentation fault (core dumped)").getLevel());
    assertEquals(9, builtinCatalog.classify("UVM_FATAL @ 20ns: [AXI] protocol violation").getLevel());
    assertEquals(8, builtinCatalog.classify("ASSERTION FAILED: fifo overflow").getLevel());
    assertEquals(5, builtinCatalog.classify("Error: checksum mismatch").getLevel());
    assertTrue(builtinCatalog.classify("UVM_ERROR :    0").isIgnored());
    assertTrue(builtinCatalog.classify("UVM_FATAL reports   :    0").isIgnored());
    assertTrue(builtinCatalog.classify("lint run: Lint failed with warnings.errors").isMatched());
  }

  @Test
  public void testWithAdditionalRulesLeavesCatalogUntouched() {
    String line = "ERROR: unable to open file /tmp/a.cfg";
    PatternCatalog catalog = new PatternCatalog("1", ImmutableList.<Rule>of(new ErrorRule("ERROR", false, 5, "e")));
    PatternCatalog promoted = catalog.withAdditionalRules(
        ImmutableList.of(new ErrorRule("ERROR:\\s+unable\\s+to\\s+open\\s+file\\s+\\S+", false, 7, "auto:error")),
        "2");

    assertEquals(1, catalog.size());
    assertEquals(5, catalog.classify(line).getLevel());
    assertEquals(2, promoted.size());
    assertEquals("2", promoted.getVersion());
    assertEquals(7, promoted.classify(line).getLevel());
    logger.info("Promoted catalog " + promoted);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testErrorRuleLevelOutOfRange() {
    new ErrorRule("boom", false, 11, "too_high");
  }
}
