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

package com.linkedin.drelephant.failurematch.learner;

import com.google.common.collect.ImmutableList;
import com.linkedin.drelephant.failurematch.catalog.PatternCatalog;
import com.linkedin.drelephant.failurematch.catalog.PatternCatalogLoader;
import com.linkedin.drelephant.failurematch.util.FailureMatchUtils;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.drelephant.failurematch.util.Constant.*;
import static org.junit.Assert.*;


public class PatternLearnerTest {
  private final Logger logger = LoggerFactory.getLogger(this.getClass());
  private PatternLearner learner;

  @Before
  public void setup() {
    FailureMatchUtils.ConfigurationBuilder.buildConfigurations(FailureMatchUtils.loadConfiguration());
    learner = new PatternLearner();
  }

  @Test
  public void testDiscoverPositionalPattern() {
    List<LearnedPatternCandidate> candidates = learner.discover(unableToOpenLines());
    logger.info("Candidates " + candidates);

    assertEquals(1, candidates.size());
    LearnedPatternCandidate candidate = candidates.get(0);
    assertEquals("ERROR:\\s+unable\\s+to\\s+open\\s+file\\s+\\S+", candidate.getRegexText());
    assertEquals(5, candidate.getSupportCount());
    assertEquals(22, candidate.getAnchorLength());
    assertEquals(Confidence.MEDIUM, candidate.getConfidence());
    assertEquals(5, candidate.getSuggestedLevel());
    assertEquals("auto:error", candidate.getSuggestedTag());
    assertEquals(5, candidate.getSampleLines().size());
    assertTrue(candidate.getSampleLines().contains("ERROR: unable to open file /data/run3/input.cfg"));
  }

  @Test
  public void testCandidatesAreOrderedBySupport() {
    List<String> lines = new ArrayList<String>();
    lines.add("Watchdog timeout after 30 ms");
    lines.add("Watchdog timeout after 45 ms");
    lines.addAll(unableToOpenLines());
    lines.add("disk quota exceeded on /scratch");
    lines.add("Watchdog timeout after 120 ms");
    lines.add("license checkout denied for vcs");

    List<LearnedPatternCandidate> candidates = learner.discover(lines);
    assertEquals(2, candidates.size());
    assertEquals(5, candidates.get(0).getSupportCount());

    LearnedPatternCandidate watchdog = candidates.get(1);
    assertEquals("Watchdog\\s+timeout\\s+after\\s+\\d+\\s+ms", watchdog.getRegexText());
    assertEquals(3, watchdog.getSupportCount());
    assertEquals(Confidence.LOW, watchdog.getConfidence());
    assertEquals(6, watchdog.getSuggestedLevel());
    assertEquals("auto:timeout", watchdog.getSuggestedTag());
  }

  @Test
  public void testCommonPrefixPattern() {
    List<LearnedPatternCandidate> candidates = learner.discover(ImmutableList.of(
        "simulator crashed while loading module alpha",
        "simulator crashed while loading module beta gamma",
        "simulator crashed while loading module delta"));

    assertEquals(1, candidates.size());
    assertEquals("simulator\\s+crashed\\s+while\\s+loading\\s+module", candidates.get(0).getRegexText());
    assertEquals(3, candidates.get(0).getSupportCount());
    assertEquals(8, candidates.get(0).getSuggestedLevel());
  }

  @Test
  public void testSmallClustersAreDropped() {
    assertTrue(learner.discover(ImmutableList.of("Watchdog timeout after 30 ms", "Watchdog timeout after 45 ms"))
        .isEmpty());
    assertTrue(learner.discover(null).isEmpty());
    assertTrue(learner.discover(ImmutableList.of("", "   ")).isEmpty());
  }

  @Test
  public void testPatternWithoutLiteralIsDropped() {
    List<String> lines = new ArrayList<String>();
    for (int i = 0; i < 6; i++) {
      lines.add("ERR" + i + " /tmp/f" + i + " 0x1" + i);
    }
    assertTrue(learner.discover(lines).isEmpty());

    lines.addAll(unableToOpenLines());
    List<LearnedPatternCandidate> candidates = learner.discover(lines);
    assertEquals(1, candidates.size());
    assertTrue(candidates.get(0).getAnchorLength() > 0);
    assertFalse(Pattern.compile(candidates.get(0).getRegexText()).matcher("hello world 0x1").find());
  }

  @Test
  public void testExportAsRules() throws Exception {
    List<String> lines = new ArrayList<String>(unableToOpenLines());
    lines.add("Watchdog timeout after 30 ms");
    lines.add("Watchdog timeout after 45 ms");
    lines.add("Watchdog timeout after 120 ms");
    List<LearnedPatternCandidate> candidates = learner.discover(lines);

    String json = learner.exportAsRules(candidates, "1.1.0");
    // only the MEDIUM candidate is exported
    PatternCatalog catalog =
        new PatternCatalogLoader().load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "export");
    assertEquals("1.1.0", catalog.getVersion());
    assertEquals(1, catalog.getErrorRules().size());
    assertEquals(5, catalog.classify("ERROR: unable to open file /tmp/other.cfg").getLevel());
    assertEquals(OutcomeType.NONE, catalog.classify("Watchdog timeout after 30 ms").getType());
  }

  @Test
  public void testPotentialErrors() {
    assertTrue(PatternLearner.isPotentialError("cannot find license server"));
    assertFalse(PatternLearner.isPotentialError("simulation complete"));
    assertEquals(ImmutableList.of("ERROR: bus hang", "segfault in worker"),
        PatternLearner.extractPotentialErrors("ERROR: bus hang\n  all good\n  segfault in worker  \n"));
  }

  @Test
  public void testGuessLevel() {
    assertEquals(9, PatternLearner.guessLevel("kernel panic in driver").level);
    assertEquals(7, PatternLearner.guessLevel("heap exhausted").level);
    assertEquals(5, PatternLearner.guessLevel("unexpected value").level);
  }

  @Test
  public void testEscape() {
    assertEquals("a\\.b\\(c\\)\\[0\\]", PatternLearner.escape("a.b(c)[0]"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidConfiguration() {
    new PatternLearner(3, 0.5, 3, 20, 10, 15, 20);
  }

  private static List<String> unableToOpenLines() {
    List<String> lines = new ArrayList<String>();
    for (int i = 1; i <= 5; i++) {
      lines.add("ERROR: unable to open file /data/run" + i + "/input.cfg");
    }
    return lines;
  }
}
