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

package com.linkedin.drelephant.failurematch.similarity;

import com.google.common.collect.ImmutableList;
import com.linkedin.drelephant.failurematch.normalizer.TextNormalizer;
import com.linkedin.drelephant.failurematch.util.FailureMatchUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.Assert.*;


public class SimilarityScorerTest {
  private final Logger logger = LoggerFactory.getLogger(this.getClass());
  private static final String SIGNATURE = "Segmentation fault in dma_engine while writing buffer";

  private TextNormalizer normalizer;
  private SimilarityScorer scorer;

  @Before
  public void setup() {
    FailureMatchUtils.ConfigurationBuilder.buildConfigurations(FailureMatchUtils.loadConfiguration());
    normalizer = new TextNormalizer();
    scorer = new SimilarityScorer(normalizer);
  }

  @Test
  public void testRelatedIssueRanksFirst() {
    CandidateIssue related = new CandidateIssue("P-1", "Segmentation fault in DMA engine buffer write",
        "The dma engine crashes when the write buffer wraps around", "Open");
    CandidateIssue unrelated = new CandidateIssue("P-2", "UI label typo on settings page");

    RankingResult ranking = scorer.rank(query(SIGNATURE), ImmutableList.of(unrelated, related));
    logger.info("Ranking " + ranking.getResults());

    assertEquals(2, ranking.getResults().size());
    assertEquals(0, ranking.getSkippedCount());
    MatchResult first = ranking.getResults().get(0);
    MatchResult second = ranking.getResults().get(1);
    assertEquals("P-1", first.getIssueId());
    assertEquals(1, first.getRank());
    assertEquals(2, second.getRank());
    assertTrue(first.getScore() > second.getScore());
    assertTrue(first.getScore() <= 1.0 && second.getScore() >= 0.0);
    assertTrue(first.getMatchingKeywords().contains("fault"));
    assertTrue(second.getMatchingKeywords().isEmpty());
    assertEquals("Low similarity", second.getRelevanceReason());
  }

  @Test
  public void testMemorySegfaultAgainstUnrelatedOpenIssue() {
    CandidateIssue allocator = new CandidateIssue("P-1", "Segfault in memory allocator", null, "Open");
    CandidateIssue rename = new CandidateIssue("P-2", "UI label rename", null, "Open");

    List<MatchResult> results =
        scorer.rank(query("segmentation fault memory"), ImmutableList.of(rename, allocator)).getResults();
    logger.info("Ranking " + results);
    assertEquals(2, results.size());
    assertEquals("P-1", results.get(0).getIssueId());
    assertEquals("P-2", results.get(1).getIssueId());
    assertTrue(results.get(0).getScore() > results.get(1).getScore());
    assertTrue(results.get(0).getScore() <= 1.0);
    assertTrue(results.get(1).getScore() >= 0.0);
  }

  @Test
  public void testResolvedIssueWinsTie() {
    SimilarityScorer noBonus = new SimilarityScorer(normalizer, WeightPreset.DEFAULT, 0.0, 0, 1.0, 200);
    CandidateIssue open = new CandidateIssue("A-1", "DMA engine segmentation fault", null, "Open");
    CandidateIssue resolved = new CandidateIssue("B-2", "DMA engine segmentation fault", null, "Resolved");

    List<MatchResult> results = noBonus.rank(query(SIGNATURE), ImmutableList.of(open, resolved)).getResults();
    assertEquals(results.get(0).getScore(), results.get(1).getScore(), 0.0);
    assertEquals("B-2", results.get(0).getIssueId());
    assertTrue(results.get(0).getRelevanceReason().contains("Issue is resolved"));
  }

  @Test
  public void testTieBreakOnUpdateTimeAndId() {
    SimilarityScorer noBonus = new SimilarityScorer(normalizer, WeightPreset.DEFAULT, 0.0, 0, 1.0, 200);
    CandidateIssue older = new CandidateIssue("A-1", "DMA engine segmentation fault");
    older.setUpdatedAt(1000L);
    CandidateIssue newer = new CandidateIssue("A-9", "DMA engine segmentation fault");
    newer.setUpdatedAt(2000L);
    CandidateIssue unknownTime = new CandidateIssue("A-0", "DMA engine segmentation fault");

    List<MatchResult> results =
        noBonus.rank(query(SIGNATURE), ImmutableList.of(unknownTime, older, newer)).getResults();
    assertEquals("A-9", results.get(0).getIssueId());
    assertEquals("A-1", results.get(1).getIssueId());
    assertEquals("A-0", results.get(2).getIssueId());

    // without update times the id decides
    List<MatchResult> byId = noBonus.rank(query(SIGNATURE),
        ImmutableList.of(new CandidateIssue("X-2", "DMA engine segmentation fault"),
            new CandidateIssue("X-1", "DMA engine segmentation fault"))).getResults();
    assertEquals("X-1", byId.get(0).getIssueId());
  }

  @Test
  public void testResolvedBonus() {
    SimilarityScorer withBonus = new SimilarityScorer(normalizer, WeightPreset.DEFAULT, 0.0, 0, 1.5, 200);
    CandidateIssue open = new CandidateIssue("A-1", "DMA engine timeout", null, "Open");
    CandidateIssue closed = new CandidateIssue("A-2", "DMA engine timeout", null, "Closed");
    List<MatchResult> results = withBonus.rank(query("timeout in dma engine"), ImmutableList.of(open, closed))
        .getResults();
    assertEquals("A-2", results.get(0).getIssueId());
    assertTrue(results.get(0).getScore() > results.get(1).getScore());
    assertTrue(results.get(0).getScore() <= 1.0);
  }

  @Test
  public void testMalformedCandidatesAreSkipped() {
    List<CandidateIssue> candidates = Arrays.asList(new CandidateIssue(null, "Segmentation fault"),
        new CandidateIssue("M-1", "  "), null, new CandidateIssue("M-2", "Segmentation fault in dma"));

    RankingResult ranking = scorer.rank(query(SIGNATURE), candidates);
    assertEquals(3, ranking.getSkippedCount());
    assertEquals(1, ranking.getResults().size());
    assertEquals("M-2", ranking.getResults().get(0).getIssueId());

    RankingResult empty = scorer.rank(query(SIGNATURE), new ArrayList<CandidateIssue>());
    assertTrue(empty.getResults().isEmpty());
    assertEquals(0, empty.getSkippedCount());
  }

  @Test
  public void testDescriptionOnlyIssueIsWellFormed() {
    CandidateIssue issue = new CandidateIssue("D-1", null, "segmentation fault in the dma engine", "Open");
    RankingResult ranking = scorer.rank(query(SIGNATURE), ImmutableList.of(issue));
    assertEquals(0, ranking.getSkippedCount());
    assertEquals(0.0, ranking.getResults().get(0).getComponents().getEditDistance(), 0.0);
  }

  @Test
  public void testMaxResultsAndMinScore() {
    List<CandidateIssue> candidates = ImmutableList.of(new CandidateIssue("T-1", "Segmentation fault in DMA engine"),
        new CandidateIssue("T-2", "Buffer overflow in cache"), new CandidateIssue("T-3", "Settings page typo"));

    SimilarityScorer topOne = new SimilarityScorer(normalizer, WeightPreset.DEFAULT, 0.0, 1, 1.0, 200);
    List<MatchResult> limited = topOne.rank(query(SIGNATURE), candidates).getResults();
    assertEquals(1, limited.size());
    assertEquals("T-1", limited.get(0).getIssueId());

    SimilarityScorer strict = new SimilarityScorer(normalizer, WeightPreset.DEFAULT, 0.2, 0, 1.0, 200);
    for (MatchResult result : strict.rank(query(SIGNATURE), candidates).getResults()) {
      assertTrue(result.getScore() >= 0.2);
      assertNotEquals("T-3", result.getIssueId());
    }
  }

  @Test
  public void testRankAllKeepsRequestOrder() throws Exception {
    List<RankingRequest> requests = new ArrayList<RankingRequest>();
    for (int i = 0; i < 8; i++) {
      requests.add(new RankingRequest(query(i % 2 == 0 ? SIGNATURE : "Settings page typo"),
          ImmutableList.of(new CandidateIssue("S-1", "Segmentation fault in DMA engine"),
              new CandidateIssue("S-2", "Typo on the settings page"))));
    }
    ExecutorService executor = Executors.newFixedThreadPool(3);
    try {
      List<RankingResult> results = scorer.rankAll(requests, executor);
      assertEquals(8, results.size());
      for (int i = 0; i < results.size(); i++) {
        assertEquals(i % 2 == 0 ? "S-1" : "S-2", results.get(i).getResults().get(0).getIssueId());
      }
    } finally {
      executor.shutdown();
    }
  }

  @Test
  public void testSynonymMatchIsCreditedAtHalfWeight() {
    double semantic =
        SimilarityScorer.semantic(normalizer.normalize("segfault"), normalizer.normalize("crash on boot"));
    assertEquals(0.5, semantic, 1e-9);
    assertEquals(1.0,
        SimilarityScorer.semantic(normalizer.normalize("segfault"), normalizer.normalize("segfault on boot")), 1e-9);
    assertEquals(0.0, SimilarityScorer.semantic(normalizer.normalize(""), normalizer.normalize("crash")), 0.0);
  }

  @Test
  public void testScoreSingleIssue() {
    MatchResult result =
        scorer.score(normalizer.normalize(SIGNATURE), new CandidateIssue("S-1", "Segmentation fault in DMA engine"));
    assertTrue(result.getScore() > 0.0);
    assertEquals(0, result.getRank());
    assertTrue(result.getComponents().getJaccard() > 0.0);
  }

  @Test
  public void testFilterByResolution() {
    CandidateIssue open = new CandidateIssue("F-1", "fault", null, "Open");
    CandidateIssue closed = new CandidateIssue("F-2", "fault", null, "Closed");
    CandidateIssue withResolution = new CandidateIssue("F-3", "fault", null, "In Progress");
    withResolution.setResolution("Won't Fix");
    List<MatchResult> results = scorer.rank(query("fault"), ImmutableList.of(open, closed, withResolution))
        .getResults();

    List<MatchResult> filtered = SimilarityScorer.filterByResolution(results, true);
    assertEquals(2, filtered.size());
    for (MatchResult result : filtered) {
      assertNotEquals("F-1", result.getIssueId());
    }
    assertEquals(3, SimilarityScorer.filterByResolution(results, false).size());
  }

  @Test
  public void testCompareSignatures() {
    assertEquals(1.0, scorer.compareSignatures(SIGNATURE, SIGNATURE), 1e-9);
    assertEquals(0.0, scorer.compareSignatures(SIGNATURE, "Settings page typo"), 1e-9);
    double partial = scorer.compareSignatures(SIGNATURE, "Segmentation fault in the cache controller");
    assertTrue(partial > 0.0 && partial < 1.0);
  }

  @Test
  public void testGroupBySimilarity() {
    List<MatchResult> results = scorer.rank(query(SIGNATURE), ImmutableList.of(
        new CandidateIssue("G-1", "Segmentation fault in DMA engine"),
        new CandidateIssue("G-2", "Settings page typo"),
        new CandidateIssue("G-3", "Segmentation fault in DMA engine"))).getResults();

    List<List<MatchResult>> groups = scorer.groupBySimilarity(results, SimilarityScorer.DEFAULT_GROUP_THRESHOLD);
    assertEquals(2, groups.size());
    assertEquals(2, groups.get(0).size());
    assertEquals(1, groups.get(1).size());
    assertEquals("G-2", groups.get(1).get(0).getIssueId());
  }

  @Test
  public void testWeightPresets() {
    assertEquals(WeightPreset.KEYWORD_HEAVY, WeightPreset.fromName(" keyword_heavy "));
    for (WeightPreset preset : WeightPreset.values()) {
      assertEquals(1.0, preset.getJaccard() + preset.getCosine() + preset.getEdit() + preset.getSemantic(), 1e-9);
    }
    assertEquals(0.35, WeightPreset.DEFAULT.combine(new ComponentScores(1.0, 0.0, 0.0, 0.0)), 1e-9);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownWeightPreset() {
    WeightPreset.fromName("balanced");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidResolvedBonus() {
    new SimilarityScorer(normalizer, WeightPreset.DEFAULT, 0.0, 0, 0.5, 200);
  }

  private SignatureQuery query(String text) {
    return SignatureQuery.of(text, normalizer);
  }
}
