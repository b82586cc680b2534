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

package com.linkedin.drelephant.failurematch.ranker;

import com.google.common.collect.ImmutableList;
import com.linkedin.drelephant.failurematch.normalizer.TextNormalizer;
import com.linkedin.drelephant.failurematch.similarity.CandidateIssue;
import com.linkedin.drelephant.failurematch.similarity.MatchResult;
import com.linkedin.drelephant.failurematch.similarity.SignatureQuery;
import com.linkedin.drelephant.failurematch.similarity.SimilarityScorer;
import com.linkedin.drelephant.failurematch.util.FailureMatchUtils;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.drelephant.failurematch.util.Constant.*;
import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;


public class FeedbackRankerTest {
  private final Logger logger = LoggerFactory.getLogger(this.getClass());
  private static final String SIGNATURE = "Segmentation fault in memory allocator";

  private TextNormalizer normalizer;
  private SimilarityScorer scorer;
  private ModelHolder modelHolder;
  private FeedbackRanker ranker;

  @Before
  public void setup() {
    FailureMatchUtils.ConfigurationBuilder.buildConfigurations(FailureMatchUtils.loadConfiguration());
    normalizer = new TextNormalizer();
    scorer = new SimilarityScorer(normalizer);
    modelHolder = new ModelHolder();
    ranker = new FeedbackRanker(new FeatureExtractor(scorer), modelHolder, 20, 0.6, 0.3, 300, 0.1, 5);
  }

  @Test
  public void testTooFewRecords() {
    List<FeedbackRecord> records = new ArrayList<FeedbackRecord>();
    for (int i = 0; i < 3; i++) {
      records.add(relevantRecord(i));
    }
    TrainingOutcome outcome = ranker.train(records);
    assertFalse(outcome.isTrained());
    assertEquals(SkipReason.INSUFFICIENT_DATA, outcome.getSkipReason().get());
    assertFalse(modelHolder.current().isPresent());
    assertEquals(SkipReason.INSUFFICIENT_DATA, ranker.train(null).getSkipReason().get());

    // without a model the ranking is returned as it is
    List<MatchResult> results = scorer.rank(query(), candidates()).getResults();
    assertSame(results, ranker.rerank(query(), results));
  }

  @Test
  public void testSingleClass() {
    List<FeedbackRecord> records = new ArrayList<FeedbackRecord>();
    for (int i = 0; i < 20; i++) {
      records.add(relevantRecord(i));
    }
    TrainingOutcome outcome = ranker.train(records);
    assertEquals(SkipReason.SINGLE_CLASS, outcome.getSkipReason().get());
    assertFalse(modelHolder.current().isPresent());
  }

  @Test
  public void testUnderfitModelIsNotPublished() {
    // identical features with alternating labels can not be learned
    List<FeedbackRecord> records = new ArrayList<FeedbackRecord>();
    for (int i = 0; i < 20; i++) {
      FeedbackRecord record = relevantRecord(i);
      record.setRelevant(i % 2 == 0);
      records.add(record);
    }
    TrainingOutcome outcome = ranker.train(records);
    logger.info("Outcome " + outcome);
    assertEquals(SkipReason.UNDERFIT, outcome.getSkipReason().get());
    assertFalse(modelHolder.current().isPresent());
  }

  @Test
  public void testTrainAndRerank() {
    TrainingOutcome outcome = ranker.train(separableRecords());
    logger.info("Outcome " + outcome);
    assertTrue(outcome.isTrained());
    ModelArtifact artifact = outcome.getArtifact().get();
    assertEquals(1, artifact.getVersion());
    assertEquals(40, artifact.getSampleCount());
    assertEquals(1.0, artifact.getAccuracy(), 1e-9);
    assertSame(artifact, modelHolder.current().get());

    List<MatchResult> reranked = ranker.rerank(query(), scorer.rank(query(), candidates()).getResults());
    assertEquals(2, reranked.size());
    assertEquals("MEM-1", reranked.get(0).getIssueId());
    assertEquals(1, reranked.get(0).getRank());
    assertEquals(2, reranked.get(1).getRank());
    for (MatchResult result : reranked) {
      assertTrue(result.getScore() >= 0.0 && result.getScore() <= 1.0);
    }

    FeatureExtractor featureExtractor = ranker.getFeatureExtractor();
    assertTrue(artifact.predict(featureExtractor.extract(relevantRecord(0))) > 0.5);
    assertTrue(artifact.predict(featureExtractor.extract(irrelevantRecord(0))) < 0.5);

    // retraining publishes the next version
    assertEquals(2, ranker.train(separableRecords()).getArtifact().get().getVersion());
  }

  @Test
  public void testModelOfWrongDimensionKeepsRanking() {
    modelHolder.publish(new ModelArtifact(7, 0.9, 10, 0L, new double[]{1.0, 1.0}, 0.0, new double[]{0.0, 0.0},
        new double[]{1.0, 1.0}));
    List<MatchResult> results = scorer.rank(query(), candidates()).getResults();
    assertSame(results, ranker.rerank(query(), results));
  }

  @Test
  public void testFailedTraining() {
    FeatureExtractor brokenExtractor = mock(FeatureExtractor.class);
    when(brokenExtractor.extract(any(FeedbackRecord.class))).thenThrow(new IllegalStateException("broken"));
    FeedbackRanker brokenRanker = new FeedbackRanker(brokenExtractor, modelHolder, 20, 0.6, 0.3, 300, 0.1, 5);

    TrainingOutcome outcome = brokenRanker.train(separableRecords());
    assertEquals(SkipReason.TRAINING_FAILED, outcome.getSkipReason().get());
    assertEquals("broken", outcome.getDetail());
    assertFalse(modelHolder.current().isPresent());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidFolds() {
    new FeedbackRanker(new FeatureExtractor(scorer), modelHolder, 20, 0.6, 0.3, 300, 0.1, 1);
  }

  private SignatureQuery query() {
    return SignatureQuery.of(SIGNATURE, normalizer);
  }

  private static List<CandidateIssue> candidates() {
    return ImmutableList.of(new CandidateIssue("UI-9", "UI label rename on settings page", null, "Open"),
        new CandidateIssue("MEM-1", "Segfault in memory allocator crash", "Allocator frees twice", "Resolved"));
  }

  private static List<FeedbackRecord> separableRecords() {
    List<FeedbackRecord> records = new ArrayList<FeedbackRecord>();
    for (int i = 0; i < 20; i++) {
      records.add(relevantRecord(i));
      records.add(irrelevantRecord(i));
    }
    return records;
  }

  private static FeedbackRecord relevantRecord(int index) {
    FeedbackRecord record = new FeedbackRecord(ImmutableList.of("segmentation", "fault", "memory", "allocator"),
        "MEM-" + index, true, 1000L + index);
    record.setSignatureText(SIGNATURE);
    record.setIssueSummary("Segfault in memory allocator crash");
    record.setIssueDescription("Allocator frees twice");
    record.setIssueStatus("Resolved");
    return record;
  }

  private static FeedbackRecord irrelevantRecord(int index) {
    FeedbackRecord record = new FeedbackRecord(ImmutableList.of("segmentation", "fault", "memory", "allocator"),
        "UI-" + index, false, 2000L + index);
    record.setSignatureText(SIGNATURE);
    record.setIssueSummary("UI label rename on settings page");
    record.setIssueStatus("Open");
    return record;
  }
}
