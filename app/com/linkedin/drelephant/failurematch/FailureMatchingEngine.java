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

package com.linkedin.drelephant.failurematch;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.linkedin.drelephant.failurematch.catalog.CatalogHolder;
import com.linkedin.drelephant.failurematch.catalog.PatternCatalog;
import com.linkedin.drelephant.failurematch.catalog.PatternCatalogLoader;
import com.linkedin.drelephant.failurematch.extractor.AnalysisResult;
import com.linkedin.drelephant.failurematch.extractor.LogInspector;
import com.linkedin.drelephant.failurematch.extractor.LogSource;
import com.linkedin.drelephant.failurematch.extractor.ScanOptions;
import com.linkedin.drelephant.failurematch.extractor.SignatureExtractor;
import com.linkedin.drelephant.failurematch.learner.LearnedPatternCandidate;
import com.linkedin.drelephant.failurematch.learner.PatternLearner;
import com.linkedin.drelephant.failurematch.normalizer.TextNormalizer;
import com.linkedin.drelephant.failurematch.ranker.FeatureExtractor;
import com.linkedin.drelephant.failurematch.ranker.FeedbackCollector;
import com.linkedin.drelephant.failurematch.ranker.FeedbackRanker;
import com.linkedin.drelephant.failurematch.ranker.FeedbackRecord;
import com.linkedin.drelephant.failurematch.ranker.FeedbackStore;
import com.linkedin.drelephant.failurematch.ranker.ModelHolder;
import com.linkedin.drelephant.failurematch.ranker.TrainingOutcome;
import com.linkedin.drelephant.failurematch.similarity.CandidateIssue;
import com.linkedin.drelephant.failurematch.similarity.MatchResult;
import com.linkedin.drelephant.failurematch.similarity.RankingRequest;
import com.linkedin.drelephant.failurematch.similarity.RankingResult;
import com.linkedin.drelephant.failurematch.similarity.SignatureQuery;
import com.linkedin.drelephant.failurematch.similarity.SimilarityScorer;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.apache.hadoop.conf.Configuration;
import org.apache.log4j.Logger;

import static com.linkedin.drelephant.failurematch.util.Constant.*;
import static com.linkedin.drelephant.failurematch.util.FailureMatchUtils.*;
import static com.linkedin.drelephant.failurematch.util.FailureMatchUtils.ConfigurationBuilder.*;


/**
 * Entry point of failure matching . It wires the components once from the configuration and
 * exposes the operations used by callers :
 * - analyze a test log into a failure signature
 * - rank candidate issues for a signature , optionally re-ranked by the feedback model
 * - discover new patterns from lines no rule matched
 * - train the re-ranking model from feedback
 *
 * Pattern catalog and re-ranking model are the only shared state , both are swapped atomically.
 */
public class FailureMatchingEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(FailureMatchingEngine.class);
  private static final long SHUTDOWN_WAIT_SECONDS = 10;
  private static final String PROMOTION_SOURCE = "promotion";

  private final CatalogHolder catalogHolder;
  private final SignatureExtractor signatureExtractor;
  private final LogInspector logInspector;
  private final TextNormalizer normalizer;
  private final SimilarityScorer scorer;
  private final PatternLearner patternLearner;
  private final ModelHolder modelHolder;
  private final FeedbackRanker feedbackRanker;
  private final ExecutorService batchExecutor;
  private final ExecutorService trainingExecutor;

  public FailureMatchingEngine() {
    this(loadConfiguration());
  }

  public FailureMatchingEngine(Configuration configuration) {
    long startTime = System.currentTimeMillis();
    buildConfigurations(configuration);
    PatternCatalog catalog = new PatternCatalogLoader().load();
    this.catalogHolder = new CatalogHolder(catalog);
    // limits are captured once , a later engine rebuilding the configuration does not change them
    int maxLineLength = MAX_LINE_LENGTH.getValue();
    this.signatureExtractor = new SignatureExtractor(catalogHolder, HISTORY_SIZE.getValue(),
        MAX_UNMATCHED_LINES.getValue(), maxLineLength);
    this.logInspector = new LogInspector(catalogHolder, maxLineLength);
    this.normalizer = new TextNormalizer();
    this.scorer = new SimilarityScorer(normalizer);
    this.patternLearner = new PatternLearner();
    this.modelHolder = new ModelHolder();
    this.feedbackRanker = new FeedbackRanker(new FeatureExtractor(scorer), modelHolder);
    this.batchExecutor = Executors.newFixedThreadPool(BATCH_THREADS.getValue(),
        new ThreadFactoryBuilder().setNameFormat("failure-match-batch-%d").setDaemon(true).build());
    this.trainingExecutor = Executors.newSingleThreadExecutor(
        new ThreadFactoryBuilder().setNameFormat("failure-match-training-%d").setDaemon(true).build());
    long endTime = System.currentTimeMillis();
    logger.info(" Failure matching engine started with catalog " + catalog.getVersion() + " , " + catalog.size()
        + " rules , preset " + scorer.getPreset() + " , stemming " + (normalizer.isStemmingAvailable() ? "on"
        : "off") + " in " + (endTime - startTime) + "ms");
  }

  public AnalysisResult analyze(LogSource source) throws IOException {
    return signatureExtractor.analyze(source);
  }

  public AnalysisResult analyze(LogSource source, ScanOptions options) throws IOException {
    return signatureExtractor.analyze(source, options);
  }

  public SignatureQuery query(AnalysisResult analysisResult) {
    return SignatureQuery.of(analysisResult, normalizer);
  }

  public RankingResult rank(SignatureQuery query, List<CandidateIssue> candidates) {
    return scorer.rank(query, candidates);
  }

  public RankingResult rank(AnalysisResult analysisResult, List<CandidateIssue> candidates) {
    return rank(query(analysisResult), candidates);
  }

  /**
   * Ranks the candidates and re-ranks them with the current model , if there is one.
   */
  public RankingResult match(AnalysisResult analysisResult, List<CandidateIssue> candidates) {
    SignatureQuery query = query(analysisResult);
    RankingResult ranking = scorer.rank(query, candidates);
    return new RankingResult(feedbackRanker.rerank(query, ranking.getResults()), ranking.getSkippedCount());
  }

  /**
   * Ranks many failures on the batch worker pool.
   */
  public List<RankingResult> rankAll(List<RankingRequest> requests) {
    return scorer.rankAll(requests, batchExecutor);
  }

  public List<MatchResult> rerank(SignatureQuery query, List<MatchResult> results) {
    return feedbackRanker.rerank(query, results);
  }

  public List<LearnedPatternCandidate> discover(List<String> unmatchedLines) {
    return patternLearner.discover(unmatchedLines);
  }

  public TrainingOutcome train(List<FeedbackRecord> feedback) {
    return feedbackRanker.train(feedback);
  }

  /**
   * @return collector which retrains on the training thread of this engine
   */
  public FeedbackCollector newFeedbackCollector(FeedbackStore feedbackStore) {
    return new FeedbackCollector(feedbackStore, feedbackRanker, trainingExecutor);
  }

  /**
   * Adds reviewed candidates to the pattern catalog as error rules . This is the only way a
   * learned pattern reaches the catalog.
   * @return the new current catalog
   */
  public PatternCatalog promote(List<LearnedPatternCandidate> reviewedCandidates, String newVersion) {
    List<Rule> rules = new ArrayList<Rule>();
    for (LearnedPatternCandidate candidate : reviewedCandidates) {
      rules.add(PatternCatalogLoader.toRule(candidate.toRuleDefinition(), RuleKind.ERROR, PROMOTION_SOURCE));
    }
    debugLog(" Promoting " + rules.size() + " reviewed candidates into catalog " + newVersion);
    return catalogHolder.promote(rules, newVersion);
  }

  public CatalogHolder getCatalogHolder() {
    return catalogHolder;
  }

  public ModelHolder getModelHolder() {
    return modelHolder;
  }

  public LogInspector getLogInspector() {
    return logInspector;
  }

  public TextNormalizer getNormalizer() {
    return normalizer;
  }

  public SimilarityScorer getScorer() {
    return scorer;
  }

  public PatternLearner getPatternLearner() {
    return patternLearner;
  }

  @Override
  public void close() {
    batchExecutor.shutdown();
    trainingExecutor.shutdown();
    try {
      if (!batchExecutor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
        batchExecutor.shutdownNow();
      }
      if (!trainingExecutor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
        trainingExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      logger.error(" Interrupted while shutting down failure matching engine ", e);
      batchExecutor.shutdownNow();
      trainingExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    logger.info(" Failure matching engine shut down ");
  }
}
