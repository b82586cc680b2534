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

/**
 * This class have Constants which are used across
 * failure matching classes or configuration properties name
 */
public final class Constant {

  private Constant() {
  }

  /**
   * Kind of a pattern rule. Ignore rules are evaluated before error and warning rules,
   * warning rules only take part once warnings are treated as errors.
   */
  public enum RuleKind {
    IGNORE, ERROR, WARNING
  }

  /**
   * Result of classifying one log line against the pattern catalog
   */
  public enum OutcomeType {
    IGNORED, MATCHED, NONE
  }

  /**
   * Status of a log analysis . NOT_FOUND and INPUT_UNAVAILABLE are valid outcomes , not failures.
   */
  public enum AnalysisStatus {
    FOUND, NOT_FOUND, INPUT_UNAVAILABLE
  }

  public enum Confidence {LOW, MEDIUM, HIGH}

  /**
   * Reasons for which training of the feedback model is skipped.
   */
  public enum SkipReason {
    INSUFFICIENT_DATA, SINGLE_CLASS, UNDERFIT, TRAINING_FAILED
  }

  public static final String FAILURE_MATCH_CONF_FILE = "FailureMatchConf.xml";
  public static final String DEFAULT_CATALOG_RESOURCE = "pattern-catalog.json";
  public static final String UNKNOWN = "unknown";

  public static final String CATALOG_RESOURCE_NAME = "fm.catalog.resource";
  public static final String HISTORY_SIZE_NAME = "fm.extractor.history.size";
  public static final String MAX_UNMATCHED_LINES_NAME = "fm.extractor.max.unmatched.lines";
  public static final String MAX_LINE_LENGTH_NAME = "fm.extractor.max.line.length";
  public static final String WEIGHT_PRESET_NAME = "fm.scorer.weight.preset";
  public static final String MIN_SCORE_NAME = "fm.scorer.min.score";
  public static final String MAX_RESULTS_NAME = "fm.scorer.max.results";
  public static final String RESOLVED_BONUS_NAME = "fm.scorer.resolved.bonus";
  public static final String EDIT_MAX_CHARS_NAME = "fm.scorer.edit.max.chars";
  public static final String SHINGLE_SIZE_NAME = "fm.learner.shingle.size";
  public static final String CLUSTER_SIMILARITY_THRESHOLD_NAME = "fm.learner.similarity.threshold";
  public static final String MIN_SUPPORT_NAME = "fm.learner.min.support";
  public static final String MEDIUM_SUPPORT_NAME = "fm.learner.medium.support";
  public static final String HIGH_SUPPORT_NAME = "fm.learner.high.support";
  public static final String HIGH_ANCHOR_LENGTH_NAME = "fm.learner.high.anchor.length";
  public static final String MAX_CANDIDATES_NAME = "fm.learner.max.candidates";
  public static final String MIN_TRAINING_RECORDS_NAME = "fm.ranker.min.records";
  public static final String MIN_MODEL_ACCURACY_NAME = "fm.ranker.min.accuracy";
  public static final String BLEND_WEIGHT_NAME = "fm.ranker.blend.weight";
  public static final String TRAINING_ITERATIONS_NAME = "fm.ranker.iterations";
  public static final String LEARNING_RATE_NAME = "fm.ranker.learning.rate";
  public static final String CROSS_VALIDATION_FOLDS_NAME = "fm.ranker.folds";
  public static final String RETRAIN_THRESHOLD_NAME = "fm.ranker.retrain.threshold";
  public static final String BATCH_THREADS_NAME = "fm.batch.threads";
}
