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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.apache.hadoop.conf.Configuration;
import org.apache.log4j.Logger;

import static com.linkedin.drelephant.failurematch.util.Constant.*;


/**
 * Util class which contains static helper methods used by failure matching.
 * It also contains configuration builder .
 */
public class FailureMatchUtils {
  private static final Logger logger = Logger.getLogger(FailureMatchUtils.class);
  static boolean debugEnabled = logger.isDebugEnabled();

  private static final List<String> ERROR_INDICATORS =
      ImmutableList.of("error", "fail", "exception", "fatal", "critical", "assert", "abort", "crash", "segfault",
          "panic", "timeout", "denied", "invalid", "cannot", "unable");
  private static final Pattern UPPERCASE_ERROR_INDICATOR = Pattern.compile("\\b(ERROR|FATAL|CRITICAL|FAIL|ABORT)\\b");

  public static void debugLog(String message) {
    if (debugEnabled) {
      logger.debug(message);
    }
  }

  /**
   * Loads the failure matching configuration from the classpath. Properties
   * which are not present in the file fall back to the defaults of {@link ConfigurationBuilder}.
   * @return configuration , never null
   */
  public static Configuration loadConfiguration() {
    Configuration configuration = new Configuration(false);
    if (FailureMatchUtils.class.getClassLoader().getResource(FAILURE_MATCH_CONF_FILE) != null) {
      configuration.addResource(FAILURE_MATCH_CONF_FILE);
    } else {
      logger.warn(" " + FAILURE_MATCH_CONF_FILE + " not found on classpath , using default configuration ");
    }
    return configuration;
  }

  /**
   * A line which was not classified by the catalog is still a potential error when it
   * carries one of the usual error words.
   * @param line : raw log line
   * @return true if line looks like an error
   */
  public static boolean containsErrorIndicator(String line) {
    if (Strings.isNullOrEmpty(line) || line.trim().isEmpty()) {
      return false;
    }
    String lowerCaseLine = line.toLowerCase(Locale.ROOT);
    for (String indicator : ERROR_INDICATORS) {
      if (lowerCaseLine.contains(indicator)) {
        return true;
      }
    }
    return UPPERCASE_ERROR_INDICATOR.matcher(line).find();
  }

  /**
   * This class used to create configuration required for failure matching.
   * Defaults are built on first use , call {@link #buildConfigurations(Configuration)} to
   * apply a loaded configuration.
   */
  public static class ConfigurationBuilder {
    public static volatile FMConfiguration<String> CATALOG_RESOURCE = null;
    public static volatile FMConfiguration<Integer> HISTORY_SIZE = null;
    public static volatile FMConfiguration<Integer> MAX_UNMATCHED_LINES = null;
    public static volatile FMConfiguration<Integer> MAX_LINE_LENGTH = null;
    public static volatile FMConfiguration<String> WEIGHT_PRESET = null;
    public static volatile FMConfiguration<Float> MIN_SCORE = null;
    public static volatile FMConfiguration<Integer> MAX_RESULTS = null;
    public static volatile FMConfiguration<Float> RESOLVED_BONUS = null;
    public static volatile FMConfiguration<Integer> EDIT_MAX_CHARS = null;
    public static volatile FMConfiguration<Integer> SHINGLE_SIZE = null;
    public static volatile FMConfiguration<Float> CLUSTER_SIMILARITY_THRESHOLD = null;
    public static volatile FMConfiguration<Integer> MIN_SUPPORT = null;
    public static volatile FMConfiguration<Integer> MEDIUM_SUPPORT = null;
    public static volatile FMConfiguration<Integer> HIGH_SUPPORT = null;
    public static volatile FMConfiguration<Integer> HIGH_ANCHOR_LENGTH = null;
    public static volatile FMConfiguration<Integer> MAX_CANDIDATES = null;
    public static volatile FMConfiguration<Integer> MIN_TRAINING_RECORDS = null;
    public static volatile FMConfiguration<Float> MIN_MODEL_ACCURACY = null;
    public static volatile FMConfiguration<Float> BLEND_WEIGHT = null;
    public static volatile FMConfiguration<Integer> TRAINING_ITERATIONS = null;
    public static volatile FMConfiguration<Float> LEARNING_RATE = null;
    public static volatile FMConfiguration<Integer> CROSS_VALIDATION_FOLDS = null;
    public static volatile FMConfiguration<Integer> RETRAIN_THRESHOLD = null;
    public static volatile FMConfiguration<Integer> BATCH_THREADS = null;

    static {
      buildConfigurations(new Configuration(false));
    }

    public static synchronized void buildConfigurations(Configuration configuration) {
      CATALOG_RESOURCE = FMConfiguration.<String>named(CATALOG_RESOURCE_NAME, configuration)
          .setValue(configuration.get(CATALOG_RESOURCE_NAME, DEFAULT_CATALOG_RESOURCE))
          .setDoc("Classpath resource or file path of the versioned pattern catalog definition");

      HISTORY_SIZE = FMConfiguration.<Integer>named(HISTORY_SIZE_NAME, configuration)
          .setValue(positive(configuration, HISTORY_SIZE_NAME, 10))
          .setDoc("Number of lines kept before the failure line as its context");

      MAX_UNMATCHED_LINES = FMConfiguration.<Integer>named(MAX_UNMATCHED_LINES_NAME, configuration)
          .setValue(nonNegative(configuration, MAX_UNMATCHED_LINES_NAME, 50))
          .setDoc("Maximum number of unclassified error looking lines kept per scan for pattern learning");

      MAX_LINE_LENGTH = FMConfiguration.<Integer>named(MAX_LINE_LENGTH_NAME, configuration)
          .setValue(positive(configuration, MAX_LINE_LENGTH_NAME, 2000))
          .setDoc("Log lines longer than this are truncated before classification");

      WEIGHT_PRESET = FMConfiguration.<String>named(WEIGHT_PRESET_NAME, configuration)
          .setValue(configuration.getTrimmed(WEIGHT_PRESET_NAME, "DEFAULT"))
          .setDoc("Name of the weight preset used to combine similarity component scores");

      MIN_SCORE = FMConfiguration.<Float>named(MIN_SCORE_NAME, configuration)
          .setValue(unitInterval(configuration, MIN_SCORE_NAME, 0.0f))
          .setDoc("Candidates scoring below this are dropped from the ranking");

      MAX_RESULTS = FMConfiguration.<Integer>named(MAX_RESULTS_NAME, configuration)
          .setValue(nonNegative(configuration, MAX_RESULTS_NAME, 0))
          .setDoc("Maximum number of ranked matches returned , 0 means no limit");

      RESOLVED_BONUS = FMConfiguration.<Float>named(RESOLVED_BONUS_NAME, configuration)
          .setValue(configuration.getFloat(RESOLVED_BONUS_NAME, 1.1f))
          .setDoc("Multiplier applied to the score of resolved or closed issues before clamping to 1");
      if (RESOLVED_BONUS.getValue() < 1.0f) {
        throw new IllegalArgumentException(RESOLVED_BONUS_NAME + " must be at least 1.0 , found "
            + RESOLVED_BONUS.getValue());
      }

      EDIT_MAX_CHARS = FMConfiguration.<Integer>named(EDIT_MAX_CHARS_NAME, configuration)
          .setValue(positive(configuration, EDIT_MAX_CHARS_NAME, 200))
          .setDoc("Number of characters of signature and summary compared by edit distance");

      SHINGLE_SIZE = FMConfiguration.<Integer>named(SHINGLE_SIZE_NAME, configuration)
          .setValue(positive(configuration, SHINGLE_SIZE_NAME, 3))
          .setDoc("Number of contiguous tokens in one shingle used for clustering unmatched lines");

      CLUSTER_SIMILARITY_THRESHOLD = FMConfiguration.<Float>named(CLUSTER_SIMILARITY_THRESHOLD_NAME, configuration)
          .setValue(unitInterval(configuration, CLUSTER_SIMILARITY_THRESHOLD_NAME, 0.5f))
          .setDoc("Minimum shingle jaccard similarity for a line to join a cluster");

      MIN_SUPPORT = FMConfiguration.<Integer>named(MIN_SUPPORT_NAME, configuration)
          .setValue(positive(configuration, MIN_SUPPORT_NAME, 3))
          .setDoc("Clusters with fewer lines than this do not produce a candidate");

      MEDIUM_SUPPORT = FMConfiguration.<Integer>named(MEDIUM_SUPPORT_NAME, configuration)
          .setValue(positive(configuration, MEDIUM_SUPPORT_NAME, 5))
          .setDoc("Support from which a candidate has MEDIUM confidence");

      HIGH_SUPPORT = FMConfiguration.<Integer>named(HIGH_SUPPORT_NAME, configuration)
          .setValue(positive(configuration, HIGH_SUPPORT_NAME, 10))
          .setDoc("Support from which a candidate can have HIGH confidence");

      HIGH_ANCHOR_LENGTH = FMConfiguration.<Integer>named(HIGH_ANCHOR_LENGTH_NAME, configuration)
          .setValue(positive(configuration, HIGH_ANCHOR_LENGTH_NAME, 15))
          .setDoc("Literal characters a candidate regex needs , along with HIGH_SUPPORT , for HIGH confidence");

      MAX_CANDIDATES = FMConfiguration.<Integer>named(MAX_CANDIDATES_NAME, configuration)
          .setValue(positive(configuration, MAX_CANDIDATES_NAME, 20))
          .setDoc("Maximum number of learned pattern candidates returned by one discovery");

      MIN_TRAINING_RECORDS = FMConfiguration.<Integer>named(MIN_TRAINING_RECORDS_NAME, configuration)
          .setValue(positive(configuration, MIN_TRAINING_RECORDS_NAME, 20))
          .setDoc("Minimum number of labelled feedback records required to train the re-ranking model");

      MIN_MODEL_ACCURACY = FMConfiguration.<Float>named(MIN_MODEL_ACCURACY_NAME, configuration)
          .setValue(unitInterval(configuration, MIN_MODEL_ACCURACY_NAME, 0.6f))
          .setDoc("Models with a cross validated accuracy below this are treated as underfit and not published");

      BLEND_WEIGHT = FMConfiguration.<Float>named(BLEND_WEIGHT_NAME, configuration)
          .setValue(unitInterval(configuration, BLEND_WEIGHT_NAME, 0.3f))
          .setDoc("Share of the model probability in the re-ranked score");

      TRAINING_ITERATIONS = FMConfiguration.<Integer>named(TRAINING_ITERATIONS_NAME, configuration)
          .setValue(positive(configuration, TRAINING_ITERATIONS_NAME, 500))
          .setDoc("Number of gradient descent iterations");

      LEARNING_RATE = FMConfiguration.<Float>named(LEARNING_RATE_NAME, configuration)
          .setValue(configuration.getFloat(LEARNING_RATE_NAME, 0.1f))
          .setDoc("Gradient descent step size");
      if (LEARNING_RATE.getValue() <= 0) {
        throw new IllegalArgumentException(
            LEARNING_RATE_NAME + " must be positive , found " + LEARNING_RATE.getValue());
      }

      CROSS_VALIDATION_FOLDS = FMConfiguration.<Integer>named(CROSS_VALIDATION_FOLDS_NAME, configuration)
          .setValue(positive(configuration, CROSS_VALIDATION_FOLDS_NAME, 5))
          .setDoc("Number of folds used to estimate model accuracy");

      RETRAIN_THRESHOLD = FMConfiguration.<Integer>named(RETRAIN_THRESHOLD_NAME, configuration)
          .setValue(positive(configuration, RETRAIN_THRESHOLD_NAME, 20))
          .setDoc("Number of new feedback records which triggers a retraining");

      BATCH_THREADS = FMConfiguration.<Integer>named(BATCH_THREADS_NAME, configuration)
          .setValue(positive(configuration, BATCH_THREADS_NAME, 4))
          .setDoc("Worker threads used for batch ranking");

      for (FMConfiguration<?> fmConfiguration : ImmutableList.<FMConfiguration<?>>of(CATALOG_RESOURCE, HISTORY_SIZE,
          MAX_UNMATCHED_LINES, MAX_LINE_LENGTH, WEIGHT_PRESET, MIN_SCORE, MAX_RESULTS, RESOLVED_BONUS, EDIT_MAX_CHARS,
          SHINGLE_SIZE, CLUSTER_SIMILARITY_THRESHOLD, MIN_SUPPORT, MEDIUM_SUPPORT, HIGH_SUPPORT, HIGH_ANCHOR_LENGTH,
          MAX_CANDIDATES, MIN_TRAINING_RECORDS, MIN_MODEL_ACCURACY, BLEND_WEIGHT, TRAINING_ITERATIONS, LEARNING_RATE,
          CROSS_VALIDATION_FOLDS, RETRAIN_THRESHOLD, BATCH_THREADS)) {
        if (fmConfiguration.isOverridden()) {
          logger.info(" Overridden " + fmConfiguration.getConfigurationName() + " = " + fmConfiguration.getValue());
        } else {
          debugLog(" Default " + fmConfiguration);
        }
      }
    }

    private static int positive(Configuration configuration, String name, int defaultValue) {
      int value = configuration.getInt(name, defaultValue);
      if (value <= 0) {
        throw new IllegalArgumentException(name + " must be positive , found " + value);
      }
      return value;
    }

    private static int nonNegative(Configuration configuration, String name, int defaultValue) {
      int value = configuration.getInt(name, defaultValue);
      if (value < 0) {
        throw new IllegalArgumentException(name + " must not be negative , found " + value);
      }
      return value;
    }

    private static float unitInterval(Configuration configuration, String name, float defaultValue) {
      float value = configuration.getFloat(name, defaultValue);
      if (value < 0.0f || value > 1.0f) {
        throw new IllegalArgumentException(name + " must be between 0 and 1 , found " + value);
      }
      return value;
    }
  }
}
