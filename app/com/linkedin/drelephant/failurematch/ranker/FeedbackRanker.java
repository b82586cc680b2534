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

import com.linkedin.drelephant.failurematch.similarity.MatchResult;
import com.linkedin.drelephant.failurematch.similarity.SignatureQuery;
import com.linkedin.drelephant.failurematch.similarity.SimilarityScorer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import org.apache.commons.math3.analysis.function.Sigmoid;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.log4j.Logger;

import static com.linkedin.drelephant.failurematch.util.Constant.*;
import static com.linkedin.drelephant.failurematch.util.FailureMatchUtils.*;
import static com.linkedin.drelephant.failurematch.util.FailureMatchUtils.ConfigurationBuilder.*;


/**
 * Optional supervised re-ranking of similarity matches.
 *
 * Training fits a logistic regression by batch gradient descent over the features of
 * {@link FeatureExtractor} . The accuracy of the model is estimated with k-fold cross
 * validation , an underfit model is not published . Re-ranking blends the probability of the
 * current model with the similarity score and returns the input unchanged when there is no
 * model.
 */
public class FeedbackRanker {
  private static final Logger logger = Logger.getLogger(FeedbackRanker.class);
  private static final Sigmoid SIGMOID = new Sigmoid();
  private static final long SHUFFLE_SEED = 42L;
  private static final double L2_PENALTY = 0.01;
  private static final double DECISION_THRESHOLD = 0.5;

  private final FeatureExtractor featureExtractor;
  private final ModelHolder modelHolder;
  private final int minRecords;
  private final double minAccuracy;
  private final double blendWeight;
  private final int iterations;
  private final double learningRate;
  private final int folds;

  public FeedbackRanker(FeatureExtractor featureExtractor, ModelHolder modelHolder) {
    this(featureExtractor, modelHolder, MIN_TRAINING_RECORDS.getValue(), MIN_MODEL_ACCURACY.getValue(),
        BLEND_WEIGHT.getValue(), TRAINING_ITERATIONS.getValue(), LEARNING_RATE.getValue(),
        CROSS_VALIDATION_FOLDS.getValue());
  }

  public FeedbackRanker(FeatureExtractor featureExtractor, ModelHolder modelHolder, int minRecords,
      double minAccuracy, double blendWeight, int iterations, double learningRate, int folds) {
    if (featureExtractor == null || modelHolder == null) {
      throw new IllegalArgumentException("Feature extractor and model holder are required");
    }
    if (minRecords <= 0 || minAccuracy < 0 || minAccuracy > 1 || blendWeight < 0 || blendWeight > 1
        || iterations <= 0 || learningRate <= 0 || folds < 2) {
      throw new IllegalArgumentException(
          "Invalid ranker configuration minRecords " + minRecords + " , minAccuracy " + minAccuracy
              + " , blendWeight " + blendWeight + " , iterations " + iterations + " , learningRate " + learningRate
              + " , folds " + folds);
    }
    this.featureExtractor = featureExtractor;
    this.modelHolder = modelHolder;
    this.minRecords = minRecords;
    this.minAccuracy = minAccuracy;
    this.blendWeight = blendWeight;
    this.iterations = iterations;
    this.learningRate = learningRate;
    this.folds = folds;
  }

  /**
   * Trains a model and publishes it when its cross validated accuracy is good enough.
   * @param records : labelled feedback
   * @return the published model or the reason nothing was published
   */
  public TrainingOutcome train(List<FeedbackRecord> records) {
    long startTime = System.currentTimeMillis();
    int size = records == null ? 0 : records.size();
    if (size < minRecords) {
      logger.info(" Skipping training , " + size + " feedback records , need at least " + minRecords);
      return TrainingOutcome.skipped(SkipReason.INSUFFICIENT_DATA,
          "need at least " + minRecords + " records , got " + size);
    }
    double[] labels = new double[size];
    int positives = 0;
    for (int i = 0; i < size; i++) {
      labels[i] = records.get(i).isRelevant() ? 1.0 : 0.0;
      positives += records.get(i).isRelevant() ? 1 : 0;
    }
    if (positives == 0 || positives == size) {
      logger.info(" Skipping training , all " + size + " feedback records have the same label ");
      return TrainingOutcome.skipped(SkipReason.SINGLE_CLASS, "all records are labelled " + (positives > 0
          ? "relevant" : "not relevant"));
    }

    ModelArtifact artifact;
    double accuracy;
    try {
      List<double[]> features = new ArrayList<double[]>(size);
      for (FeedbackRecord record : records) {
        features.add(featureExtractor.extract(record));
      }
      accuracy = crossValidate(features, labels);
      if (accuracy < minAccuracy) {
        logger.info(" Model is underfit , cross validated accuracy " + accuracy + " is below " + minAccuracy);
        return TrainingOutcome.skipped(SkipReason.UNDERFIT,
            "cross validated accuracy " + accuracy + " is below " + minAccuracy);
      }
      artifact = fit(features, labels, modelHolder.nextVersion(), accuracy);
    } catch (RuntimeException e) {
      logger.error(" Training of the re-ranking model failed ", e);
      return TrainingOutcome.skipped(SkipReason.TRAINING_FAILED, String.valueOf(e.getMessage()));
    }
    artifact = modelHolder.publish(artifact);
    long endTime = System.currentTimeMillis();
    logger.info(" Trained re-ranking model " + artifact.getVersion() + " on " + size + " records with accuracy "
        + accuracy + " in " + (endTime - startTime) + "ms");
    return TrainingOutcome.trained(artifact);
  }

  /**
   * Blends the model probability into the scores of already ranked results and ranks them
   * again . Without a model the input list itself is returned.
   */
  public List<MatchResult> rerank(SignatureQuery query, List<MatchResult> results) {
    Optional<ModelArtifact> model = modelHolder.current();
    if (!model.isPresent() || results == null || results.isEmpty()) {
      return results;
    }
    ModelArtifact artifact = model.get();
    List<MatchResult> blended = new ArrayList<MatchResult>(results.size());
    try {
      for (MatchResult result : results) {
        double probability =
            artifact.predict(featureExtractor.extract(query, result.getIssue(), result.getComponents()));
        double score = (1.0 - blendWeight) * result.getScore() + blendWeight * probability;
        blended.add(result.withScoreAndRank(Math.min(1.0, Math.max(0.0, score)), result.getRank()));
      }
    } catch (IllegalArgumentException e) {
      logger.error(" Re-ranking with model " + artifact.getVersion() + " failed , keeping similarity ranking ", e);
      return results;
    }
    debugLog(" Re-ranked " + results.size() + " results with model " + artifact.getVersion());
    return SimilarityScorer.order(blended, 0);
  }

  /**
   * Accuracy over folds of a seeded shuffle , so the same records always give the same value.
   */
  double crossValidate(List<double[]> features, double[] labels) {
    int size = labels.length;
    int foldCount = Math.min(folds, size);
    List<Integer> indices = new ArrayList<Integer>(size);
    for (int i = 0; i < size; i++) {
      indices.add(i);
    }
    Collections.shuffle(indices, new Random(SHUFFLE_SEED));
    int correct = 0;
    for (int fold = 0; fold < foldCount; fold++) {
      List<double[]> trainFeatures = new ArrayList<double[]>();
      List<Double> trainLabels = new ArrayList<Double>();
      List<Integer> testIndices = new ArrayList<Integer>();
      for (int position = 0; position < size; position++) {
        int index = indices.get(position);
        if (position % foldCount == fold) {
          testIndices.add(index);
        } else {
          trainFeatures.add(features.get(index));
          trainLabels.add(labels[index]);
        }
      }
      double[] foldLabels = new double[trainLabels.size()];
      for (int i = 0; i < foldLabels.length; i++) {
        foldLabels[i] = trainLabels.get(i);
      }
      ModelArtifact foldModel = fit(trainFeatures, foldLabels, 0, 0.0);
      for (int index : testIndices) {
        boolean predicted = foldModel.predict(features.get(index)) >= DECISION_THRESHOLD;
        if (predicted == (labels[index] > 0.5)) {
          correct++;
        }
      }
    }
    double accuracy = (double) correct / size;
    debugLog(" Cross validated accuracy " + accuracy + " over " + foldCount + " folds ");
    return accuracy;
  }

  ModelArtifact fit(List<double[]> features, double[] labels, int version, double accuracy) {
    int dimension = FeatureExtractor.FEATURE_COUNT;
    double[] means = new double[dimension];
    double[] stds = new double[dimension];
    for (int column = 0; column < dimension; column++) {
      SummaryStatistics statistics = new SummaryStatistics();
      for (double[] row : features) {
        statistics.addValue(row[column]);
      }
      means[column] = statistics.getMean();
      double std = statistics.getStandardDeviation();
      // constant columns are left centered at 0
      stds[column] = std > 0 && !Double.isNaN(std) ? std : 1.0;
    }

    List<RealVector> rows = new ArrayList<RealVector>(features.size());
    for (double[] row : features) {
      rows.add(ModelArtifact.standardize(new ArrayRealVector(row, false), means, stds));
    }

    RealVector weights = new ArrayRealVector(dimension);
    double bias = 0.0;
    int size = rows.size();
    for (int iteration = 0; iteration < iterations; iteration++) {
      RealVector gradient = new ArrayRealVector(dimension);
      double biasGradient = 0.0;
      for (int i = 0; i < size; i++) {
        double error = SIGMOID.value(weights.dotProduct(rows.get(i)) + bias) - labels[i];
        gradient = gradient.add(rows.get(i).mapMultiply(error));
        biasGradient += error;
      }
      gradient = gradient.mapDivide(size).add(weights.mapMultiply(L2_PENALTY));
      weights = weights.subtract(gradient.mapMultiply(learningRate));
      bias -= learningRate * biasGradient / size;
    }
    return new ModelArtifact(version, accuracy, size, System.currentTimeMillis(), weights.toArray(), bias, means,
        stds);
  }

  public ModelHolder getModelHolder() {
    return modelHolder;
  }

  public FeatureExtractor getFeatureExtractor() {
    return featureExtractor;
  }
}
