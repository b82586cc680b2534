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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import org.apache.commons.math3.analysis.function.Sigmoid;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;


/**
 * Trained logistic regression re-ranking model . The artifact is immutable , retraining builds
 * a new one which is published through {@link ModelHolder}.
 *
 * Features are standardized with the means and standard deviations of the training data
 * before the weights are applied.
 */
public final class ModelArtifact {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final Sigmoid SIGMOID = new Sigmoid();

  private final int version;
  private final double accuracy;
  private final int sampleCount;
  private final long trainedAt;
  private final double[] weights;
  private final double bias;
  private final double[] means;
  private final double[] stds;

  @JsonCreator
  public ModelArtifact(@JsonProperty("version") int version, @JsonProperty("accuracy") double accuracy,
      @JsonProperty("sampleCount") int sampleCount, @JsonProperty("trainedAt") long trainedAt,
      @JsonProperty("weights") double[] weights, @JsonProperty("bias") double bias,
      @JsonProperty("means") double[] means, @JsonProperty("stds") double[] stds) {
    if (weights == null || means == null || stds == null || weights.length != means.length
        || weights.length != stds.length) {
      throw new IllegalArgumentException("Model weights , means and stds must have the same length");
    }
    this.version = version;
    this.accuracy = accuracy;
    this.sampleCount = sampleCount;
    this.trainedAt = trainedAt;
    this.weights = weights.clone();
    this.bias = bias;
    this.means = means.clone();
    this.stds = stds.clone();
  }

  /**
   * @return copy of this model carrying another version
   */
  public ModelArtifact withVersion(int newVersion) {
    return new ModelArtifact(newVersion, accuracy, sampleCount, trainedAt, weights, bias, means, stds);
  }

  /**
   * @param features : raw feature vector , see {@link FeatureExtractor}
   * @return probability that the issue is relevant
   */
  public double predict(double[] features) {
    if (features == null || features.length != weights.length) {
      throw new IllegalArgumentException(
          "Model " + version + " expects " + weights.length + " features , got " + (features == null ? 0
              : features.length));
    }
    RealVector standardized = standardize(new ArrayRealVector(features, false), means, stds);
    return SIGMOID.value(new ArrayRealVector(weights, false).dotProduct(standardized) + bias);
  }

  static RealVector standardize(RealVector features, double[] means, double[] stds) {
    RealVector standardized = new ArrayRealVector(features.getDimension());
    for (int i = 0; i < features.getDimension(); i++) {
      standardized.setEntry(i, (features.getEntry(i) - means[i]) / stds[i]);
    }
    return standardized;
  }

  public int getVersion() {
    return version;
  }

  /**
   * @return cross validated accuracy measured when the model was trained
   */
  public double getAccuracy() {
    return accuracy;
  }

  public int getSampleCount() {
    return sampleCount;
  }

  public long getTrainedAt() {
    return trainedAt;
  }

  public double[] getWeights() {
    return weights.clone();
  }

  public double getBias() {
    return bias;
  }

  public double[] getMeans() {
    return means.clone();
  }

  public double[] getStds() {
    return stds.clone();
  }

  public void save(File file) throws IOException {
    OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file, this);
  }

  public static ModelArtifact load(File file) throws IOException {
    return OBJECT_MAPPER.readValue(file, ModelArtifact.class);
  }

  @Override
  public String toString() {
    return "ModelArtifact{" + "version=" + version + ", accuracy=" + accuracy + ", sampleCount=" + sampleCount
        + ", trainedAt=" + trainedAt + '}';
  }
}
