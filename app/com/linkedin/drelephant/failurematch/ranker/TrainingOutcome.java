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

import java.util.Optional;

import static com.linkedin.drelephant.failurematch.util.Constant.*;


/**
 * Either a newly trained model or the reason training was skipped . A skipped training is
 * informational , the current model stays in place.
 */
public final class TrainingOutcome {
  private final ModelArtifact artifact;
  private final SkipReason skipReason;
  private final String detail;

  private TrainingOutcome(ModelArtifact artifact, SkipReason skipReason, String detail) {
    this.artifact = artifact;
    this.skipReason = skipReason;
    this.detail = detail;
  }

  public static TrainingOutcome trained(ModelArtifact artifact) {
    return new TrainingOutcome(artifact, null, "trained on " + artifact.getSampleCount() + " records");
  }

  public static TrainingOutcome skipped(SkipReason reason, String detail) {
    return new TrainingOutcome(null, reason, detail);
  }

  public boolean isTrained() {
    return artifact != null;
  }

  public Optional<ModelArtifact> getArtifact() {
    return Optional.ofNullable(artifact);
  }

  public Optional<SkipReason> getSkipReason() {
    return Optional.ofNullable(skipReason);
  }

  public String getDetail() {
    return detail;
  }

  @Override
  public String toString() {
    return isTrained() ? "Trained{" + artifact + '}' : "TrainingSkipped{" + skipReason + " , " + detail + '}';
  }
}
