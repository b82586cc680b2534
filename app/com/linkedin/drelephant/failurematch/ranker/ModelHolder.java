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
import java.util.concurrent.atomic.AtomicReference;
import org.apache.log4j.Logger;


/**
 * Holds the current re-ranking model . A re-ranking reads the model once , so it sees either
 * the old or the new artifact while a retraining publishes.
 */
public class ModelHolder {
  private static final Logger logger = Logger.getLogger(ModelHolder.class);
  private final AtomicReference<ModelArtifact> model = new AtomicReference<>();

  public Optional<ModelArtifact> current() {
    return Optional.ofNullable(model.get());
  }

  /**
   * Versions only grow . An artifact whose version is not above the current one is published
   * with the version following the current one , so two trainings racing each other never
   * publish the same version.
   * @return the published model , with the version it was published under
   */
  public ModelArtifact publish(ModelArtifact artifact) {
    if (artifact == null) {
      throw new IllegalArgumentException("Model artifact to publish is null");
    }
    while (true) {
      ModelArtifact previous = model.get();
      int version = previous == null ? artifact.getVersion()
          : Math.max(artifact.getVersion(), previous.getVersion() + 1);
      ModelArtifact published = version == artifact.getVersion() ? artifact : artifact.withVersion(version);
      if (model.compareAndSet(previous, published)) {
        logger.info(" Published re-ranking model " + published + " , replaced " + (previous == null ? "none"
            : "version " + previous.getVersion()));
        return published;
      }
    }
  }

  /**
   * @return version a model trained now is expected to get , publishing can still raise it
   */
  public int nextVersion() {
    ModelArtifact artifact = model.get();
    return artifact == null ? 1 : artifact.getVersion() + 1;
  }

  public void clear() {
    model.set(null);
  }
}
