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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.*;


public class ModelArtifactTest {

  @Rule
  public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Test
  public void testPredict() {
    ModelArtifact artifact =
        new ModelArtifact(1, 0.8, 20, 0L, new double[]{2.0, 0.0}, 0.0, new double[]{1.0, 5.0}, new double[]{0.5, 1.0});
    // standardized first feature is 0 , so only the bias counts
    assertEquals(0.5, artifact.predict(new double[]{1.0, 100.0}), 1e-9);
    assertTrue(artifact.predict(new double[]{2.0, 0.0}) > 0.9);
    assertTrue(artifact.predict(new double[]{0.0, 0.0}) < 0.1);
  }

  @Test
  public void testSaveAndLoad() throws IOException {
    ModelArtifact artifact = new ModelArtifact(3, 0.75, 40, 1234L, new double[]{0.5, -1.5, 2.0}, 0.25,
        new double[]{0.1, 0.2, 0.3}, new double[]{1.0, 2.0, 3.0});
    File file = new File(temporaryFolder.getRoot(), "model.json");
    artifact.save(file);

    ModelArtifact loaded = ModelArtifact.load(file);
    assertEquals(3, loaded.getVersion());
    assertEquals(0.75, loaded.getAccuracy(), 0.0);
    assertEquals(40, loaded.getSampleCount());
    assertEquals(1234L, loaded.getTrainedAt());
    assertArrayEquals(artifact.getWeights(), loaded.getWeights(), 0.0);
    assertArrayEquals(artifact.getStds(), loaded.getStds(), 0.0);
    assertEquals(artifact.predict(new double[]{1.0, 1.0, 1.0}), loaded.predict(new double[]{1.0, 1.0, 1.0}), 1e-12);
  }

  @Test
  public void testWeightsCanNotBeModified() {
    ModelArtifact artifact =
        new ModelArtifact(1, 0.8, 20, 0L, new double[]{1.0}, 0.0, new double[]{0.0}, new double[]{1.0});
    artifact.getWeights()[0] = 42.0;
    assertEquals(1.0, artifact.getWeights()[0], 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFeatureCountMismatch() {
    new ModelArtifact(1, 0.8, 20, 0L, new double[]{1.0, 1.0}, 0.0, new double[]{0.0, 0.0}, new double[]{1.0, 1.0})
        .predict(new double[]{1.0});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInconsistentArtifact() {
    new ModelArtifact(1, 0.8, 20, 0L, new double[]{1.0, 1.0}, 0.0, new double[]{0.0}, new double[]{1.0, 1.0});
  }

  @Test
  public void testModelHolder() {
    ModelHolder holder = new ModelHolder();
    assertFalse(holder.current().isPresent());
    assertEquals(1, holder.nextVersion());

    ModelArtifact first =
        new ModelArtifact(1, 0.8, 20, 0L, new double[]{1.0}, 0.0, new double[]{0.0}, new double[]{1.0});
    ModelArtifact second =
        new ModelArtifact(2, 0.9, 30, 0L, new double[]{1.0}, 0.0, new double[]{0.0}, new double[]{1.0});
    assertSame(first, holder.publish(first));
    assertSame(second, holder.publish(second));
    assertEquals(3, holder.nextVersion());

    // a model trained against an older version is published after the current one
    ModelArtifact stale =
        new ModelArtifact(2, 0.7, 25, 0L, new double[]{1.0}, 0.0, new double[]{0.0}, new double[]{1.0});
    ModelArtifact published = holder.publish(stale);
    assertEquals(3, published.getVersion());
    assertEquals(0.7, published.getAccuracy(), 0.0);
    assertSame(published, holder.current().get());

    holder.clear();
    assertFalse(holder.current().isPresent());
  }

  @Test
  public void testConcurrentPublishesGetDistinctVersions() throws Exception {
    final ModelHolder holder = new ModelHolder();
    final ModelArtifact artifact =
        new ModelArtifact(1, 0.8, 20, 0L, new double[]{1.0}, 0.0, new double[]{0.0}, new double[]{1.0});
    ExecutorService executor = Executors.newFixedThreadPool(4);
    List<Future<Integer>> versions = new ArrayList<Future<Integer>>();
    try {
      for (int i = 0; i < 40; i++) {
        versions.add(executor.submit(() -> holder.publish(artifact).getVersion()));
      }
      Set<Integer> distinct = new HashSet<Integer>();
      for (Future<Integer> version : versions) {
        distinct.add(version.get());
      }
      assertEquals(40, distinct.size());
      assertEquals(40, holder.current().get().getVersion());
    } finally {
      executor.shutdownNow();
    }
  }
}
