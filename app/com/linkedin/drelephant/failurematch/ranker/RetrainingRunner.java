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

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.log4j.Logger;

import static com.linkedin.drelephant.failurematch.util.Constant.*;


/**
 * Out of band training task . It reads every stored feedback record and trains the ranker , a
 * trained model is published by the ranker to its holder.
 */
public class RetrainingRunner implements Callable<TrainingOutcome> {
  private static final Logger logger = Logger.getLogger(RetrainingRunner.class);
  private final FeedbackStore feedbackStore;
  private final FeedbackRanker feedbackRanker;

  public RetrainingRunner(FeedbackStore feedbackStore, FeedbackRanker feedbackRanker) {
    this.feedbackStore = feedbackStore;
    this.feedbackRanker = feedbackRanker;
  }

  @Override
  public TrainingOutcome call() {
    long startTime = System.currentTimeMillis();
    List<FeedbackRecord> records;
    try {
      records = feedbackStore.loadAll();
    } catch (IOException e) {
      logger.error(" Unable to load feedback from " + feedbackStore.getFile(), e);
      return TrainingOutcome.skipped(SkipReason.TRAINING_FAILED, "unable to load feedback : " + e.getMessage());
    }
    TrainingOutcome outcome = feedbackRanker.train(records);
    long endTime = System.currentTimeMillis();
    logger.info(" Retraining finished with " + outcome + " in " + (endTime - startTime) * 1.0 / (1000.0) + "s");
    return outcome;
  }
}
