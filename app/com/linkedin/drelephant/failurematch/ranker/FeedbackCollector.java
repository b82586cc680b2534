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
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.log4j.Logger;

import static com.linkedin.drelephant.failurematch.util.FailureMatchUtils.ConfigurationBuilder.*;


/**
 * Stores incoming feedback and submits a {@link RetrainingRunner} every time the number of
 * records received since the last submission reaches the threshold . The ranking path never
 * waits for the training , it only sees the model once it is published.
 */
public class FeedbackCollector {
  private static final Logger logger = Logger.getLogger(FeedbackCollector.class);
  private final FeedbackStore feedbackStore;
  private final FeedbackRanker feedbackRanker;
  private final ExecutorService trainingExecutor;
  private final int retrainThreshold;
  private final AtomicInteger pending = new AtomicInteger();

  public FeedbackCollector(FeedbackStore feedbackStore, FeedbackRanker feedbackRanker,
      ExecutorService trainingExecutor) {
    this(feedbackStore, feedbackRanker, trainingExecutor, RETRAIN_THRESHOLD.getValue());
  }

  public FeedbackCollector(FeedbackStore feedbackStore, FeedbackRanker feedbackRanker,
      ExecutorService trainingExecutor, int retrainThreshold) {
    if (retrainThreshold <= 0) {
      throw new IllegalArgumentException("Retrain threshold must be positive , found " + retrainThreshold);
    }
    this.feedbackStore = feedbackStore;
    this.feedbackRanker = feedbackRanker;
    this.trainingExecutor = trainingExecutor;
    this.retrainThreshold = retrainThreshold;
  }

  /**
   * @return the submitted retraining when this record reached the threshold
   */
  public Optional<Future<TrainingOutcome>> record(FeedbackRecord record) throws IOException {
    feedbackStore.append(record);
    int count = pending.incrementAndGet();
    if (count < retrainThreshold || !pending.compareAndSet(count, 0)) {
      return Optional.empty();
    }
    logger.info(" " + count + " new feedback records , submitting retraining ");
    return Optional.of(trainingExecutor.submit(new RetrainingRunner(feedbackStore, feedbackRanker)));
  }

  public int getPendingCount() {
    return pending.get();
  }
}
