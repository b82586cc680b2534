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

package com.linkedin.drelephant.failurematch.similarity;

import com.google.common.collect.ImmutableList;
import java.util.List;


/**
 * Ranked matches of one signature and the number of malformed candidates which were skipped.
 */
public final class RankingResult {
  private final ImmutableList<MatchResult> results;
  private final int skippedCount;

  public RankingResult(List<MatchResult> results, int skippedCount) {
    this.results = ImmutableList.copyOf(results);
    this.skippedCount = skippedCount;
  }

  public List<MatchResult> getResults() {
    return results;
  }

  public int getSkippedCount() {
    return skippedCount;
  }

  @Override
  public String toString() {
    return "RankingResult{" + "results=" + results.size() + ", skippedCount=" + skippedCount + '}';
  }
}
