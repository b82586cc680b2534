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
 * One failure of a batch ranking with its own candidates.
 */
public final class RankingRequest {
  private final SignatureQuery query;
  private final ImmutableList<CandidateIssue> candidates;

  public RankingRequest(SignatureQuery query, List<CandidateIssue> candidates) {
    this.query = query;
    this.candidates = candidates == null ? ImmutableList.<CandidateIssue>of() : ImmutableList.copyOf(candidates);
  }

  public SignatureQuery getQuery() {
    return query;
  }

  public List<CandidateIssue> getCandidates() {
    return candidates;
  }
}
