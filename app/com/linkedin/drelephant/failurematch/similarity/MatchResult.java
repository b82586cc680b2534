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
import java.util.Comparator;
import java.util.List;
import java.util.Optional;


/**
 * Score of one candidate issue for one signature . Rank is 1 based , 0 until the result is
 * placed in a ranking.
 */
public final class MatchResult {

  /**
   * Score descending , resolved issues first , recently updated first and finally issue id , so
   * that no two distinct issues compare equal.
   */
  public static final Comparator<MatchResult> RANKING_ORDER =
      Comparator.comparingDouble(MatchResult::getScore).reversed()
          .thenComparing(result -> !result.getIssue().isResolved())
          .thenComparing(result -> result.getIssue().getUpdatedAt(),
              Comparator.nullsLast(Comparator.<Long>reverseOrder()))
          .thenComparing(MatchResult::getIssueId);

  private final CandidateIssue issue;
  private final double score;
  private final ComponentScores components;
  private final int rank;
  private final ImmutableList<String> matchingKeywords;
  private final String relevanceReason;
  private final String solutionSummary;

  public MatchResult(CandidateIssue issue, double score, ComponentScores components, int rank,
      List<String> matchingKeywords, String relevanceReason, String solutionSummary) {
    this.issue = issue;
    this.score = score;
    this.components = components;
    this.rank = rank;
    this.matchingKeywords = ImmutableList.copyOf(matchingKeywords);
    this.relevanceReason = relevanceReason;
    this.solutionSummary = solutionSummary;
  }

  public MatchResult withRank(int newRank) {
    return new MatchResult(issue, score, components, newRank, matchingKeywords, relevanceReason, solutionSummary);
  }

  public MatchResult withScoreAndRank(double newScore, int newRank) {
    return new MatchResult(issue, newScore, components, newRank, matchingKeywords, relevanceReason, solutionSummary);
  }

  public CandidateIssue getIssue() {
    return issue;
  }

  public String getIssueId() {
    return issue.getId();
  }

  public double getScore() {
    return score;
  }

  public ComponentScores getComponents() {
    return components;
  }

  public int getRank() {
    return rank;
  }

  public List<String> getMatchingKeywords() {
    return matchingKeywords;
  }

  public String getRelevanceReason() {
    return relevanceReason;
  }

  public Optional<String> getSolutionSummary() {
    return Optional.ofNullable(solutionSummary);
  }

  @Override
  public String toString() {
    return "MatchResult{" + "issueId='" + getIssueId() + '\'' + ", score=" + score + ", rank=" + rank
        + ", components=" + components + ", reason='" + relevanceReason + '\'' + '}';
  }
}
