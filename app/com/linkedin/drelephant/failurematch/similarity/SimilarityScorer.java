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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import com.google.common.collect.Sets;
import com.linkedin.drelephant.failurematch.normalizer.TextNormalizer;
import com.linkedin.drelephant.failurematch.normalizer.TokenSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import static com.linkedin.drelephant.failurematch.util.FailureMatchUtils.*;
import static com.linkedin.drelephant.failurematch.util.FailureMatchUtils.ConfigurationBuilder.*;


/**
 * Scores candidate issues against a failure signature . Four scores are computed for every
 * candidate and combined by a {@link WeightPreset}:
 * jaccard overlap of the normalized terms , cosine similarity of tf-idf vectors whose idf is
 * computed over the candidates being ranked , edit distance similarity of the raw signature
 * and the issue summary , and a semantic score which also credits terms matched only through
 * a synonym , at half weight.
 *
 * The scorer holds no mutable state and can be shared by any number of threads.
 */
public class SimilarityScorer {
  private static final Logger logger = Logger.getLogger(SimilarityScorer.class);
  private static final double SYNONYM_MATCH_WEIGHT = 0.5;
  private static final double REASON_THRESHOLD = 0.5;
  private static final int MAX_ISSUE_COMMENTS = 3;
  static final double COMPARE_KEYWORD_WEIGHT = 0.6;
  static final double COMPARE_TEXT_WEIGHT = 0.4;
  public static final double DEFAULT_GROUP_THRESHOLD = 0.8;

  private final TextNormalizer normalizer;
  private final WeightPreset preset;
  private final double minScore;
  private final int maxResults;
  private final double resolvedBonus;
  private final int editMaxChars;

  public SimilarityScorer(TextNormalizer normalizer) {
    this(normalizer, WeightPreset.fromName(WEIGHT_PRESET.getValue()), MIN_SCORE.getValue(), MAX_RESULTS.getValue(),
        RESOLVED_BONUS.getValue(), EDIT_MAX_CHARS.getValue());
  }

  public SimilarityScorer(TextNormalizer normalizer, WeightPreset preset) {
    this(normalizer, preset, MIN_SCORE.getValue(), MAX_RESULTS.getValue(), RESOLVED_BONUS.getValue(),
        EDIT_MAX_CHARS.getValue());
  }

  /**
   * @param maxResults : 0 for no limit
   * @param resolvedBonus : multiplier of the score of resolved issues , at least 1
   */
  public SimilarityScorer(TextNormalizer normalizer, WeightPreset preset, double minScore, int maxResults,
      double resolvedBonus, int editMaxChars) {
    if (normalizer == null || preset == null) {
      throw new IllegalArgumentException("Normalizer and weight preset are required");
    }
    if (minScore < 0 || minScore > 1 || maxResults < 0 || resolvedBonus < 1 || editMaxChars <= 0) {
      throw new IllegalArgumentException(
          "Invalid scorer configuration minScore " + minScore + " , maxResults " + maxResults + " , resolvedBonus "
              + resolvedBonus + " , editMaxChars " + editMaxChars);
    }
    this.normalizer = normalizer;
    this.preset = preset;
    this.minScore = minScore;
    this.maxResults = maxResults;
    this.resolvedBonus = resolvedBonus;
    this.editMaxChars = editMaxChars;
  }

  /**
   * Scores a single issue , the issue alone is the tf-idf corpus.
   * @param signatureTokens : normalized tokens of the signature
   */
  public MatchResult score(TokenSet signatureTokens, CandidateIssue issue) {
    return score(new SignatureQuery(signatureTokens.toText(), ImmutableList.<String>of(), signatureTokens), issue);
  }

  public MatchResult score(SignatureQuery query, CandidateIssue issue) {
    TokenSet issueTokens = issueTokens(issue);
    return score(query, issue, issueTokens, new Corpus(query.getTokens(), ImmutableList.of(issueTokens)));
  }

  /**
   * Ranks the candidates of one signature . Candidates without an id or without any text are
   * skipped and counted.
   * @return matches in ranking order with ranks 1..n
   */
  public RankingResult rank(SignatureQuery query, List<CandidateIssue> candidates) {
    long startTime = System.currentTimeMillis();
    if (candidates == null || candidates.isEmpty()) {
      return new RankingResult(ImmutableList.<MatchResult>of(), 0);
    }
    List<CandidateIssue> wellFormed = new ArrayList<CandidateIssue>();
    List<TokenSet> documents = new ArrayList<TokenSet>();
    int skipped = 0;
    for (CandidateIssue issue : candidates) {
      if (issue == null || !issue.isWellFormed()) {
        skipped++;
        logger.warn(" Skipping malformed candidate issue " + (issue == null ? null : issue.getId()));
        continue;
      }
      wellFormed.add(issue);
      documents.add(issueTokens(issue));
    }
    Corpus corpus = new Corpus(query.getTokens(), documents);
    List<MatchResult> results = new ArrayList<MatchResult>();
    for (int i = 0; i < wellFormed.size(); i++) {
      MatchResult result = score(query, wellFormed.get(i), documents.get(i), corpus);
      if (result.getScore() >= minScore) {
        results.add(result);
      }
    }
    List<MatchResult> ranked = order(results, maxResults);
    long endTime = System.currentTimeMillis();
    debugLog(" Ranked " + ranked.size() + " of " + candidates.size() + " candidates , skipped " + skipped + " in "
        + (endTime - startTime) + "ms");
    return new RankingResult(ranked, skipped);
  }

  /**
   * Ranks many failures in parallel . Results are in the order of the requests.
   */
  public List<RankingResult> rankAll(List<RankingRequest> requests, ExecutorService executor) {
    List<Future<RankingResult>> futures = new ArrayList<Future<RankingResult>>();
    for (final RankingRequest request : requests) {
      futures.add(executor.submit(new Callable<RankingResult>() {
        @Override
        public RankingResult call() {
          return rank(request.getQuery(), request.getCandidates());
        }
      }));
    }
    List<RankingResult> results = new ArrayList<RankingResult>();
    try {
      for (Future<RankingResult> future : futures) {
        results.add(future.get());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while ranking " + requests.size() + " failures", e);
    } catch (ExecutionException e) {
      logger.error(" Batch ranking failed ", e.getCause());
      throw new IllegalStateException("Batch ranking failed", e.getCause());
    }
    logger.info(" Ranked " + results.size() + " failures ");
    return results;
  }

  /**
   * Sorts results in ranking order , truncates them and assigns ranks from 1.
   * @param limit : 0 for no limit
   */
  public static List<MatchResult> order(List<MatchResult> results, int limit) {
    List<MatchResult> sorted = new ArrayList<MatchResult>(results);
    sorted.sort(MatchResult.RANKING_ORDER);
    if (limit > 0 && sorted.size() > limit) {
      sorted = sorted.subList(0, limit);
    }
    List<MatchResult> ranked = new ArrayList<MatchResult>(sorted.size());
    for (int i = 0; i < sorted.size(); i++) {
      ranked.add(sorted.get(i).withRank(i + 1));
    }
    return ranked;
  }

  private MatchResult score(SignatureQuery query, CandidateIssue issue, TokenSet issueTokens, Corpus corpus) {
    ComponentScores components = componentScores(query, issue, issueTokens, corpus);
    double score = preset.combine(components);
    if (issue.isResolved()) {
      score *= resolvedBonus;
    }
    score = Math.min(1.0, Math.max(0.0, score));
    List<String> matching = new ArrayList<String>(
        new TreeSet<String>(Sets.intersection(query.getTokens().getBaseTermSet(), issueTokens.getBaseTermSet())));
    String reason = relevanceReason(components, matching.size(), query.getTokens().getBaseTermSet().size(), issue);
    return new MatchResult(issue, score, components, 0, matching, reason,
        SolutionExtractor.extract(issue).orElse(null));
  }

  /**
   * Component scores of an issue , corpus is the issue alone.
   */
  public ComponentScores componentScores(SignatureQuery query, CandidateIssue issue) {
    TokenSet issueTokens = issueTokens(issue);
    return componentScores(query, issue, issueTokens, new Corpus(query.getTokens(), ImmutableList.of(issueTokens)));
  }

  private ComponentScores componentScores(SignatureQuery query, CandidateIssue issue, TokenSet issueTokens,
      Corpus corpus) {
    TokenSet signatureTokens = query.getTokens();
    return new ComponentScores(jaccard(signatureTokens.getBaseTermSet(), issueTokens.getBaseTermSet()),
        cosine(signatureTokens.getBaseTerms(), issueTokens.getBaseTerms(), corpus),
        editSimilarity(query.getText(), issue.getSummary()), semantic(signatureTokens, issueTokens));
  }

  public TokenSet issueTokens(CandidateIssue issue) {
    return normalizer.normalize(issueText(issue));
  }

  /**
   * Summary is counted twice , followed by description , labels and the first comments.
   */
  public static String issueText(CandidateIssue issue) {
    List<String> parts = new ArrayList<String>();
    if (StringUtils.isNotBlank(issue.getSummary())) {
      parts.add(issue.getSummary());
      parts.add(issue.getSummary());
    }
    if (StringUtils.isNotBlank(issue.getDescription())) {
      parts.add(issue.getDescription());
    }
    if (issue.getLabels() != null && !issue.getLabels().isEmpty()) {
      parts.add(String.join(" ", issue.getLabels()));
    }
    if (issue.getComments() != null) {
      for (String comment : issue.getComments().subList(0, Math.min(MAX_ISSUE_COMMENTS, issue.getComments().size()))) {
        if (StringUtils.isNotBlank(comment)) {
          parts.add(comment);
        }
      }
    }
    return String.join(" ", parts);
  }

  static double jaccard(Set<String> first, Set<String> second) {
    if (first.isEmpty() && second.isEmpty()) {
      return 0.0;
    }
    int intersection = Sets.intersection(first, second).size();
    int union = first.size() + second.size() - intersection;
    return union == 0 ? 0.0 : (double) intersection / union;
  }

  static double cosine(Multiset<String> first, Multiset<String> second, Corpus corpus) {
    double dot = 0.0;
    double firstNorm = 0.0;
    double secondNorm = 0.0;
    for (Multiset.Entry<String> entry : first.entrySet()) {
      double weight = entry.getCount() * corpus.idf(entry.getElement());
      firstNorm += weight * weight;
      int otherCount = second.count(entry.getElement());
      if (otherCount > 0) {
        dot += weight * otherCount * corpus.idf(entry.getElement());
      }
    }
    for (Multiset.Entry<String> entry : second.entrySet()) {
      double weight = entry.getCount() * corpus.idf(entry.getElement());
      secondNorm += weight * weight;
    }
    if (firstNorm == 0.0 || secondNorm == 0.0) {
      return 0.0;
    }
    return Math.min(1.0, Math.max(0.0, dot / (Math.sqrt(firstNorm) * Math.sqrt(secondNorm))));
  }

  double editSimilarity(String first, String second) {
    if (StringUtils.isEmpty(first) || StringUtils.isEmpty(second)) {
      return 0.0;
    }
    String left = StringUtils.left(first, editMaxChars).toLowerCase(Locale.ROOT);
    String right = StringUtils.left(second, editMaxChars).toLowerCase(Locale.ROOT);
    int distance = StringUtils.getLevenshteinDistance(left, right);
    return 1.0 - (double) distance / Math.max(left.length(), right.length());
  }

  /**
   * Exact matches count 1 , matches found only through a synonym of an issue term count 0.5.
   */
  static double semantic(TokenSet signatureTokens, TokenSet issueTokens) {
    Set<String> signatureTerms = signatureTokens.getBaseTermSet();
    if (signatureTerms.isEmpty()) {
      return 0.0;
    }
    double credit = 0.0;
    for (String term : signatureTerms) {
      if (issueTokens.getBaseTermSet().contains(term)) {
        credit += 1.0;
      } else if (issueTokens.getExpansionTerms().contains(term)) {
        credit += SYNONYM_MATCH_WEIGHT;
      }
    }
    return credit / signatureTerms.size();
  }

  private static String relevanceReason(ComponentScores components, int matching, int signatureTerms,
      CandidateIssue issue) {
    List<String> reasons = new ArrayList<String>();
    if (components.getJaccard() > REASON_THRESHOLD) {
      reasons.add("Keyword match: " + matching + "/" + signatureTerms);
    }
    if (components.getCosineTfidf() > REASON_THRESHOLD) {
      reasons.add("Text similarity: " + (int) (components.getCosineTfidf() * 100) + "%");
    }
    if (components.getEditDistance() > REASON_THRESHOLD) {
      reasons.add("Summary match: " + (int) (components.getEditDistance() * 100) + "%");
    }
    if (issue.isResolved()) {
      reasons.add("Issue is resolved");
    }
    return reasons.isEmpty() ? "Low similarity" : String.join("; ", reasons);
  }

  /**
   * @param requireResolution : false returns the results as they are
   * @return results of resolved or closed issues or issues with a resolution
   */
  public static List<MatchResult> filterByResolution(List<MatchResult> results, boolean requireResolution) {
    if (!requireResolution) {
      return results;
    }
    List<MatchResult> filtered = new ArrayList<MatchResult>();
    for (MatchResult result : results) {
      CandidateIssue issue = result.getIssue();
      if (issue.isResolved() || StringUtils.isNotBlank(issue.getResolution())) {
        filtered.add(result);
      }
    }
    return filtered;
  }

  /**
   * Groups results whose summaries are similar . Every group starts with the first result not
   * yet grouped , order of the results is kept within a group.
   */
  public List<List<MatchResult>> groupBySimilarity(List<MatchResult> results, double threshold) {
    List<List<MatchResult>> groups = new ArrayList<List<MatchResult>>();
    Set<Integer> used = new HashSet<Integer>();
    for (int i = 0; i < results.size(); i++) {
      if (used.contains(i)) {
        continue;
      }
      List<MatchResult> group = new ArrayList<MatchResult>();
      group.add(results.get(i));
      used.add(i);
      for (int j = i + 1; j < results.size(); j++) {
        if (used.contains(j)) {
          continue;
        }
        if (compareSignatures(results.get(i).getIssue().getSummary(), results.get(j).getIssue().getSummary())
            >= threshold) {
          group.add(results.get(j));
          used.add(j);
        }
      }
      groups.add(group);
    }
    return groups;
  }

  /**
   * Similarity of two failure texts , used to find duplicate failures and duplicate issues.
   * @return score in [0,1]
   */
  public double compareSignatures(String first, String second) {
    TokenSet firstTokens = normalizer.normalize(first);
    TokenSet secondTokens = normalizer.normalize(second);
    double keywordScore = jaccard(firstTokens.getBaseTermSet(), secondTokens.getBaseTermSet());
    double textScore =
        cosine(firstTokens.getBaseTerms(), secondTokens.getBaseTerms(), new Corpus(firstTokens,
            ImmutableList.of(secondTokens)));
    return Math.min(1.0, keywordScore * COMPARE_KEYWORD_WEIGHT + textScore * COMPARE_TEXT_WEIGHT);
  }

  public WeightPreset getPreset() {
    return preset;
  }

  public TextNormalizer getNormalizer() {
    return normalizer;
  }

  /**
   * Document frequencies of the signature and the candidate issues being ranked.
   */
  static final class Corpus {
    private final Multiset<String> documentFrequency = HashMultiset.create();
    private final int documents;

    Corpus(TokenSet query, Collection<TokenSet> issues) {
      documentFrequency.addAll(query.getBaseTermSet());
      for (TokenSet issue : issues) {
        documentFrequency.addAll(issue.getBaseTermSet());
      }
      this.documents = issues.size() + 1;
    }

    /**
     * Smoothed idf , a term found in every document still has weight 1.
     */
    double idf(String term) {
      return Math.log((1.0 + documents) / (1.0 + documentFrequency.count(term))) + 1.0;
    }
  }
}
