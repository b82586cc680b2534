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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.linkedin.drelephant.failurematch.similarity.CandidateIssue;
import com.linkedin.drelephant.failurematch.similarity.ComponentScores;
import com.linkedin.drelephant.failurematch.similarity.SignatureQuery;
import com.linkedin.drelephant.failurematch.similarity.SimilarityScorer;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;


/**
 * Turns a (signature , issue) pair into the fixed size feature vector of the re-ranking model.
 * Features in order :
 * 0-3 jaccard , cosine , edit and semantic component scores ,
 * 4 share of signature keywords found in the issue text ,
 * 5 status match , 1 when the issue is resolved or closed ,
 * 6 share of issue labels found in the signature ,
 * 7-11 error type match for memory , crash , timeout , assertion and fatal ,
 * 12 error code present in the signature.
 */
public class FeatureExtractor {
  public static final int FEATURE_COUNT = 13;
  public static final List<String> FEATURE_NAMES = ImmutableList.of("jaccard", "cosine", "edit", "semantic",
      "keyword_overlap", "status_match", "label_overlap", "memory", "crash", "timeout", "assertion", "fatal",
      "error_code");

  // both texts mention the type
  static final double TYPE_IN_BOTH = 1.0;
  // only one of the texts mentions it
  static final double TYPE_IN_ONE = 0.5;

  private static final Map<String, List<String>> ERROR_TYPES = ImmutableMap.<String, List<String>>builder()
      .put("memory", ImmutableList.of("memory", "malloc", "alloc", "heap", "leak", "oom"))
      .put("crash", ImmutableList.of("crash", "segfault", "sigsegv", "segmentation", "abort", "coredump"))
      .put("timeout", ImmutableList.of("timeout", "hang", "freeze", "stuck", "deadlock"))
      .put("assertion", ImmutableList.of("assert", "assertion", "invariant"))
      .put("fatal", ImmutableList.of("fatal", "panic", "critical"))
      .build();
  private static final Pattern ERROR_CODE = Pattern.compile("0x[0-9a-f]+|error\\s+\\d+");

  private final SimilarityScorer scorer;

  public FeatureExtractor(SimilarityScorer scorer) {
    this.scorer = scorer;
  }

  /**
   * Features of a labelled record . Component scores are computed with the issue alone as the
   * tf-idf corpus.
   */
  public double[] extract(FeedbackRecord record) {
    CandidateIssue issue = record.toCandidateIssue();
    SignatureQuery query =
        new SignatureQuery(record.getSearchText(), record.getSignatureKeywords(),
            scorer.getNormalizer().normalize(record.getSearchText()));
    return extract(query, issue, scorer.componentScores(query, issue));
  }

  /**
   * @param components : component scores already computed while ranking
   */
  public double[] extract(SignatureQuery query, CandidateIssue issue, ComponentScores components) {
    double[] features = new double[FEATURE_COUNT];
    features[0] = components.getJaccard();
    features[1] = components.getCosineTfidf();
    features[2] = components.getEditDistance();
    features[3] = components.getSemantic();

    String signatureText = (query.getText() + " " + String.join(" ", query.getKeywords())).toLowerCase(Locale.ROOT);
    String issueText = SimilarityScorer.issueText(issue).toLowerCase(Locale.ROOT);

    features[4] = keywordOverlap(query.getKeywords(), issueText);
    features[5] = issue.isResolved() ? 1.0 : 0.0;
    features[6] = labelOverlap(issue.getLabels(), signatureText);

    int index = 7;
    for (List<String> typeKeywords : ERROR_TYPES.values()) {
      features[index++] = errorTypeMatch(typeKeywords, signatureText, issueText);
    }
    features[12] = ERROR_CODE.matcher(signatureText).find() ? 1.0 : 0.0;
    return features;
  }

  static double keywordOverlap(List<String> keywords, String issueText) {
    if (keywords == null || keywords.isEmpty()) {
      return 0.0;
    }
    int found = 0;
    for (String keyword : keywords) {
      if (issueText.contains(keyword.toLowerCase(Locale.ROOT))) {
        found++;
      }
    }
    return (double) found / keywords.size();
  }

  static double labelOverlap(List<String> labels, String signatureText) {
    if (labels == null || labels.isEmpty()) {
      return 0.0;
    }
    int found = 0;
    for (String label : labels) {
      if (label != null && !label.isEmpty() && signatureText.contains(label.toLowerCase(Locale.ROOT))) {
        found++;
      }
    }
    return (double) found / labels.size();
  }

  static double errorTypeMatch(List<String> typeKeywords, String signatureText, String issueText) {
    boolean inSignature = containsAny(signatureText, typeKeywords);
    boolean inIssue = containsAny(issueText, typeKeywords);
    if (inSignature && inIssue) {
      return TYPE_IN_BOTH;
    }
    return inSignature || inIssue ? TYPE_IN_ONE : 0.0;
  }

  private static boolean containsAny(String text, List<String> keywords) {
    for (String keyword : keywords) {
      if (text.contains(keyword)) {
        return true;
      }
    }
    return false;
  }
}
