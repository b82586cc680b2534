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
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;


/**
 * Finds the sentence of an issue which most likely describes how it was fixed.
 */
public class SolutionExtractor {
  static final int MAX_SOLUTION_LENGTH = 200;
  private static final List<String> SOLUTION_KEYWORDS =
      ImmutableList.of("solution", "fix", "resolved", "patch", "workaround", "applied");
  private static final Pattern SENTENCE_END = Pattern.compile("[.!?]");

  private SolutionExtractor() {
  }

  /**
   * Comments of fixed issues are looked at first , then the description.
   * @return first sentence carrying a solution keyword , at most 200 characters
   */
  public static Optional<String> extract(CandidateIssue issue) {
    if (issue == null) {
      return Optional.empty();
    }
    if (issue.isFixed() && issue.getComments() != null) {
      for (String comment : issue.getComments()) {
        Optional<String> sentence = solutionSentence(comment);
        if (sentence.isPresent()) {
          return sentence;
        }
      }
    }
    return solutionSentence(issue.getDescription());
  }

  private static Optional<String> solutionSentence(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    String lowerCaseText = text.toLowerCase(Locale.ROOT);
    String[] sentences = SENTENCE_END.split(text);
    for (String keyword : SOLUTION_KEYWORDS) {
      if (!lowerCaseText.contains(keyword)) {
        continue;
      }
      for (String sentence : sentences) {
        if (sentence.toLowerCase(Locale.ROOT).contains(keyword)) {
          String trimmed = sentence.trim();
          return Optional.of(trimmed.length() > MAX_SOLUTION_LENGTH ? trimmed.substring(0, MAX_SOLUTION_LENGTH)
              : trimmed);
        }
      }
    }
    return Optional.empty();
  }
}
