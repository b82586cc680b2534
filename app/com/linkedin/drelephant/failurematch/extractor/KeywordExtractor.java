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

package com.linkedin.drelephant.failurematch.extractor;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;


/**
 * Keywords used to search the issue tracker for a failure.
 */
public class KeywordExtractor {
  public static final int DEFAULT_MAX_KEYWORDS = 10;
  public static final int DEFAULT_MAX_SEARCH_KEYWORDS = 5;

  static final Set<String> NOISE_WORDS =
      ImmutableSet.of("the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by", "from",
          "as", "is", "was", "were", "are", "be", "been", "being", "have", "has", "had", "do", "does", "did", "will",
          "would", "should", "could", "may", "might", "must", "can", "this", "that", "these", "those", "i", "you",
          "he", "she", "it", "we", "they", "what", "which", "who", "when", "where", "why", "how", "all", "each",
          "every", "both", "few", "more", "most", "other", "some", "such", "no", "nor", "not", "only", "own", "same",
          "so", "than", "too", "very", "s", "t", "just", "don", "now", "ve", "ll", "m", "o", "re", "d", "y");

  private static final List<String> TECHNICAL_TERMS =
      ImmutableList.of("memory", "allocation", "dma", "cache", "buffer", "timeout", "assertion", "segmentation",
          "fatal");
  private static final List<String> TEST_NAME_PREFIXES = ImmutableList.of("test_", "tc_", "testcase_");
  private static final Pattern WORD_PATTERN = Pattern.compile("\\b[a-z0-9_]+\\b");
  private static final Pattern CAMEL_CASE_BOUNDARY = Pattern.compile("([a-z])([A-Z])");
  private static final Pattern DIGITS = Pattern.compile("\\d+");

  private KeywordExtractor() {
  }

  /**
   * @param text : text of the failure
   * @param maxKeywords : maximum number of keywords returned
   * @return distinct keywords in order of appearance
   */
  public static List<String> extractKeywords(String text, int maxKeywords) {
    List<String> keywords = new ArrayList<String>();
    if (text == null || text.isEmpty() || maxKeywords <= 0) {
      return keywords;
    }
    Set<String> seen = new LinkedHashSet<String>();
    Matcher matcher = WORD_PATTERN.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find() && keywords.size() < maxKeywords) {
      String word = matcher.group();
      if (word.length() <= 2 || NOISE_WORDS.contains(word) || seen.contains(word)) {
        continue;
      }
      // short numbers are noise , longer ones are usually error codes
      if (DIGITS.matcher(word).matches() && word.length() < 3) {
        continue;
      }
      seen.add(word);
      keywords.add(word);
    }
    return keywords;
  }

  public static List<String> extractKeywords(String text) {
    return extractKeywords(text, DEFAULT_MAX_KEYWORDS);
  }

  /**
   * Derives keywords from naming conventions of tests , for e.g test_dmaTransfer_basic gives
   * dma , transfer and basic.
   * @param testName : name of the test
   * @return keywords , empty if test name is missing
   */
  public static List<String> fromTestName(String testName) {
    List<String> keywords = new ArrayList<String>();
    if (testName == null || testName.trim().isEmpty()) {
      return keywords;
    }
    String name = CAMEL_CASE_BOUNDARY.matcher(testName.trim()).replaceAll("$1_$2").toLowerCase(Locale.ROOT);
    for (String prefix : TEST_NAME_PREFIXES) {
      if (name.startsWith(prefix)) {
        name = name.substring(prefix.length());
        break;
      }
    }
    for (String part : name.split("_")) {
      part = part.trim();
      if (part.length() > 2 && !NOISE_WORDS.contains(part)) {
        keywords.add(part);
      }
    }
    return keywords;
  }

  /**
   * Orders keywords by how useful they are for an issue tracker search . Keywords present in the
   * signature , long keywords and technical terms are preferred , ties keep the given order.
   * @return at most maxKeywords keywords
   */
  public static List<String> suggestSearchKeywords(String signatureText, List<String> keywords, int maxKeywords) {
    if (keywords == null || keywords.isEmpty()) {
      return new ArrayList<String>();
    }
    String signature = signatureText == null ? "" : signatureText.toLowerCase(Locale.ROOT);
    Map<String, Double> scores = new LinkedHashMap<String, Double>();
    for (String keyword : keywords) {
      String lowerCaseKeyword = keyword.toLowerCase(Locale.ROOT);
      double score = 1.0;
      if (signature.contains(lowerCaseKeyword)) {
        score += 2.0;
      }
      if (keyword.length() > 5) {
        score += 1.0;
      }
      for (String term : TECHNICAL_TERMS) {
        if (lowerCaseKeyword.contains(term)) {
          score += 1.5;
          break;
        }
      }
      scores.put(keyword, score);
    }
    List<Map.Entry<String, Double>> entries = new ArrayList<Map.Entry<String, Double>>(scores.entrySet());
    // List.sort is stable
    entries.sort((first, second) -> Double.compare(second.getValue(), first.getValue()));
    List<String> suggested = new ArrayList<String>();
    for (Map.Entry<String, Double> entry : entries) {
      if (suggested.size() >= maxKeywords) {
        break;
      }
      suggested.add(entry.getKey());
    }
    return suggested;
  }
}
