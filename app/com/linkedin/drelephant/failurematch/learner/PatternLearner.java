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

package com.linkedin.drelephant.failurematch.learner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multiset;
import com.google.common.collect.Sets;
import com.linkedin.drelephant.failurematch.catalog.CatalogDefinition;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.log4j.Logger;

import static com.linkedin.drelephant.failurematch.util.Constant.*;
import static com.linkedin.drelephant.failurematch.util.FailureMatchUtils.*;
import static com.linkedin.drelephant.failurematch.util.FailureMatchUtils.ConfigurationBuilder.*;


/**
 * Discovers candidate error rules from log lines which looked like errors but matched no rule.
 * Variable tokens (numbers , hex literals , paths , identifiers) are masked , lines are grouped
 * by their shingles of contiguous masked tokens and a regex is synthesized for every group with
 * enough lines . Candidates are advisory , nothing is added to a catalog here.
 */
public class PatternLearner {
  private static final Logger logger = Logger.getLogger(PatternLearner.class);

  private static final String TOKEN_SEPARATOR_REGEX = "\\s+";
  private static final String ANY_REGEX = ".*";
  private static final String NUMBER_REGEX = "\\d+";
  private static final String HEX_REGEX = "0x[0-9a-fA-F]+";
  private static final String NON_SPACE_REGEX = "\\S+";
  private static final String REGEX_META_CHARACTERS = "\\.[]{}()*+-?^$|";
  private static final int MAX_SAMPLES = 5;

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern NUMBER = Pattern.compile("\\d+");
  private static final Pattern HEX = Pattern.compile("0x[0-9a-fA-F]+");
  private static final Pattern IDENTIFIER = Pattern.compile("(?=[^\\s]*[A-Za-z])(?=[^\\s]*\\d)[A-Za-z0-9_.:-]+");

  // checked in order , first group with a keyword in the line wins
  private static final Map<List<String>, LevelGuess> LEVEL_GUESSES =
      ImmutableMap.<List<String>, LevelGuess>builder()
          .put(ImmutableList.of("fatal", "critical", "panic", "abort"), new LevelGuess(9, "auto:fatal"))
          .put(ImmutableList.of("crash", "segfault", "sigsegv", "coredump"), new LevelGuess(8, "auto:crash"))
          .put(ImmutableList.of("memory", "malloc", "alloc", "heap", "leak"), new LevelGuess(7, "auto:memory"))
          .put(ImmutableList.of("timeout", "hang", "deadlock", "freeze"), new LevelGuess(6, "auto:timeout"))
          .put(ImmutableList.of("assert", "assertion", "invariant"), new LevelGuess(6, "auto:assertion"))
          .put(ImmutableList.of("null", "nullptr", "nil"), new LevelGuess(5, "auto:null_pointer"))
          .build();
  private static final LevelGuess DEFAULT_LEVEL_GUESS = new LevelGuess(5, "auto:error");

  private enum TokenClass {LITERAL, NUMBER, HEX, PATH, IDENTIFIER}

  private final int shingleSize;
  private final double similarityThreshold;
  private final int minSupport;
  private final int mediumSupport;
  private final int highSupport;
  private final int highAnchorLength;
  private final int maxCandidates;
  private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  public PatternLearner() {
    this(SHINGLE_SIZE.getValue(), CLUSTER_SIMILARITY_THRESHOLD.getValue(), MIN_SUPPORT.getValue(),
        MEDIUM_SUPPORT.getValue(), HIGH_SUPPORT.getValue(), HIGH_ANCHOR_LENGTH.getValue(), MAX_CANDIDATES.getValue());
  }

  public PatternLearner(int shingleSize, double similarityThreshold, int minSupport, int mediumSupport,
      int highSupport, int highAnchorLength, int maxCandidates) {
    if (shingleSize <= 0 || minSupport <= 0 || maxCandidates <= 0 || similarityThreshold < 0
        || similarityThreshold > 1 || mediumSupport > highSupport) {
      throw new IllegalArgumentException(
          "Invalid learner configuration shingleSize " + shingleSize + " , threshold " + similarityThreshold
              + " , minSupport " + minSupport + " , mediumSupport " + mediumSupport + " , highSupport " + highSupport
              + " , maxCandidates " + maxCandidates);
    }
    this.shingleSize = shingleSize;
    this.similarityThreshold = similarityThreshold;
    this.minSupport = minSupport;
    this.mediumSupport = mediumSupport;
    this.highSupport = highSupport;
    this.highAnchorLength = highAnchorLength;
    this.maxCandidates = maxCandidates;
  }

  /**
   * @param unmatchedLines : lines which matched no rule , blank lines are ignored
   * @return candidates ordered by support , most supported first
   */
  public List<LearnedPatternCandidate> discover(List<String> unmatchedLines) {
    long startTime = System.currentTimeMillis();
    List<LearnedPatternCandidate> candidates = new ArrayList<LearnedPatternCandidate>();
    if (unmatchedLines == null || unmatchedLines.isEmpty()) {
      return candidates;
    }
    List<TokenizedLine> lines = new ArrayList<TokenizedLine>();
    for (String line : unmatchedLines) {
      if (line != null && !line.trim().isEmpty()) {
        lines.add(new TokenizedLine(line.trim(), shingleSize));
      }
    }
    List<List<TokenizedLine>> clusters = cluster(lines);
    Map<String, LearnedPatternCandidate> byRegex = new LinkedHashMap<String, LearnedPatternCandidate>();
    for (List<TokenizedLine> cluster : clusters) {
      if (cluster.size() < minSupport) {
        continue;
      }
      LearnedPatternCandidate candidate = synthesize(cluster);
      if (candidate == null) {
        continue;
      }
      LearnedPatternCandidate existing = byRegex.get(candidate.getRegexText());
      if (existing == null || existing.getSupportCount() < candidate.getSupportCount()) {
        byRegex.put(candidate.getRegexText(), candidate);
      }
    }
    candidates.addAll(byRegex.values());
    candidates.sort(Comparator.comparingInt(LearnedPatternCandidate::getSupportCount).reversed()
        .thenComparing(Comparator.comparingInt(LearnedPatternCandidate::getAnchorLength).reversed())
        .thenComparing(LearnedPatternCandidate::getRegexText));
    if (candidates.size() > maxCandidates) {
      candidates = new ArrayList<LearnedPatternCandidate>(candidates.subList(0, maxCandidates));
    }
    long endTime = System.currentTimeMillis();
    logger.info(" Discovered " + candidates.size() + " pattern candidates from " + lines.size() + " lines in "
        + clusters.size() + " clusters in " + (endTime - startTime) + "ms");
    return candidates;
  }

  /**
   * Leader clustering , a line joins the most similar cluster leader at or above the threshold
   * or starts a new cluster.
   */
  private List<List<TokenizedLine>> cluster(List<TokenizedLine> lines) {
    List<List<TokenizedLine>> clusters = new ArrayList<List<TokenizedLine>>();
    for (TokenizedLine line : lines) {
      List<TokenizedLine> best = null;
      double bestSimilarity = -1;
      for (List<TokenizedLine> cluster : clusters) {
        double similarity = jaccard(cluster.get(0).shingles, line.shingles);
        if (similarity >= similarityThreshold && similarity > bestSimilarity) {
          best = cluster;
          bestSimilarity = similarity;
        }
      }
      if (best == null) {
        best = new ArrayList<TokenizedLine>();
        clusters.add(best);
      }
      best.add(line);
    }
    return clusters;
  }

  private LearnedPatternCandidate synthesize(List<TokenizedLine> cluster) {
    RegexDraft draft = positionalRegex(cluster);
    if (draft == null) {
      draft = prefixSuffixRegex(cluster);
    }
    if (draft == null) {
      draft = shingleRegex(cluster);
    }
    if (draft.anchorLength == 0) {
      // only wildcards , the regex would match any line of the same shape
      debugLog(" Dropping regex " + draft.regex + " without literal anchor for " + cluster.size() + " lines ");
      return null;
    }
    Pattern pattern = Pattern.compile(draft.regex);
    int support = 0;
    Set<String> samples = new LinkedHashSet<String>();
    for (TokenizedLine line : cluster) {
      if (pattern.matcher(line.text).find()) {
        support++;
        if (samples.size() < MAX_SAMPLES) {
          samples.add(line.text);
        }
      }
    }
    if (support < minSupport) {
      debugLog(" Dropping regex " + draft.regex + " which matches only " + support + " of " + cluster.size()
          + " lines ");
      return null;
    }
    LevelGuess guess = guessLevel(samples.iterator().next());
    return new LearnedPatternCandidate(draft.regex, new ArrayList<String>(samples),
        confidence(support, draft.anchorLength), support, draft.anchorLength, guess.level, guess.tag);
  }

  /**
   * Lines with the same number of tokens , every position becomes a literal or a wildcard.
   */
  private static RegexDraft positionalRegex(List<TokenizedLine> cluster) {
    TokenizedLine leader = cluster.get(0);
    for (TokenizedLine line : cluster) {
      if (line.tokens.size() != leader.tokens.size()) {
        return null;
      }
    }
    List<String> parts = new ArrayList<String>();
    int anchorLength = 0;
    for (int i = 0; i < leader.tokens.size(); i++) {
      boolean sameText = true;
      boolean sameClass = true;
      for (TokenizedLine line : cluster) {
        sameText &= line.tokens.get(i).equals(leader.tokens.get(i));
        sameClass &= line.classes.get(i) == leader.classes.get(i);
      }
      if (sameText && leader.classes.get(i) == TokenClass.LITERAL) {
        parts.add(escape(leader.tokens.get(i)));
        anchorLength += leader.tokens.get(i).length();
      } else {
        parts.add(wildcard(sameClass ? leader.classes.get(i) : TokenClass.LITERAL));
      }
    }
    return new RegexDraft(String.join(TOKEN_SEPARATOR_REGEX, parts), anchorLength);
  }

  /**
   * Lines of different length , the common leading and trailing literal tokens are kept.
   */
  private static RegexDraft prefixSuffixRegex(List<TokenizedLine> cluster) {
    int shortest = Integer.MAX_VALUE;
    for (TokenizedLine line : cluster) {
      shortest = Math.min(shortest, line.tokens.size());
    }
    TokenizedLine leader = cluster.get(0);
    int prefix = 0;
    while (prefix < shortest && isCommonLiteral(cluster, leader.literalAt(prefix), false, prefix)) {
      prefix++;
    }
    int suffix = 0;
    while (suffix < shortest - prefix && isCommonLiteral(cluster, leader.literalFromEnd(suffix), true, suffix)) {
      suffix++;
    }
    if (prefix == 0 && suffix == 0) {
      return null;
    }
    List<String> prefixParts = new ArrayList<String>();
    int anchorLength = 0;
    for (int i = 0; i < prefix; i++) {
      prefixParts.add(escape(leader.tokens.get(i)));
      anchorLength += leader.tokens.get(i).length();
    }
    List<String> suffixParts = new ArrayList<String>();
    for (int i = leader.tokens.size() - suffix; i < leader.tokens.size(); i++) {
      suffixParts.add(escape(leader.tokens.get(i)));
      anchorLength += leader.tokens.get(i).length();
    }
    StringBuilder regex = new StringBuilder(String.join(TOKEN_SEPARATOR_REGEX, prefixParts));
    if (prefix > 0 && suffix > 0) {
      regex.append(ANY_REGEX);
    }
    regex.append(String.join(TOKEN_SEPARATOR_REGEX, suffixParts));
    return new RegexDraft(regex.toString(), anchorLength);
  }

  private static boolean isCommonLiteral(List<TokenizedLine> cluster, String literal, boolean fromEnd, int index) {
    if (literal == null) {
      return false;
    }
    for (TokenizedLine line : cluster) {
      if (!literal.equals(fromEnd ? line.literalFromEnd(index) : line.literalAt(index))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Most frequent shingle of the cluster , used when the lines share neither start nor end.
   */
  private static RegexDraft shingleRegex(List<TokenizedLine> cluster) {
    Multiset<String> counts = HashMultiset.create();
    Map<String, TokenizedLine> owner = new LinkedHashMap<String, TokenizedLine>();
    for (TokenizedLine line : cluster) {
      for (String shingle : line.shingles) {
        counts.add(shingle);
        owner.putIfAbsent(shingle, line);
      }
    }
    String best = null;
    for (String shingle : owner.keySet()) {
      if (best == null || counts.count(shingle) > counts.count(best)) {
        best = shingle;
      }
    }
    List<String> parts = new ArrayList<String>();
    int anchorLength = 0;
    for (String token : WHITESPACE.split(best)) {
      TokenClass tokenClass = maskedClass(token);
      if (tokenClass == null) {
        parts.add(escape(token));
        anchorLength += token.length();
      } else {
        parts.add(wildcard(tokenClass));
      }
    }
    return new RegexDraft(String.join(TOKEN_SEPARATOR_REGEX, parts), anchorLength);
  }

  private Confidence confidence(int support, int anchorLength) {
    if (support >= highSupport && anchorLength >= highAnchorLength) {
      return Confidence.HIGH;
    }
    if (support >= mediumSupport) {
      return Confidence.MEDIUM;
    }
    return Confidence.LOW;
  }

  static LevelGuess guessLevel(String line) {
    String lowerCaseLine = line.toLowerCase(Locale.ROOT);
    for (Map.Entry<List<String>, LevelGuess> entry : LEVEL_GUESSES.entrySet()) {
      for (String keyword : entry.getKey()) {
        if (lowerCaseLine.contains(keyword)) {
          return entry.getValue();
        }
      }
    }
    return DEFAULT_LEVEL_GUESS;
  }

  /**
   * Catalog definition holding the HIGH and MEDIUM confidence candidates as error rules , to be
   * reviewed and merged into the catalog by a person.
   * @param version : version written into the definition
   * @return json text of the definition
   */
  public String exportAsRules(List<LearnedPatternCandidate> candidates, String version)
      throws JsonProcessingException {
    CatalogDefinition definition = new CatalogDefinition();
    definition.setVersion(version);
    for (LearnedPatternCandidate candidate : candidates) {
      if (candidate.getConfidence() == Confidence.HIGH || candidate.getConfidence() == Confidence.MEDIUM) {
        definition.getErrorRules().add(candidate.toRuleDefinition());
      }
    }
    logger.info(" Exporting " + definition.getErrorRules().size() + " of " + candidates.size()
        + " pattern candidates as rules ");
    return objectMapper.writeValueAsString(definition);
  }

  /**
   * @return true if the line looks like an error and is worth keeping for discovery
   */
  public static boolean isPotentialError(String line) {
    return containsErrorIndicator(line);
  }

  /**
   * @return potential error lines of a whole log , trimmed , in log order
   */
  public static List<String> extractPotentialErrors(String logContent) {
    List<String> lines = new ArrayList<String>();
    if (logContent == null) {
      return lines;
    }
    for (String line : logContent.split("\n")) {
      if (isPotentialError(line)) {
        lines.add(line.trim());
      }
    }
    return lines;
  }

  private static double jaccard(Set<String> first, Set<String> second) {
    int intersection = Sets.intersection(first, second).size();
    int union = first.size() + second.size() - intersection;
    return union == 0 ? 0.0 : (double) intersection / union;
  }

  private static String wildcard(TokenClass tokenClass) {
    switch (tokenClass) {
      case NUMBER:
        return NUMBER_REGEX;
      case HEX:
        return HEX_REGEX;
      default:
        return NON_SPACE_REGEX;
    }
  }

  /**
   * @return class of a variable token , null for a literal token
   */
  private static TokenClass maskClass(String token) {
    if (HEX.matcher(token).matches()) {
      return TokenClass.HEX;
    }
    if (NUMBER.matcher(token).matches()) {
      return TokenClass.NUMBER;
    }
    if (token.indexOf('/') >= 0 || token.indexOf('\\') >= 0) {
      return TokenClass.PATH;
    }
    if (IDENTIFIER.matcher(token).matches()) {
      return TokenClass.IDENTIFIER;
    }
    return null;
  }

  /**
   * @return class of a token masked as &lt;CLASS&gt; , null for a literal token
   */
  private static TokenClass maskedClass(String token) {
    for (TokenClass tokenClass : TokenClass.values()) {
      if (tokenClass != TokenClass.LITERAL && token.equals(mask(tokenClass))) {
        return tokenClass;
      }
    }
    return null;
  }

  private static String mask(TokenClass tokenClass) {
    return "<" + tokenClass + ">";
  }

  static String escape(String literal) {
    StringBuilder escaped = new StringBuilder(literal.length() + 8);
    for (char c : literal.toCharArray()) {
      if (REGEX_META_CHARACTERS.indexOf(c) >= 0) {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }

  private static final class TokenizedLine {
    private final String text;
    private final List<String> tokens;
    private final List<TokenClass> classes;
    private final Set<String> shingles;

    TokenizedLine(String text, int shingleSize) {
      this.text = text;
      this.tokens = ImmutableList.copyOf(WHITESPACE.split(text));
      List<TokenClass> tokenClasses = new ArrayList<TokenClass>();
      List<String> masked = new ArrayList<String>();
      for (String token : tokens) {
        TokenClass tokenClass = maskClass(token);
        tokenClasses.add(tokenClass == null ? TokenClass.LITERAL : tokenClass);
        masked.add(tokenClass == null ? token : mask(tokenClass));
      }
      this.classes = tokenClasses;
      this.shingles = new LinkedHashSet<String>();
      if (masked.size() <= shingleSize) {
        shingles.add(String.join(" ", masked));
      } else {
        for (int i = 0; i + shingleSize <= masked.size(); i++) {
          shingles.add(String.join(" ", masked.subList(i, i + shingleSize)));
        }
      }
    }

    String literalAt(int index) {
      return index >= 0 && index < tokens.size() && classes.get(index) == TokenClass.LITERAL ? tokens.get(index) : null;
    }

    String literalFromEnd(int index) {
      return literalAt(tokens.size() - 1 - index);
    }
  }

  private static final class RegexDraft {
    private final String regex;
    private final int anchorLength;

    RegexDraft(String regex, int anchorLength) {
      this.regex = regex;
      this.anchorLength = anchorLength;
    }
  }

  static final class LevelGuess {
    final int level;
    final String tag;

    LevelGuess(int level, String tag) {
      this.level = level;
      this.tag = tag;
    }
  }
}
