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

package com.linkedin.drelephant.failurematch.normalizer;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.log4j.Logger;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.StopFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.analysis.en.PorterStemFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import static com.linkedin.drelephant.failurematch.util.FailureMatchUtils.*;


/**
 * Turns free text (log lines , issue summaries , comments) into a {@link TokenSet}.
 * Words are lower cased , stop words are removed and the rest is Porter stemmed . Hex literals ,
 * function calls and acronyms are kept verbatim . Every term is expanded with its domain synonyms.
 *
 * If the stemming analyzer can not be used the normalizer falls back to a plain lower case
 * tokenization , normalization itself never fails for a non null text.
 */
public class TextNormalizer {
  private static final Logger logger = Logger.getLogger(TextNormalizer.class);
  private static final String FIELD_NAME = "text";
  private static final int MAX_STEM_ROUNDS = 5;

  private static final Pattern HEX_LITERAL = Pattern.compile("\\b0x[0-9a-fA-F]+\\b");
  private static final Pattern FUNCTION_CALL = Pattern.compile("\\b[A-Za-z_][A-Za-z0-9_]*\\(\\)");
  private static final Pattern ACRONYM = Pattern.compile("\\b[A-Z]{2,}\\b");
  private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9\\s_]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final Set<String> FALLBACK_STOP_WORDS =
      ImmutableSet.of("the", "is", "at", "which", "on", "a", "an", "and", "or", "but", "in", "with", "to", "for",
          "of", "as", "by", "from", "this", "that", "these", "those", "be", "was", "were", "been");

  /**
   * Groups of domain terms which are treated as synonyms . Groups sharing a term are merged.
   */
  static final Map<String, List<String>> TECH_SYNONYMS = ImmutableMap.<String, List<String>>builder()
      .put("memory", ImmutableList.of("mem", "ram", "heap", "allocation", "malloc", "alloc"))
      .put("crash", ImmutableList.of("segfault", "sigsegv", "sigabrt", "abort", "coredump", "panic", "fault"))
      .put("timeout", ImmutableList.of("hang", "freeze", "stuck", "deadlock", "unresponsive", "blocked"))
      .put("null", ImmutableList.of("nullptr", "nil", "none", "undefined", "invalid"))
      .put("gpu", ImmutableList.of("graphics", "render", "display", "cuda", "opencl", "vulkan"))
      .put("fail", ImmutableList.of("failure", "failed", "failing", "error", "unsuccessful"))
      .put("network", ImmutableList.of("socket", "connection", "tcp", "udp", "http", "https"))
      .put("io", ImmutableList.of("read", "write", "file", "disk", "storage"))
      .put("assert", ImmutableList.of("assertion", "invariant", "precondition", "postcondition"))
      .put("driver", ImmutableList.of("kernel", "module", "firmware"))
      .build();

  private final Analyzer analyzer;
  private final Map<String, Set<String>> synonymClasses;

  public TextNormalizer() {
    this(createAnalyzer());
  }

  /**
   * @param analyzer : stemming analyzer , null to use the fallback tokenization
   */
  @VisibleForTesting
  TextNormalizer(Analyzer analyzer) {
    this.analyzer = analyzer;
    if (analyzer == null) {
      logger.warn(" Stemming analyzer not available , text normalization falls back to lower case tokens ");
    }
    this.synonymClasses = buildSynonymClasses();
  }

  private static Analyzer createAnalyzer() {
    try {
      return new StemmingAnalyzer();
    } catch (LinkageError e) {
      logger.error(" Unable to create stemming analyzer ", e);
      return null;
    }
  }

  public boolean isStemmingAvailable() {
    return analyzer != null;
  }

  /**
   * @param text : raw text , null is treated as empty
   * @return normalized terms of the text
   */
  public TokenSet normalize(String text) {
    if (text == null || text.trim().isEmpty()) {
      return TokenSet.empty();
    }
    Set<String> technical = technicalTokens(text);
    Multiset<String> base = HashMultiset.create();
    for (String token : tokenize(text)) {
      base.add(token);
    }
    for (String token : technical) {
      base.add(token);
    }
    return new TokenSet(base, technical, expand(base.elementSet()));
  }

  /**
   * Normalizes already normalized terms again . Stems are stemmed to a fixed point and technical
   * tokens are kept as they are , so the result equals the input.
   */
  public TokenSet normalize(TokenSet tokens) {
    if (tokens == null || tokens.isEmpty()) {
      return TokenSet.empty();
    }
    Multiset<String> base = HashMultiset.create();
    for (Multiset.Entry<String> entry : tokens.getBaseTerms().entrySet()) {
      String term = entry.getElement();
      if (tokens.getTechnicalTerms().contains(term)) {
        base.add(term, entry.getCount());
        continue;
      }
      for (String token : tokenize(term)) {
        base.add(token, entry.getCount());
      }
    }
    return new TokenSet(base, tokens.getTechnicalTerms(), expand(base.elementSet()));
  }

  /**
   * @return normalized synonyms of a normalized term , empty if it has none
   */
  public Set<String> synonymsOf(String normalizedTerm) {
    Set<String> synonyms = synonymClasses.get(normalizedTerm);
    return synonyms == null ? Collections.<String>emptySet() : synonyms;
  }

  private Set<String> expand(Set<String> baseTerms) {
    Set<String> expansion = new LinkedHashSet<String>();
    for (String term : baseTerms) {
      expansion.addAll(synonymsOf(term));
    }
    expansion.removeAll(baseTerms);
    return expansion;
  }

  private List<String> tokenize(String text) {
    if (analyzer != null) {
      try {
        List<String> tokens = new ArrayList<String>();
        for (String token : analyze(text)) {
          String stem = stemToFixedPoint(token);
          if (stem != null) {
            tokens.add(stem);
          }
        }
        return tokens;
      } catch (IOException | RuntimeException e) {
        logger.warn(" Stemming failed , using fallback tokenization for text of length " + text.length(), e);
      }
    }
    return fallbackTokenize(text);
  }

  /**
   * Porter stemming is not idempotent for every word , the stem is stemmed again till it does
   * not change.
   * @return stem , or null if the stem is a stop word or too short
   */
  private String stemToFixedPoint(String token) throws IOException {
    String current = token;
    for (int round = 0; round < MAX_STEM_ROUNDS; round++) {
      List<String> next = analyze(current);
      if (next.size() != 1) {
        // stemmed into a stop word or split
        return next.isEmpty() ? null : current;
      }
      if (next.get(0).equals(current)) {
        break;
      }
      current = next.get(0);
    }
    if (current.length() < 2 || EnglishAnalyzer.ENGLISH_STOP_WORDS_SET.contains(current)) {
      return null;
    }
    return current;
  }

  private List<String> analyze(String text) throws IOException {
    List<String> tokens = new ArrayList<String>();
    try (TokenStream stream = analyzer.tokenStream(FIELD_NAME, text)) {
      CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
      stream.reset();
      while (stream.incrementToken()) {
        tokens.add(term.toString());
      }
      stream.end();
    }
    return tokens;
  }

  private static List<String> fallbackTokenize(String text) {
    List<String> tokens = new ArrayList<String>();
    String cleaned = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
    for (String word : WHITESPACE.split(cleaned.trim())) {
      if (word.length() >= 3 && !FALLBACK_STOP_WORDS.contains(word)) {
        tokens.add(word);
      }
    }
    return tokens;
  }

  private static Set<String> technicalTokens(String text) {
    Set<String> tokens = new LinkedHashSet<String>();
    for (Pattern pattern : ImmutableList.of(HEX_LITERAL, FUNCTION_CALL, ACRONYM)) {
      Matcher matcher = pattern.matcher(text);
      while (matcher.find()) {
        tokens.add(matcher.group().toLowerCase(Locale.ROOT));
      }
    }
    return tokens;
  }

  /**
   * Normalizes every synonym with the same pipeline as the text and merges groups which end up
   * sharing a term , so that the synonym relation is closed.
   */
  private Map<String, Set<String>> buildSynonymClasses() {
    Map<String, String> parent = new HashMap<String, String>();
    for (Map.Entry<String, List<String>> group : TECH_SYNONYMS.entrySet()) {
      List<String> members = new ArrayList<String>();
      members.addAll(tokenize(group.getKey()));
      for (String synonym : group.getValue()) {
        members.addAll(tokenize(synonym));
      }
      for (String member : members) {
        parent.putIfAbsent(member, member);
        union(parent, members.get(0), member);
      }
    }
    Map<String, Set<String>> classes = new HashMap<String, Set<String>>();
    for (String term : parent.keySet()) {
      classes.computeIfAbsent(find(parent, term), root -> new LinkedHashSet<String>()).add(term);
    }
    Map<String, Set<String>> synonyms = new HashMap<String, Set<String>>();
    for (Set<String> equivalent : classes.values()) {
      for (String term : equivalent) {
        Set<String> others = new LinkedHashSet<String>(equivalent);
        others.remove(term);
        synonyms.put(term, ImmutableSet.copyOf(others));
      }
    }
    debugLog(" Built " + classes.size() + " synonym classes from " + TECH_SYNONYMS.size() + " groups ");
    return ImmutableMap.copyOf(synonyms);
  }

  private static String find(Map<String, String> parent, String term) {
    String root = term;
    while (!parent.get(root).equals(root)) {
      root = parent.get(root);
    }
    return root;
  }

  private static void union(Map<String, String> parent, String first, String second) {
    String firstRoot = find(parent, first);
    String secondRoot = find(parent, second);
    if (!firstRoot.equals(secondRoot)) {
      parent.put(secondRoot, firstRoot);
    }
  }

  /**
   * Standard tokenizer , lower case , english stop words and porter stemming.
   */
  static final class StemmingAnalyzer extends Analyzer {
    @Override
    protected TokenStreamComponents createComponents(String fieldName) {
      StandardTokenizer source = new StandardTokenizer();
      TokenStream result = new LowerCaseFilter(source);
      result = new StopFilter(result, EnglishAnalyzer.ENGLISH_STOP_WORDS_SET);
      result = new PorterStemFilter(result);
      return new TokenStreamComponents(source, result);
    }
  }
}
