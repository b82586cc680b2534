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
import com.linkedin.drelephant.failurematch.extractor.AnalysisResult;
import com.linkedin.drelephant.failurematch.normalizer.TextNormalizer;
import com.linkedin.drelephant.failurematch.normalizer.TokenSet;
import java.util.List;


/**
 * What is compared with the candidate issues : raw text of the failure , its keywords and its
 * normalized tokens.
 */
public final class SignatureQuery {
  private final String text;
  private final ImmutableList<String> keywords;
  private final TokenSet tokens;

  public SignatureQuery(String text, List<String> keywords, TokenSet tokens) {
    this.text = text == null ? "" : text;
    this.keywords = keywords == null ? ImmutableList.<String>of() : ImmutableList.copyOf(keywords);
    this.tokens = tokens == null ? TokenSet.empty() : tokens;
  }

  /**
   * Query of an analyzed log . Without a signature the keywords stand in for the text.
   */
  public static SignatureQuery of(AnalysisResult result, TextNormalizer normalizer) {
    String text = result.getSearchText();
    return new SignatureQuery(text, result.getKeywords(), normalizer.normalize(text));
  }

  public static SignatureQuery of(String text, TextNormalizer normalizer) {
    return new SignatureQuery(text, ImmutableList.<String>of(), normalizer.normalize(text));
  }

  public String getText() {
    return text;
  }

  public List<String> getKeywords() {
    return keywords;
  }

  public TokenSet getTokens() {
    return tokens;
  }

  @Override
  public String toString() {
    return "SignatureQuery{" + "text='" + text + '\'' + ", tokens=" + tokens + '}';
  }
}
