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

import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import com.google.common.collect.Sets;
import java.util.Set;


/**
 * Normalized terms of a text . Base terms are the stems and technical tokens found in the text
 * with their frequency , expansion terms are synonyms of base terms which are not base terms
 * themselves . Order of terms is not relevant.
 */
public final class TokenSet {
  private static final TokenSet EMPTY =
      new TokenSet(ImmutableMultiset.<String>of(), ImmutableSet.<String>of(), ImmutableSet.<String>of());

  private final ImmutableMultiset<String> baseTerms;
  private final ImmutableSet<String> technicalTerms;
  private final ImmutableSet<String> expansionTerms;
  private final ImmutableSet<String> terms;

  TokenSet(Multiset<String> baseTerms, Set<String> technicalTerms, Set<String> expansionTerms) {
    this.baseTerms = ImmutableMultiset.copyOf(baseTerms);
    this.technicalTerms = ImmutableSet.copyOf(technicalTerms);
    this.expansionTerms = ImmutableSet.copyOf(Sets.difference(expansionTerms, this.baseTerms.elementSet()));
    this.terms = ImmutableSet.<String>builder().addAll(this.baseTerms.elementSet()).addAll(this.expansionTerms).build();
  }

  public static TokenSet empty() {
    return EMPTY;
  }

  /**
   * @return stems and technical tokens with the number of times they occur
   */
  public ImmutableMultiset<String> getBaseTerms() {
    return baseTerms;
  }

  public ImmutableSet<String> getBaseTermSet() {
    return baseTerms.elementSet();
  }

  /**
   * @return hex literals , function calls and acronyms , kept verbatim in lower case
   */
  public ImmutableSet<String> getTechnicalTerms() {
    return technicalTerms;
  }

  public ImmutableSet<String> getExpansionTerms() {
    return expansionTerms;
  }

  /**
   * @return base and expansion terms
   */
  public ImmutableSet<String> terms() {
    return terms;
  }

  public boolean isEmpty() {
    return terms.isEmpty();
  }

  public int size() {
    return terms.size();
  }

  /**
   * @return base terms separated by a space
   */
  public String toText() {
    return String.join(" ", baseTerms.elementSet());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return terms.equals(((TokenSet) o).terms);
  }

  @Override
  public int hashCode() {
    return terms.hashCode();
  }

  @Override
  public String toString() {
    return "TokenSet{" + "base=" + baseTerms.elementSet() + ", technical=" + technicalTerms + ", expansion="
        + expansionTerms + '}';
  }
}
