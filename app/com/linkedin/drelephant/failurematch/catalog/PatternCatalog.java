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

package com.linkedin.drelephant.failurematch.catalog;

import com.google.common.collect.ImmutableList;
import com.linkedin.drelephant.failurematch.Classifier;
import com.linkedin.drelephant.failurematch.Rule;
import java.util.List;
import org.apache.log4j.Logger;

import static com.linkedin.drelephant.failurematch.util.Constant.*;
import static com.linkedin.drelephant.failurematch.util.FailureMatchUtils.*;


/**
 * Ordered , immutable set of ignore , error and warning rules . The catalog is built once
 * and shared by reference , a changed catalog is a new instance (see {@link CatalogHolder}).
 *
 * Classification applies ignore rules first , first match wins . Otherwise every error rule
 * is tried and the highest level is kept , on a tie the rule which comes first in catalog
 * order wins . Warning rules are tried the same way only when warnings are treated as errors.
 */
public final class PatternCatalog implements Classifier {
  private static final Logger logger = Logger.getLogger(PatternCatalog.class);

  private final String version;
  private final ImmutableList<Rule> rules;
  private final ImmutableList<Rule> ignoreRules;
  private final ImmutableList<Rule> errorRules;
  private final ImmutableList<Rule> warningRules;

  public PatternCatalog(String version, List<? extends Rule> rules) {
    if (version == null || version.trim().isEmpty()) {
      throw new IllegalArgumentException("Pattern catalog needs a version");
    }
    this.version = version;
    this.rules = ImmutableList.copyOf(rules);
    ImmutableList.Builder<Rule> ignore = ImmutableList.builder();
    ImmutableList.Builder<Rule> error = ImmutableList.builder();
    ImmutableList.Builder<Rule> warning = ImmutableList.builder();
    for (Rule rule : this.rules) {
      switch (rule.getKind()) {
        case IGNORE:
          ignore.add(rule);
          break;
        case ERROR:
          error.add(rule);
          break;
        case WARNING:
          warning.add(rule);
          break;
        default:
          throw new IllegalArgumentException("Unknown rule kind " + rule.getKind());
      }
    }
    this.ignoreRules = ignore.build();
    this.errorRules = error.build();
    this.warningRules = warning.build();
    logger.info(" Pattern catalog " + version + " built with " + ignoreRules.size() + " ignore rules , "
        + errorRules.size() + " error rules and " + warningRules.size() + " warning rules ");
  }

  @Override
  public ClassificationOutcome classify(String line) {
    return classify(line, false);
  }

  @Override
  public ClassificationOutcome classify(String line, boolean warningsAsErrors) {
    if (line == null || line.trim().isEmpty()) {
      return ClassificationOutcome.none();
    }
    for (Rule rule : ignoreRules) {
      if (rule.matches(line)) {
        debugLog(" Line ignored by " + rule.getTag() + " : " + line);
        return ClassificationOutcome.ignored(rule.getTag());
      }
    }
    Rule best = bestMatch(errorRules, line, null);
    if (warningsAsErrors) {
      best = bestMatch(warningRules, line, best);
    }
    if (best == null) {
      return ClassificationOutcome.none();
    }
    return ClassificationOutcome.matched(best.getLevel(), best.getTag());
  }

  private static Rule bestMatch(List<Rule> candidates, String line, Rule bestSoFar) {
    Rule best = bestSoFar;
    for (Rule rule : candidates) {
      // a rule at the same level can not replace an earlier one
      if (best != null && rule.getLevel() <= best.getLevel()) {
        continue;
      }
      if (rule.matches(line)) {
        best = rule;
      }
    }
    return best;
  }

  /**
   * Promotion of reviewed rules produces a new catalog , this one is left untouched.
   * @param additionalRules : rules appended after the existing ones
   * @param newVersion : version of the new catalog
   * @return new catalog
   */
  public PatternCatalog withAdditionalRules(List<? extends Rule> additionalRules, String newVersion) {
    return new PatternCatalog(newVersion,
        ImmutableList.<Rule>builder().addAll(rules).addAll(additionalRules).build());
  }

  public String getVersion() {
    return version;
  }

  public List<Rule> getRules() {
    return rules;
  }

  public List<Rule> getIgnoreRules() {
    return ignoreRules;
  }

  public List<Rule> getErrorRules() {
    return errorRules;
  }

  public List<Rule> getWarningRules() {
    return warningRules;
  }

  public int size() {
    return rules.size();
  }

  @Override
  public String toString() {
    return "PatternCatalog{" + "version='" + version + '\'' + ", rules=" + rules.size() + '}';
  }
}
