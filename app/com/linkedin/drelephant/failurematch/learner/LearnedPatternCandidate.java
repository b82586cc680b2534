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

import com.google.common.collect.ImmutableList;
import com.linkedin.drelephant.failurematch.catalog.RuleDefinition;
import java.util.List;

import static com.linkedin.drelephant.failurematch.util.Constant.*;


/**
 * A proposed error rule found in lines no rule matched . It is advisory , a person has to review
 * it before it is promoted into the catalog.
 */
public final class LearnedPatternCandidate {
  private final String regexText;
  private final ImmutableList<String> sampleLines;
  private final Confidence confidence;
  private final int supportCount;
  private final int anchorLength;
  private final int suggestedLevel;
  private final String suggestedTag;

  public LearnedPatternCandidate(String regexText, List<String> sampleLines, Confidence confidence, int supportCount,
      int anchorLength, int suggestedLevel, String suggestedTag) {
    this.regexText = regexText;
    this.sampleLines = ImmutableList.copyOf(sampleLines);
    this.confidence = confidence;
    this.supportCount = supportCount;
    this.anchorLength = anchorLength;
    this.suggestedLevel = suggestedLevel;
    this.suggestedTag = suggestedTag;
  }

  public String getRegexText() {
    return regexText;
  }

  public List<String> getSampleLines() {
    return sampleLines;
  }

  public Confidence getConfidence() {
    return confidence;
  }

  /**
   * @return number of lines matched by the regex
   */
  public int getSupportCount() {
    return supportCount;
  }

  /**
   * @return number of literal characters in the regex
   */
  public int getAnchorLength() {
    return anchorLength;
  }

  public int getSuggestedLevel() {
    return suggestedLevel;
  }

  public String getSuggestedTag() {
    return suggestedTag;
  }

  /**
   * @return error rule definition which can be reviewed and added to a catalog definition
   */
  public RuleDefinition toRuleDefinition() {
    RuleDefinition definition = new RuleDefinition(regexText, suggestedLevel, suggestedTag, false);
    definition.setDescription("learned from " + supportCount + " lines , confidence " + confidence);
    return definition;
  }

  @Override
  public String toString() {
    return "LearnedPatternCandidate{" + "regexText='" + regexText + '\'' + ", confidence=" + confidence
        + ", supportCount=" + supportCount + ", anchorLength=" + anchorLength + ", suggestedLevel=" + suggestedLevel
        + ", suggestedTag='" + suggestedTag + '\'' + '}';
  }
}
