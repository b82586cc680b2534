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

import java.util.Arrays;
import java.util.Locale;


/**
 * Named weights used to combine the component scores . Every preset sums to 1 so that the
 * combined score stays in [0,1].
 */
public enum WeightPreset {
  DEFAULT(0.35, 0.30, 0.15, 0.20),
  KEYWORD_HEAVY(0.50, 0.30, 0.20, 0.0),
  SEMANTIC_HEAVY(0.25, 0.20, 0.10, 0.45),
  SUMMARY_HEAVY(0.25, 0.20, 0.40, 0.15);

  private final double jaccard;
  private final double cosine;
  private final double edit;
  private final double semantic;

  WeightPreset(double jaccard, double cosine, double edit, double semantic) {
    this.jaccard = jaccard;
    this.cosine = cosine;
    this.edit = edit;
    this.semantic = semantic;
  }

  public double getJaccard() {
    return jaccard;
  }

  public double getCosine() {
    return cosine;
  }

  public double getEdit() {
    return edit;
  }

  public double getSemantic() {
    return semantic;
  }

  public double combine(ComponentScores scores) {
    return jaccard * scores.getJaccard() + cosine * scores.getCosineTfidf() + edit * scores.getEditDistance()
        + semantic * scores.getSemantic();
  }

  /**
   * @param name : name of the preset , case insensitive
   * @throws IllegalArgumentException if there is no such preset
   */
  public static WeightPreset fromName(String name) {
    if (name != null) {
      for (WeightPreset preset : values()) {
        if (preset.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
          return preset;
        }
      }
    }
    throw new IllegalArgumentException(
        "Unknown weight preset " + name + " , expected one of " + Arrays.toString(values()));
  }
}
