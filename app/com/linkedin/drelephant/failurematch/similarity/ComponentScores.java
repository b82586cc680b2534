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

import java.util.Objects;


/**
 * The four similarity scores of a signature and an issue , each in [0,1].
 */
public final class ComponentScores {
  private final double jaccard;
  private final double cosineTfidf;
  private final double editDistance;
  private final double semantic;

  public ComponentScores(double jaccard, double cosineTfidf, double editDistance, double semantic) {
    this.jaccard = jaccard;
    this.cosineTfidf = cosineTfidf;
    this.editDistance = editDistance;
    this.semantic = semantic;
  }

  public double getJaccard() {
    return jaccard;
  }

  public double getCosineTfidf() {
    return cosineTfidf;
  }

  public double getEditDistance() {
    return editDistance;
  }

  public double getSemantic() {
    return semantic;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ComponentScores that = (ComponentScores) o;
    return Double.compare(that.jaccard, jaccard) == 0 && Double.compare(that.cosineTfidf, cosineTfidf) == 0
        && Double.compare(that.editDistance, editDistance) == 0 && Double.compare(that.semantic, semantic) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(jaccard, cosineTfidf, editDistance, semantic);
  }

  @Override
  public String toString() {
    return "ComponentScores{" + "jaccard=" + jaccard + ", cosineTfidf=" + cosineTfidf + ", editDistance="
        + editDistance + ", semantic=" + semantic + '}';
  }
}
