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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.Data;


/**
 * Historical issue supplied by the issue store . It is read only input of the scorer.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CandidateIssue {
  private static final Set<String> RESOLVED_STATUSES = ImmutableSet.of("resolved", "closed");
  private static final Set<String> FIXED_RESOLUTIONS = ImmutableSet.of("fixed", "done", "resolved");

  private String id;
  private String summary;
  private String description;
  private List<String> comments = new ArrayList<String>();
  private String status;
  private List<String> labels = new ArrayList<String>();
  private String resolution;
  // epoch millis , null if unknown
  private Long updatedAt;

  /**
   * Added for serialize and deserialize into JSON
   */
  public CandidateIssue() {
  }

  public CandidateIssue(String id, String summary) {
    this.id = id;
    this.summary = summary;
  }

  public CandidateIssue(String id, String summary, String description, String status) {
    this.id = id;
    this.summary = summary;
    this.description = description;
    this.status = status;
  }

  /**
   * @return true if the status is resolved or closed
   */
  @JsonIgnore
  public boolean isResolved() {
    return status != null && RESOLVED_STATUSES.contains(status.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * @return true if the resolution says the issue was fixed
   */
  @JsonIgnore
  public boolean isFixed() {
    return resolution != null && FIXED_RESOLUTIONS.contains(resolution.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * @return false if the issue has no id or no text to compare with
   */
  @JsonIgnore
  public boolean isWellFormed() {
    return !isBlank(id) && !(isBlank(summary) && isBlank(description));
  }

  private static boolean isBlank(String value) {
    return value == null || value.trim().isEmpty();
  }
}
