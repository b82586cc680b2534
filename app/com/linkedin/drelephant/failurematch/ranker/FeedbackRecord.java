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

package com.linkedin.drelephant.failurematch.ranker;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.linkedin.drelephant.failurematch.similarity.CandidateIssue;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;


/**
 * Relevance label given by a user to an issue returned for a failure . Besides the keywords
 * and the issue id the record keeps the texts that were compared , so that the model can be
 * trained without going back to the issue store.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeedbackRecord {
  private List<String> signatureKeywords = new ArrayList<String>();
  private String issueId;
  private boolean relevant;
  // epoch millis
  private long timestamp;
  private String signatureText;
  private String testName;
  private String issueSummary;
  private String issueDescription;
  private String issueStatus;
  private List<String> issueLabels = new ArrayList<String>();

  /**
   * Added for serialize and deserialize into JSON
   */
  public FeedbackRecord() {
  }

  public FeedbackRecord(List<String> signatureKeywords, String issueId, boolean relevant, long timestamp) {
    this.signatureKeywords =
        signatureKeywords == null ? new ArrayList<String>() : new ArrayList<String>(signatureKeywords);
    this.issueId = issueId;
    this.relevant = relevant;
    this.timestamp = timestamp;
  }

  /**
   * @return the issue as it was when the label was given
   */
  @JsonIgnore
  public CandidateIssue toCandidateIssue() {
    CandidateIssue issue = new CandidateIssue(issueId, issueSummary, issueDescription, issueStatus);
    if (issueLabels != null) {
      issue.setLabels(new ArrayList<String>(issueLabels));
    }
    return issue;
  }

  /**
   * @return signature text , or the keywords when the text was not recorded
   */
  @JsonIgnore
  public String getSearchText() {
    if (signatureText != null && !signatureText.trim().isEmpty()) {
      return signatureText;
    }
    return signatureKeywords == null ? "" : String.join(" ", signatureKeywords);
  }
}
