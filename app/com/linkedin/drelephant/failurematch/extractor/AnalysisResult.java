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

package com.linkedin.drelephant.failurematch.extractor;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

import static com.linkedin.drelephant.failurematch.util.Constant.*;


/**
 * Outcome of analyzing one log . A signature is present only when the status is FOUND.
 * Keywords are always present , for an unavailable log they are derived from the test name.
 */
public final class AnalysisResult {
  private final AnalysisStatus status;
  private final FailureSignature signature;
  private final String suite;
  private final String test;
  private final String toolName;
  private final ImmutableList<String> keywords;
  private final ImmutableList<String> unmatchedLines;
  private final long linesScanned;
  private final String detail;

  private AnalysisResult(AnalysisStatus status, FailureSignature signature, String suite, String test,
      String toolName, List<String> keywords, List<String> unmatchedLines, long linesScanned, String detail) {
    this.status = status;
    this.signature = signature;
    this.suite = suite;
    this.test = test;
    this.toolName = toolName;
    this.keywords = ImmutableList.copyOf(keywords);
    this.unmatchedLines = ImmutableList.copyOf(unmatchedLines);
    this.linesScanned = linesScanned;
    this.detail = detail;
  }

  public static AnalysisResult found(FailureSignature signature, String toolName, List<String> keywords,
      List<String> unmatchedLines) {
    if (signature == null) {
      throw new IllegalArgumentException("Found result needs a signature");
    }
    return new AnalysisResult(AnalysisStatus.FOUND, signature, signature.getSuite(), signature.getTest(), toolName,
        keywords, unmatchedLines, signature.getLinesScanned(), "error found at line " + signature.getLineNumber());
  }

  public static AnalysisResult notFound(String suite, String test, String toolName, List<String> keywords,
      List<String> unmatchedLines, long linesScanned, String detail) {
    return new AnalysisResult(AnalysisStatus.NOT_FOUND, null, suite, test, toolName, keywords, unmatchedLines,
        linesScanned, detail);
  }

  public static AnalysisResult unavailable(String suite, String test, List<String> keywords, String detail) {
    return new AnalysisResult(AnalysisStatus.INPUT_UNAVAILABLE, null, suite, test, null, keywords,
        ImmutableList.<String>of(), 0, detail);
  }

  public AnalysisStatus getStatus() {
    return status;
  }

  public boolean isFound() {
    return status == AnalysisStatus.FOUND;
  }

  public Optional<FailureSignature> getSignature() {
    return Optional.ofNullable(signature);
  }

  public String getSuite() {
    return suite;
  }

  public String getTest() {
    return test;
  }

  /**
   * @return last tool seen in the log , or the tool given in the scan options
   */
  public Optional<String> getToolName() {
    return Optional.ofNullable(toolName);
  }

  public List<String> getKeywords() {
    return keywords;
  }

  /**
   * @return lines which look like errors but matched no rule , input of pattern learning
   */
  public List<String> getUnmatchedLines() {
    return unmatchedLines;
  }

  public long getLinesScanned() {
    return linesScanned;
  }

  public String getDetail() {
    return detail;
  }

  /**
   * @return text used to search and score candidate issues
   */
  public String getSearchText() {
    if (signature != null) {
      return signature.getMatchedText();
    }
    return String.join(" ", keywords);
  }

  @Override
  public String toString() {
    return "AnalysisResult{" + "status=" + status + ", signature=" + signature + ", suite='" + suite + '\''
        + ", test='" + test + '\'' + ", toolName='" + toolName + '\'' + ", keywords=" + keywords
        + ", unmatchedLines=" + unmatchedLines.size() + ", linesScanned=" + linesScanned + ", detail='" + detail
        + '\'' + '}';
  }
}
