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
import java.util.Objects;
import java.util.Optional;


/**
 * The most severe classified line of one log along with its location and the lines
 * which preceded it.
 */
public final class FailureSignature {
  private final String suite;
  private final String test;
  private final long lineNumber;
  private final long lineOffset;
  private final String matchedText;
  private final int errorLevel;
  private final String patternTag;
  private final String toolName;
  private final long linesScanned;
  private final ImmutableList<String> context;

  public FailureSignature(String suite, String test, long lineNumber, long lineOffset, String matchedText,
      int errorLevel, String patternTag, String toolName, long linesScanned, List<String> context) {
    this.suite = suite;
    this.test = test;
    this.lineNumber = lineNumber;
    this.lineOffset = lineOffset;
    this.matchedText = matchedText;
    this.errorLevel = errorLevel;
    this.patternTag = patternTag;
    this.toolName = toolName;
    this.linesScanned = linesScanned;
    this.context = context == null ? ImmutableList.<String>of() : ImmutableList.copyOf(context);
  }

  public String getSuite() {
    return suite;
  }

  public String getTest() {
    return test;
  }

  /**
   * @return 1 based number of the line among the lines read . Lines skipped in the middle of a
   * log scanned in ends only mode are not counted , use the offset to locate the line.
   */
  public long getLineNumber() {
    return lineNumber;
  }

  /**
   * @return byte offset of the first byte of the line
   */
  public long getLineOffset() {
    return lineOffset;
  }

  public String getMatchedText() {
    return matchedText;
  }

  public int getErrorLevel() {
    return errorLevel;
  }

  public String getPatternTag() {
    return patternTag;
  }

  /**
   * @return tool which was running when the line was logged
   */
  public Optional<String> getToolName() {
    return Optional.ofNullable(toolName);
  }

  public long getLinesScanned() {
    return linesScanned;
  }

  /**
   * @return lines logged just before the matched line , oldest first
   */
  public List<String> getContext() {
    return context;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    FailureSignature that = (FailureSignature) o;
    return lineNumber == that.lineNumber && lineOffset == that.lineOffset && errorLevel == that.errorLevel
        && linesScanned == that.linesScanned && Objects.equals(suite, that.suite) && Objects.equals(test, that.test)
        && Objects.equals(matchedText, that.matchedText) && Objects.equals(patternTag, that.patternTag)
        && Objects.equals(toolName, that.toolName) && context.equals(that.context);
  }

  @Override
  public int hashCode() {
    return Objects.hash(suite, test, lineNumber, lineOffset, matchedText, errorLevel, patternTag, toolName,
        linesScanned, context);
  }

  @Override
  public String toString() {
    return "FailureSignature{" + "suite='" + suite + '\'' + ", test='" + test + '\'' + ", lineNumber=" + lineNumber
        + ", lineOffset=" + lineOffset + ", matchedText='" + matchedText + '\'' + ", errorLevel=" + errorLevel
        + ", patternTag='" + patternTag + '\'' + ", toolName='" + toolName + '\'' + ", linesScanned=" + linesScanned
        + '}';
  }
}
