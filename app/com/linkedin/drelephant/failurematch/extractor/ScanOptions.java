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

/**
 * Budget and known metadata of one log scan.
 * maxLines limits the number of lines scanned , endsOnlyBytes scans only that many bytes from the
 * start and from the end of the log . The two budgets can not be combined . 0 means not set.
 * suite , test and tool are detected from the log when they are not given.
 */
public class ScanOptions {
  private int maxLines;
  private long endsOnlyBytes;
  private String suite;
  private String test;
  private String tool;

  public static ScanOptions defaults() {
    return new ScanOptions();
  }

  public int getMaxLines() {
    return maxLines;
  }

  public ScanOptions setMaxLines(int maxLines) {
    this.maxLines = maxLines;
    return this;
  }

  public long getEndsOnlyBytes() {
    return endsOnlyBytes;
  }

  public ScanOptions setEndsOnlyBytes(long endsOnlyBytes) {
    this.endsOnlyBytes = endsOnlyBytes;
    return this;
  }

  public String getSuite() {
    return suite;
  }

  public ScanOptions setSuite(String suite) {
    this.suite = suite;
    return this;
  }

  public String getTest() {
    return test;
  }

  public ScanOptions setTest(String test) {
    this.test = test;
    return this;
  }

  public String getTool() {
    return tool;
  }

  public ScanOptions setTool(String tool) {
    this.tool = tool;
    return this;
  }

  /**
   * @throws IllegalArgumentException if a budget is negative or both budgets are set
   */
  public void validate() {
    if (maxLines < 0) {
      throw new IllegalArgumentException("maxLines must not be negative , found " + maxLines);
    }
    if (endsOnlyBytes < 0) {
      throw new IllegalArgumentException("endsOnlyBytes must not be negative , found " + endsOnlyBytes);
    }
    if (maxLines > 0 && endsOnlyBytes > 0) {
      throw new IllegalArgumentException(
          "maxLines and endsOnlyBytes are mutually exclusive , found " + maxLines + " and " + endsOnlyBytes);
    }
  }

  @Override
  public String toString() {
    return "ScanOptions{" + "maxLines=" + maxLines + ", endsOnlyBytes=" + endsOnlyBytes + ", suite='" + suite + '\''
        + ", test='" + test + '\'' + ", tool='" + tool + '\'' + '}';
  }
}
