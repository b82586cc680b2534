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

import com.google.common.collect.EvictingQueue;
import com.linkedin.drelephant.failurematch.catalog.CatalogHolder;
import com.linkedin.drelephant.failurematch.catalog.ClassificationOutcome;
import com.linkedin.drelephant.failurematch.catalog.PatternCatalog;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import static com.linkedin.drelephant.failurematch.util.FailureMatchUtils.ConfigurationBuilder.*;


/**
 * Helpers used while a failure is investigated by a person , for e.g to list every error of a
 * log or to show the lines around the failure line.
 */
public class LogInspector {
  private static final Logger logger = Logger.getLogger(LogInspector.class);
  private static final Pattern WARNINGS_AS_ERRORS_PATTERN =
      Pattern.compile("cc1plus: warnings being treated as errors");

  public static final int DEFAULT_MAX_ERRORS = 10;
  public static final int DEFAULT_TAIL_LINES = 100;
  public static final int DEFAULT_CONTEXT_LINES = 5;
  public static final int QUICK_CHECK_LINES = 1000;

  private final CatalogHolder catalogHolder;
  private final int maxLineLength;

  public LogInspector(CatalogHolder catalogHolder) {
    this(catalogHolder, MAX_LINE_LENGTH.getValue());
  }

  /**
   * @param maxLineLength : lines are truncated to this many characters before classification
   */
  public LogInspector(CatalogHolder catalogHolder, int maxLineLength) {
    if (catalogHolder == null) {
      throw new IllegalArgumentException("Catalog holder is null");
    }
    if (maxLineLength <= 0) {
      throw new IllegalArgumentException("Invalid inspector configuration maxLineLength " + maxLineLength);
    }
    this.catalogHolder = catalogHolder;
    this.maxLineLength = maxLineLength;
  }

  /**
   * Every classified error line of the log in log order , not only the most severe one.
   * @return at most maxErrors lines , empty if the log is not available
   */
  public List<ErrorLine> extractAllErrors(LogSource source, int maxErrors) throws IOException {
    List<ErrorLine> errors = new ArrayList<ErrorLine>();
    if (maxErrors <= 0) {
      return errors;
    }
    InputStream in = open(source);
    if (in == null) {
      return errors;
    }
    PatternCatalog catalog = catalogHolder.current();
    boolean warningsAsErrors = false;
    try (OffsetLineReader reader = new OffsetLineReader(in, maxLineLength)) {
      String rawLine;
      while ((rawLine = reader.readLine()) != null) {
        String line = truncate(rawLine);
        ClassificationOutcome outcome = catalog.classify(line, warningsAsErrors);
        if (outcome.isIgnored()) {
          continue;
        }
        if (WARNINGS_AS_ERRORS_PATTERN.matcher(line).find()) {
          warningsAsErrors = true;
          continue;
        }
        if (outcome.isMatched()) {
          errors.add(new ErrorLine(line.trim(), reader.getLineNumber(), outcome.getLevel(), outcome.getTag()));
          if (errors.size() >= maxErrors) {
            break;
          }
        }
      }
    }
    return errors;
  }

  /**
   * @return last numLines lines joined by new lines , empty if the log is not available
   */
  public Optional<String> tail(LogSource source, int numLines) throws IOException {
    InputStream in = open(source);
    if (in == null) {
      return Optional.empty();
    }
    EvictingQueue<String> lines = EvictingQueue.create(Math.max(numLines, 1));
    try (OffsetLineReader reader = new OffsetLineReader(in, maxLineLength)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lines.add(line);
      }
    }
    if (numLines <= 0) {
      return Optional.of("");
    }
    return Optional.of(String.join("\n", lines));
  }

  /**
   * Lines around a line of the log . The given line is marked with >>> and every line is
   * prefixed by its number.
   * @param lineNumber : 1 based number of the line
   * @param contextLines : lines shown before and after
   */
  public Optional<String> errorContext(LogSource source, long lineNumber, int contextLines) throws IOException {
    InputStream in = open(source);
    if (in == null) {
      return Optional.empty();
    }
    long first = Math.max(1, lineNumber - contextLines);
    long last = lineNumber + contextLines;
    List<String> context = new ArrayList<String>();
    try (OffsetLineReader reader = new OffsetLineReader(in, maxLineLength)) {
      String line;
      while ((line = reader.readLine()) != null && reader.getLineNumber() <= last) {
        long current = reader.getLineNumber();
        if (current < first) {
          continue;
        }
        String marker = current == lineNumber ? ">>> " : "    ";
        context.add(marker + String.format("%5d: ", current) + StringUtils.stripEnd(line, null));
      }
    }
    return Optional.of(String.join("\n", context));
  }

  /**
   * @return true if one of the first lines of the log matches an error rule
   */
  public boolean quickErrorCheck(LogSource source) throws IOException {
    InputStream in = open(source);
    if (in == null) {
      return false;
    }
    PatternCatalog catalog = catalogHolder.current();
    try (OffsetLineReader reader = new OffsetLineReader(in, maxLineLength)) {
      String line;
      while ((line = reader.readLine()) != null && reader.getLineNumber() <= QUICK_CHECK_LINES) {
        if (catalog.classify(truncate(line)).isMatched()) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * @return opened log , null if the log is missing or can not be opened
   */
  private static InputStream open(LogSource source) {
    if (source == null || !source.isAvailable()) {
      logger.warn(" Log " + (source == null ? "<none>" : source.getName()) + " is not available for inspection ");
      return null;
    }
    try {
      return source.open();
    } catch (IOException e) {
      logger.warn(" Unable to open log " + source.getName() + " for inspection ", e);
      return null;
    }
  }

  private String truncate(String line) {
    return line.length() > maxLineLength ? line.substring(0, maxLineLength) : line;
  }

  /**
   * One classified error line.
   */
  public static final class ErrorLine {
    private final String text;
    private final long lineNumber;
    private final int level;
    private final String tag;

    public ErrorLine(String text, long lineNumber, int level, String tag) {
      this.text = text;
      this.lineNumber = lineNumber;
      this.level = level;
      this.tag = tag;
    }

    public String getText() {
      return text;
    }

    public long getLineNumber() {
      return lineNumber;
    }

    public int getLevel() {
      return level;
    }

    public String getTag() {
      return tag;
    }

    @Override
    public String toString() {
      return "ErrorLine{" + "text='" + text + '\'' + ", lineNumber=" + lineNumber + ", level=" + level + ", tag='"
          + tag + '\'' + '}';
    }
  }
}
