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
import com.google.common.collect.ImmutableList;
import com.linkedin.drelephant.failurematch.catalog.CatalogHolder;
import com.linkedin.drelephant.failurematch.catalog.ClassificationOutcome;
import com.linkedin.drelephant.failurematch.catalog.PatternCatalog;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.log4j.Logger;

import static com.linkedin.drelephant.failurematch.util.Constant.*;
import static com.linkedin.drelephant.failurematch.util.FailureMatchUtils.*;
import static com.linkedin.drelephant.failurematch.util.FailureMatchUtils.ConfigurationBuilder.*;


/**
 * Extracts the failure signature of a test log . The log is read once from start to end and
 * every line is classified by the current pattern catalog . The scan never stops at the first
 * error since a later line can carry a more severe one.
 */
public class SignatureExtractor {
  private static final Logger logger = Logger.getLogger(SignatureExtractor.class);

  private static final Pattern ACTION_LINE_PATTERN = Pattern.compile("^# action: gc\\(.*\\)::(\\w+)\\/(\\w+)\\.(\\S+)");
  private static final Pattern RUNNING_TOOL_PATTERN = Pattern.compile("dv: \\.\\.\\. running tool (\\S+)");
  private static final Pattern FAILED_TOOL_PATTERN = Pattern.compile("dv: tool (\\S+) failed!");
  private static final Pattern WARNINGS_AS_ERRORS_PATTERN =
      Pattern.compile("cc1plus: warnings being treated as errors");

  private final CatalogHolder catalogHolder;
  private final int historySize;
  private final int maxUnmatchedLines;
  private final int maxLineLength;

  /**
   * Limits are taken from the configuration built at the time of construction.
   */
  public SignatureExtractor(CatalogHolder catalogHolder) {
    this(catalogHolder, HISTORY_SIZE.getValue(), MAX_UNMATCHED_LINES.getValue(), MAX_LINE_LENGTH.getValue());
  }

  /**
   * @param historySize : lines kept before the failure line as its context
   * @param maxUnmatchedLines : unmatched error looking lines kept per scan
   * @param maxLineLength : lines are truncated to this many characters before classification
   */
  public SignatureExtractor(CatalogHolder catalogHolder, int historySize, int maxUnmatchedLines, int maxLineLength) {
    if (catalogHolder == null) {
      throw new IllegalArgumentException("Catalog holder is null");
    }
    if (historySize <= 0 || maxUnmatchedLines < 0 || maxLineLength <= 0) {
      throw new IllegalArgumentException(
          "Invalid extractor configuration historySize " + historySize + " , maxUnmatchedLines " + maxUnmatchedLines
              + " , maxLineLength " + maxLineLength);
    }
    this.catalogHolder = catalogHolder;
    this.historySize = historySize;
    this.maxUnmatchedLines = maxUnmatchedLines;
    this.maxLineLength = maxLineLength;
  }

  public AnalysisResult analyze(LogSource source) throws IOException {
    return analyze(source, ScanOptions.defaults());
  }

  /**
   * @param source : log to scan , can be null
   * @param options : scan budget and known metadata
   * @return FOUND with the most severe line , NOT_FOUND if no line matched an error rule or
   * INPUT_UNAVAILABLE if the log can not be opened
   * @throws IOException if reading the opened log fails
   * @throws IllegalArgumentException if the options are invalid
   */
  public AnalysisResult analyze(LogSource source, ScanOptions options) throws IOException {
    if (options == null) {
      options = ScanOptions.defaults();
    }
    options.validate();
    if (source == null || !source.isAvailable()) {
      String name = source == null ? "<none>" : source.getName();
      logger.warn(" Log " + name + " is not available , deriving keywords from test name " + options.getTest());
      return unavailable(options, "log " + name + " is not available");
    }
    InputStream in;
    try {
      in = source.open();
    } catch (IOException e) {
      logger.warn(" Unable to open log " + source.getName() + " , deriving keywords from test name ", e);
      return unavailable(options, "unable to open log " + source.getName() + " : " + e.getMessage());
    }

    long startTime = System.currentTimeMillis();
    ScanState state = new ScanState(catalogHolder.current(), options, historySize, maxUnmatchedLines, maxLineLength);
    logger.info(" Analyzing log " + source.getName() + " with catalog " + state.catalog.getVersion() + " " + options);
    try (OffsetLineReader reader = new OffsetLineReader(in, maxLineLength)) {
      if (options.getEndsOnlyBytes() > 0) {
        scanEnds(reader, source.length(), state);
      } else {
        scanAll(reader, state);
      }
    }
    AnalysisResult result = state.toResult();
    long endTime = System.currentTimeMillis();
    logger.info(" Analysis of " + source.getName() + " finished with " + result.getStatus() + " after "
        + state.linesScanned + " lines in " + (endTime - startTime) * 1.0 / (1000.0) + "s");
    return result;
  }

  private void scanAll(OffsetLineReader reader, ScanState state) throws IOException {
    int maxLines = state.options.getMaxLines();
    String line;
    while ((line = reader.readLine()) != null) {
      if (maxLines > 0 && state.linesScanned >= maxLines) {
        state.budgetExhausted = true;
        break;
      }
      state.process(line, reader.getLineNumber(), reader.getLineOffset());
    }
  }

  /**
   * Scans the first and the last endsOnly bytes . With a known length the middle of the log is
   * skipped , otherwise the tail is kept in a buffer bounded by endsOnly bytes.
   */
  private void scanEnds(OffsetLineReader reader, long length, ScanState state) throws IOException {
    long endsOnly = state.options.getEndsOnlyBytes();
    String line;
    if (length >= 0) {
      long tailStart = length - endsOnly;
      boolean headDone = false;
      while ((line = reader.readLine()) != null) {
        if (!headDone && reader.getLineOffset() >= endsOnly) {
          headDone = true;
          if (tailStart > reader.getPosition()) {
            // line is in the middle , continue from the first line starting in the tail
            reader.skipTo(tailStart - 1);
            reader.discardRestOfLine();
            state.budgetExhausted = true;
            debugLog(" Skipped to byte " + reader.getPosition() + " of " + length);
            continue;
          }
        }
        state.process(line, reader.getLineNumber(), reader.getLineOffset());
      }
      return;
    }

    Deque<BufferedLine> tail = new ArrayDeque<BufferedLine>();
    long tailBytes = 0;
    while ((line = reader.readLine()) != null) {
      if (reader.getLineOffset() < endsOnly) {
        state.process(line, reader.getLineNumber(), reader.getLineOffset());
        continue;
      }
      BufferedLine buffered = new BufferedLine(line, reader.getLineNumber(), reader.getLineOffset(),
          reader.getPosition() - reader.getLineOffset());
      tail.addLast(buffered);
      tailBytes += buffered.bytes;
      while (tailBytes > endsOnly && !tail.isEmpty()) {
        tailBytes -= tail.removeFirst().bytes;
        state.budgetExhausted = true;
      }
    }
    for (BufferedLine buffered : tail) {
      state.process(buffered.text, buffered.lineNumber, buffered.offset);
    }
  }

  private static AnalysisResult unavailable(ScanOptions options, String detail) {
    return AnalysisResult.unavailable(orUnknown(options.getSuite()), orUnknown(options.getTest()),
        KeywordExtractor.fromTestName(options.getTest()), detail);
  }

  private static String orUnknown(String value) {
    return value == null || value.isEmpty() ? UNKNOWN : value;
  }

  private static boolean isMissing(String value) {
    return value == null || value.isEmpty();
  }

  private static class BufferedLine {
    private final String text;
    private final long lineNumber;
    private final long offset;
    private final long bytes;

    BufferedLine(String text, long lineNumber, long offset, long bytes) {
      this.text = text;
      this.lineNumber = lineNumber;
      this.offset = offset;
      this.bytes = bytes;
    }
  }

  /**
   * State of one scan . Catalog is read once so that a catalog swapped in during the scan does
   * not affect it.
   */
  private static class ScanState {
    private final PatternCatalog catalog;
    private final ScanOptions options;
    private final EvictingQueue<String> history;
    private final Set<String> unmatchedLines = new LinkedHashSet<String>();
    private final int maxUnmatchedLines;
    private final int maxLineLength;
    private final boolean toolGiven;

    private String suite;
    private String test;
    private String currentTool;
    private boolean warningsAsErrors = false;
    private boolean budgetExhausted = false;
    private long linesScanned = 0;

    private int bestLevel = 0;
    private String bestText;
    private String bestTag;
    private String bestTool;
    private long bestLineNumber;
    private long bestOffset;
    private List<String> bestContext;

    ScanState(PatternCatalog catalog, ScanOptions options, int historySize, int maxUnmatchedLines,
        int maxLineLength) {
      this.catalog = catalog;
      this.options = options;
      this.history = EvictingQueue.create(historySize);
      this.maxUnmatchedLines = maxUnmatchedLines;
      this.maxLineLength = maxLineLength;
      this.suite = options.getSuite();
      this.test = options.getTest();
      this.currentTool = options.getTool();
      this.toolGiven = !isMissing(options.getTool());
    }

    void process(String rawLine, long lineNumber, long offset) {
      linesScanned++;
      String line = rawLine.length() > maxLineLength ? rawLine.substring(0, maxLineLength) : rawLine;
      if (line.trim().isEmpty()) {
        return;
      }
      try {
        ClassificationOutcome outcome = catalog.classify(line, warningsAsErrors);
        if (outcome.isIgnored()) {
          return;
        }
        if (isMissing(suite) || isMissing(test)) {
          Matcher action = ACTION_LINE_PATTERN.matcher(line);
          if (action.find()) {
            suite = action.group(1);
            test = action.group(2);
            if (!toolGiven) {
              currentTool = action.group(3);
            }
            debugLog(" Detected suite " + suite + " , test " + test + " from line " + lineNumber);
            return;
          }
        }
        String tool = toolName(line);
        if (tool != null) {
          currentTool = tool;
          return;
        }
        if (WARNINGS_AS_ERRORS_PATTERN.matcher(line).find()) {
          warningsAsErrors = true;
          debugLog(" Warnings are treated as errors from line " + lineNumber);
          return;
        }
        if (outcome.isMatched()) {
          // equal level keeps the earlier line
          if (outcome.getLevel() > bestLevel) {
            bestLevel = outcome.getLevel();
            bestText = line.trim();
            bestTag = outcome.getTag();
            bestTool = currentTool;
            bestLineNumber = lineNumber;
            bestOffset = offset;
            bestContext = ImmutableList.copyOf(history);
            debugLog(" New best error at line " + lineNumber + " level " + bestLevel + " : " + bestText);
          }
        } else if (unmatchedLines.size() < maxUnmatchedLines && containsErrorIndicator(line)) {
          unmatchedLines.add(line.trim());
        }
      } finally {
        history.add(line);
      }
    }

    private static String toolName(String line) {
      Matcher running = RUNNING_TOOL_PATTERN.matcher(line);
      if (running.find()) {
        return running.group(1);
      }
      Matcher failed = FAILED_TOOL_PATTERN.matcher(line);
      if (failed.find()) {
        return failed.group(1);
      }
      return null;
    }

    AnalysisResult toResult() {
      List<String> unmatched = new ArrayList<String>(unmatchedLines);
      if (bestText != null) {
        FailureSignature signature =
            new FailureSignature(orUnknown(suite), orUnknown(test), bestLineNumber, bestOffset, bestText, bestLevel,
                bestTag, bestTool, linesScanned, bestContext);
        List<String> keywords = KeywordExtractor.extractKeywords(bestText);
        if (keywords.isEmpty()) {
          keywords = KeywordExtractor.fromTestName(test);
        }
        return AnalysisResult.found(signature, currentTool, keywords, unmatched);
      }
      return AnalysisResult.notFound(orUnknown(suite), orUnknown(test), currentTool,
          KeywordExtractor.fromTestName(test), unmatched, linesScanned, notFoundDetail());
    }

    private String notFoundDetail() {
      if (budgetExhausted && options.getMaxLines() > 0) {
        return "did not find error in first " + options.getMaxLines() + " lines";
      }
      if (budgetExhausted && options.getEndsOnlyBytes() > 0) {
        return "did not find error in first/last " + options.getEndsOnlyBytes() + " bytes";
      }
      return "no error line found in " + linesScanned + " lines";
    }
  }
}
