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

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;


/**
 * Reads lines from a byte stream and keeps track of the byte offset at which every line
 * starts . Lines end with \n , a trailing \r is dropped . Bytes of a line beyond the
 * configured maximum are consumed but not kept.
 */
class OffsetLineReader implements Closeable {
  private static final int NEW_LINE = '\n';
  private static final int CARRIAGE_RETURN = '\r';

  private final InputStream in;
  private final int maxLineBytes;
  private byte[] lineBuffer = new byte[256];
  private int lineLength;
  private long position;
  private long lineOffset;
  private long lineNumber;

  OffsetLineReader(InputStream in, int maxLineChars) {
    this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
    // utf-8 needs at most 4 bytes per char
    this.maxLineBytes = maxLineChars * 4;
  }

  /**
   * @return next line without terminator , null at end of stream
   */
  String readLine() throws IOException {
    int b = in.read();
    if (b == -1) {
      return null;
    }
    lineOffset = position;
    lineLength = 0;
    while (b != -1) {
      position++;
      if (b == NEW_LINE) {
        break;
      }
      if (lineLength < maxLineBytes) {
        append((byte) b);
      }
      b = in.read();
    }
    lineNumber++;
    int length = lineLength;
    if (length > 0 && lineBuffer[length - 1] == CARRIAGE_RETURN) {
      length--;
    }
    return new String(lineBuffer, 0, length, StandardCharsets.UTF_8);
  }

  /**
   * Moves forward to the given byte offset , nothing happens if it is already passed.
   */
  void skipTo(long target) throws IOException {
    while (position < target) {
      long skipped = in.skip(target - position);
      if (skipped <= 0) {
        if (in.read() == -1) {
          return;
        }
        skipped = 1;
      }
      position += skipped;
    }
  }

  /**
   * Consumes the rest of the current line including its terminator.
   */
  void discardRestOfLine() throws IOException {
    int b;
    while ((b = in.read()) != -1) {
      position++;
      if (b == NEW_LINE) {
        break;
      }
    }
  }

  private void append(byte b) {
    if (lineLength == lineBuffer.length) {
      lineBuffer = Arrays.copyOf(lineBuffer, lineBuffer.length * 2);
    }
    lineBuffer[lineLength++] = b;
  }

  /**
   * @return byte offset at which the last returned line starts
   */
  long getLineOffset() {
    return lineOffset;
  }

  /**
   * @return number of lines read so far , skipped bytes are not counted as lines
   */
  long getLineNumber() {
    return lineNumber;
  }

  long getPosition() {
    return position;
  }

  @Override
  public void close() throws IOException {
    in.close();
  }
}
