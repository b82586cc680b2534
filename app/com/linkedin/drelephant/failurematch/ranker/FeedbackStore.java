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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;


/**
 * Local store of feedback records , one JSON document per line . Lines which can not be read
 * back are skipped with a warning , they do not make the whole store unusable.
 */
public class FeedbackStore {
  private static final Logger logger = Logger.getLogger(FeedbackStore.class);
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final File file;

  public FeedbackStore(File file) {
    if (file == null) {
      throw new IllegalArgumentException("Feedback store file is null");
    }
    this.file = file;
  }

  public synchronized void append(FeedbackRecord record) throws IOException {
    String line = objectMapper.writeValueAsString(record) + System.lineSeparator();
    FileUtils.writeStringToFile(file, line, StandardCharsets.UTF_8, true);
  }

  /**
   * @return every readable record in the order it was appended , empty if the file does not exist
   */
  public synchronized List<FeedbackRecord> loadAll() throws IOException {
    List<FeedbackRecord> records = new ArrayList<FeedbackRecord>();
    if (!file.exists()) {
      return records;
    }
    int lineNumber = 0;
    for (String line : FileUtils.readLines(file, StandardCharsets.UTF_8)) {
      lineNumber++;
      if (line.trim().isEmpty()) {
        continue;
      }
      try {
        records.add(objectMapper.readValue(line, FeedbackRecord.class));
      } catch (JsonProcessingException e) {
        logger.warn(" Skipping unreadable feedback record at line " + lineNumber + " of " + file + " : "
            + e.getOriginalMessage());
      }
    }
    return records;
  }

  public File getFile() {
    return file;
  }
}
