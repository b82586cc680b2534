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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.log4j.Logger;


/**
 * Log stored on the local file system.
 */
public class FileLogSource implements LogSource {
  private static final Logger logger = Logger.getLogger(FileLogSource.class);
  private final Path path;

  public FileLogSource(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("Path of log is null");
    }
    this.path = path;
  }

  @Override
  public boolean isAvailable() {
    return Files.isRegularFile(path) && Files.isReadable(path);
  }

  @Override
  public InputStream open() throws IOException {
    return Files.newInputStream(path);
  }

  @Override
  public long length() {
    try {
      return Files.size(path);
    } catch (IOException e) {
      logger.warn(" Unable to get length of log " + path + " , reading it as a stream of unknown length ", e);
      return -1;
    }
  }

  @Override
  public String getName() {
    return path.toString();
  }

  public Path getPath() {
    return path;
  }
}
