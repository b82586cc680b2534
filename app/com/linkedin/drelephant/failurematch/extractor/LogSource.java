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


/**
 * A log which can be read as a byte stream . Fetching the log (HDFS , http , local disk) is
 * the concern of the implementation , the extractor only reads it once from start to end.
 */
public interface LogSource {

  /**
   * @return false if the log is known to be missing or unreadable
   */
  boolean isAvailable();

  /**
   * Opens a new stream positioned at the start of the log . Caller closes the stream.
   */
  InputStream open() throws IOException;

  /**
   * @return length of the log in bytes , -1 if unknown
   */
  long length();

  /**
   * @return name used in logs and results
   */
  String getName();
}
