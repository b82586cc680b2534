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

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;


/**
 * Log content which is already in memory , for e.g fetched by a remote log client.
 */
public class StringLogSource implements LogSource {
  private final String name;
  private final byte[] content;

  public StringLogSource(String name, String content) {
    this.name = name;
    this.content = content == null ? new byte[0] : content.getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public boolean isAvailable() {
    return true;
  }

  @Override
  public InputStream open() {
    return new ByteArrayInputStream(content);
  }

  @Override
  public long length() {
    return content.length;
  }

  @Override
  public String getName() {
    return name;
  }
}
