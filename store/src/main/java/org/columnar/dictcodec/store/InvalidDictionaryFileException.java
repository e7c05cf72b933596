/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.columnar.dictcodec.store;

import java.nio.file.Path;

/**
 * Thrown when a dictionary file or an encoded data file is malformed.
 */
public class InvalidDictionaryFileException extends RuntimeException {

  private final Path file;

  private final long lineNumber;

  /**
   * Constructs the exception.
   * @param file the malformed file.
   * @param lineNumber the 1-based number of the offending line.
   * @param message what is wrong with the line.
   */
  public InvalidDictionaryFileException(Path file, long lineNumber, String message) {
    this(file, lineNumber, message, null);
  }

  public InvalidDictionaryFileException(Path file, long lineNumber, String message, Throwable cause) {
    super(file + ":" + lineNumber + ": " + message, cause);
    this.file = file;
    this.lineNumber = lineNumber;
  }

  public Path getFile() {
    return file;
  }

  public long getLineNumber() {
    return lineNumber;
  }
}
