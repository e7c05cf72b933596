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

package org.columnar.dictcodec.algorithm.dictionary;

import java.util.concurrent.ExecutionException;

/**
 * Thrown when a partition task of a dictionary build or an encoding fails.
 *
 * <p>The cause is the failure of the first failed partition, in partition order. Failures of other
 * partitions are attached as suppressed exceptions. No partial result is produced.
 */
public class DictionaryBuildException extends RuntimeException {

  public DictionaryBuildException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Creates an exception from the aggregated failure of a parallel execution.
   * @param message the detail message.
   * @param failure the aggregated failure.
   * @return the exception to throw.
   */
  static DictionaryBuildException of(String message, ExecutionException failure) {
    DictionaryBuildException exception = new DictionaryBuildException(message, failure.getCause());
    for (Throwable suppressed : failure.getSuppressed()) {
      exception.addSuppressed(suppressed);
    }
    return exception;
  }
}
