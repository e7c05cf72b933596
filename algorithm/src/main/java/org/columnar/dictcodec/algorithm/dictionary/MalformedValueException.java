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

/**
 * Thrown when a value of a column is not well-formed UTF-8, so it cannot be added to a dictionary.
 */
public class MalformedValueException extends IllegalArgumentException {

  private final int rowIndex;

  /**
   * Constructs the exception.
   * @param rowIndex the row holding the value.
   */
  public MalformedValueException(int rowIndex) {
    super("The value at row " + rowIndex + " is not well-formed UTF-8");
    this.rowIndex = rowIndex;
  }

  public int getRowIndex() {
    return rowIndex;
  }
}
