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
 * Thrown when a value being encoded has no entry in the dictionary. This happens only when a
 * dictionary is applied to a column other than the one it was built from.
 */
public class DictionaryMismatchException extends IllegalArgumentException {

  private final int rowIndex;

  /**
   * Constructs the exception.
   * @param rowIndex the row holding the value.
   * @param value the value, or null for a null slot.
   */
  public DictionaryMismatchException(int rowIndex, String value) {
    super(value == null
        ? "Null value at row " + rowIndex + " cannot be dictionary encoded"
        : "The value '" + value + "' at row " + rowIndex + " is not found in the dictionary");
    this.rowIndex = rowIndex;
  }

  public int getRowIndex() {
    return rowIndex;
  }
}
