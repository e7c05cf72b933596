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

package org.columnar.dictcodec.algorithm.search;

import org.apache.arrow.vector.IntVector;

/**
 * Finds the positions of a code in an encoded vector.
 *
 * <p>Implementations differ only in how fast they are: for the same input, every implementation
 * returns the same positions in the same (ascending) order.
 */
public interface CodeScanner {

  /**
   * Finds the positions in {@code [start, end)} holding the code.
   * @param encoded the encoded vector. It must not contain nulls.
   * @param start the first position to examine (inclusive).
   * @param end the last position to examine (exclusive).
   * @param code the code to look for.
   * @return the matching positions, in ascending order.
   */
  int[] scan(IntVector encoded, int start, int end, int code);

  /**
   * Finds all positions of the vector holding the code.
   * @param encoded the encoded vector. It must not contain nulls.
   * @param code the code to look for.
   * @return the matching positions, in ascending order.
   */
  default int[] scan(IntVector encoded, int code) {
    return scan(encoded, 0, encoded.getValueCount(), code);
  }
}
