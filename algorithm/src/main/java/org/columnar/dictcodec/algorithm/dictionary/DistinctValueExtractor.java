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

import java.util.HashMap;
import java.util.Map;

import org.apache.arrow.memory.util.ArrowBufPointer;
import org.apache.arrow.vector.VarCharVector;
import org.columnar.dictcodec.algorithm.partition.Partition;

/**
 * Finds the distinct values of a range of a vector.
 *
 * <p>The extraction only reads the vector and keeps its state local, so extractions of different
 * ranges of the same vector can run concurrently without locking.
 */
public final class DistinctValueExtractor {

  /**
   * Extracts the distinct values of a partition.
   * Each add operation can be finished in O(1) time, so the extraction takes O(n) time,
   * where n is the size of the partition.
   *
   * @param rows the vector to read. It must not be modified while the result is in use, as the
   *     returned pointers refer to its data buffer.
   * @param partition the range of rows to read.
   * @return for each distinct value, the first row of the partition holding it.
   * @throws DictionaryMismatchException if the partition contains a null value.
   * @throws MalformedValueException if a value of the partition is not well-formed UTF-8.
   */
  public static Map<ArrowBufPointer, Integer> extract(VarCharVector rows, Partition partition) {
    Map<ArrowBufPointer, Integer> distinct = new HashMap<>();
    ArrowBufPointer nextPointer = new ArrowBufPointer();

    for (int i = partition.getStart(); i < partition.getEnd(); i++) {
      if (rows.isNull(i)) {
        throw new DictionaryMismatchException(i, null);
      }

      rows.getDataPointer(i, nextPointer);
      if (!distinct.containsKey(nextPointer)) {
        // a new distinct value is found
        if (!Utf8Values.isWellFormed(rows.get(i))) {
          throw new MalformedValueException(i);
        }
        distinct.put(nextPointer, i);
        nextPointer = new ArrowBufPointer();
      }
    }
    return distinct;
  }

  private DistinctValueExtractor() {
  }
}
