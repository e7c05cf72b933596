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

package org.columnar.dictcodec.algorithm.query;

import java.util.Map;

/**
 * Answers equality and prefix queries over a column of strings.
 *
 * <p>Queries only read the column, so they can be repeated, and run concurrently, with identical
 * results. Positions are row indices of the column.
 */
public interface ColumnQueryEngine {

  /**
   * Finds the rows equal to a string.
   * @param needle the string to look for.
   * @return the matching rows in ascending order, empty if the string does not occur.
   */
  int[] queryExact(String needle);

  /**
   * Finds the rows starting with a prefix. The comparison is case-sensitive and does not normalize
   * the strings. The empty prefix matches every row.
   * @param prefix the prefix.
   * @return for each distinct matching string, its rows in ascending order. The map iterates the
   *     strings in ascending UTF-8 byte order, and contains no string without rows.
   */
  Map<String, int[]> queryPrefix(String prefix);
}
