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

import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.IntVector;

/**
 * Scans an encoded vector by comparing one element at a time.
 */
public class ScalarCodeScanner implements CodeScanner {

  public static final ScalarCodeScanner INSTANCE = new ScalarCodeScanner();

  @Override
  public int[] scan(IntVector encoded, int start, int end, int code) {
    Preconditions.checkPositionIndexes(start, end, encoded.getValueCount());
    PositionListBuilder positions = new PositionListBuilder();
    for (int i = start; i < end; i++) {
      if (encoded.get(i) == code) {
        positions.add(i);
      }
    }
    return positions.build();
  }
}
