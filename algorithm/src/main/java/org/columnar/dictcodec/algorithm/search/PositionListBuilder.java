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

import java.util.Arrays;

/**
 * An append-only list of positions, backed by a growing array.
 */
public final class PositionListBuilder {

  private static final int INITIAL_CAPACITY = 16;

  private int[] positions = new int[INITIAL_CAPACITY];

  private int size;

  public void add(int position) {
    if (size == positions.length) {
      positions = Arrays.copyOf(positions, positions.length * 2);
    }
    positions[size++] = position;
  }

  /**
   * Gets the positions added so far.
   * @return a copy of the positions, in insertion order.
   */
  public int[] build() {
    return Arrays.copyOf(positions, size);
  }
}
