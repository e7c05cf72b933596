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

package org.columnar.dictcodec.algorithm;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarCharVector;

/**
 * Utilities to populate and read vectors in tests.
 */
public final class ColumnTestUtils {

  private static final String[] SYMBOLS = {"a", "b", "c", ",", "é", "中", "𝄞"};

  /**
   * Creates a vector holding the given strings.
   */
  public static VarCharVector newColumn(BufferAllocator allocator, String... values) {
    return newColumn(allocator, Arrays.asList(values));
  }

  /**
   * Creates a vector holding the given strings.
   */
  public static VarCharVector newColumn(BufferAllocator allocator, List<String> values) {
    VarCharVector vector = new VarCharVector("rows", allocator);
    vector.allocateNew();
    for (int i = 0; i < values.size(); i++) {
      vector.setSafe(i, values.get(i).getBytes(StandardCharsets.UTF_8));
    }
    vector.setValueCount(values.size());
    return vector;
  }

  /**
   * Creates a vector holding the given bytes, which need not be well-formed UTF-8.
   */
  public static VarCharVector newByteColumn(BufferAllocator allocator, byte[]... values) {
    VarCharVector vector = new VarCharVector("rows", allocator);
    vector.allocateNew();
    for (int i = 0; i < values.length; i++) {
      vector.setSafe(i, values[i]);
    }
    vector.setValueCount(values.length);
    return vector;
  }

  public static List<String> toStrings(VarCharVector vector) {
    List<String> result = new ArrayList<>(vector.getValueCount());
    for (int i = 0; i < vector.getValueCount(); i++) {
      result.add(new String(vector.get(i), StandardCharsets.UTF_8));
    }
    return result;
  }

  public static int[] toArray(IntVector vector) {
    int[] result = new int[vector.getValueCount()];
    for (int i = 0; i < result.length; i++) {
      result[i] = vector.get(i);
    }
    return result;
  }

  /**
   * Generates strings of up to {@code maxLength} symbols, including empty strings and strings outside
   * the basic multilingual plane. Short lengths make repeated values and shared prefixes frequent.
   */
  public static List<String> randomStrings(Random random, int count, int maxLength) {
    List<String> result = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      int length = random.nextInt(maxLength + 1);
      StringBuilder builder = new StringBuilder();
      for (int j = 0; j < length; j++) {
        builder.append(SYMBOLS[random.nextInt(SYMBOLS.length)]);
      }
      result.add(builder.toString());
    }
    return result;
  }

  /**
   * Gets the rows of a list equal to the needle, the expected result of an exact query.
   */
  public static int[] positionsOf(List<String> rows, String needle) {
    return IntStream.range(0, rows.size()).filter(i -> rows.get(i).equals(needle)).toArray();
  }

  private ColumnTestUtils() {
  }
}
