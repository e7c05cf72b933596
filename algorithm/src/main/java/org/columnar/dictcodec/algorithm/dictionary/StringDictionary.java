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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.util.ArrowBufPointer;
import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.VarCharVector;

import com.google.common.primitives.UnsignedBytes;

/**
 * An immutable bijection between a set of distinct strings and the dense codes {@code [0, size())}.
 *
 * <p>Codes follow the ascending unsigned byte order of the UTF-8 values, which is also the
 * code point order of the strings. So code 0 is the smallest value.
 *
 * <p>Both directions of the mapping are owned here and built together:
 * <ul>
 *   <li>code to value: a sorted {@link VarCharVector}, where the value of code {@code i} is at index
 *   {@code i}. It also supports lookups of string keys by binary search.</li>
 *   <li>value to code: a hash table keyed by pointers into that vector, used to encode elements
 *   of other vectors without copying them.</li>
 * </ul>
 *
 * <p>A dictionary is safe to read from multiple threads. It owns its vector and must be closed.
 */
public class StringDictionary implements AutoCloseable {

  /**
   * Result returned when a value is not in the dictionary.
   */
  public static final int NOT_FOUND = -1;

  /**
   * The order in which codes are assigned.
   */
  public static final Comparator<byte[]> VALUE_ORDER = UnsignedBytes.lexicographicalComparator();

  static final String DICTIONARY_VECTOR_NAME = "dictionary";

  /**
   * The dictionary values, in code order.
   */
  private final VarCharVector values;

  /**
   * The hash map for distinct dictionary entries.
   * The key is the pointer to the dictionary element, whereas the value is its code.
   */
  private final Map<ArrowBufPointer, Integer> codes;

  private StringDictionary(VarCharVector values) {
    this.values = values;

    int size = values.getValueCount();
    Map<ArrowBufPointer, Integer> index = new HashMap<>(Math.max(16, size * 2));
    for (int i = 0; i < size; i++) {
      ArrowBufPointer pointer = new ArrowBufPointer();
      values.getDataPointer(i, pointer);
      index.put(pointer, i);
    }
    this.codes = index;
  }

  /**
   * Creates a dictionary backed by the given vector. On success, the dictionary takes over the
   * vector and closes it when the dictionary is closed.
   * @param values the values, which must be non-null, well-formed UTF-8 and in strictly ascending
   *     {@link #VALUE_ORDER}.
   * @return the dictionary.
   * @throws IllegalArgumentException if the values are null, malformed, duplicated or out of order.
   */
  public static StringDictionary fromSortedVector(VarCharVector values) {
    Preconditions.checkNotNull(values, "values must not be null");
    byte[] previous = null;
    for (int i = 0; i < values.getValueCount(); i++) {
      Preconditions.checkArgument(!values.isNull(i), "dictionary value %s is null", i);
      byte[] current = values.get(i);
      Preconditions.checkArgument(Utf8Values.isWellFormed(current),
          "dictionary value %s is not well-formed UTF-8", i);
      if (previous != null && VALUE_ORDER.compare(previous, current) >= 0) {
        throw new IllegalArgumentException(
            "dictionary values must be distinct and in ascending order, violated at code " + i);
      }
      previous = current;
    }
    return new StringDictionary(values);
  }

  /**
   * Creates a dictionary from values that are already sorted in strictly ascending
   * {@link #VALUE_ORDER}.
   * @param sortedValues the UTF-8 encoded values.
   * @param allocator the allocator for the dictionary vector.
   * @return the dictionary.
   */
  public static StringDictionary fromSortedValues(List<byte[]> sortedValues, BufferAllocator allocator) {
    VarCharVector vector = new VarCharVector(DICTIONARY_VECTOR_NAME, allocator);
    try {
      vector.allocateNew();
      for (int i = 0; i < sortedValues.size(); i++) {
        vector.setSafe(i, sortedValues.get(i));
      }
      vector.setValueCount(sortedValues.size());
      return fromSortedVector(vector);
    } catch (RuntimeException e) {
      vector.close();
      throw e;
    }
  }

  /**
   * Gets the number of distinct values, which is also the upper bound (exclusive) of the codes.
   * @return the dictionary size.
   */
  public int size() {
    return values.getValueCount();
  }

  /**
   * Looks up the code of a string by binary search.
   * @param value the string to look up.
   * @return the code, or {@link #NOT_FOUND} if the string is not in the dictionary or has no UTF-8
   *     encoding.
   */
  public int codeOf(String value) {
    Preconditions.checkNotNull(value, "value must not be null");
    byte[] bytes = Utf8Values.encode(value);
    return bytes == null ? NOT_FOUND : codeOf(bytes);
  }

  /**
   * Looks up the code of a UTF-8 encoded value by binary search.
   * @param value the value to look up.
   * @return the code, or {@link #NOT_FOUND} if the value is not in the dictionary.
   */
  public int codeOf(byte[] value) {
    int low = 0;
    int high = size() - 1;

    while (low <= high) {
      int mid = low + (high - low) / 2;
      int cmp = VALUE_ORDER.compare(value, values.get(mid));
      if (cmp < 0) {
        high = mid - 1;
      } else if (cmp > 0) {
        low = mid + 1;
      } else {
        return mid;
      }
    }
    return NOT_FOUND;
  }

  /**
   * Looks up the code of an element of another vector through the hash table.
   * @param vector the vector holding the element.
   * @param index the index of the element. It must not be null.
   * @param probe a pointer owned by the caller, reused across calls to avoid allocation.
   * @return the code, or {@link #NOT_FOUND} if the element is not in the dictionary.
   */
  public int codeOf(VarCharVector vector, int index, ArrowBufPointer probe) {
    vector.getDataPointer(index, probe);
    Integer code = codes.get(probe);
    return code == null ? NOT_FOUND : code;
  }

  /**
   * Gets the first code whose value is not smaller than the key. The values starting with a prefix
   * occupy a contiguous run of codes beginning at the lower bound of the prefix.
   * @param key the UTF-8 encoded key.
   * @return the lower bound, which is {@link #size()} if every value is smaller than the key.
   */
  public int lowerBound(byte[] key) {
    int low = 0;
    int high = size();

    while (low < high) {
      int mid = low + (high - low) / 2;
      if (VALUE_ORDER.compare(values.get(mid), key) < 0) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }

  /**
   * Gets the UTF-8 bytes of a code.
   * @param code the code.
   * @return the value bytes.
   */
  public byte[] getBytes(int code) {
    Preconditions.checkElementIndex(code, size(), "code");
    return values.get(code);
  }

  /**
   * Gets the string of a code.
   * @param code the code.
   * @return the string.
   */
  public String valueOf(int code) {
    return new String(getBytes(code), StandardCharsets.UTF_8);
  }

  /**
   * Gets all values in code order.
   * @return the values, where the element at index {@code i} is the value of code {@code i}.
   */
  public List<String> getValues() {
    List<String> result = new ArrayList<>(size());
    for (int i = 0; i < size(); i++) {
      result.add(valueOf(i));
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Gets the underlying vector. Writing to it would invalidate the hash table.
   * @return the values in code order.
   */
  VarCharVector getVector() {
    return values;
  }

  @Override
  public void close() {
    values.close();
  }

  @Override
  public String toString() {
    return "StringDictionary{size=" + size() + "}";
  }
}
