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

import com.google.common.base.Utf8;

/**
 * Strict conversions between strings and their UTF-8 encoding.
 *
 * <p>{@link String#getBytes(java.nio.charset.Charset)} replaces an unpaired surrogate with
 * {@code '?'}, which would make such a string equal to another one. Such strings have no UTF-8
 * encoding here, so they can never match a dictionary value.
 */
public final class Utf8Values {

  /**
   * Encodes a string.
   * @param value the string to encode.
   * @return the UTF-8 bytes, or null if the string contains an unpaired surrogate.
   */
  public static byte[] encode(String value) {
    try {
      Utf8.encodedLength(value);
    } catch (IllegalArgumentException e) {
      // unpaired surrogate
      return null;
    }
    return value.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Checks whether bytes are well-formed UTF-8.
   * @param bytes the bytes to check.
   * @return true if the bytes are the UTF-8 encoding of some string.
   */
  public static boolean isWellFormed(byte[] bytes) {
    return Utf8.isWellFormed(bytes);
  }

  private Utf8Values() {
  }
}
