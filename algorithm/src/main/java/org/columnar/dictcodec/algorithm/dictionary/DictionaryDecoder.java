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

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarCharVector;

/**
 * Translates a vector of codes back into the values of a dictionary.
 */
public final class DictionaryDecoder {

  static final String DECODED_VECTOR_NAME = "decoded";

  /**
   * Decodes a vector.
   * @param encoded the vector of codes.
   * @param dictionary the dictionary the codes refer to.
   * @param allocator the allocator for the output vector.
   * @return the decoded vector, owned by the caller.
   * @throws IllegalArgumentException if a code is null or outside the code range of the dictionary.
   */
  public static VarCharVector decode(IntVector encoded, StringDictionary dictionary, BufferAllocator allocator) {
    VarCharVector decoded = new VarCharVector(DECODED_VECTOR_NAME, allocator);
    try {
      decoded.allocateNew();
      for (int i = 0; i < encoded.getValueCount(); i++) {
        if (encoded.isNull(i)) {
          throw new IllegalArgumentException("Null code at row " + i);
        }
        int code = encoded.get(i);
        if (code < 0 || code >= dictionary.size()) {
          throw new IllegalArgumentException(
              "Code " + code + " at row " + i + " is outside the dictionary of size " + dictionary.size());
        }
        decoded.copyFromSafe(code, i, dictionary.getVector());
      }
      decoded.setValueCount(encoded.getValueCount());
      return decoded;
    } catch (RuntimeException e) {
      decoded.close();
      throw e;
    }
  }

  private DictionaryDecoder() {
  }
}
