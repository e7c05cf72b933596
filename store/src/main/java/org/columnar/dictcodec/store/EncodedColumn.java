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

package org.columnar.dictcodec.store;

import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.IntVector;
import org.columnar.dictcodec.algorithm.dictionary.StringDictionary;

/**
 * A dictionary together with the column encoded with it. Closing it closes both.
 */
public class EncodedColumn implements AutoCloseable {

  private final StringDictionary dictionary;

  private final IntVector encoded;

  /**
   * Constructs the pair, taking over both.
   * @param dictionary the dictionary.
   * @param encoded the encoded column.
   */
  public EncodedColumn(StringDictionary dictionary, IntVector encoded) {
    Preconditions.checkNotNull(dictionary, "dictionary must not be null");
    Preconditions.checkNotNull(encoded, "encoded vector must not be null");
    this.dictionary = dictionary;
    this.encoded = encoded;
  }

  public StringDictionary getDictionary() {
    return dictionary;
  }

  public IntVector getEncoded() {
    return encoded;
  }

  @Override
  public void close() {
    try {
      encoded.close();
    } finally {
      dictionary.close();
    }
  }
}
