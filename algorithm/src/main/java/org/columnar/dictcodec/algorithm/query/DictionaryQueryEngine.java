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

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.IntVector;
import org.columnar.dictcodec.algorithm.dictionary.StringDictionary;
import org.columnar.dictcodec.algorithm.dictionary.Utf8Values;
import org.columnar.dictcodec.algorithm.search.CodeScanner;
import org.columnar.dictcodec.algorithm.search.ScanStrategy;

/**
 * Answers queries from a dictionary and the column encoded with it.
 *
 * <p>Strings are resolved to codes through the dictionary, and only the encoded vector is scanned.
 * Since codes follow the order of the values, the values with a given prefix have consecutive codes,
 * found by one binary search.
 */
public class DictionaryQueryEngine implements ColumnQueryEngine {

  private static final int[] NO_POSITIONS = new int[0];

  private final StringDictionary dictionary;

  private final IntVector encoded;

  private final CodeScanner scanner;

  /**
   * Constructs an engine scanning with {@link ScanStrategy#VECTORIZED}.
   * @param dictionary the dictionary.
   * @param encoded the encoded column.
   */
  public DictionaryQueryEngine(StringDictionary dictionary, IntVector encoded) {
    this(dictionary, encoded, ScanStrategy.VECTORIZED.getScanner());
  }

  /**
   * Constructs an engine.
   * @param dictionary the dictionary.
   * @param encoded the encoded column.
   * @param scanner the scanner to find the positions of a code.
   */
  public DictionaryQueryEngine(StringDictionary dictionary, IntVector encoded, CodeScanner scanner) {
    Preconditions.checkNotNull(dictionary, "dictionary must not be null");
    Preconditions.checkNotNull(encoded, "encoded vector must not be null");
    Preconditions.checkNotNull(scanner, "scanner must not be null");
    this.dictionary = dictionary;
    this.encoded = encoded;
    this.scanner = scanner;
  }

  @Override
  public int[] queryExact(String needle) {
    int code = dictionary.codeOf(needle);
    if (code == StringDictionary.NOT_FOUND) {
      return NO_POSITIONS;
    }
    return scanner.scan(encoded, code);
  }

  @Override
  public Map<String, int[]> queryPrefix(String prefix) {
    Preconditions.checkNotNull(prefix, "prefix must not be null");
    byte[] key = Utf8Values.encode(prefix);
    if (key == null) {
      return Collections.emptyMap();
    }

    Map<String, int[]> result = new LinkedHashMap<>();
    for (int code = dictionary.lowerBound(key); code < dictionary.size(); code++) {
      byte[] value = dictionary.getBytes(code);
      if (!Utf8Prefixes.startsWith(value, key)) {
        // past the run of values with the prefix
        break;
      }
      int[] positions = scanner.scan(encoded, code);
      if (positions.length > 0) {
        result.put(new String(value, StandardCharsets.UTF_8), positions);
      }
    }
    return Collections.unmodifiableMap(result);
  }
}
