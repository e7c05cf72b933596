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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.VarCharVector;
import org.columnar.dictcodec.algorithm.dictionary.StringDictionary;
import org.columnar.dictcodec.algorithm.dictionary.Utf8Values;
import org.columnar.dictcodec.algorithm.search.PositionListBuilder;

/**
 * Answers queries by comparing the strings of the column directly, without a dictionary.
 *
 * <p>This is the baseline for dictionary encoded queries: each query reads every string of the
 * column. Null slots never match, and neither do values that are not well-formed UTF-8.
 */
public class RawColumnQueryEngine implements ColumnQueryEngine {

  private final VarCharVector rows;

  public RawColumnQueryEngine(VarCharVector rows) {
    Preconditions.checkNotNull(rows, "rows must not be null");
    this.rows = rows;
  }

  @Override
  public int[] queryExact(String needle) {
    Preconditions.checkNotNull(needle, "needle must not be null");
    byte[] key = Utf8Values.encode(needle);
    if (key == null) {
      return new int[0];
    }

    PositionListBuilder positions = new PositionListBuilder();
    for (int i = 0; i < rows.getValueCount(); i++) {
      if (!rows.isNull(i) && Arrays.equals(rows.get(i), key)) {
        positions.add(i);
      }
    }
    return positions.build();
  }

  @Override
  public Map<String, int[]> queryPrefix(String prefix) {
    Preconditions.checkNotNull(prefix, "prefix must not be null");
    byte[] key = Utf8Values.encode(prefix);
    if (key == null) {
      return Collections.emptyMap();
    }

    Map<byte[], PositionListBuilder> matches = new TreeMap<>(StringDictionary.VALUE_ORDER);
    for (int i = 0; i < rows.getValueCount(); i++) {
      if (rows.isNull(i)) {
        continue;
      }
      byte[] value = rows.get(i);
      if (Utf8Prefixes.startsWith(value, key) && Utf8Values.isWellFormed(value)) {
        matches.computeIfAbsent(value, v -> new PositionListBuilder()).add(i);
      }
    }

    Map<String, int[]> result = new LinkedHashMap<>();
    for (Map.Entry<byte[], PositionListBuilder> entry : matches.entrySet()) {
      result.put(new String(entry.getKey(), StandardCharsets.UTF_8), entry.getValue().build());
    }
    return Collections.unmodifiableMap(result);
  }
}
