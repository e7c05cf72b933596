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

import java.util.Locale;

/**
 * The single-threaded scan implementations. They are interchangeable: only the speed differs.
 */
public enum ScanStrategy {

  /** Element-by-element comparison, see {@link ScalarCodeScanner}. */
  SCALAR(ScalarCodeScanner.INSTANCE),

  /** Branch-free batch comparison, see {@link VectorizedCodeScanner}. */
  VECTORIZED(VectorizedCodeScanner.INSTANCE);

  private final CodeScanner scanner;

  ScanStrategy(CodeScanner scanner) {
    this.scanner = scanner;
  }

  public CodeScanner getScanner() {
    return scanner;
  }

  /**
   * Parses a strategy name, ignoring case.
   * @param name the name, e.g. "scalar" or "vectorized".
   * @return the strategy.
   * @throws IllegalArgumentException if the name is unknown.
   */
  public static ScanStrategy fromName(String name) {
    return valueOf(name.trim().toUpperCase(Locale.ROOT));
  }
}
