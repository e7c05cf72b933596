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

import org.columnar.dictcodec.algorithm.search.ScanStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.primitives.Ints;

/**
 * Defaults used by {@link DictionaryCodec}.
 *
 * <p>Each option is read from a system property first, then from an environment variable. Invalid
 * values are reported and the built-in default is used instead:
 * <ul>
 *   <li>"dictcodec.worker_count" / DICTCODEC_WORKER_COUNT: the number of workers building and
 *   encoding dictionaries, by default the number of available processors.</li>
 *   <li>"dictcodec.scan_strategy" / DICTCODEC_SCAN_STRATEGY: "scalar" or "vectorized" (default).</li>
 * </ul>
 */
public final class CodecOptions {

  private static final Logger logger = LoggerFactory.getLogger(CodecOptions.class);

  public static final String WORKER_COUNT_PROPERTY_NAME = "dictcodec.worker_count";

  public static final String WORKER_COUNT_ENV_NAME = "DICTCODEC_WORKER_COUNT";

  public static final String SCAN_STRATEGY_PROPERTY_NAME = "dictcodec.scan_strategy";

  public static final String SCAN_STRATEGY_ENV_NAME = "DICTCODEC_SCAN_STRATEGY";

  public static final ScanStrategy DEFAULT_SCAN_STRATEGY = ScanStrategy.VECTORIZED;

  public static int getWorkerCount() {
    return parseWorkerCount(lookup(WORKER_COUNT_PROPERTY_NAME, WORKER_COUNT_ENV_NAME));
  }

  public static ScanStrategy getScanStrategy() {
    return parseScanStrategy(lookup(SCAN_STRATEGY_PROPERTY_NAME, SCAN_STRATEGY_ENV_NAME));
  }

  static int parseWorkerCount(String value) {
    int defaultCount = Runtime.getRuntime().availableProcessors();
    if (value == null) {
      return defaultCount;
    }
    Integer count = Ints.tryParse(value.trim());
    if (count != null && count > 0) {
      return count;
    }
    logger.warn("Invalid worker count \"{}\", using {} workers", value, defaultCount);
    return defaultCount;
  }

  static ScanStrategy parseScanStrategy(String value) {
    if (value == null) {
      return DEFAULT_SCAN_STRATEGY;
    }
    try {
      return ScanStrategy.fromName(value);
    } catch (IllegalArgumentException e) {
      logger.warn("Unknown scan strategy \"{}\", using {}", value, DEFAULT_SCAN_STRATEGY);
      return DEFAULT_SCAN_STRATEGY;
    }
  }

  // system properties take precedence over environment variables
  private static String lookup(String propertyName, String envName) {
    String propertyValue = System.getProperty(propertyName);
    return propertyValue != null ? propertyValue : System.getenv(envName);
  }

  private CodecOptions() {
  }
}
