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

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarCharVector;
import org.columnar.dictcodec.algorithm.dictionary.DictionaryDecoder;
import org.columnar.dictcodec.algorithm.dictionary.ParallelDictionaryBuilder;
import org.columnar.dictcodec.algorithm.dictionary.ParallelDictionaryEncoder;
import org.columnar.dictcodec.algorithm.dictionary.StringDictionary;
import org.columnar.dictcodec.algorithm.partition.Partitioner;
import org.columnar.dictcodec.algorithm.query.DictionaryQueryEngine;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Entry points for dictionary encoding a string column and querying the result.
 *
 * <p>Below gives the sample code:
 *
 * <pre>{@code
 * try (StringDictionary dictionary = DictionaryCodec.buildDictionary(rows, 4, allocator);
 *      IntVector encoded = DictionaryCodec.encode(rows, dictionary, 4, allocator)) {
 *   int[] positions = DictionaryCodec.queryExact(encoded, dictionary, "a");
 *   ...
 * }
 * }</pre>
 *
 * <p>Builds and encodings run on a fixed pool created for the call and shut down when it returns. The
 * pool has one thread per non-empty partition, and at most {@code workerCount} threads.
 */
public final class DictionaryCodec {

  private static final String WORKER_THREAD_NAME_FORMAT = "dictcodec-worker-%d";

  /**
   * Builds the dictionary of a column.
   * @param rows the column.
   * @param workerCount the number of workers.
   * @param allocator the allocator for the dictionary.
   * @return the dictionary, owned by the caller.
   * @throws org.columnar.dictcodec.algorithm.partition.InvalidWorkerCountException if the worker
   *     count is not positive.
   * @throws org.columnar.dictcodec.algorithm.dictionary.DictionaryBuildException if a worker fails.
   * @throws InterruptedException if the current thread is interrupted while waiting for the workers.
   */
  public static StringDictionary buildDictionary(VarCharVector rows, int workerCount, BufferAllocator allocator)
      throws InterruptedException {
    Partitioner.checkWorkerCount(workerCount);
    ExecutorService threadPool = newWorkerPool(poolSize(rows.getValueCount(), workerCount));
    try {
      return new ParallelDictionaryBuilder(threadPool, workerCount).build(rows, allocator);
    } finally {
      threadPool.shutdown();
    }
  }

  /**
   * Builds the dictionary of a column, with the worker count of {@link CodecOptions}.
   */
  public static StringDictionary buildDictionary(VarCharVector rows, BufferAllocator allocator)
      throws InterruptedException {
    return buildDictionary(rows, CodecOptions.getWorkerCount(), allocator);
  }

  /**
   * Encodes a column with a dictionary.
   * @param rows the column.
   * @param dictionary the dictionary.
   * @param workerCount the number of workers.
   * @param allocator the allocator for the encoded vector.
   * @return the encoded vector, owned by the caller.
   * @throws org.columnar.dictcodec.algorithm.partition.InvalidWorkerCountException if the worker
   *     count is not positive.
   * @throws org.columnar.dictcodec.algorithm.dictionary.DictionaryMismatchException if a row has no
   *     entry in the dictionary.
   * @throws org.columnar.dictcodec.algorithm.dictionary.DictionaryBuildException if a worker fails.
   * @throws InterruptedException if the current thread is interrupted while waiting for the workers.
   */
  public static IntVector encode(VarCharVector rows, StringDictionary dictionary, int workerCount,
      BufferAllocator allocator) throws InterruptedException {
    Partitioner.checkWorkerCount(workerCount);
    ExecutorService threadPool = newWorkerPool(poolSize(rows.getValueCount(), workerCount));
    try {
      return new ParallelDictionaryEncoder(threadPool, workerCount).encode(rows, dictionary, allocator);
    } finally {
      threadPool.shutdown();
    }
  }

  /**
   * Encodes a column with a dictionary, with the worker count of {@link CodecOptions}.
   */
  public static IntVector encode(VarCharVector rows, StringDictionary dictionary, BufferAllocator allocator)
      throws InterruptedException {
    return encode(rows, dictionary, CodecOptions.getWorkerCount(), allocator);
  }

  /**
   * Decodes an encoded column.
   * @param encoded the encoded column.
   * @param dictionary the dictionary it was encoded with.
   * @param allocator the allocator for the decoded vector.
   * @return the decoded column, owned by the caller.
   */
  public static VarCharVector decode(IntVector encoded, StringDictionary dictionary, BufferAllocator allocator) {
    return DictionaryDecoder.decode(encoded, dictionary, allocator);
  }

  /**
   * Finds the rows equal to a string, scanning with the strategy of {@link CodecOptions}.
   * @param encoded the encoded column.
   * @param dictionary the dictionary of the column.
   * @param needle the string.
   * @return the matching rows in ascending order.
   */
  public static int[] queryExact(IntVector encoded, StringDictionary dictionary, String needle) {
    return newQueryEngine(dictionary, encoded).queryExact(needle);
  }

  /**
   * Finds the rows starting with a prefix, scanning with the strategy of {@link CodecOptions}.
   * @param dictionary the dictionary of the column.
   * @param encoded the encoded column.
   * @param prefix the prefix.
   * @return for each matching string, its rows in ascending order.
   */
  public static Map<String, int[]> queryPrefix(StringDictionary dictionary, IntVector encoded, String prefix) {
    return newQueryEngine(dictionary, encoded).queryPrefix(prefix);
  }

  private static DictionaryQueryEngine newQueryEngine(StringDictionary dictionary, IntVector encoded) {
    return new DictionaryQueryEngine(dictionary, encoded, CodecOptions.getScanStrategy().getScanner());
  }

  static int poolSize(int rowCount, int workerCount) {
    return Math.max(1, Math.min(workerCount, Partitioner.nonEmptyPartitions(rowCount, workerCount).size()));
  }

  static ExecutorService newWorkerPool(int threadCount) {
    return Executors.newFixedThreadPool(threadCount,
        new ThreadFactoryBuilder().setNameFormat(WORKER_THREAD_NAME_FORMAT).setDaemon(true).build());
  }

  private DictionaryCodec() {
  }
}
