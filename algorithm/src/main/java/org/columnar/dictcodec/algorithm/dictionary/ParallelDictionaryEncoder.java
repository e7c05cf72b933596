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
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.util.ArrowBufPointer;
import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarCharVector;
import org.columnar.dictcodec.algorithm.partition.Partition;
import org.columnar.dictcodec.algorithm.partition.PartitionTaskRunner;
import org.columnar.dictcodec.algorithm.partition.Partitioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dictionary encoder running one task per partition of the input vector.
 *
 * <p>Each task translates its rows into a private array of codes. The output vector is populated
 * only after all tasks are done, by placing each array at the start offset of its partition, so the
 * row order of the input is preserved.
 */
public class ParallelDictionaryEncoder {

  private static final Logger logger = LoggerFactory.getLogger(ParallelDictionaryEncoder.class);

  static final String ENCODED_VECTOR_NAME = "encoded";

  private final PartitionTaskRunner runner;

  private final int workerCount;

  /**
   * Constructs an encoder.
   * @param threadPool the thread pool running the partition tasks.
   * @param workerCount the number of partitions to split the work into.
   * @throws org.columnar.dictcodec.algorithm.partition.InvalidWorkerCountException if the worker
   *     count is not positive.
   */
  public ParallelDictionaryEncoder(ExecutorService threadPool, int workerCount) {
    Partitioner.checkWorkerCount(workerCount);
    this.runner = new PartitionTaskRunner(threadPool);
    this.workerCount = workerCount;
  }

  /**
   * Translates the input vector into a vector of dictionary codes.
   * The algorithm takes O(n) time, where n is the length of the input vector.
   *
   * @param rows the vector to encode.
   * @param dictionary the dictionary.
   * @param allocator the allocator for the output vector.
   * @return the encoded vector, with one code per input row, owned by the caller.
   * @throws DictionaryMismatchException if a row is null or has no entry in the dictionary. The
   *     reported row is the first such row of the vector.
   * @throws DictionaryBuildException if a partition fails for any other reason.
   * @throws InterruptedException if the current thread is interrupted while waiting for the tasks.
   */
  public IntVector encode(VarCharVector rows, StringDictionary dictionary, BufferAllocator allocator)
      throws InterruptedException {
    Preconditions.checkNotNull(rows, "rows must not be null");
    Preconditions.checkNotNull(dictionary, "dictionary must not be null");
    Preconditions.checkNotNull(allocator, "allocator must not be null");

    List<Partition> partitions = Partitioner.nonEmptyPartitions(rows.getValueCount(), workerCount);
    List<int[]> partials;
    try {
      partials = runner.invokeAll(partitions, partition -> encodePartition(rows, partition, dictionary));
    } catch (ExecutionException e) {
      if (e.getCause() instanceof DictionaryMismatchException) {
        DictionaryMismatchException mismatch = (DictionaryMismatchException) e.getCause();
        for (Throwable suppressed : e.getSuppressed()) {
          mismatch.addSuppressed(suppressed);
        }
        throw mismatch;
      }
      throw DictionaryBuildException.of("Failed to encode the vector", e);
    }

    IntVector encoded = new IntVector(ENCODED_VECTOR_NAME, allocator);
    try {
      encoded.allocateNew(rows.getValueCount());
      for (int i = 0; i < partitions.size(); i++) {
        int start = partitions.get(i).getStart();
        int[] codes = partials.get(i);
        for (int j = 0; j < codes.length; j++) {
          encoded.set(start + j, codes[j]);
        }
      }
      encoded.setValueCount(rows.getValueCount());
    } catch (RuntimeException e) {
      encoded.close();
      throw e;
    }

    logger.debug("Encoded {} rows over {} partitions with a dictionary of {} values",
        rows.getValueCount(), partitions.size(), dictionary.size());
    return encoded;
  }

  private static int[] encodePartition(VarCharVector rows, Partition partition, StringDictionary dictionary) {
    int[] codes = new int[partition.size()];
    ArrowBufPointer probe = new ArrowBufPointer();
    for (int i = partition.getStart(); i < partition.getEnd(); i++) {
      if (rows.isNull(i)) {
        throw new DictionaryMismatchException(i, null);
      }
      int code = dictionary.codeOf(rows, i, probe);
      if (code == StringDictionary.NOT_FOUND) {
        throw new DictionaryMismatchException(i, new String(rows.get(i), StandardCharsets.UTF_8));
      }
      codes[i - partition.getStart()] = code;
    }
    return codes;
  }
}
