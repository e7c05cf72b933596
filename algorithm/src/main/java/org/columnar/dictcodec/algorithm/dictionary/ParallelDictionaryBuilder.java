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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.util.ArrowBufPointer;
import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.VarCharVector;
import org.columnar.dictcodec.algorithm.partition.Partition;
import org.columnar.dictcodec.algorithm.partition.PartitionTaskRunner;
import org.columnar.dictcodec.algorithm.partition.Partitioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the dictionary of a vector by multiple threads.
 *
 * <p>The vector is split by {@link Partitioner}, and the distinct values of each partition are
 * extracted by an independent task. When all tasks are done, the partial results are merged, and
 * codes are assigned following {@link StringDictionary#VALUE_ORDER}. The result depends only on the
 * values of the vector, never on the worker count or on task scheduling.
 */
public class ParallelDictionaryBuilder {

  private static final Logger logger = LoggerFactory.getLogger(ParallelDictionaryBuilder.class);

  private final PartitionTaskRunner runner;

  private final int workerCount;

  /**
   * Constructs a builder.
   * @param threadPool the thread pool running the partition tasks.
   * @param workerCount the number of partitions to split the work into.
   * @throws org.columnar.dictcodec.algorithm.partition.InvalidWorkerCountException if the worker
   *     count is not positive.
   */
  public ParallelDictionaryBuilder(ExecutorService threadPool, int workerCount) {
    Partitioner.checkWorkerCount(workerCount);
    this.runner = new PartitionTaskRunner(threadPool);
    this.workerCount = workerCount;
  }

  /**
   * Builds the dictionary of all values in the vector.
   * @param rows the vector to build the dictionary for. It must not contain nulls, and must not be
   *     modified during the build.
   * @param allocator the allocator for the dictionary.
   * @return the dictionary, which is empty if the vector is empty.
   * @throws DictionaryBuildException if the distinct values of any partition cannot be extracted.
   * @throws InterruptedException if the current thread is interrupted while waiting for the tasks.
   */
  public StringDictionary build(VarCharVector rows, BufferAllocator allocator) throws InterruptedException {
    Preconditions.checkNotNull(rows, "rows must not be null");
    Preconditions.checkNotNull(allocator, "allocator must not be null");

    List<Partition> partitions = Partitioner.nonEmptyPartitions(rows.getValueCount(), workerCount);
    List<Map<ArrowBufPointer, Integer>> partials;
    try {
      partials = runner.invokeAll(partitions, partition -> DistinctValueExtractor.extract(rows, partition));
    } catch (ExecutionException e) {
      throw DictionaryBuildException.of("Failed to extract the distinct values of the vector", e);
    }

    // merge in partition order, so each value keeps its first row
    Map<ArrowBufPointer, Integer> distinct = new HashMap<>();
    for (Map<ArrowBufPointer, Integer> partial : partials) {
      for (Map.Entry<ArrowBufPointer, Integer> entry : partial.entrySet()) {
        distinct.putIfAbsent(entry.getKey(), entry.getValue());
      }
    }

    List<byte[]> sortedValues = new ArrayList<>(distinct.size());
    for (int row : distinct.values()) {
      sortedValues.add(rows.get(row));
    }
    sortedValues.sort(StringDictionary.VALUE_ORDER);

    logger.debug("Found {} distinct values in {} rows over {} partitions",
        sortedValues.size(), rows.getValueCount(), partitions.size());
    return StringDictionary.fromSortedValues(sortedValues, allocator);
  }
}
