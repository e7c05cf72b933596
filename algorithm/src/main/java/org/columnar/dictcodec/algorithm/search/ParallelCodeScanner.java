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

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.IntVector;
import org.columnar.dictcodec.algorithm.partition.Partition;
import org.columnar.dictcodec.algorithm.partition.PartitionTaskRunner;
import org.columnar.dictcodec.algorithm.partition.Partitioner;

/**
 * Scans an encoded vector by multiple threads. This is often used in scenarios where the
 * vector is large or low response time is required.
 *
 * <p>The range is split by {@link Partitioner}, each partition is scanned by the delegate scanner,
 * and the partial results are concatenated in partition order. So the result is the same as that of
 * the delegate scanning the whole range.
 */
public class ParallelCodeScanner implements CodeScanner {

  private final PartitionTaskRunner runner;

  private final int workerCount;

  private final CodeScanner delegate;

  /**
   * Constructs a parallel scanner.
   * @param threadPool the thread pool to use.
   * @param workerCount the number of partitions to split a scan into.
   * @param delegate the scanner applied to each partition.
   */
  public ParallelCodeScanner(ExecutorService threadPool, int workerCount, CodeScanner delegate) {
    Partitioner.checkWorkerCount(workerCount);
    Preconditions.checkNotNull(delegate, "delegate scanner must not be null");
    this.runner = new PartitionTaskRunner(threadPool);
    this.workerCount = workerCount;
    this.delegate = delegate;
  }

  @Override
  public int[] scan(IntVector encoded, int start, int end, int code) {
    Preconditions.checkPositionIndexes(start, end, encoded.getValueCount());
    List<Partition> partitions = Partitioner.nonEmptyPartitions(end - start, workerCount);

    List<int[]> partials;
    try {
      partials = runner.invokeAll(partitions,
          partition -> delegate.scan(encoded, start + partition.getStart(), start + partition.getEnd(), code));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while scanning for code " + code, e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new IllegalStateException("Failed to scan for code " + code, e.getCause());
    }

    int total = 0;
    for (int[] partial : partials) {
      total += partial.length;
    }
    int[] positions = new int[total];
    int offset = 0;
    for (int[] partial : partials) {
      System.arraycopy(partial, 0, positions, offset, partial.length);
      offset += partial.length;
    }
    return positions;
  }
}
