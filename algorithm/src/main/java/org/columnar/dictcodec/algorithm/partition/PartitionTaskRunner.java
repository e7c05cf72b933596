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

package org.columnar.dictcodec.algorithm.partition;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.apache.arrow.util.Preconditions;

/**
 * Runs one task per partition on a thread pool and waits for all of them before returning.
 *
 * <p>Tasks must not share mutable state: each one sees only its own partition and returns its own
 * result. Results are returned in partition order, regardless of the order in which tasks finish.
 */
public class PartitionTaskRunner {

  /**
   * The work done for a single partition.
   *
   * @param <T> the partition result type.
   */
  @FunctionalInterface
  public interface PartitionTask<T> {

    /**
     * Processes a partition.
     * @param partition the rows to process.
     * @return the partition result.
     * @throws Exception if the partition cannot be processed.
     */
    T process(Partition partition) throws Exception;
  }

  /** The thread pool. */
  private final ExecutorService threadPool;

  /**
   * Constructs a runner.
   * @param threadPool the thread pool executing the tasks.
   */
  public PartitionTaskRunner(ExecutorService threadPool) {
    Preconditions.checkNotNull(threadPool, "thread pool must not be null");
    this.threadPool = threadPool;
  }

  /**
   * Runs the task for every partition and waits until all of them are done.
   * @param partitions the partitions to process.
   * @param task the task to apply to each partition.
   * @param <T> the partition result type.
   * @return the partition results, in the same order as the partitions.
   * @throws ExecutionException if any task failed. Its cause is the failure of the first failed
   *     partition (in partition order); failures of later partitions are attached as suppressed.
   * @throws InterruptedException if the current thread is interrupted while waiting.
   */
  public <T> List<T> invokeAll(List<Partition> partitions, PartitionTask<T> task)
      throws ExecutionException, InterruptedException {
    List<Callable<T>> callables = new ArrayList<>(partitions.size());
    for (Partition partition : partitions) {
      callables.add(() -> task.process(partition));
    }

    // invokeAll returns only after every task has completed
    List<Future<T>> futures = threadPool.invokeAll(callables);

    List<T> results = new ArrayList<>(futures.size());
    ExecutionException failure = null;
    for (Future<T> future : futures) {
      try {
        results.add(future.get());
      } catch (ExecutionException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e.getCause());
        }
      }
    }

    if (failure != null) {
      throw failure;
    }
    return results;
  }
}
