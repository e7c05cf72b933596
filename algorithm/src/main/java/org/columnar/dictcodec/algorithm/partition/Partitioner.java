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
import java.util.Collections;
import java.util.List;

import org.apache.arrow.util.Preconditions;

/**
 * Splits a column into contiguous ranges so that each range can be processed by an independent task.
 *
 * <p>For {@code n} rows and {@code w} workers, there are {@code w} ranges of {@code n / w} rows each.
 * If {@code w} does not divide {@code n}, the remaining rows form one more trailing range. So
 * a non-empty column is split into {@code w} or {@code w + 1} ranges, and an empty column into none.
 */
public final class Partitioner {

  /**
   * Partitions a column.
   * @param rowCount the number of rows in the column.
   * @param workerCount the number of workers.
   * @return the ranges, ordered by their start offsets. If there are fewer rows than workers, the
   *     leading {@code workerCount} ranges are empty.
   * @throws InvalidWorkerCountException if the worker count is not positive.
   */
  public static List<Partition> partition(int rowCount, int workerCount) {
    return split(rowCount, workerCount, true);
  }

  /**
   * Partitions a column like {@link #partition(int, int)}, leaving out the empty ranges. The result
   * has at most {@code min(rowCount, workerCount + 1)} ranges, whatever the worker count.
   * @param rowCount the number of rows in the column.
   * @param workerCount the number of workers.
   * @return the non-empty ranges, ordered by their start offsets.
   * @throws InvalidWorkerCountException if the worker count is not positive.
   */
  public static List<Partition> nonEmptyPartitions(int rowCount, int workerCount) {
    return split(rowCount, workerCount, false);
  }

  private static List<Partition> split(int rowCount, int workerCount, boolean keepEmpty) {
    checkWorkerCount(workerCount);
    Preconditions.checkArgument(rowCount >= 0, "row count must be non-negative, got %s", rowCount);
    if (rowCount == 0) {
      return Collections.emptyList();
    }

    int chunkSize = rowCount / workerCount;
    List<Partition> partitions = new ArrayList<>(Math.min(workerCount, rowCount - 1) + 1);
    if (chunkSize > 0 || keepEmpty) {
      for (int i = 0; i < workerCount; i++) {
        partitions.add(new Partition(i * chunkSize, (i + 1) * chunkSize));
      }
    }

    // at most rowCount, so it does not overflow
    int covered = workerCount * chunkSize;
    if (covered < rowCount) {
      partitions.add(new Partition(covered, rowCount));
    }
    return partitions;
  }

  /**
   * Validates a worker count.
   * @param workerCount the worker count to check.
   * @throws InvalidWorkerCountException if the worker count is not positive.
   */
  public static void checkWorkerCount(int workerCount) {
    if (workerCount <= 0) {
      throw new InvalidWorkerCountException(workerCount);
    }
  }

  private Partitioner() {
  }
}
