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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Test cases for {@link Partitioner}.
 */
public class TestPartitioner {

  @Test
  public void testEvenSplit() {
    List<Partition> partitions = Partitioner.partition(12, 4);
    assertEquals(Arrays.asList(new Partition(0, 3), new Partition(3, 6), new Partition(6, 9), new Partition(9, 12)),
        partitions);
  }

  @Test
  public void testRemainderFormsTrailingPartition() {
    List<Partition> partitions = Partitioner.partition(5, 2);
    assertEquals(Arrays.asList(new Partition(0, 2), new Partition(2, 4), new Partition(4, 5)), partitions);
  }

  @Test
  public void testFewerRowsThanWorkers() {
    List<Partition> partitions = Partitioner.partition(3, 5);
    assertEquals(6, partitions.size());
    for (int i = 0; i < 5; i++) {
      assertTrue(partitions.get(i).isEmpty());
    }
    assertEquals(new Partition(0, 3), partitions.get(5));
  }

  @Test
  public void testEmptyColumn() {
    assertTrue(Partitioner.partition(0, 3).isEmpty());
  }

  @ParameterizedTest
  @ValueSource(ints = {0, -1, Integer.MIN_VALUE})
  public void testInvalidWorkerCount(int workerCount) {
    InvalidWorkerCountException e =
        assertThrows(InvalidWorkerCountException.class, () -> Partitioner.partition(10, workerCount));
    assertEquals(workerCount, e.getWorkerCount());
  }

  @Test
  public void testNegativeRowCount() {
    assertThrows(IllegalArgumentException.class, () -> Partitioner.partition(-1, 2));
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 3, 7, 16, 100, 1000})
  public void testPartitionsCoverAllRows(int workerCount) {
    int rowCount = 997;
    List<Partition> partitions = Partitioner.partition(rowCount, workerCount);

    assertTrue(partitions.size() == workerCount || partitions.size() == workerCount + 1);
    int expectedStart = 0;
    for (Partition partition : partitions) {
      assertEquals(expectedStart, partition.getStart());
      expectedStart = partition.getEnd();
    }
    assertEquals(rowCount, expectedStart);
  }

  @Test
  public void testNonEmptyPartitions() {
    assertEquals(Partitioner.partition(5, 2), Partitioner.nonEmptyPartitions(5, 2));
    assertEquals(Collections.singletonList(new Partition(0, 3)), Partitioner.nonEmptyPartitions(3, 5));
    assertTrue(Partitioner.nonEmptyPartitions(0, 3).isEmpty());
  }

  @Test
  public void testMaximumWorkerCount() {
    assertEquals(Collections.singletonList(new Partition(0, 5)),
        Partitioner.nonEmptyPartitions(5, Integer.MAX_VALUE));
    assertEquals(Collections.singletonList(new Partition(0, 100)),
        Partitioner.nonEmptyPartitions(100, Integer.MAX_VALUE - 1));
    assertTrue(Partitioner.partition(0, Integer.MAX_VALUE).isEmpty());
  }
}
