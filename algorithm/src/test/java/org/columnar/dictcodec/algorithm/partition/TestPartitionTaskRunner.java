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
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Test cases for {@link PartitionTaskRunner}.
 */
public class TestPartitionTaskRunner {

  private ExecutorService threadPool;

  @BeforeEach
  public void prepare() {
    threadPool = Executors.newFixedThreadPool(4);
  }

  @AfterEach
  public void shutdown() {
    threadPool.shutdownNow();
  }

  @Test
  public void testResultsFollowPartitionOrder() throws Exception {
    List<Partition> partitions = Partitioner.partition(40, 4);
    PartitionTaskRunner runner = new PartitionTaskRunner(threadPool);

    // earlier partitions finish last
    List<Integer> starts = runner.invokeAll(partitions, partition -> {
      TimeUnit.MILLISECONDS.sleep(40 - partition.getStart());
      return partition.getStart();
    });

    assertEquals(List.of(0, 10, 20, 30), starts);
  }

  @Test
  public void testWaitsForAllTasksBeforeFailing() {
    List<Partition> partitions = Partitioner.partition(40, 4);
    PartitionTaskRunner runner = new PartitionTaskRunner(threadPool);
    AtomicInteger completed = new AtomicInteger();
    IllegalStateException second = new IllegalStateException("second");
    IllegalStateException fourth = new IllegalStateException("fourth");

    ExecutionException e = assertThrows(ExecutionException.class, () -> runner.invokeAll(partitions, partition -> {
      if (partition.getStart() == 30) {
        throw fourth;
      }
      if (partition.getStart() == 10) {
        TimeUnit.MILLISECONDS.sleep(50);
        throw second;
      }
      TimeUnit.MILLISECONDS.sleep(20);
      return completed.incrementAndGet();
    }));

    assertSame(second, e.getCause());
    assertEquals(1, e.getSuppressed().length);
    assertSame(fourth, e.getSuppressed()[0]);
    assertEquals(2, completed.get());
  }

  @Test
  public void testEmptyPartitionList() throws Exception {
    PartitionTaskRunner runner = new PartitionTaskRunner(threadPool);
    assertTrue(runner.invokeAll(List.of(), partition -> partition.size()).isEmpty());
  }
}
