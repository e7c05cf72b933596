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

import org.apache.arrow.util.Preconditions;

/**
 * A contiguous, half-open range of row indices {@code [start, end)} of a column.
 */
public final class Partition {

  private final int start;

  private final int end;

  /**
   * Constructs a partition.
   * @param start the first row of the partition (inclusive).
   * @param end the last row of the partition (exclusive).
   */
  public Partition(int start, int end) {
    Preconditions.checkArgument(start >= 0, "start must be non-negative, got %s", start);
    Preconditions.checkArgument(end >= start, "end (%s) must not be smaller than start (%s)", end, start);
    this.start = start;
    this.end = end;
  }

  public int getStart() {
    return start;
  }

  public int getEnd() {
    return end;
  }

  public int size() {
    return end - start;
  }

  public boolean isEmpty() {
    return start == end;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Partition other = (Partition) o;
    return start == other.start && end == other.end;
  }

  @Override
  public int hashCode() {
    return 31 * start + end;
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
