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

import org.apache.arrow.memory.ArrowBuf;
import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.IntVector;

/**
 * Scans an encoded vector in batches.
 *
 * <p>The codes of a batch are read straight from the data buffer and compared without branching,
 * producing one bit per position in a match mask. Positions are then emitted from the set bits of the
 * mask, lowest first.
 */
public class VectorizedCodeScanner implements CodeScanner {

  public static final VectorizedCodeScanner INSTANCE = new VectorizedCodeScanner();

  /**
   * The number of positions compared per batch, one per bit of the match mask.
   */
  public static final int BATCH_SIZE = Long.SIZE;

  @Override
  public int[] scan(IntVector encoded, int start, int end, int code) {
    Preconditions.checkPositionIndexes(start, end, encoded.getValueCount());
    ArrowBuf data = encoded.getDataBuffer();
    PositionListBuilder positions = new PositionListBuilder();

    int batchStart = start;
    while (batchStart < end) {
      int batchLength = Math.min(BATCH_SIZE, end - batchStart);
      long offset = (long) batchStart * IntVector.TYPE_WIDTH;

      long mask = 0L;
      for (int j = 0; j < batchLength; j++) {
        int diff = data.getInt(offset + (long) j * IntVector.TYPE_WIDTH) ^ code;
        // the sign bit of (diff | -diff) is set iff diff != 0
        mask |= ((long) (((diff | -diff) >>> 31) ^ 1)) << j;
      }

      while (mask != 0L) {
        positions.add(batchStart + Long.numberOfTrailingZeros(mask));
        mask &= mask - 1;
      }
      batchStart += batchLength;
    }
    return positions.build();
  }
}
