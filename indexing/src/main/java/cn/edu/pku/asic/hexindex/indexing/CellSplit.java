/*
 * Copyright 2018 University of California, Riverside
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package cn.edu.pku.asic.hexindex.indexing;

import cn.edu.pku.asic.hexindex.common.utils.IntArray;
import cn.edu.pku.asic.hexindex.dggs.core.CellIds;

/**
 * The outcome of splitting an overflowing node into two groups. Groups hold positions in the split input.
 */
public class CellSplit {
  /**Positions of the entries that go to the left node*/
  private final IntArray left;
  /**Positions of the entries that go to the right node*/
  private final IntArray right;
  /**Bounding key of the left group*/
  private final long leftKey;
  /**Bounding key of the right group*/
  private final long rightKey;

  public CellSplit(IntArray left, IntArray right, long leftKey, long rightKey) {
    this.left = left;
    this.right = right;
    this.leftKey = leftKey;
    this.rightKey = rightKey;
  }

  public IntArray getLeft() {
    return left;
  }

  public IntArray getRight() {
    return right;
  }

  public long getLeftKey() {
    return leftKey;
  }

  public long getRightKey() {
    return rightKey;
  }

  @Override
  public String toString() {
    return String.format("Split left=[%s] (%s) right=[%s] (%s)", left, CellIds.toString(leftKey),
        right, CellIds.toString(rightKey));
  }
}
