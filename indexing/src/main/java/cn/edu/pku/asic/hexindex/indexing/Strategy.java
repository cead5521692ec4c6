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

/**
 * The operators that a search through the cell index can be driven by. Each one carries the strategy number
 * that host access methods use to identify it.
 */
public enum Strategy {
  /**The indexed cell and the query share any area*/
  OVERLAP(3),
  /**The indexed cell contains the query*/
  CONTAINS(7),
  /**The indexed cell is contained by the query*/
  CONTAINED_BY(8),
  /**Order the indexed cells by their grid distance to the query*/
  NEAREST_NEIGHBOR(15);

  private final int code;

  Strategy(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  /**
   * Whether this strategy orders the results rather than filtering them.
   * @return {@code true} for the nearest-neighbor strategy
   */
  public boolean isOrdering() {
    return this == NEAREST_NEIGHBOR;
  }

  /**
   * Resolves a host strategy number.
   * @param code the strategy number
   * @return the matching strategy
   * @throws IllegalArgumentException if the number does not denote any supported strategy
   */
  public static Strategy fromCode(int code) {
    for (Strategy strategy : values()) {
      if (strategy.code == code)
        return strategy;
    }
    throw new IllegalArgumentException(String.format("Unrecognized strategy number: %d", code));
  }
}
