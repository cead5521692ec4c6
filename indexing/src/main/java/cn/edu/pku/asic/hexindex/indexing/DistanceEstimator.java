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

import cn.edu.pku.asic.hexindex.dggs.core.CellHierarchy;
import cn.edu.pku.asic.hexindex.dggs.core.CellHierarchyException;
import cn.edu.pku.asic.hexindex.dggs.core.CellIds;
import com.google.common.base.Preconditions;

/**
 * Estimates the distance from a bounding key to a query cell to drive a nearest-first traversal.
 */
public class DistanceEstimator {
  /**Returned for strategies that do not order the results*/
  public static final double NO_DISTANCE = -1;

  protected final CellHierarchy hierarchy;

  public DistanceEstimator(CellHierarchy hierarchy) {
    this.hierarchy = Preconditions.checkNotNull(hierarchy, "hierarchy");
  }

  /**
   * The grid distance between the query and the center child of the key at the query's resolution.
   * @param key a bounding key or a stored cell, not finer than the query
   * @param query the query cell
   * @param strategy the ordering strategy
   * @return the estimated distance in grid steps, or {@link #NO_DISTANCE} for a non-ordering strategy
   * @throws IllegalStateException if the hierarchy cannot compute the center child or the distance
   */
  public double distance(long key, long query, Strategy strategy) {
    return switch (strategy) {
      case NEAREST_NEIGHBOR -> gridDistanceToCenterChild(key, query);
      case OVERLAP, CONTAINS, CONTAINED_BY -> NO_DISTANCE;
    };
  }

  private double gridDistanceToCenterChild(long key, long query) {
    try {
      long child = hierarchy.centerChildAt(key, hierarchy.resolution(query));
      return hierarchy.gridDistance(query, child);
    } catch (CellHierarchyException e) {
      throw new IllegalStateException(String.format("Cannot estimate the distance from key %s to query %s",
          CellIds.toString(key), CellIds.toString(query)), e);
    }
  }
}
