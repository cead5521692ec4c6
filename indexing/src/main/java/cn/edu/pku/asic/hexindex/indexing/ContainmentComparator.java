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
 * Decides how two cells relate in the hierarchy and answers the search-descent predicate of the index.
 */
public class ContainmentComparator {

  protected final CellHierarchy hierarchy;

  public ContainmentComparator(CellHierarchy hierarchy) {
    this.hierarchy = Preconditions.checkNotNull(hierarchy, "hierarchy");
  }

  /**
   * Compares two cells.
   * @param a the first cell, typically a bounding key
   * @param b the second cell, typically the query
   * @return how {@code a} relates to {@code b}
   */
  public Containment compare(long a, long b) {
    if (a == b)
      return Containment.CONTAINS;
    // The sentinel as a key bounds cells from several base cells, i.e., the whole world
    if (CellIds.isSentinel(a))
      return Containment.CONTAINS;
    if (CellIds.isSentinel(b))
      return Containment.CONTAINED_BY;
    if (hierarchy.baseCell(a) != hierarchy.baseCell(b))
      return Containment.DISJOINT;

    int aRes = hierarchy.resolution(a);
    int bRes = hierarchy.resolution(b);
    if (aRes < bRes && isAncestor(a, b, aRes))
      return Containment.CONTAINS;
    if (aRes > bRes && isAncestor(b, a, bRes))
      return Containment.CONTAINED_BY;
    return Containment.DISJOINT;
  }

  /**
   * Tests whether the ancestor of {@code cell} at the given resolution is {@code ancestor}. A hierarchy error counts
   * as no match.
   */
  private boolean isAncestor(long ancestor, long cell, int resolution) {
    try {
      return hierarchy.ancestorAt(cell, resolution) == ancestor;
    } catch (CellHierarchyException e) {
      return false;
    }
  }

  /**
   * The search-descent predicate. A {@code false} answer means no value under {@code key} can satisfy the operator;
   * a {@code true} answer is approximate and must be rechecked against the stored value.
   * @param key the bounding key of a node, or the stored value itself for a leaf entry
   * @param query the query cell
   * @param strategy the operator of the search
   * @param leaf whether {@code key} is a leaf entry
   * @return {@code false} if the subtree can be skipped
   */
  public boolean consistent(long key, long query, Strategy strategy, boolean leaf) {
    Containment containment = compare(key, query);
    return switch (strategy) {
      case OVERLAP -> containment != Containment.DISJOINT;
      case CONTAINS -> containment == Containment.CONTAINS;
      // An internal key only approximates its subtree so any overlap has to be explored
      case CONTAINED_BY -> leaf ? containment == Containment.CONTAINED_BY : containment != Containment.DISJOINT;
      case NEAREST_NEIGHBOR -> throw new IllegalArgumentException(
          "The nearest-neighbor strategy orders the results and cannot be used as a search predicate");
    };
  }

  /**
   * Evaluates the operator exactly on a stored value.
   * @param value the stored cell
   * @param query the query cell
   * @param strategy the operator
   * @return {@code true} if the value satisfies the operator
   */
  public boolean matches(long value, long query, Strategy strategy) {
    return consistent(value, query, strategy, true);
  }
}
