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
import cn.edu.pku.asic.hexindex.dggs.core.CellHierarchy;
import cn.edu.pku.asic.hexindex.dggs.core.CellHierarchyException;
import cn.edu.pku.asic.hexindex.dggs.core.CellIds;
import com.google.common.base.Preconditions;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Computes lowest common ancestors in the forest of cells, where each base cell roots a tree of depth 16.
 * The finest common ancestor of a set of cells is the bounding key of an index node that holds them.
 */
public class AncestorEngine {
  private static final Log LOG = LogFactory.getLog(AncestorEngine.class);

  protected final CellHierarchy hierarchy;

  public AncestorEngine(CellHierarchy hierarchy) {
    this.hierarchy = Preconditions.checkNotNull(hierarchy, "hierarchy");
  }

  /**
   * The finest cell that is an ancestor of (or equal to) both given cells.
   * @param a the first cell
   * @param b the second cell
   * @return the common ancestor, or {@link CellIds#SENTINEL} if the cells lie under different base cells
   */
  public long finestCommonAncestor(long a, long b) {
    if (a == b)
      return a;
    if (CellIds.isSentinel(a) || CellIds.isSentinel(b))
      return CellIds.SENTINEL;
    // Different trees of the forest
    if (hierarchy.baseCell(a) != hierarchy.baseCell(b))
      return CellIds.SENTINEL;

    int coarsestRes = Math.min(hierarchy.resolution(a), hierarchy.resolution(b));
    for (int res = coarsestRes; res >= 0; res--) {
      long aParent, bParent;
      try {
        aParent = hierarchy.ancestorAt(a, res);
        bParent = hierarchy.ancestorAt(b, res);
      } catch (CellHierarchyException e) {
        // No ancestor at this level, try the next coarser one
        LOG.debug(String.format("Skipping resolution %d: %s", res, e.getMessage()));
        continue;
      }
      if (aParent == bParent)
        return aParent;
    }
    return CellIds.SENTINEL;
  }

  /**
   * Folds a list of cells into their finest common ancestor, left to right.
   * @param cells the cells to fold, at least one
   * @return the minimal bounding key of all the cells
   */
  public long union(long ... cells) {
    Preconditions.checkArgument(cells.length > 0, "Cannot compute the union of an empty set of cells");
    long out = cells[0];
    for (int i = 1; i < cells.length; i++)
      out = finestCommonAncestor(out, cells[i]);
    return out;
  }

  /**
   * Folds the cells at the given positions into their finest common ancestor.
   * @param cells all the cells
   * @param positions the positions in {@code cells} to fold, at least one
   * @return the minimal bounding key of the selected cells
   */
  public long union(long[] cells, IntArray positions) {
    Preconditions.checkArgument(!positions.isEmpty(), "Cannot compute the union of an empty set of cells");
    long out = cells[positions.get(0)];
    for (int i = 1; i < positions.size(); i++)
      out = finestCommonAncestor(out, cells[positions.get(i)]);
    return out;
  }
}
