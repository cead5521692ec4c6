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
 * Node split with quadratic seed selection, following Guttman's R-tree quadratic split. The area of a rectangle is
 * replaced by the number of fine cells that a bounding key claims, so the most wasteful pair becomes the seeds and
 * every other entry goes to the group whose key has to be generalized the least.
 */
public class QuadraticCellSplit {
  private static final Log LOG = LogFactory.getLog(QuadraticCellSplit.class);

  protected final CellHierarchy hierarchy;

  protected final AncestorEngine ancestors;

  protected final ContainmentComparator comparator;

  public QuadraticCellSplit(CellHierarchy hierarchy, AncestorEngine ancestors, ContainmentComparator comparator) {
    this.hierarchy = Preconditions.checkNotNull(hierarchy, "hierarchy");
    this.ancestors = Preconditions.checkNotNull(ancestors, "ancestors");
    this.comparator = Preconditions.checkNotNull(comparator, "comparator");
  }

  /**
   * Splits a list of keys into two non-empty groups. The result only depends on the keys and their order.
   * @param keys the keys of all the entries of the overflowing node
   * @return the two groups as positions in {@code keys} with their bounding keys
   */
  public CellSplit split(long[] keys) {
    Preconditions.checkArgument(keys.length >= 2, "Cannot split %s entries", keys.length);
    // Pick seeds
    // For each pair of entries, compute the waste of grouping them together and choose the most wasteful pair
    int seed1 = -1, seed2 = -1;
    long maxWaste = -1;
    for (int i1 = 0; i1 < keys.length; i1++) {
      for (int i2 = i1 + 1; i2 < keys.length; i2++) {
        long waste = waste(keys[i1], keys[i2]);
        if (waste > maxWaste) {
          maxWaste = waste;
          seed1 = i1;
          seed2 = i2;
        }
      }
    }

    IntArray group1 = new IntArray();
    IntArray group2 = new IntArray();
    group1.add(seed1);
    group2.add(seed2);
    long key1 = keys[seed1];
    long key2 = keys[seed2];
    for (int i = 0; i < keys.length; i++) {
      if (i == seed1 || i == seed2)
        continue;
      long ancestor1 = ancestors.finestCommonAncestor(key1, keys[i]);
      long ancestor2 = ancestors.finestCommonAncestor(key2, keys[i]);
      int d1 = hierarchy.resolution(key1) - hierarchy.resolution(ancestor1);
      int d2 = hierarchy.resolution(key2) - hierarchy.resolution(ancestor2);
      // Least growth first, then the group with fewer entries, then the left group
      boolean chooseGroup1 = d1 != d2 ? d1 < d2 : group1.size() <= group2.size();
      if (chooseGroup1) {
        group1.add(i);
        key1 = ancestor1;
      } else {
        group2.add(i);
        key2 = ancestor2;
      }
    }

    CellSplit split = new CellSplit(group1, group2, ancestors.union(keys, group1), ancestors.union(keys, group2));
    if (LOG.isDebugEnabled())
      LOG.debug(String.format("Split %d entries with seeds %d and %d (waste %d) into %d and %d entries",
          keys.length, seed1, seed2, maxWaste, group1.size(), group2.size()));
    return split;
  }

  /**
   * The number of cells at the finer resolution of the two that their common ancestor covers beyond the cells they
   * cover themselves. Zero if one of them contains the other.
   * @param a the first key
   * @param b the second key
   * @return the waste of grouping both keys under one bounding key
   */
  public long waste(long a, long b) {
    if (comparator.compare(a, b) != Containment.DISJOINT)
      return 0;
    long ancestor = ancestors.finestCommonAncestor(a, b);
    // The descendants of the world root are not countable
    if (CellIds.isSentinel(ancestor))
      return 0;
    int res = Math.max(hierarchy.resolution(a), hierarchy.resolution(b));
    try {
      return hierarchy.descendantCountAt(ancestor, res) - hierarchy.descendantCountAt(a, res)
          - hierarchy.descendantCountAt(b, res);
    } catch (CellHierarchyException e) {
      LOG.debug(String.format("No waste computed for %s and %s: %s", CellIds.toString(a), CellIds.toString(b),
          e.getMessage()));
      return 0;
    }
  }
}
