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

import cn.edu.pku.asic.hexindex.common.cli.IndexOptions;
import cn.edu.pku.asic.hexindex.common.cli.OperationParam;
import cn.edu.pku.asic.hexindex.common.utils.IConfigurable;
import cn.edu.pku.asic.hexindex.dggs.core.CellHierarchy;
import cn.edu.pku.asic.hexindex.dggs.core.CellIds;
import com.google.common.base.Preconditions;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * The operations a balanced search tree calls to index cell identifiers: the search-descent predicate, bounding-key
 * union, insertion penalty, node split, key identity, and nearest-neighbor distance.
 * All operations are pure functions of their arguments and can be called concurrently.
 */
public class CellIndexOperations implements IConfigurable {
  private static final Log LOG = LogFactory.getLog(CellIndexOperations.class);

  @OperationParam(
      description = "Reject identifiers that are not valid cells before using them",
      defaultValue = "false"
  )
  public static final String ValidateCells = "hexindex.validateCells";

  /**Every positive answer of {@link #consistent(long, long, Strategy, boolean)} needs an exact recheck*/
  public static final boolean RECHECK = true;

  protected final CellHierarchy hierarchy;

  protected final AncestorEngine ancestors;

  protected final ContainmentComparator comparator;

  protected final QuadraticCellSplit splitter;

  protected final DistanceEstimator distanceEstimator;

  /**Whether incoming identifiers are validated*/
  protected boolean validateCells;

  public CellIndexOperations(CellHierarchy hierarchy) {
    this.hierarchy = Preconditions.checkNotNull(hierarchy, "hierarchy");
    this.ancestors = new AncestorEngine(hierarchy);
    this.comparator = new ContainmentComparator(hierarchy);
    this.splitter = new QuadraticCellSplit(hierarchy, ancestors, comparator);
    this.distanceEstimator = new DistanceEstimator(hierarchy);
  }

  public CellIndexOperations(CellHierarchy hierarchy, IndexOptions opts) {
    this(hierarchy);
    setup(opts);
  }

  @Override
  public void setup(IndexOptions opts) {
    this.validateCells = opts.getBoolean(ValidateCells, false);
    LOG.debug(String.format("Cell validation is %s", validateCells ? "on" : "off"));
  }

  public CellHierarchy getHierarchy() {
    return hierarchy;
  }

  public boolean isValidateCells() {
    return validateCells;
  }

  public long finestCommonAncestor(long a, long b) {
    checkCell(a);
    checkCell(b);
    return ancestors.finestCommonAncestor(a, b);
  }

  public Containment compare(long a, long b) {
    checkCell(a);
    checkCell(b);
    return comparator.compare(a, b);
  }

  /**
   * Tests whether the subtree under {@code key} may hold values that satisfy the operator with the query.
   * @param key the bounding key or leaf value
   * @param query the query cell
   * @param strategy the search operator
   * @param leaf whether {@code key} is a leaf entry
   * @return {@code false} if no value under the key can match; {@code true} results need a {@link #RECHECK}
   */
  public boolean consistent(long key, long query, Strategy strategy, boolean leaf) {
    checkCell(key);
    checkCell(query);
    return comparator.consistent(key, query, strategy, leaf);
  }

  public boolean consistent(long key, long query, int strategyCode, boolean leaf) {
    return consistent(key, query, Strategy.fromCode(strategyCode), leaf);
  }

  /**
   * Exact evaluation of a search operator against a stored value.
   */
  public boolean recheck(long value, long query, Strategy strategy) {
    checkCell(value);
    checkCell(query);
    return comparator.matches(value, query, strategy);
  }

  /**
   * The minimal bounding key of a set of cells.
   * @param cells the cells, at least one
   * @return their finest common ancestor
   */
  public long union(long ... cells) {
    for (long cell : cells)
      checkCell(cell);
    return ancestors.union(cells);
  }

  /**
   * The cost of adding a new cell to the subtree bounded by {@code existingKey}, measured as the number of
   * resolution levels the key has to be generalized by.
   * @param existingKey the current bounding key
   * @param newCell the cell to insert
   * @return zero if the key already contains the cell, a positive number otherwise
   */
  public float penalty(long existingKey, long newCell) {
    checkCell(existingKey);
    checkCell(newCell);
    long ancestor = ancestors.finestCommonAncestor(existingKey, newCell);
    return (float) hierarchy.resolution(existingKey) - hierarchy.resolution(ancestor);
  }

  /**
   * Splits the keys of an overflowing node into two groups.
   * @param keys the keys, at least two
   * @return the split
   */
  public CellSplit pickSplit(long[] keys) {
    for (long key : keys)
      checkCell(key);
    return splitter.split(keys);
  }

  public boolean same(long a, long b) {
    return a == b;
  }

  /**
   * Estimates the distance from a key to the query for an ordered search.
   * @see DistanceEstimator#distance(long, long, Strategy)
   */
  public double distance(long key, long query, Strategy strategy) {
    checkCell(key);
    checkCell(query);
    return distanceEstimator.distance(key, query, strategy);
  }

  public double distance(long key, long query, int strategyCode) {
    return distance(key, query, Strategy.fromCode(strategyCode));
  }

  protected void checkCell(long cell) {
    if (validateCells && !CellIds.isSentinel(cell))
      Preconditions.checkArgument(hierarchy.isValidCell(cell), "Invalid cell identifier %s", CellIds.toString(cell));
  }
}
