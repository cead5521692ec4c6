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
import cn.edu.pku.asic.hexindex.common.utils.IntArray;
import cn.edu.pku.asic.hexindex.dggs.core.CellHierarchy;
import cn.edu.pku.asic.hexindex.dggs.core.CellHierarchyException;
import cn.edu.pku.asic.hexindex.dggs.core.CellIds;
import com.google.common.base.Preconditions;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.PriorityQueue;

/**
 * An in-memory balanced tree over cell identifiers that is organized entirely by {@link CellIndexOperations}.
 * Every node carries a bounding key, the finest common ancestor of all cells below it. Insertion descends to the
 * child with the least penalty, an overflowing node is split with the quadratic cell split, and searches prune the
 * subtrees whose keys are not consistent with the query.
 *
 * Data entries and nodes are numbered separately. Entry IDs are assigned in insertion order starting at zero.
 * The tree is not thread-safe.
 */
public class CellTree {
  private static final Log LOG = LogFactory.getLog(CellTree.class);

  @OperationParam(
      description = "Maximum number of entries in one node of the tree",
      defaultValue = "16"
  )
  public static final String MaxCapacity = "hexindex.tree.maxCapacity";

  /** Maximum capacity of a node (M) */
  protected final int maxCapacity;

  protected final CellIndexOperations operations;

  /**The cells of all data entries indexed by entry ID*/
  protected long[] cells;

  /**Total number of data entries*/
  protected int numEntries;

  /**The bounding keys of all nodes indexed by node ID*/
  protected long[] nodeKeys;

  /**Which nodes are leaves. Children of leaves are entry IDs, children of other nodes are node IDs*/
  protected boolean[] isLeaf;

  /**The children of each node*/
  protected List<IntArray> children;

  /**Total number of nodes*/
  protected int numNodes;

  /**The index of the root in the list of nodes, -1 while the tree is empty*/
  protected int root = -1;

  /**
   * Construct a new empty tree.
   * @param operations the index operations that organize the tree
   * @param maxCapacity maximum number of children in a node
   */
  public CellTree(CellIndexOperations operations, int maxCapacity) {
    Preconditions.checkArgument(maxCapacity >= 2, "Invalid maxCapacity=%s. A node must hold at least two entries",
        maxCapacity);
    this.operations = Preconditions.checkNotNull(operations, "operations");
    this.maxCapacity = maxCapacity;
    this.cells = new long[16];
    this.nodeKeys = new long[16];
    this.isLeaf = new boolean[16];
    this.children = new ArrayList<>();
  }

  public CellTree(CellIndexOperations operations, IndexOptions opts) {
    this(operations, opts.getInt(MaxCapacity, 16));
    LOG.info(String.format("Created a cell tree with maxCapacity=%d", maxCapacity));
  }

  /**
   * Inserts a cell in the tree.
   * @param cell the cell to insert
   * @return the ID of the new data entry
   */
  public int insert(long cell) {
    operations.checkCell(cell);
    int iEntry = Entry_create(cell);
    if (root == -1) {
      root = Node_createNodeWithChildren(true, iEntry);
      return iEntry;
    }
    // The path from the root to the leaf that receives the entry. Used for splitting.
    IntArray path = new IntArray();
    int iCurrentVisitedNode = root;
    path.add(iCurrentVisitedNode);
    while (!isLeaf[iCurrentVisitedNode]) {
      iCurrentVisitedNode = chooseSubtree(cell, iCurrentVisitedNode);
      path.add(iCurrentVisitedNode);
    }
    Node_addChild(iCurrentVisitedNode, iEntry);
    adjustTree(path);
    return iEntry;
  }

  /**
   * Chooses the child of the given node that needs the least generalization of its key to hold the cell.
   * Ties go to the first such child.
   * @param cell the cell being inserted
   * @param iNode a non-leaf node
   * @return the ID of the chosen child node
   */
  protected int chooseSubtree(long cell, int iNode) {
    float minPenalty = Float.POSITIVE_INFINITY;
    int iBestChild = -1;
    for (int iCandidateChild : children.get(iNode)) {
      float penalty = operations.penalty(nodeKeys[iCandidateChild], cell);
      if (penalty < minPenalty) {
        minPenalty = penalty;
        iBestChild = iCandidateChild;
      }
    }
    assert iBestChild != -1;
    return iBestChild;
  }

  /**
   * Adjusts the tree after an insertion by recomputing the bounding keys and making the necessary splits up to the
   * root.
   * @param path the path from the root to the leaf node where the insertion happened
   */
  protected void adjustTree(IntArray path) {
    int newNode = -1;
    for (int $i = path.size() - 1; $i >= 0; $i--) {
      int iNode = path.get($i);
      if (newNode != -1) {
        // The child below was split, its new sibling goes next to it
        Node_addChild(iNode, newNode);
        newNode = -1;
      }
      if (Node_size(iNode) > maxCapacity)
        newNode = split(iNode);
      else
        Node_recalculateKey(iNode);
      if ($i == 0 && newNode != -1) {
        // The root is split, create a new root
        root = Node_createNodeWithChildren(false, iNode, newNode);
      }
    }
  }

  /**
   * Splits an overflowing node. The node keeps the left group and a new node receives the right group.
   * @param iNode the node to split
   * @return the ID of the new node
   */
  protected int split(int iNode) {
    IntArray nodeChildren = children.get(iNode);
    long[] keys = new long[nodeChildren.size()];
    for (int i = 0; i < keys.length; i++)
      keys[i] = Object_key(iNode, nodeChildren.get(i));
    CellSplit split = operations.pickSplit(keys);

    IntArray leftChildren = new IntArray();
    for (int position : split.getLeft())
      leftChildren.add(nodeChildren.get(position));
    IntArray rightChildren = new IntArray();
    for (int position : split.getRight())
      rightChildren.add(nodeChildren.get(position));

    children.set(iNode, leftChildren);
    nodeKeys[iNode] = split.getLeftKey();
    int iNewNode = Node_createNodeWithChildren(isLeaf[iNode], rightChildren.toArray());
    LOG.debug(String.format("Split node #%d into #%d and #%d", iNode, iNode, iNewNode));
    return iNewNode;
  }

  /**
   * Searches for all the entries that satisfy the operator with the query cell.
   * @param query the query cell
   * @param strategy a filtering operator
   * @return the IDs of the matching entries in increasing order
   */
  public IntArray search(long query, Strategy strategy) {
    Preconditions.checkArgument(!strategy.isOrdering(), "Use nearest() for the %s strategy", strategy);
    IntArray results = new IntArray();
    if (root == -1)
      return results;
    IntArray nodesToSearch = new IntArray();
    nodesToSearch.add(root);
    int numVisitedNodes = 0;
    while (!nodesToSearch.isEmpty()) {
      int nodeToSearch = nodesToSearch.pop();
      numVisitedNodes++;
      if (isLeaf[nodeToSearch]) {
        for (int iEntry : children.get(nodeToSearch)) {
          if (operations.consistent(cells[iEntry], query, strategy, true)
              && (!CellIndexOperations.RECHECK || operations.recheck(cells[iEntry], query, strategy)))
            results.add(iEntry);
        }
      } else {
        // A non-leaf node, expand the search to all consistent children
        for (int iChild : children.get(nodeToSearch)) {
          if (operations.consistent(nodeKeys[iChild], query, strategy, false))
            nodesToSearch.add(iChild);
        }
      }
    }
    results.sort();
    if (LOG.isDebugEnabled())
      LOG.debug(String.format("Search %s %s visited %d of %d nodes and found %d entries", strategy,
          CellIds.toString(query), numVisitedNodes, numNodes, results.size()));
    return results;
  }

  /**
   * Finds the entries nearest to the query cell with a best-first traversal.
   * @param query the query cell
   * @param k the maximum number of entries to return
   * @return the IDs of the nearest entries, nearest first. Entries with no grid distance to the query come last.
   */
  public IntArray nearest(long query, int k) {
    Preconditions.checkArgument(k > 0, "k must be positive, got %s", k);
    operations.checkCell(query);
    IntArray results = new IntArray();
    if (root == -1)
      return results;
    PriorityQueue<Candidate> queue = new PriorityQueue<>();
    queue.add(new Candidate(0, root, false));
    while (!queue.isEmpty() && results.size() < k) {
      Candidate candidate = queue.poll();
      if (candidate.entry) {
        results.add(candidate.id);
      } else if (isLeaf[candidate.id]) {
        for (int iEntry : children.get(candidate.id))
          queue.add(new Candidate(Entry_distance(cells[iEntry], query), iEntry, true));
      } else {
        for (int iChild : children.get(candidate.id))
          queue.add(new Candidate(Node_distance(nodeKeys[iChild], query), iChild, false));
      }
    }
    return results;
  }

  /**
   * Lower bound of the distance from any entry under a node to the query. A key at or below the query's resolution
   * is measured through its ancestor at that resolution, which all the entries under it share. A coarser key, the
   * world key, or a key that contains the query is bounded by zero.
   */
  protected double Node_distance(long key, long query) {
    CellHierarchy hierarchy = operations.getHierarchy();
    if (CellIds.isSentinel(key) || hierarchy.resolution(key) < hierarchy.resolution(query)
        || operations.compare(key, query) == Containment.CONTAINS)
      return 0;
    return Entry_distance(key, query);
  }

  /**
   * Grid distance from a stored cell to the query. A cell finer than the query is measured through its ancestor at
   * the query's resolution. A cell whose distance the hierarchy cannot compute, e.g., one too far away from the
   * query, is ranked last.
   */
  protected double Entry_distance(long cell, long query) {
    CellHierarchy hierarchy = operations.getHierarchy();
    int queryRes = hierarchy.resolution(query);
    try {
      if (hierarchy.resolution(cell) > queryRes)
        cell = hierarchy.ancestorAt(cell, queryRes);
      return operations.distance(cell, query, Strategy.NEAREST_NEIGHBOR);
    } catch (CellHierarchyException e) {
      return Object_unreachable(cell, query, e);
    } catch (IllegalStateException e) {
      if (!(e.getCause() instanceof CellHierarchyException))
        throw e;
      return Object_unreachable(cell, query, e);
    }
  }

  private double Object_unreachable(long cell, long query, Exception e) {
    if (LOG.isDebugEnabled())
      LOG.debug(String.format("No grid distance from %s to %s, ranked last: %s", CellIds.toString(cell),
          CellIds.toString(query), e.getMessage()));
    return Double.POSITIVE_INFINITY;
  }

  /**
   * An item of the nearest-neighbor queue. Entries come before nodes at the same distance.
   */
  protected static class Candidate implements Comparable<Candidate> {
    final double distance;
    final int id;
    final boolean entry;

    Candidate(double distance, int id, boolean entry) {
      this.distance = distance;
      this.id = id;
      this.entry = entry;
    }

    @Override
    public int compareTo(Candidate other) {
      int diff = Double.compare(this.distance, other.distance);
      if (diff != 0)
        return diff;
      if (this.entry != other.entry)
        return this.entry ? -1 : 1;
      return Integer.compare(this.id, other.id);
    }
  }

  /**
   * The cell stored in a data entry.
   * @param iEntry the entry ID
   * @return the cell
   */
  public long getCell(int iEntry) {
    Preconditions.checkElementIndex(iEntry, numEntries, "entry");
    return cells[iEntry];
  }

  /**
   * The bounding key of the root, i.e., the finest common ancestor of all the cells in the tree.
   * @return the root key, or {@link CellIds#SENTINEL} if the tree is empty or spans several base cells
   */
  public long getRootKey() {
    return root == -1 ? CellIds.SENTINEL : nodeKeys[root];
  }

  public int numOfDataEntries() {
    return numEntries;
  }

  public int numOfNodes() {
    return numNodes;
  }

  /**
   * Computes the height of the tree as the number of edges from the root to any leaf.
   * @return the height of the tree (number of levels - 1)
   */
  public int getHeight() {
    if (root == -1)
      return 0;
    int height = 0;
    int iNode = root;
    while (!isLeaf[iNode]) {
      height++;
      iNode = children.get(iNode).get(0);
    }
    return height;
  }

  /**
   * Checks the structural invariants of the tree: every node other than the root holds between 1 and maxCapacity
   * children, all leaves are at the same depth, and every key equals the union of its children's keys.
   * @return {@code true} if the tree is valid
   */
  public boolean isValid() {
    if (root == -1)
      return true;
    return Node_isValid(root, getHeight());
  }

  private boolean Node_isValid(int iNode, int depthToLeaves) {
    int size = Node_size(iNode);
    if (size == 0 || size > maxCapacity)
      return false;
    if (isLeaf[iNode] != (depthToLeaves == 0))
      return false;
    long[] keys = new long[size];
    for (int i = 0; i < size; i++) {
      int iChild = children.get(iNode).get(i);
      keys[i] = Object_key(iNode, iChild);
      if (!isLeaf[iNode] && !Node_isValid(iChild, depthToLeaves - 1))
        return false;
    }
    return operations.union(keys) == nodeKeys[iNode];
  }

  protected int Entry_create(long cell) {
    if (numEntries == cells.length)
      cells = Arrays.copyOf(cells, cells.length * 2);
    cells[numEntries] = cell;
    return numEntries++;
  }

  /**
   * Creates a new node that contains the given children and returns the ID of that node.
   * @param leaf set to true to create a leaf node
   * @param iChildren the IDs of all children in this node
   * @return the id of the new node created.
   */
  protected int Node_createNodeWithChildren(boolean leaf, int ... iChildren) {
    if (numNodes == nodeKeys.length) {
      nodeKeys = Arrays.copyOf(nodeKeys, nodeKeys.length * 2);
      isLeaf = Arrays.copyOf(isLeaf, isLeaf.length * 2);
    }
    int iNewNode = numNodes++;
    isLeaf[iNewNode] = leaf;
    IntArray nodeChildren = new IntArray();
    nodeChildren.append(iChildren, 0, iChildren.length);
    children.add(nodeChildren);
    Node_recalculateKey(iNewNode);
    return iNewNode;
  }

  protected void Node_addChild(int iNode, int iNewChild) {
    children.get(iNode).add(iNewChild);
  }

  protected int Node_size(int iNode) {
    return children.get(iNode).size();
  }

  protected void Node_recalculateKey(int iNode) {
    IntArray nodeChildren = children.get(iNode);
    long key = Object_key(iNode, nodeChildren.get(0));
    for (int i = 1; i < nodeChildren.size(); i++)
      key = operations.finestCommonAncestor(key, Object_key(iNode, nodeChildren.get(i)));
    nodeKeys[iNode] = key;
  }

  /**
   * The key of a child of the given node: the stored cell for a leaf, the bounding key otherwise.
   */
  protected long Object_key(int iParent, int iChild) {
    return isLeaf[iParent] ? cells[iChild] : nodeKeys[iChild];
  }
}
