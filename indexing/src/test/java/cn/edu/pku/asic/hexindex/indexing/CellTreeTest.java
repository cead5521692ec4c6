package cn.edu.pku.asic.hexindex.indexing;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cn.edu.pku.asic.hexindex.common.cli.IndexOptions;
import cn.edu.pku.asic.hexindex.common.utils.IntArray;
import cn.edu.pku.asic.hexindex.dggs.core.CellIds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class CellTreeTest {

  private TestCells cells;
  private CellIndexOperations operations;
  /**The resolution-6 cell that holds all the test data*/
  private long base;
  /**The center of the test data at resolution 9*/
  private long origin;
  /**All resolution-9 descendants of the base cell, the origin first*/
  private List<Long> disk;

  @BeforeEach
  public void setUp() {
    cells = new TestCells();
    operations = new CellIndexOperations(cells.hierarchy, new IndexOptions());
    base = cells.center(cells.p3, 6);
    origin = cells.center(base, 9);
    disk = new ArrayList<>();
    disk.add(origin);
    for (long cell : cells.children(base, 9)) {
      if (cell != origin)
        disk.add(cell);
    }
  }

  private CellTree buildTree(int maxCapacity, List<Long> data) {
    CellTree tree = new CellTree(operations, maxCapacity);
    for (int i = 0; i < data.size(); i++)
      assertEquals(i, tree.insert(data.get(i)));
    return tree;
  }

  private List<Long> mixedResolutions() {
    List<Long> data = new ArrayList<>(disk);
    Set<Long> coarse = new HashSet<>();
    for (int i = 0; i < disk.size(); i += 20)
      coarse.add(cells.parent(disk.get(i), 8));
    data.addAll(coarse);
    data.addAll(cells.children(base, 7));
    return data;
  }

  private IntArray bruteForce(List<Long> data, long query, Strategy strategy) {
    IntArray expected = new IntArray();
    for (int i = 0; i < data.size(); i++) {
      if (operations.recheck(data.get(i), query, strategy))
        expected.add(i);
    }
    return expected;
  }

  @Test
  public void testEmptyTree() {
    CellTree tree = new CellTree(operations, 4);
    assertEquals(0, tree.numOfDataEntries());
    assertEquals(0, tree.getHeight());
    assertEquals(CellIds.SENTINEL, tree.getRootKey());
    assertTrue(tree.search(origin, Strategy.OVERLAP).isEmpty());
    assertTrue(tree.nearest(origin, 3).isEmpty());
    assertTrue(tree.isValid());
  }

  @Test
  public void testInsertionAndStructure() {
    List<Long> data = mixedResolutions();
    CellTree tree = buildTree(4, data);
    assertEquals(data.size(), tree.numOfDataEntries());
    assertTrue(tree.getHeight() >= 2);
    assertTrue(tree.isValid());
    long[] all = new long[data.size()];
    for (int i = 0; i < all.length; i++) {
      all[i] = data.get(i);
      assertEquals(all[i], tree.getCell(i));
    }
    assertEquals(operations.union(all), tree.getRootKey());
  }

  @Test
  public void testSearchMatchesBruteForce() {
    List<Long> data = mixedResolutions();
    CellTree tree = buildTree(4, data);
    long[] queries = {origin, cells.parent(origin, 7), cells.parent(origin, 8), base, cells.p3,
        disk.get(disk.size() - 1), cells.parent(disk.get(100), 8), cells.siblings4[0], cells.sydney5};
    for (long query : queries) {
      for (Strategy strategy : new Strategy[] {Strategy.OVERLAP, Strategy.CONTAINS, Strategy.CONTAINED_BY}) {
        assertArrayEquals(bruteForce(data, query, strategy).toArray(), tree.search(query, strategy).toArray(),
            String.format("%s %s", strategy, CellIds.toString(query)));
      }
    }
  }

  @Test
  public void testSearchContainedBy() {
    List<Long> data = mixedResolutions();
    CellTree tree = buildTree(5, data);
    // Everything in the data lies under the base cell
    IntArray all = tree.search(base, Strategy.CONTAINED_BY);
    assertEquals(data.size(), all.size());
    assertEquals(base, tree.getRootKey());
    // Strictly contained, so the origin is found under its parent but not under itself
    IntArray underParent = tree.search(cells.parent(origin, 8), Strategy.CONTAINED_BY);
    assertEquals(0, underParent.get(0));
    assertTrue(tree.search(origin, Strategy.CONTAINED_BY).isEmpty());
  }

  @Test
  public void testSeveralBaseCells() {
    List<Long> data = new ArrayList<>(disk.subList(0, 30));
    data.add(cells.sydney5);
    data.add(cells.center(cells.sydney5, 9));
    CellTree tree = buildTree(3, data);
    assertTrue(tree.isValid());
    assertEquals(CellIds.SENTINEL, tree.getRootKey());
    IntArray found = tree.search(cells.sydney5, Strategy.OVERLAP);
    assertArrayEquals(new int[] {30, 31}, found.toArray());
  }

  @Test
  public void testNearestFirstResultIsTheQuery() {
    CellTree tree = buildTree(4, disk);
    IntArray nearest = tree.nearest(origin, 10);
    assertEquals(10, nearest.size());
    assertEquals(0, nearest.get(0));
    Set<Integer> distinct = new HashSet<>();
    for (int id : nearest)
      distinct.add(id);
    assertEquals(10, distinct.size());
    // Asking for more than available returns everything once
    assertEquals(disk.size(), tree.nearest(origin, disk.size() + 5).size());
  }

  @Test
  public void testNearestOrderInOneLeaf() {
    CellTree tree = buildTree(disk.size(), disk);
    assertEquals(0, tree.getHeight());
    IntArray nearest = tree.nearest(origin, disk.size());
    assertEquals(disk.size(), nearest.size());
    long previous = -1;
    for (int id : nearest) {
      long distance = cells.h3.gridDistance(origin, tree.getCell(id));
      assertTrue(distance >= previous);
      previous = distance;
    }
    // The origin and its six neighbors
    IntArray closest = tree.nearest(origin, 7);
    assertEquals(0, closest.get(0));
    for (int id : closest)
      assertTrue(cells.h3.gridDistance(origin, tree.getCell(id)) <= 1);
  }

  @Test
  public void testNearestMatchesSortedDistancesAcrossLevels() {
    long neighbor = base;
    for (long cell : cells.h3.gridDisk(base, 1)) {
      if (cell != base) {
        neighbor = cell;
        break;
      }
    }
    List<Long> data = new ArrayList<>(disk);
    data.addAll(cells.children(neighbor, 9));
    CellTree tree = buildTree(8, data);
    assertTrue(tree.getHeight() >= 2);
    int k = 30;
    for (int q = 0; q < data.size(); q += 7) {
      long query = data.get(q);
      long[] expected = new long[data.size()];
      for (int i = 0; i < expected.length; i++)
        expected[i] = cells.h3.gridDistance(query, data.get(i));
      Arrays.sort(expected);
      IntArray nearest = tree.nearest(query, k);
      assertEquals(k, nearest.size());
      for (int i = 0; i < k; i++) {
        assertEquals(expected[i], cells.h3.gridDistance(query, tree.getCell(nearest.get(i))),
            String.format("Result #%d for query %s", i, CellIds.toString(query)));
      }
    }
  }

  @Test
  public void testNearestWithCellsInTwoRegions() {
    List<Long> data = new ArrayList<>(disk.subList(0, 20));
    long sydney = cells.center(cells.sydney5, 9);
    data.add(sydney);
    CellTree tree = buildTree(4, data);
    assertArrayEquals(new int[] {0}, tree.nearest(origin, 1).toArray());
    assertArrayEquals(new int[] {20}, tree.nearest(sydney, 1).toArray());
    // The far away cell comes after all the reachable ones
    IntArray all = tree.nearest(origin, data.size());
    assertEquals(data.size(), all.size());
    assertEquals(20, all.get(data.size() - 1));
  }

  @Test
  public void testNearestToCoarseQuery() {
    CellTree tree = buildTree(4, disk);
    long query = cells.parent(origin, 7);
    IntArray nearest = tree.nearest(query, 5);
    assertEquals(5, nearest.size());
    for (int id : nearest)
      assertEquals(query, cells.parent(tree.getCell(id), 7));
  }

  @Test
  public void testCapacityFromOptions() {
    CellTree tree = new CellTree(operations, new IndexOptions().with(CellTree.MaxCapacity, 2));
    for (long cell : disk.subList(0, 20))
      tree.insert(cell);
    assertTrue(tree.isValid());
    assertTrue(tree.getHeight() >= 3);
  }

  @Test
  public void testInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new CellTree(operations, 1));
    CellTree tree = buildTree(4, disk.subList(0, 5));
    assertThrows(IllegalArgumentException.class, () -> tree.search(origin, Strategy.NEAREST_NEIGHBOR));
    assertThrows(IllegalArgumentException.class, () -> tree.nearest(origin, 0));
    assertThrows(IndexOutOfBoundsException.class, () -> tree.getCell(5));
  }
}
