package cn.edu.pku.asic.hexindex.indexing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cn.edu.pku.asic.hexindex.dggs.core.CellIds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ContainmentComparatorTest {

  private TestCells cells;
  private ContainmentComparator comparator;

  @BeforeEach
  public void setUp() {
    cells = new TestCells();
    comparator = new ContainmentComparator(cells.hierarchy);
  }

  @Test
  public void testSelfContainment() {
    for (long cell : new long[] {cells.p1, cells.p3, cells.center4, cells.cousin5, cells.sydney5})
      assertEquals(Containment.CONTAINS, comparator.compare(cell, cell));
  }

  @Test
  public void testAncestorAndDescendant() {
    long fine = cells.center(cells.siblings4[1], 8);
    assertEquals(Containment.CONTAINS, comparator.compare(cells.p3, fine));
    assertEquals(Containment.CONTAINED_BY, comparator.compare(fine, cells.p3));
    assertEquals(Containment.CONTAINS, comparator.compare(cells.p1, cells.cousin5));
  }

  @Test
  public void testDisjoint() {
    // Same resolution, same base cell
    assertEquals(Containment.DISJOINT, comparator.compare(cells.siblings4[0], cells.siblings4[1]));
    // Different resolutions without ancestry
    assertEquals(Containment.DISJOINT, comparator.compare(cells.p3, cells.cousin5));
    assertEquals(Containment.DISJOINT, comparator.compare(cells.cousin5, cells.p3));
    // Different base cells
    assertEquals(Containment.DISJOINT, comparator.compare(cells.p3, cells.sydney5));
    assertEquals(Containment.DISJOINT, comparator.compare(cells.sydney5, cells.p1));
  }

  @Test
  public void testSentinelKeyContainsEverything() {
    assertEquals(Containment.CONTAINS, comparator.compare(CellIds.SENTINEL, cells.sydney5));
    assertEquals(Containment.CONTAINED_BY, comparator.compare(cells.p3, CellIds.SENTINEL));
    assertTrue(comparator.consistent(CellIds.SENTINEL, cells.p3, Strategy.CONTAINED_BY, false));
  }

  @Test
  public void testOverlapStrategy() {
    long fine = cells.center(cells.center4, 6);
    assertTrue(comparator.consistent(cells.p3, fine, Strategy.OVERLAP, false));
    assertTrue(comparator.consistent(fine, cells.p3, Strategy.OVERLAP, true));
    assertFalse(comparator.consistent(cells.siblings4[0], fine, Strategy.OVERLAP, false));
  }

  @Test
  public void testContainsStrategy() {
    long fine = cells.center(cells.center4, 6);
    assertTrue(comparator.consistent(cells.p3, fine, Strategy.CONTAINS, true));
    assertFalse(comparator.consistent(fine, cells.p3, Strategy.CONTAINS, true));
  }

  @Test
  public void testContainedByStrategy() {
    long fine = cells.center(cells.center4, 6);
    // A leaf value must lie inside the query
    assertTrue(comparator.consistent(fine, cells.p3, Strategy.CONTAINED_BY, true));
    assertFalse(comparator.consistent(cells.p3, fine, Strategy.CONTAINED_BY, true));
    // An internal key coarser than the query may still have entries inside it
    assertTrue(comparator.consistent(cells.p3, fine, Strategy.CONTAINED_BY, false));
    assertFalse(comparator.consistent(cells.sydney5, fine, Strategy.CONTAINED_BY, false));
  }

  @Test
  public void testNearestNeighborIsNotAPredicate() {
    assertThrows(IllegalArgumentException.class,
        () -> comparator.consistent(cells.p3, cells.p1, Strategy.NEAREST_NEIGHBOR, false));
  }

  @Test
  public void testHierarchyErrorCountsAsDisjoint() {
    long child = cells.children(cells.center4, 5).get(1);
    assertEquals(Containment.CONTAINS, comparator.compare(cells.center4, child));
    ContainmentComparator failing = new ContainmentComparator(new FailingCellHierarchy(cells.hierarchy, 4));
    assertEquals(Containment.DISJOINT, failing.compare(cells.center4, child));
    assertEquals(Containment.DISJOINT, failing.compare(child, cells.center4));
    assertFalse(failing.consistent(cells.center4, child, Strategy.OVERLAP, false));
    // Other levels are not affected
    assertEquals(Containment.CONTAINS, failing.compare(cells.p3, child));
  }
}
