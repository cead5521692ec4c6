package cn.edu.pku.asic.hexindex.dggs.core;

/**
 * =============================================================================================
 *
 * @ProjectName hex-index
 * @Package cn.edu.pku.asic.hexindex.dggs.core
 * @ClassName CellHierarchy
 * @Version 1.0.0
 * @See CellIds
 * =============================================================================================
 * @Description Navigation over the cells of a hierarchical grid. Every cell has one resolution and one base cell,
 *              exactly one parent at each coarser resolution, and descendants at every finer resolution.
 *              Implementations must be stateless or thread-safe, the index calls them concurrently.
 */
public interface CellHierarchy {

  /**
   * Resolution of a cell.
   * @param cell the cell identifier
   * @return the resolution in [0, 15], or -1 for {@link CellIds#SENTINEL}
   */
  int resolution(long cell);

  /**
   * The top-level partition that roots the tree the cell belongs to.
   * @param cell the cell identifier
   * @return the base cell number
   */
  int baseCell(long cell);

  /**
   * The ancestor of a cell at a coarser (or the same) resolution.
   * @param cell the cell identifier
   * @param resolution the resolution of the requested ancestor
   * @return the ancestor, equal to {@code cell} when {@code resolution == resolution(cell)}
   * @throws CellHierarchyException if the ancestor does not exist at that resolution
   */
  long ancestorAt(long cell, int resolution) throws CellHierarchyException;

  /**
   * Number of descendants of a cell at a finer (or the same) resolution.
   * @param cell the cell identifier
   * @param resolution the resolution of the descendants
   * @return the descendant count, 1 for the cell's own resolution
   * @throws CellHierarchyException if the resolution is coarser than the cell
   */
  long descendantCountAt(long cell, int resolution) throws CellHierarchyException;

  /**
   * The geometrically central descendant of a cell at a finer (or the same) resolution.
   * @param cell the cell identifier
   * @param resolution the resolution of the child
   * @return the center child
   * @throws CellHierarchyException if the resolution is coarser than the cell
   */
  long centerChildAt(long cell, int resolution) throws CellHierarchyException;

  /**
   * Number of grid steps between two cells of the same resolution.
   * @param a the first cell
   * @param b the second cell
   * @return the grid distance
   * @throws CellHierarchyException if the distance cannot be computed
   */
  long gridDistance(long a, long b) throws CellHierarchyException;

  /**
   * Tests whether an identifier encodes a valid cell.
   * @param cell the identifier to test
   * @return {@code true} if it is a valid cell
   */
  boolean isValidCell(long cell);
}
