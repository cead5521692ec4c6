package cn.edu.pku.asic.hexindex.dggs.core;

/**
 * =============================================================================================
 *
 * @ProjectName hex-index
 * @Package cn.edu.pku.asic.hexindex.dggs.core
 * @ClassName CellIds
 * @Version 1.0.0
 * =============================================================================================
 * @Description Constants of the 64-bit cell identifier space.
 */
public final class CellIds {
  /**The reserved "no valid cell" value. As a bounding key it stands for the whole world.*/
  public static final long SENTINEL = 0L;

  /**Resolution reported for the sentinel*/
  public static final int SENTINEL_RESOLUTION = -1;

  /**The finest resolution*/
  public static final int MAX_RESOLUTION = 15;

  /**Number of top-level partitions*/
  public static final int NUM_BASE_CELLS = 122;

  private CellIds() {
  }

  public static boolean isSentinel(long cell) {
    return cell == SENTINEL;
  }

  /**
   * Formats a cell identifier the way H3 prints it, in lowercase hexadecimal.
   * @param cell the cell identifier
   * @return the hexadecimal string
   */
  public static String toString(long cell) {
    return Long.toHexString(cell);
  }
}
