package cn.edu.pku.asic.hexindex.dggs.h3;

import cn.edu.pku.asic.hexindex.dggs.core.CellHierarchy;
import cn.edu.pku.asic.hexindex.dggs.core.CellHierarchyException;
import cn.edu.pku.asic.hexindex.dggs.core.CellIds;
import com.google.common.base.Preconditions;
import com.uber.h3core.H3Core;
import com.uber.h3core.exceptions.H3Exception;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.io.IOException;

/**
 * =============================================================================================
 *
 * @ProjectName hex-index
 * @Package cn.edu.pku.asic.hexindex.dggs.h3
 * @ClassName H3CellHierarchy
 * @Version 1.0.0
 * @See CellHierarchy
 * =============================================================================================
 * @Description The H3 cell hierarchy backed by the Uber H3 library. {@link H3Core} is thread-safe so a single
 *              instance is shared by all callers.
 */
public class H3CellHierarchy implements CellHierarchy {
  private static final Log LOG = LogFactory.getLog(H3CellHierarchy.class);

  private static H3CellHierarchy h3Instance;

  private final H3Core h3;

  public H3CellHierarchy(H3Core h3) {
    this.h3 = Preconditions.checkNotNull(h3, "H3Core");
  }

  public static synchronized H3CellHierarchy getInstance() {
    if (h3Instance == null) {
      try {
        h3Instance = new H3CellHierarchy(H3Core.newInstance());
        LOG.info("Loaded the native H3 library");
      } catch (IOException e) {
        throw new IllegalStateException("Failed to initialize H3Core", e);
      }
    }
    return h3Instance;
  }

  /**
   * The underlying H3 library, for callers that need to build cells from coordinates.
   * @return the H3 core instance
   */
  public H3Core getH3Core() {
    return h3;
  }

  @Override
  public int resolution(long cell) {
    if (CellIds.isSentinel(cell))
      return CellIds.SENTINEL_RESOLUTION;
    return h3.getResolution(cell);
  }

  @Override
  public int baseCell(long cell) {
    return h3.getBaseCellNumber(cell);
  }

  @Override
  public long ancestorAt(long cell, int resolution) throws CellHierarchyException {
    int cellResolution = resolution(cell);
    if (resolution < 0 || resolution > cellResolution)
      throw new CellHierarchyException(String.format("No ancestor of cell %s (resolution %d) at resolution %d",
          CellIds.toString(cell), cellResolution, resolution));
    try {
      return h3.cellToParent(cell, resolution);
    } catch (H3Exception | IllegalArgumentException e) {
      throw new CellHierarchyException(String.format("cellToParent(%s, %d) failed", CellIds.toString(cell), resolution), e);
    }
  }

  @Override
  public long descendantCountAt(long cell, int resolution) throws CellHierarchyException {
    checkFinerResolution(cell, resolution);
    try {
      return h3.cellToChildrenSize(cell, resolution);
    } catch (H3Exception | IllegalArgumentException e) {
      throw new CellHierarchyException(String.format("cellToChildrenSize(%s, %d) failed", CellIds.toString(cell), resolution), e);
    }
  }

  @Override
  public long centerChildAt(long cell, int resolution) throws CellHierarchyException {
    checkFinerResolution(cell, resolution);
    try {
      return h3.cellToCenterChild(cell, resolution);
    } catch (H3Exception | IllegalArgumentException e) {
      throw new CellHierarchyException(String.format("cellToCenterChild(%s, %d) failed", CellIds.toString(cell), resolution), e);
    }
  }

  @Override
  public long gridDistance(long a, long b) throws CellHierarchyException {
    try {
      return h3.gridDistance(a, b);
    } catch (H3Exception | IllegalArgumentException e) {
      throw new CellHierarchyException(String.format("gridDistance(%s, %s) failed", CellIds.toString(a), CellIds.toString(b)), e);
    }
  }

  @Override
  public boolean isValidCell(long cell) {
    return h3.isValidCell(cell);
  }

  private void checkFinerResolution(long cell, int resolution) throws CellHierarchyException {
    int cellResolution = resolution(cell);
    if (cellResolution < 0 || resolution < cellResolution || resolution > CellIds.MAX_RESOLUTION)
      throw new CellHierarchyException(String.format("No descendants of cell %s (resolution %d) at resolution %d",
          CellIds.toString(cell), cellResolution, resolution));
  }
}
