package cn.edu.pku.asic.hexindex.dggs.core;

/**
 * Signals that a {@link CellHierarchy} could not answer a navigation request, e.g., an ancestor requested at a finer
 * resolution than the cell or a grid distance across a pentagon distortion.
 */
public class CellHierarchyException extends Exception {
  private static final long serialVersionUID = 1L;

  public CellHierarchyException(String message) {
    super(message);
  }

  public CellHierarchyException(String message, Throwable cause) {
    super(message, cause);
  }
}
