package com.gentoro.docsmcp.docs.model;

import java.util.List;

/**
 * Table with its geometry and cells. {@code columns} is taken from the first row; later rows may
 * be ragged when the service reports merged or missing cells.
 */
public record TableElement(
    int startIndex, int endIndex, int rows, int columns, List<List<TableCell>> cells)
    implements StructuralElement {

  public TableElement {
    cells = cells.stream().map(List::copyOf).toList();
  }

  @Override
  public ElementType type() {
    return ElementType.TABLE;
  }

  public int cellCount() {
    return cells.stream().mapToInt(List::size).sum();
  }
}
