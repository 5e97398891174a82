package com.gentoro.docsmcp.docs.table;

/**
 * Index layout of a freshly inserted, still empty table.
 *
 * <p>Inserting a table at {@code i} first adds a paragraph break, so the table starts at {@code
 * i + 1}. Inside, the table start is followed by a row marker and a cell marker before the first
 * cell's empty paragraph; every cell then takes two units (marker and newline) and every row one
 * extra for its own marker. The insertion index of cell {@code (r, c)} is therefore {@code
 * tableStart + 3 + r * (2 * columns + 1) + 2 * c}.
 */
public record TableGeometry(int tableStart, int rows, int columns) {

  private static final int FIRST_CELL_OFFSET = 3;

  public static TableGeometry forNewTable(int insertIndex, int rows, int columns) {
    return new TableGeometry(insertIndex + 1, rows, columns);
  }

  public int cellInsertionIndex(int row, int column) {
    if (row < 0 || row >= rows || column < 0 || column >= columns) {
      throw new IndexOutOfBoundsException(
          "Cell (" + row + "," + column + ") outside " + rows + "x" + columns + " table");
    }
    return tableStart + FIRST_CELL_OFFSET + row * (2 * columns + 1) + 2 * column;
  }
}
