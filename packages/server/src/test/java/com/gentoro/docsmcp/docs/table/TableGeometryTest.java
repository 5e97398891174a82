package com.gentoro.docsmcp.docs.table;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TableGeometryTest {

  @Test
  @DisplayName("a table inserted at i starts at i + 1")
  void tableStart() {
    assertEquals(11, TableGeometry.forNewTable(10, 2, 2).tableStart());
  }

  @Test
  @DisplayName("cell insertion indices follow the row and cell marker layout")
  void cellIndices() {
    TableGeometry geometry = TableGeometry.forNewTable(10, 2, 3);

    assertEquals(14, geometry.cellInsertionIndex(0, 0));
    assertEquals(16, geometry.cellInsertionIndex(0, 1));
    assertEquals(18, geometry.cellInsertionIndex(0, 2));
    // row 0 takes 2 * 3 + 1 units
    assertEquals(21, geometry.cellInsertionIndex(1, 0));
    assertEquals(25, geometry.cellInsertionIndex(1, 2));
  }

  @Test
  void outsideTheTable() {
    TableGeometry geometry = TableGeometry.forNewTable(1, 1, 1);
    assertThrows(IndexOutOfBoundsException.class, () -> geometry.cellInsertionIndex(1, 0));
    assertThrows(IndexOutOfBoundsException.class, () -> geometry.cellInsertionIndex(0, -1));
  }
}
