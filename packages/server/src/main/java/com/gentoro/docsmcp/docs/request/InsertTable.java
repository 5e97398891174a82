package com.gentoro.docsmcp.docs.request;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docsmcp.exception.ValidationException;

/** Inserts an empty {@code rows x columns} table. */
public record InsertTable(int index, int rows, int columns) implements EditOperation {

  public InsertTable {
    if (index < 0) {
      throw new ValidationException("Table index must be non-negative, got " + index);
    }
    if (rows <= 0 || columns <= 0) {
      throw new ValidationException(
          "Table needs at least one row and one column, got " + rows + "x" + columns);
    }
  }

  @Override
  public String kind() {
    return "insertTable";
  }

  @Override
  public ObjectNode body() {
    ObjectNode body = EditOperation.newObject();
    body.set("location", EditOperation.location(index, null));
    body.put("rows", rows);
    body.put("columns", columns);
    return body;
  }
}
