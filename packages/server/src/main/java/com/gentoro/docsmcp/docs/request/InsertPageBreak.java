package com.gentoro.docsmcp.docs.request;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docsmcp.exception.ValidationException;

public record InsertPageBreak(int index) implements EditOperation {

  public InsertPageBreak {
    if (index < 0) {
      throw new ValidationException("Page break index must be non-negative, got " + index);
    }
  }

  @Override
  public String kind() {
    return "insertPageBreak";
  }

  @Override
  public ObjectNode body() {
    ObjectNode body = EditOperation.newObject();
    body.set("location", EditOperation.location(index, null));
    return body;
  }
}
