package com.gentoro.docsmcp.docs.request;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docsmcp.docs.index.IndexRange;
import com.gentoro.docsmcp.exception.ValidationException;

public record DeleteRange(int start, int end, String segmentId) implements EditOperation {

  public DeleteRange {
    if (start < 0) {
      throw new ValidationException("Delete start index must be non-negative, got " + start);
    }
    if (end <= start) {
      throw new ValidationException(
          "Delete end index (" + end + ") must be greater than start index (" + start + ")");
    }
  }

  public DeleteRange(int start, int end) {
    this(start, end, null);
  }

  public IndexRange range() {
    return IndexRange.of(start, end);
  }

  @Override
  public String kind() {
    return "deleteContentRange";
  }

  @Override
  public ObjectNode body() {
    ObjectNode body = EditOperation.newObject();
    body.set("range", EditOperation.range(start, end, segmentId));
    return body;
  }
}
