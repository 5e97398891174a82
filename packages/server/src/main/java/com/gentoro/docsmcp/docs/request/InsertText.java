package com.gentoro.docsmcp.docs.request;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docsmcp.docs.index.IndexRange;
import com.gentoro.docsmcp.exception.ValidationException;

/** Inserts {@code text} at {@code index}; {@code segmentId} addresses a header or footer. */
public record InsertText(int index, String text, String segmentId) implements EditOperation {

  public InsertText {
    if (index < 0) {
      throw new ValidationException("Insert index must be non-negative, got " + index);
    }
    if (text == null || text.isEmpty()) {
      throw new ValidationException("Text to insert must not be empty");
    }
  }

  public InsertText(int index, String text) {
    this(index, text, null);
  }

  /** Range the text occupies right after this operation is applied. */
  public IndexRange insertedRange() {
    return IndexRange.ofText(index, text);
  }

  @Override
  public String kind() {
    return "insertText";
  }

  @Override
  public ObjectNode body() {
    ObjectNode body = EditOperation.newObject();
    body.set("location", EditOperation.location(index, segmentId));
    body.put("text", text);
    return body;
  }
}
