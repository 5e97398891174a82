package com.gentoro.docsmcp.docs.request;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docsmcp.docs.index.IndexRange;
import com.gentoro.docsmcp.exception.ValidationException;
import java.util.Objects;

public record FormatText(int start, int end, TextStyle style) implements EditOperation {

  public FormatText {
    Objects.requireNonNull(style, "style");
    if (start < 0) {
      throw new ValidationException("Format start index must be non-negative, got " + start);
    }
    if (end <= start) {
      throw new ValidationException(
          "Format end index (" + end + ") must be greater than start index (" + start + ")");
    }
    if (style.isEmpty()) {
      throw new ValidationException("At least one formatting attribute is required");
    }
  }

  public IndexRange range() {
    return IndexRange.of(start, end);
  }

  @Override
  public String kind() {
    return "updateTextStyle";
  }

  @Override
  public ObjectNode body() {
    ObjectNode body = EditOperation.newObject();
    body.set("range", EditOperation.range(start, end, null));
    body.set("textStyle", style.toJson());
    body.put("fields", String.join(",", style.fields()));
    return body;
  }
}
