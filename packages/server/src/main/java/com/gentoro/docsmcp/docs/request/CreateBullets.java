package com.gentoro.docsmcp.docs.request;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docsmcp.docs.index.IndexRange;
import com.gentoro.docsmcp.exception.ValidationException;

/**
 * Turns every paragraph touching {@code [start, end)} into a list item. The range must reach the
 * paragraph's terminating newline or the preset is not applied.
 */
public record CreateBullets(int start, int end, String presetId) implements EditOperation {

  public CreateBullets {
    if (start < 0) {
      throw new ValidationException("Bullet start index must be non-negative, got " + start);
    }
    if (end <= start) {
      throw new ValidationException(
          "Bullet end index (" + end + ") must be greater than start index (" + start + ")");
    }
    if (presetId == null || presetId.isBlank()) {
      throw new ValidationException("Bullet preset is required");
    }
  }

  public IndexRange range() {
    return IndexRange.of(start, end);
  }

  @Override
  public String kind() {
    return "createParagraphBullets";
  }

  @Override
  public ObjectNode body() {
    ObjectNode body = EditOperation.newObject();
    body.set("range", EditOperation.range(start, end, null));
    body.put("bulletPreset", presetId);
    return body;
  }
}
