package com.gentoro.docsmcp.docs.request;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docsmcp.exception.ValidationException;

/**
 * Inserts an inline image fetched by the service from {@code uri}.
 *
 * @param width width in points, or null to let the service size it
 * @param height height in points, or null to let the service size it
 */
public record InsertImage(int index, String uri, Integer width, Integer height)
    implements EditOperation {

  public InsertImage {
    if (index < 0) {
      throw new ValidationException("Image index must be non-negative, got " + index);
    }
    if (uri == null || uri.isBlank()) {
      throw new ValidationException("Image URI must not be empty");
    }
    if ((width != null && width <= 0) || (height != null && height <= 0)) {
      throw new ValidationException("Image width and height must be positive when given");
    }
  }

  @Override
  public String kind() {
    return "insertInlineImage";
  }

  @Override
  public ObjectNode body() {
    ObjectNode body = EditOperation.newObject();
    body.set("location", EditOperation.location(index, null));
    body.put("uri", uri);
    if (width != null || height != null) {
      ObjectNode size = EditOperation.newObject();
      if (width != null) size.set("width", EditOperation.points(width));
      if (height != null) size.set("height", EditOperation.points(height));
      body.set("objectSize", size);
    }
    return body;
  }
}
