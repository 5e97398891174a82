package com.gentoro.docsmcp.docs.request;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docsmcp.utility.JacksonUtility;

/**
 * One primitive edit, immutable once built.
 *
 * <p>A batch is an ordered list of operations that the service applies strictly in order, each
 * against the index space left by the ones before it. Operations never adjust themselves for
 * earlier entries of the same batch; that is the edit compiler's job.
 */
public sealed interface EditOperation
    permits InsertText,
        DeleteRange,
        FormatText,
        FindReplace,
        InsertTable,
        InsertImage,
        InsertPageBreak,
        CreateBullets {

  /** Request name used by the service, e.g. {@code insertText}. */
  String kind();

  /** Body of the request, the value under {@link #kind()}. */
  ObjectNode body();

  /** The request as the service expects it: a single-key object named by {@link #kind()}. */
  default ObjectNode toRequest() {
    ObjectNode request = JacksonUtility.getJsonMapper().createObjectNode();
    request.set(kind(), body());
    return request;
  }

  static ObjectNode newObject() {
    return JacksonUtility.getJsonMapper().createObjectNode();
  }

  static ObjectNode location(int index, String segmentId) {
    ObjectNode location = newObject().put("index", index);
    if (segmentId != null) {
      location.put("segmentId", segmentId);
    }
    return location;
  }

  static ObjectNode range(int start, int end, String segmentId) {
    ObjectNode range = newObject().put("startIndex", start).put("endIndex", end);
    if (segmentId != null) {
      range.put("segmentId", segmentId);
    }
    return range;
  }

  static ObjectNode points(int magnitude) {
    return newObject().put("magnitude", magnitude).put("unit", "PT");
  }
}
