package com.gentoro.docsmcp.docs.request;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docsmcp.exception.ValidationException;

/** Replaces every occurrence of {@code find}; the service reports how many it changed. */
public record FindReplace(String find, String replace, boolean matchCase)
    implements EditOperation {

  public FindReplace {
    if (find == null || find.isEmpty()) {
      throw new ValidationException("Text to find must not be empty");
    }
    if (replace == null) {
      throw new ValidationException(
          "Replacement text is required (use an empty string to remove)");
    }
  }

  @Override
  public String kind() {
    return "replaceAllText";
  }

  @Override
  public ObjectNode body() {
    ObjectNode body = EditOperation.newObject();
    body.set(
        "containsText",
        EditOperation.newObject().put("text", find).put("matchCase", matchCase));
    body.put("replaceText", replace);
    return body;
  }
}
