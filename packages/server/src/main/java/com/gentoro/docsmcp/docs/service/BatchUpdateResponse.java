package com.gentoro.docsmcp.docs.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Replies of a batch, one per request in request order. Requests without a result still get an
 * (empty) reply object.
 */
public record BatchUpdateResponse(String documentId, List<JsonNode> replies) {

  public BatchUpdateResponse {
    replies = List.copyOf(replies);
  }

  public static BatchUpdateResponse fromJson(JsonNode json) {
    List<JsonNode> replies = new ArrayList<>();
    json.path("replies").forEach(replies::add);
    return new BatchUpdateResponse(json.path("documentId").asText(null), replies);
  }

  public int repliesCount() {
    return replies.size();
  }

  public JsonNode reply(int position) {
    return position >= 0 && position < replies.size()
        ? replies.get(position)
        : MissingNode.getInstance();
  }

  /** {@code occurrencesChanged} of the first find/replace reply, 0 when there is none. */
  public int occurrencesChanged() {
    for (JsonNode reply : replies) {
      if (reply.has("replaceAllText")) {
        return reply.path("replaceAllText").path("occurrencesChanged").asInt(0);
      }
    }
    return 0;
  }

  /** Id of an object created by the request at {@code position}, e.g. a new header's id. */
  public Optional<String> createdObjectId(int position) {
    JsonNode reply = reply(position);
    var names = reply.fieldNames();
    while (names.hasNext()) {
      JsonNode result = reply.get(names.next());
      for (String idField :
          List.of("headerId", "footerId", "objectId", "namedRangeId", "footnoteId")) {
        if (result.hasNonNull(idField)) {
          return Optional.of(result.get(idField).asText());
        }
      }
    }
    return Optional.empty();
  }
}
