package com.gentoro.docsmcp.docs.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Outcome of a submitted batch, with one metadata entry per service reply. */
public record BatchResult(
    @JsonProperty("success") boolean success,
    @JsonProperty("message") String message,
    @JsonProperty("replies_count") int repliesCount,
    @JsonProperty("replies") List<ReplyMetadata> replies) {

  public BatchResult {
    replies = List.copyOf(replies);
  }

  /**
   * @param kind name of the reply's single field, or {@code empty} for requests without a result
   */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ReplyMetadata(
      @JsonProperty("position") int position,
      @JsonProperty("kind") String kind,
      @JsonProperty("object_id") String objectId,
      @JsonProperty("occurrences_changed") Integer occurrencesChanged) {}
}
