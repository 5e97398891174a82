package com.gentoro.docsmcp.docs.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.docsmcp.docs.service.BatchUpdateResponse;
import com.gentoro.docsmcp.docs.service.DocumentService;
import com.gentoro.docsmcp.docs.validation.DocumentValidator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Submits caller-built operations as one batch. Entries are checked for shape before anything is
 * sent; their indices are not corrected, the caller is expected to have ordered them already.
 */
public class BatchOperationManager {
  private static final org.slf4j.Logger log =
      com.gentoro.docsmcp.logging.LoggingService.getLogger(BatchOperationManager.class);

  private final DocumentService documentService;
  private final DocumentValidator validator;
  private final BatchEntryParser parser = new BatchEntryParser();

  public BatchOperationManager(DocumentService documentService, DocumentValidator validator) {
    this.documentService = documentService;
    this.validator = validator;
  }

  public BatchResult execute(String documentId, List<? extends JsonNode> entries) {
    validator.validateDocumentId(documentId);
    List<BatchEntryParser.ParsedEntry> parsed = parser.parse(entries);

    List<JsonNode> requests = new ArrayList<>();
    Map<String, Integer> labels = new LinkedHashMap<>();
    for (BatchEntryParser.ParsedEntry entry : parsed) {
      requests.addAll(entry.requests());
      labels.merge(entry.label(), 1, Integer::sum);
    }

    log.debug(
        "Submitting {} request(s) from {} operation(s) to document {}",
        requests.size(),
        parsed.size(),
        documentId);
    BatchUpdateResponse response = documentService.batchUpdate(documentId, requests);

    List<BatchResult.ReplyMetadata> replies = new ArrayList<>();
    for (int i = 0; i < response.repliesCount(); i++) {
      JsonNode reply = response.reply(i);
      String kind = BatchEntryParser.replyKind(reply);
      Integer occurrences =
          reply.has("replaceAllText")
              ? reply.path("replaceAllText").path("occurrencesChanged").asInt(0)
              : null;
      replies.add(
          new BatchResult.ReplyMetadata(
              i, kind, response.createdObjectId(i).orElse(null), occurrences));
    }

    String summary =
        labels.entrySet().stream()
            .map(e -> e.getValue() > 1 ? e.getKey() + " x" + e.getValue() : e.getKey())
            .collect(Collectors.joining(", "));
    String message =
        "Successfully executed " + parsed.size() + " operation(s) (" + summary + ")";
    log.info("{} on document {}", message, documentId);
    return new BatchResult(true, message, response.repliesCount(), replies);
  }
}
