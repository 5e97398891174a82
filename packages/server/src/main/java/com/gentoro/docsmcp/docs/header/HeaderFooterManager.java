package com.gentoro.docsmcp.docs.header;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.docsmcp.docs.index.DocumentIndex;
import com.gentoro.docsmcp.docs.request.EditOperation;
import com.gentoro.docsmcp.docs.request.EditRequests;
import com.gentoro.docsmcp.docs.service.BatchUpdateResponse;
import com.gentoro.docsmcp.docs.service.DocumentService;
import com.gentoro.docsmcp.docs.validation.DocumentValidator;
import com.gentoro.docsmcp.exception.StateException;
import com.gentoro.docsmcp.exception.ValidationException;
import com.gentoro.docsmcp.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;

/**
 * Sets the text of a header or footer, creating the segment first when the document has none of
 * the requested variant. Calling it twice with the same content leaves the same result.
 */
public class HeaderFooterManager {
  private static final org.slf4j.Logger log =
      com.gentoro.docsmcp.logging.LoggingService.getLogger(HeaderFooterManager.class);

  private final DocumentService documentService;
  private final DocumentValidator validator;

  public HeaderFooterManager(DocumentService documentService, DocumentValidator validator) {
    this.documentService = documentService;
    this.validator = validator;
  }

  public HeaderFooterResult upsert(
      String documentId, SectionType type, HeaderFooterVariant variant, String content) {
    validator.validateDocumentId(documentId);
    validator.validateTextContent(content, "content");

    JsonNode document = documentService.getDocument(documentId, false);
    String segmentId = document.path("documentStyle").path(variant.styleField(type)).asText(null);
    boolean created = false;
    int existingEnd = 0;

    if (segmentId == null || segmentId.isBlank()) {
      if (variant != HeaderFooterVariant.DEFAULT) {
        // createHeader/createFooter only ever yields a DEFAULT segment
        throw new ValidationException(
            "Document "
                + documentId
                + " has no "
                + variant.name()
                + " "
                + type.wireName()
                + " and only DEFAULT "
                + type.segmentsField()
                + " can be created; enable the variant in the document first");
      }
      segmentId = create(documentId, type);
      created = true;
    } else {
      existingEnd = segmentEnd(document.path(type.segmentsField()).path(segmentId));
    }

    List<EditOperation> operations = new ArrayList<>();
    // the segment's final newline stays, it cannot be deleted
    int lastDeletable = existingEnd - 1;
    if (lastDeletable > DocumentIndex.FIRST_WRITABLE) {
      operations.add(
          EditRequests.deleteRange(DocumentIndex.FIRST_WRITABLE, lastDeletable, segmentId));
    }
    operations.add(EditRequests.insertText(DocumentIndex.FIRST_WRITABLE, content, segmentId));
    documentService.submit(documentId, operations);

    HeaderFooterResult result =
        new HeaderFooterResult(type, variant, segmentId, created, DocumentIndex.width(content));
    log.info("{} in document {}", result.describe(), documentId);
    return result;
  }

  private String create(String documentId, SectionType type) {
    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode();
    body.put("type", HeaderFooterVariant.DEFAULT.name());
    ObjectNode request = JacksonUtility.getJsonMapper().createObjectNode();
    request.set(type.createRequestKind(), body);

    log.debug("No {} in document {}, creating one", type.wireName(), documentId);
    BatchUpdateResponse response = documentService.batchUpdate(documentId, List.of(request));
    return response
        .createdObjectId(0)
        .orElseThrow(
            () ->
                new StateException(
                    "Service created a "
                        + type.wireName()
                        + " in document "
                        + documentId
                        + " but returned no id"));
  }

  private static int segmentEnd(JsonNode segment) {
    JsonNode content = segment.path("content");
    if (!content.isArray() || content.isEmpty()) {
      return 0;
    }
    return content.get(content.size() - 1).path("endIndex").asInt(0);
  }
}
