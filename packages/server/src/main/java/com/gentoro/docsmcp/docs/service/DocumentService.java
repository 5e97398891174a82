package com.gentoro.docsmcp.docs.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.docsmcp.docs.request.EditOperation;
import java.util.List;

/**
 * Handle on the remote document service. Implementations deal with transport and credentials;
 * callers only see document trees and batch replies.
 *
 * <p>Failures surface as {@link com.gentoro.docsmcp.exception.DocumentServiceException} when the
 * service answered with an error, or {@link com.gentoro.docsmcp.exception.NetworkException} when
 * it could not be reached. A failed batch is assumed to have applied nothing.
 */
public interface DocumentService {

  /**
   * Current document tree.
   *
   * @param includeTabsContent when true the service returns every tab's content under {@code
   *     tabs}
   */
  JsonNode getDocument(String documentId, boolean includeTabsContent);

  /** Submits raw single-key requests as one atomic batch. */
  BatchUpdateResponse batchUpdate(String documentId, List<? extends JsonNode> requests);

  /** Submits built operations as one atomic batch, in list order. */
  default BatchUpdateResponse submit(String documentId, List<? extends EditOperation> operations) {
    return batchUpdate(documentId, operations.stream().map(EditOperation::toRequest).toList());
  }
}
