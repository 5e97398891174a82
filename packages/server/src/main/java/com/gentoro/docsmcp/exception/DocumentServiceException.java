package com.gentoro.docsmcp.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Error reported by the remote document service for a read or a batch update.
 *
 * <p>Carries the HTTP status, the service's canonical status string (e.g. {@code
 * INVALID_ARGUMENT}) and the service message. The whole batch is rejected when this is thrown; no
 * partial application is assumed.
 */
public class DocumentServiceException extends DocsMcpException {

  /** Service wording for an insertion point that is not strictly before the segment end. */
  private static final Pattern BOUNDARY_MESSAGE =
      Pattern.compile("must be less than the end index", Pattern.CASE_INSENSITIVE);

  private static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";

  private final int httpStatus;
  private final String serviceStatus;

  public DocumentServiceException(int httpStatus, String serviceStatus, String message) {
    super(DocsMcpErrorCode.DOCUMENT_SERVICE_ERROR, message, context(httpStatus, serviceStatus));
    this.httpStatus = httpStatus;
    this.serviceStatus = serviceStatus;
  }

  public int getHttpStatus() {
    return httpStatus;
  }

  public String getServiceStatus() {
    return serviceStatus;
  }

  /**
   * True when the service rejected an index because it is at or past the end of the addressed
   * segment. Requires both the {@code INVALID_ARGUMENT} status and the boundary wording so that an
   * unrelated error quoting the same phrase is not mistaken for a boundary rejection.
   */
  public boolean isBoundaryViolation() {
    boolean invalidArgument =
        INVALID_ARGUMENT.equalsIgnoreCase(serviceStatus)
            || (serviceStatus == null && httpStatus == 400);
    return invalidArgument && getMessage() != null && BOUNDARY_MESSAGE.matcher(getMessage()).find();
  }

  private static Map<String, Object> context(int httpStatus, String serviceStatus) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("httpStatus", httpStatus);
    if (serviceStatus != null) m.put("serviceStatus", serviceStatus);
    return m;
  }
}
