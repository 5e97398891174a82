package com.gentoro.docsmcp.exception;

/** Input validation failure, detected before any request reaches the document service. */
public class ValidationException extends DocsMcpException {
  public ValidationException(String message) {
    super(DocsMcpErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(DocsMcpErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
