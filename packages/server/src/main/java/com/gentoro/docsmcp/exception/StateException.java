package com.gentoro.docsmcp.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends DocsMcpException {
  public StateException(String message) {
    super(DocsMcpErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(DocsMcpErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
