package com.gentoro.docsmcp.exception;

/** A referenced document element (table, header, tab) does not exist. */
public class NotFoundException extends DocsMcpException {
  public NotFoundException(String message) {
    super(DocsMcpErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(DocsMcpErrorCode.NOT_FOUND, message, cause);
  }
}
