package com.gentoro.docsmcp.exception;

/** Network-level communication error (HTTP, sockets, timeouts). */
public class NetworkException extends DocsMcpException {
  public NetworkException(String message) {
    super(DocsMcpErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(DocsMcpErrorCode.NETWORK_ERROR, message, cause);
  }
}
