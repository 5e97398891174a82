package com.gentoro.docsmcp.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends DocsMcpException {
  public SerializationException(String message) {
    super(DocsMcpErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(DocsMcpErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
