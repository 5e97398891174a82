package com.gentoro.docsmcp.exception;

import java.util.Map;

/**
 * Failure of a high-level document operation. The message always starts with {@code
 * "<operation> failed: "} so clients can tell which tool call broke without parsing the cause.
 */
public class ExecutionException extends DocsMcpException {
  public ExecutionException(String message) {
    super(DocsMcpErrorCode.EXECUTION_ERROR, message);
  }

  public ExecutionException(String message, Throwable cause) {
    super(DocsMcpErrorCode.EXECUTION_ERROR, message, cause);
  }

  public static ExecutionException forOperation(String operation, Throwable cause) {
    String detail =
        cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    return new ExecutionException(
        operation + " failed: " + detail, Map.of("operation", operation), cause);
  }

  private ExecutionException(String message, Map<String, ?> context, Throwable cause) {
    super(DocsMcpErrorCode.EXECUTION_ERROR, message, context, cause);
  }
}
