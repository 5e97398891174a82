package com.gentoro.docsmcp.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for the docs MCP server with a stable {@link DocsMcpErrorCode} and
 * optional context.
 *
 * <p>The context map is copied and unmodifiable. Subclasses pick the code; callers only supply a
 * message, a cause and, where useful, diagnostic key/value pairs.
 */
public class DocsMcpException extends RuntimeException {
  private final DocsMcpErrorCode code;
  private final Map<String, Object> context;

  public DocsMcpException(DocsMcpErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public DocsMcpException(DocsMcpErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public DocsMcpException(DocsMcpErrorCode code, String message, Map<String, ?> context) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public DocsMcpException(
      DocsMcpErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public DocsMcpErrorCode getCode() {
    return code;
  }

  /** Additional key/value details that help diagnosing the error. */
  public Map<String, Object> getContext() {
    return context;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, Object> m = new LinkedHashMap<>();
    input.forEach((k, v) -> m.put(k, v));
    return Collections.unmodifiableMap(m);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{"
        + "code="
        + code
        + ", message="
        + String.valueOf(getMessage())
        + (context.isEmpty() ? "" : ", context=" + context)
        + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
        + '}';
  }
}
