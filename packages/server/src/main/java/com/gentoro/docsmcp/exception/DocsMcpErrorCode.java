package com.gentoro.docsmcp.exception;

/**
 * Canonical error codes for the docs MCP server. Codes are stable and suitable for downstream
 * clients and logs. Prefer the most specific code that reflects the failure origin.
 */
public enum DocsMcpErrorCode {
  // Generic
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  EXECUTION_ERROR,
  DOCUMENT_SERVICE_ERROR,
  NETWORK_ERROR,
}
