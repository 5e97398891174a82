package com.gentoro.docsmcp.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends DocsMcpException {
  public ConfigException(String message) {
    super(DocsMcpErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(DocsMcpErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
