package com.oraclegate.gateway.tool;

/** The external tool command failed, timed out, or produced unusable output. */
public class ToolCommandException extends RuntimeException {

  public ToolCommandException(String message) {
    super(message);
  }

  public ToolCommandException(String message, Throwable cause) {
    super(message, cause);
  }
}
