package com.oraclegate.gateway.tool;

public class UnknownToolException extends RuntimeException {

  public UnknownToolException(String toolName) {
    super("unknown tool: " + toolName);
  }
}
