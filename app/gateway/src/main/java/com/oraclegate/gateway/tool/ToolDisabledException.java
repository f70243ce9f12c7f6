package com.oraclegate.gateway.tool;

public class ToolDisabledException extends RuntimeException {

  public ToolDisabledException(String toolName) {
    super(toolName + " is currently disabled");
  }
}
