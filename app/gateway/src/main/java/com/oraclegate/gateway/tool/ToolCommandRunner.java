package com.oraclegate.gateway.tool;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** Runs one market-data/oracle command and returns its structured result. */
public interface ToolCommandRunner {

  /**
   * @throws ToolCommandException when the command fails or its output is not JSON
   */
  JsonNode run(String command, List<String> arguments);
}
