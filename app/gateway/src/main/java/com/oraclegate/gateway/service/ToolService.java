/*
 * どこで: Gateway サービス層
 * 何を: 受付済みのツール呼び出しを外部コマンドの引数へ変換して実行する
 * なぜ: ツールごとの必須引数と oracle feed の停止スイッチを 1 か所で扱うため
 */
package com.oraclegate.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.oraclegate.gateway.admission.ToolOperation;
import com.oraclegate.gateway.api.ToolRequest;
import com.oraclegate.gateway.config.ToolProperties;
import com.oraclegate.gateway.model.GatewayIdentity;
import com.oraclegate.gateway.tool.ToolCommandRunner;
import com.oraclegate.gateway.tool.ToolDisabledException;
import com.oraclegate.gateway.tool.UnknownToolException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ToolService {

  private static final Logger logger = LoggerFactory.getLogger(ToolService.class);
  private static final String DEFAULT_HORIZON = "1d";

  private final ToolCommandRunner runner;
  private final ToolProperties properties;

  public JsonNode invoke(String toolName, ToolRequest request, GatewayIdentity identity) {
    final ToolOperation operation =
        ToolOperation.fromToolName(toolName).orElseThrow(() -> new UnknownToolException(toolName));
    final ToolRequest input = request == null ? ToolRequest.empty() : request;
    final List<String> arguments =
        switch (operation) {
          case GET_PRICE -> List.of(requireSymbol(input));
          case ANALYZE_MARKET ->
              List.of(
                  requireSymbol(input),
                  input.horizon() == null ? DEFAULT_HORIZON : input.horizon(),
                  input.provider() == null ? properties.defaultProvider() : input.provider());
          case FEED_ORACLE -> {
            if (!properties.feedOracleEnabled()) {
              throw new ToolDisabledException(operation.toolName());
            }
            yield List.of(requireSymbol(input));
          }
          case HEALTH_CHECK -> List.of();
        };
    logger.info(
        "tool invoked tool={} subject_id={} symbol={}",
        operation.toolName(),
        identity.subjectId(),
        input.symbol());
    return runner.run(operation.command(), arguments);
  }

  private static String requireSymbol(ToolRequest request) {
    if (request.symbol() == null || request.symbol().isBlank()) {
      throw new IllegalArgumentException("symbol is required");
    }
    return request.symbol();
  }
}
