/*
 * どこで: Gateway 受付判定
 * 何を: /tools 配下の各ツールに必要な権限と課金対象の操作種別を定義する
 * なぜ: 権限判定とクォータ判定を同じカタログから引くため
 */
package com.oraclegate.gateway.admission;

import com.oraclegate.gateway.model.OperationClass;
import com.oraclegate.gateway.model.Permission;
import java.util.Arrays;
import java.util.Optional;

public enum ToolOperation {
  GET_PRICE("get_price", "get_price", OperationClass.GENERAL, Permission.TOOLS_READ),
  ANALYZE_MARKET(
      "analyze_market", "analyze_market", OperationClass.GENERAL, Permission.TOOLS_READ),
  HEALTH_CHECK("health_check", "health", OperationClass.GENERAL, Permission.TOOLS_READ),
  FEED_ORACLE(
      "feed_oracle", "feed_oracle", OperationClass.COST_SENSITIVE, Permission.TOOLS_WRITE);

  private static final String PATH_PREFIX = "/tools/";

  private final String toolName;
  private final String command;
  private final OperationClass operationClass;
  private final Permission requiredPermission;

  ToolOperation(
      String toolName, String command, OperationClass operationClass, Permission permission) {
    this.toolName = toolName;
    this.command = command;
    this.operationClass = operationClass;
    this.requiredPermission = permission;
  }

  public String toolName() {
    return toolName;
  }

  public String command() {
    return command;
  }

  public OperationClass operationClass() {
    return operationClass;
  }

  public Permission requiredPermission() {
    return requiredPermission;
  }

  public static Optional<ToolOperation> fromToolName(String toolName) {
    return Arrays.stream(values()).filter(t -> t.toolName.equals(toolName)).findFirst();
  }

  /** Tool name from a {@code /tools/<name>} path, or null for other paths. */
  public static String toolNameOf(String requestUri) {
    if (requestUri == null || !requestUri.startsWith(PATH_PREFIX)) {
      return null;
    }
    final String rest = requestUri.substring(PATH_PREFIX.length());
    final int slash = rest.indexOf('/');
    return slash < 0 ? rest : rest.substring(0, slash);
  }

  /** Unknown tools are charged and authorized like a read. */
  public static OperationClass operationClassOf(String toolName) {
    return fromToolName(toolName).map(ToolOperation::operationClass).orElse(OperationClass.GENERAL);
  }

  public static Permission requiredPermissionOf(String toolName) {
    return fromToolName(toolName)
        .map(ToolOperation::requiredPermission)
        .orElse(Permission.TOOLS_READ);
  }
}
