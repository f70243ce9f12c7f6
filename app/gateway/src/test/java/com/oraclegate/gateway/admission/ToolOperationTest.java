package com.oraclegate.gateway.admission;

import static org.assertj.core.api.Assertions.assertThat;

import com.oraclegate.gateway.model.OperationClass;
import com.oraclegate.gateway.model.Permission;
import org.junit.jupiter.api.Test;

class ToolOperationTest {

  @Test
  void toolNameIsTakenFromFirstPathSegment() {
    assertThat(ToolOperation.toolNameOf("/tools/get_price")).isEqualTo("get_price");
    assertThat(ToolOperation.toolNameOf("/tools/feed_oracle/extra")).isEqualTo("feed_oracle");
    assertThat(ToolOperation.toolNameOf("/v1/api-keys")).isNull();
    assertThat(ToolOperation.toolNameOf(null)).isNull();
  }

  @Test
  void oracleFeedIsCostSensitiveAndNeedsWrite() {
    assertThat(ToolOperation.operationClassOf("feed_oracle"))
        .isEqualTo(OperationClass.COST_SENSITIVE);
    assertThat(ToolOperation.requiredPermissionOf("feed_oracle"))
        .isEqualTo(Permission.TOOLS_WRITE);
    assertThat(ToolOperation.operationClassOf("analyze_market")).isEqualTo(OperationClass.GENERAL);
    assertThat(ToolOperation.requiredPermissionOf("get_price")).isEqualTo(Permission.TOOLS_READ);
  }

  @Test
  void unknownToolsAreTreatedAsGeneralReads() {
    assertThat(ToolOperation.fromToolName("mint_tokens")).isEmpty();
    assertThat(ToolOperation.operationClassOf("mint_tokens")).isEqualTo(OperationClass.GENERAL);
    assertThat(ToolOperation.requiredPermissionOf("mint_tokens"))
        .isEqualTo(Permission.TOOLS_READ);
  }
}
