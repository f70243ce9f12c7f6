/*
 * どこで: Gateway API
 * 何を: 受付判定を通過した /tools 呼び出しを受け、結果を {ok, data, trace_id} で返す
 * なぜ: 認証/権限/クォータは AdmissionFilter に任せ、ここでは入力検証と実行だけを行うため
 */
package com.oraclegate.gateway.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.oraclegate.gateway.admission.AdmissionAttributes;
import com.oraclegate.gateway.service.ToolService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tools")
@RequiredArgsConstructor
public class ToolController {

  private final ToolService toolService;

  @PostMapping("/{tool}")
  public ToolResponse invoke(
      @PathVariable("tool") String tool,
      @Valid @RequestBody(required = false) ToolRequest request,
      HttpServletRequest servletRequest) {
    final JsonNode data =
        toolService.invoke(tool, request, AdmissionAttributes.identity(servletRequest));
    return ToolResponse.of(data, AdmissionAttributes.traceId(servletRequest));
  }
}
