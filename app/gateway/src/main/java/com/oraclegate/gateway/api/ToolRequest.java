/*
 * どこで: Gateway API
 * 何を: /tools 呼び出しの入力 (symbol/horizon/provider) を保持する
 * なぜ: 外部コマンドへ渡す前に引数の形を限定するため
 *       先頭文字は英数字に限る
 */
package com.oraclegate.gateway.api;

import jakarta.validation.constraints.Pattern;

public record ToolRequest(
    @Pattern(regexp = "^[A-Z0-9][A-Z0-9:_\\-.]{0,31}$", message = "symbol is invalid")
        String symbol,
    @Pattern(regexp = "^(1h|1d|1w)$", message = "horizon must be one of 1h, 1d, 1w")
        String horizon,
    @Pattern(regexp = "^[a-z0-9][a-z0-9_\\-]{0,31}$", message = "provider is invalid")
        String provider) {

  public static ToolRequest empty() {
    return new ToolRequest(null, null, null);
  }
}
