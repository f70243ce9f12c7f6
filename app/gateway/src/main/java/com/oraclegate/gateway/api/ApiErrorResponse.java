/*
 * どこで: Gateway API
 * 何を: エラーレスポンスの共通フォーマット {ok:false, error, message?} を定義する
 * なぜ: 受付拒否と管理 API のエラーをクライアントが同じ形で判定できるようにするため
 */
package com.oraclegate.gateway.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(boolean ok, String error, String message) {

  public static ApiErrorResponse of(String error) {
    return new ApiErrorResponse(false, error, null);
  }

  public static ApiErrorResponse of(String error, String message) {
    return new ApiErrorResponse(false, error, message);
  }
}
