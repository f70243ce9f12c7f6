/*
 * どこで: Gateway API
 * 何を: 他人のキー/組織を操作しようとした場合の 403 を表す例外を定義する
 * なぜ: 所有者判定の失敗を not_found と区別して返すため
 */
package com.oraclegate.gateway.api;

public class ApiKeyAccessDeniedException extends RuntimeException {

  public ApiKeyAccessDeniedException(String message) {
    super(message);
  }
}
