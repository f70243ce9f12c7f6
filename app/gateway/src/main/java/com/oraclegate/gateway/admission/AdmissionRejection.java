/*
 * どこで: Gateway 受付判定
 * 何を: 受付拒否の種別と HTTP ステータス/機械可読コードの対応を定義する
 * なぜ: 拒否応答の形を 1 か所で決め、呼び出し元に内部事情を漏らさないため
 */
package com.oraclegate.gateway.admission;

import org.springframework.http.HttpStatus;

public enum AdmissionRejection {
  INVALID_CREDENTIAL(HttpStatus.UNAUTHORIZED, "invalid_credential"),
  MALFORMED_REQUEST(HttpStatus.UNAUTHORIZED, "malformed_request"),
  PERMISSION_DENIED(HttpStatus.FORBIDDEN, "permission_denied"),
  QUOTA_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "quota_exceeded"),
  UPSTREAM_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "upstream_unavailable");

  private final HttpStatus status;
  private final String code;

  AdmissionRejection(HttpStatus status, String code) {
    this.status = status;
    this.code = code;
  }

  public HttpStatus status() {
    return status;
  }

  public String code() {
    return code;
  }
}
