/*
 * どこで: Gateway ドメインモデル
 * 何を: 発行直後のキー (生の秘密値 + 保存済みレコード) を表す
 * なぜ: 秘密値を返せるのは発行時の 1 回だけであることを型で表すため
 */
package com.oraclegate.gateway.model;

public record IssuedApiKey(String rawSecret, ApiKeyRecord record) {

  @Override
  public String toString() {
    return "IssuedApiKey[rawSecret=***, record=" + record.id() + "]";
  }
}
