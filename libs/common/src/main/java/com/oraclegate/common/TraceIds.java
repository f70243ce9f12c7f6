/*
 * どこで: 共通ユーティリティ
 * 何を: リクエスト単位の trace id を採番/引き継ぎする
 * なぜ: 受付判定から業務処理・監査ログまで同じ ID で追跡できるようにするため
 */
package com.oraclegate.common;

import java.util.UUID;

public final class TraceIds {

  public static final String HEADER_NAME = "X-Trace-Id";

  private static final int MAX_LENGTH = 64;

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  // 呼び出し側から渡された値は長さと文字種を確認してから採用する
  public static String resolve(String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return newTraceId();
    }
    final String trimmed = candidate.trim();
    if (trimmed.length() > MAX_LENGTH || !isSafe(trimmed)) {
      return newTraceId();
    }
    return trimmed;
  }

  private static boolean isSafe(String value) {
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      final boolean allowed = Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.';
      if (!allowed) {
        return false;
      }
    }
    return true;
  }
}
