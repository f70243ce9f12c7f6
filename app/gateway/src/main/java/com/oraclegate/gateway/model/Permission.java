/*
 * どこで: Gateway ドメインモデル
 * 何を: API キーに付与できる権限トークンの閉じた語彙を定義する
 * なぜ: 未知の権限文字列を発行時/検証時の両方で弾けるようにするため
 */
package com.oraclegate.gateway.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

public enum Permission {
  TOOLS_READ("tools:read"),
  TOOLS_WRITE("tools:write"),
  ADMIN_READ("admin:read"),
  ADMIN_WRITE("admin:write");

  /** Bumped whenever a token is added or removed; stored records are re-validated on read. */
  public static final int VOCABULARY_VERSION = 1;

  private final String token;

  Permission(String token) {
    this.token = token;
  }

  public String token() {
    return token;
  }

  public static Optional<Permission> fromToken(String token) {
    if (token == null) {
      return Optional.empty();
    }
    final String normalized = token.trim();
    return Arrays.stream(values()).filter(p -> p.token.equals(normalized)).findFirst();
  }

  public static Set<Permission> all() {
    return new LinkedHashSet<>(Arrays.asList(values()));
  }

  public static Set<String> tokens(Collection<Permission> permissions) {
    return permissions.stream()
        .map(Permission::token)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }
}
