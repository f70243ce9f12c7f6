/*
 * どこで: Gateway セキュリティ
 * 何を: 共有秘密によるリクエスト本文の HMAC-SHA256 署名と検証を行う
 * なぜ: API キーを持たない内部サービス呼び出しを本文改ざんなしで受け付けるため
 */
package com.oraclegate.gateway.security;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

@Component
public class RequestSigner {

  private static final String ALGORITHM = "HmacSHA256";
  private static final HexFormat HEX = HexFormat.of();

  /** Lower-case hex HMAC over the exact payload bytes. */
  public String sign(byte[] payload, String secret) {
    if (secret == null || secret.isBlank()) {
      throw new IllegalArgumentException("signing secret must not be blank");
    }
    return HEX.formatHex(hmac(payload == null ? new byte[0] : payload, secret));
  }

  /** Signs the canonical JSON form of {@code payload}; used for outbound calls. */
  public String sign(Object payload, String secret) {
    return sign(CanonicalJson.toBytes(payload), secret);
  }

  public boolean verify(byte[] payload, String signature, String secret) {
    if (signature == null || signature.isBlank() || secret == null || secret.isBlank()) {
      return false;
    }
    final byte[] presented;
    try {
      presented = HEX.parseHex(signature.trim().toLowerCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      return false;
    }
    final byte[] expected = hmac(payload == null ? new byte[0] : payload, secret);
    return MessageDigest.isEqual(expected, presented);
  }

  private byte[] hmac(byte[] payload, String secret) {
    try {
      final Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      return mac.doFinal(payload);
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new IllegalStateException("HMAC-SHA256 is unavailable", e);
    }
  }
}
