/*
 * どこで: ApiKeyVerifier の単体テスト
 * 何を: 正しいキーの identity 解決と、未知/不正形式/失効/期限切れが同じ拒否になることを検証する
 * なぜ: 拒否理由の違いからキーの存在を推測させないため
 */
package com.oraclegate.gateway.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.oraclegate.gateway.admission.AdmissionRejection;
import com.oraclegate.gateway.config.ApiKeyProperties;
import com.oraclegate.gateway.model.ApiKeyRecord;
import com.oraclegate.gateway.model.AuthenticationMethod;
import com.oraclegate.gateway.model.Permission;
import com.oraclegate.gateway.model.RateLimitTier;
import com.oraclegate.gateway.service.GatewayMetrics;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class ApiKeyVerifierTest {

  private static final VerificationResult INVALID =
      VerificationResult.rejected(AdmissionRejection.INVALID_CREDENTIAL);

  @Mock private ApiKeyStore store;
  @Mock private GatewayMetrics metrics;

  private final ApiKeyProperties properties = new ApiKeyProperties(null, 0, 0, 4, 0, 0, 0, 0);
  private final SecretHasher hasher = new SecretHasher(properties);
  private final ApiKeyGenerator generator = new ApiKeyGenerator(properties);
  private ApiKeyVerifier verifier;

  @BeforeEach
  void setUp() {
    verifier = new ApiKeyVerifier(store, hasher, generator, metrics, Runnable::run);
  }

  @Test
  void validKeyResolvesToIdentityWithStoredPermissions() throws Exception {
    final String secret = generator.newSecret();
    final ApiKeyRecord record =
        record(secret, Set.of(Permission.TOOLS_READ, Permission.ADMIN_READ));
    when(store.findLiveCandidates(generator.displayPrefix(secret))).thenReturn(List.of(record));
    when(store.findByDigest(record.keyHash())).thenReturn(Optional.of(record));

    final VerificationResult result = verifier.verify(secret).get();

    assertThat(result.isAccepted()).isTrue();
    assertThat(result.identity().subjectId()).isEqualTo("user-1");
    assertThat(result.identity().orgId()).isEqualTo("org-1");
    assertThat(result.identity().keyId()).isEqualTo(record.id());
    assertThat(result.identity().tier()).isEqualTo(RateLimitTier.PRO);
    assertThat(result.identity().method()).isEqualTo(AuthenticationMethod.API_KEY);
    assertThat(result.identity().permissions())
        .containsExactlyInAnyOrder(Permission.TOOLS_READ, Permission.ADMIN_READ);
  }

  @Test
  void unknownKeyIsRejectedAsInvalidCredential() throws Exception {
    final String secret = generator.newSecret();
    when(store.findLiveCandidates(any())).thenReturn(List.of());

    assertThat(verifier.verify(secret).get()).isEqualTo(INVALID);
  }

  @Test
  void malformedKeyIsRejectedWithoutStoreLookup() throws Exception {
    assertThat(verifier.verify("not-an-oraclegate-key").get()).isEqualTo(INVALID);
    assertThat(verifier.verify("og_pk_").get()).isEqualTo(INVALID);

    verifyNoInteractions(store);
  }

  @Test
  void wrongSecretSharingPrefixIsRejected() throws Exception {
    final String secret = generator.newSecret();
    final String forged =
        secret.substring(0, secret.length() - 1) + (secret.endsWith("A") ? "B" : "A");
    final ApiKeyRecord record = record(secret, Set.of(Permission.TOOLS_READ));
    when(store.findLiveCandidates(generator.displayPrefix(forged))).thenReturn(List.of(record));

    assertThat(verifier.verify(forged).get()).isEqualTo(INVALID);
    verify(store, never()).findByDigest(any());
  }

  @Test
  void keyRevokedOrExpiredBeforeRecheckIsRejected() throws Exception {
    final String secret = generator.newSecret();
    final ApiKeyRecord record = record(secret, Set.of(Permission.TOOLS_READ));
    when(store.findLiveCandidates(generator.displayPrefix(secret))).thenReturn(List.of(record));
    when(store.findByDigest(record.keyHash())).thenReturn(Optional.empty());

    assertThat(verifier.verify(secret).get()).isEqualTo(INVALID);
  }

  @Test
  void storeFailureCompletesExceptionally() {
    final String secret = generator.newSecret();
    when(store.findLiveCandidates(any()))
        .thenThrow(new DataAccessResourceFailureException("pool exhausted"));

    assertThatThrownBy(() -> verifier.verify(secret).get())
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    verify(metrics).recordVerification(any());
  }

  private ApiKeyRecord record(String secret, Set<Permission> permissions) {
    return new ApiKeyRecord(
        UUID.randomUUID(),
        hasher.hash(secret),
        generator.displayPrefix(secret),
        "user-1",
        "org-1",
        "ci",
        permissions,
        Instant.parse("2026-01-01T00:00:00Z"),
        null,
        null,
        true,
        RateLimitTier.PRO,
        0L);
  }
}
