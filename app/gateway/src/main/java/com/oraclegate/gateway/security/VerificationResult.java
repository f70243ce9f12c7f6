package com.oraclegate.gateway.security;

import com.oraclegate.gateway.admission.AdmissionRejection;
import com.oraclegate.gateway.model.GatewayIdentity;

/** Either an identity or a rejection, never both. */
public record VerificationResult(GatewayIdentity identity, AdmissionRejection rejection) {

  public static VerificationResult accepted(GatewayIdentity identity) {
    return new VerificationResult(identity, null);
  }

  public static VerificationResult rejected(AdmissionRejection rejection) {
    return new VerificationResult(null, rejection);
  }

  public boolean isAccepted() {
    return identity != null;
  }
}
