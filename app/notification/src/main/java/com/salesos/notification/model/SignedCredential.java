/*
 * Where: Notification domain model
 * What: A signed provider token and its validity window
 * Why: The credential manager caches it per process and checks expiry before reuse
 */
package com.salesos.notification.model;

import java.time.Duration;
import java.time.Instant;

public record SignedCredential(
    String token,
    String algorithm,
    String issuer,
    String keyId,
    Instant issuedAt,
    Instant expiresAt) {

  public boolean isUsableAt(Instant now, Duration refreshMargin) {
    return now.isBefore(expiresAt.minus(refreshMargin));
  }
}
