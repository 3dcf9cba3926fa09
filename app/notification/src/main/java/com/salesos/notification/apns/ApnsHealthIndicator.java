/*
 * Where: APNs integration
 * What: Reports whether a provider token can be minted with the current configuration
 * Why: Native push configuration errors are not retried, so they have to show up in health
 */
package com.salesos.notification.apns;

import com.salesos.notification.config.ApnsProperties;
import com.salesos.notification.model.SignedCredential;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("apns")
@RequiredArgsConstructor
public class ApnsHealthIndicator implements HealthIndicator {

  private final ApnsCredentialManager credentialManager;
  private final ApnsProperties properties;

  @Override
  public Health health() {
    try {
      final SignedCredential credential = credentialManager.getCredential();
      return Health.up()
          .withDetail("environment", properties.environment().name())
          .withDetail("keyId", credential.keyId())
          .withDetail("tokenExpiresAt", credential.expiresAt().toString())
          .build();
    } catch (ApnsConfigurationException ex) {
      return Health.down()
          .withDetail("environment", properties.environment().name())
          .withDetail("error", ex.getMessage())
          .build();
    }
  }
}
