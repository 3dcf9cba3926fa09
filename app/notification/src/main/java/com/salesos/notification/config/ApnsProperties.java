/*
 * Where: Notification configuration binding
 * What: APNs provider settings (environment, signing key, topic, timeouts, token lifetime)
 * Why: Key material and the target environment differ per deployment and must not be hard-coded
 */
package com.salesos.notification.config;

import com.salesos.notification.apns.ApnsEnvironment;
import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.apns")
@Validated
public record ApnsProperties(
    ApnsEnvironment environment,
    String baseUrl,
    String teamId,
    String keyId,
    String privateKeyPath,
    String privateKey,
    String topic,
    Duration connectTimeout,
    Duration requestTimeout,
    Duration tokenTtl,
    Duration tokenRefreshMargin,
    Duration notificationTtl) {

  public ApnsProperties {
    environment = environment == null ? ApnsEnvironment.SANDBOX : environment;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    requestTimeout = requestTimeout == null ? Duration.ofSeconds(10) : requestTimeout;
    tokenTtl = tokenTtl == null ? Duration.ofHours(1) : tokenTtl;
    tokenRefreshMargin = tokenRefreshMargin == null ? Duration.ofMinutes(10) : tokenRefreshMargin;
    notificationTtl = notificationTtl == null ? Duration.ofDays(1) : notificationTtl;
  }

  /** Explicit base URL wins; otherwise the environment's provider host. */
  public String resolveBaseUrl() {
    if (baseUrl != null && !baseUrl.isBlank()) {
      return baseUrl;
    }
    return environment.baseUrl();
  }

  @AssertTrue(message = "notification.apns.token-refresh-margin must be shorter than token-ttl")
  public boolean isRefreshMarginWithinTtl() {
    return tokenRefreshMargin.compareTo(tokenTtl) < 0;
  }

  @AssertTrue(message = "notification.apns timeouts must be positive")
  public boolean isTimeoutsPositive() {
    return DurationChecks.isPositive(connectTimeout) && DurationChecks.isPositive(requestTimeout);
  }
}
