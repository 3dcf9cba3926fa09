/*
 * Where: Notification configuration binding
 * What: Claim cycle settings for scheduled notification jobs (interval, batch, lease)
 * Why: Operators tune throughput and crash-recovery latency per environment
 */
package com.salesos.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.claim")
@Validated
public record NotificationClaimProperties(
    boolean enabled,
    @NotNull Duration interval,
    @Positive int batchSize,
    @NotNull Duration lease,
    @Positive int errorMessageMaxLength) {

  @AssertTrue(message = "notification.claim.interval must be positive")
  public boolean isIntervalPositive() {
    return DurationChecks.isPositive(interval);
  }

  @AssertTrue(message = "notification.claim.lease must be positive")
  public boolean isLeasePositive() {
    // IN_FLIGHT rows become reclaimable once the lease passes, so it must outlive a batch.
    return DurationChecks.isPositive(lease);
  }
}
