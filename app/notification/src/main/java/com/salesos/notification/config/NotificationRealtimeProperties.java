/*
 * Where: Notification configuration binding
 * What: Request/reply settings for the realtime socket gateway
 * Why: The realtime attempt must be bounded so a slow gateway cannot stall a claim cycle
 */
package com.salesos.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.realtime")
@Validated
public record NotificationRealtimeProperties(
    @NotBlank String subjectPrefix, @NotNull Duration requestTimeout) {

  @AssertTrue(message = "notification.realtime.request-timeout must be positive")
  public boolean isRequestTimeoutPositive() {
    return DurationChecks.isPositive(requestTimeout);
  }

  public String subjectFor(String userId) {
    return subjectPrefix + "." + userId;
  }
}
