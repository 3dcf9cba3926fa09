/*
 * Where: Notification configuration binding
 * What: Claim cycle settings for task due-date reminders
 * Why: Reminders run on their own, slower timer
 */
package com.salesos.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.reminder")
@Validated
public record NotificationReminderProperties(
    boolean enabled,
    @NotNull Duration interval,
    @Positive int batchSize,
    @NotNull Duration lease) {

  @AssertTrue(message = "notification.reminder.interval must be positive")
  public boolean isIntervalPositive() {
    return DurationChecks.isPositive(interval);
  }

  @AssertTrue(message = "notification.reminder.lease must be positive")
  public boolean isLeasePositive() {
    return DurationChecks.isPositive(lease);
  }
}
