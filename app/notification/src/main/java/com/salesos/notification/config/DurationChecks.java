package com.salesos.notification.config;

import java.time.Duration;

final class DurationChecks {
  private DurationChecks() {}

  // @Positive does not apply to Duration; null is left to @NotNull.
  static boolean isPositive(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
