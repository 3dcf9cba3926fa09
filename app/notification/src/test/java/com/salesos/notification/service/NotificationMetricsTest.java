package com.salesos.notification.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.salesos.notification.model.JobStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class NotificationMetricsTest {

  @Test
  void recordsDeliveryChannelInvalidationAndBacklogMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final NotificationMetrics metrics = new NotificationMetrics(registry);

    metrics.recordDeliveryResult(JobStatus.SENT);
    metrics.recordDeliveryResult(JobStatus.SENT);
    metrics.recordDeliveryResult(JobStatus.FAILED);
    metrics.recordChannelAttempt(NotificationMetrics.CHANNEL_APNS, false);
    metrics.recordClaimed("notification", 25);
    metrics.recordDeviceInvalidated();
    metrics.recordDeliveryE2eDelay(
        Instant.parse("2026-03-02T09:00:00Z"), Instant.parse("2026-03-02T09:00:07Z"));
    metrics.updateBacklogCurrent(12);

    assertThat(registry.get("notification.delivery.total").tag("status", "SENT").counter().count())
        .isEqualTo(2.0d);
    assertThat(registry.get("notification.delivery.total").tag("status", "FAILED").counter().count())
        .isEqualTo(1.0d);
    assertThat(
            registry
                .get("notification.channel.attempt.total")
                .tags("channel", "apns", "result", "failure")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(registry.get("notification.claimed.total").tag("source", "notification").counter().count())
        .isEqualTo(25.0d);
    assertThat(registry.get("notification.device.invalidated.total").counter().count()).isEqualTo(1.0d);
    assertThat(registry.get("notification.delivery.e2e.delay").timer().count()).isEqualTo(1L);
    assertThat(registry.get("notification.backlog.current").gauge().value()).isEqualTo(12.0d);
  }

  @Test
  void ignoresNegativeDelayAndNegativeBacklog() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final NotificationMetrics metrics = new NotificationMetrics(registry);

    metrics.recordDeliveryE2eDelay(
        Instant.parse("2026-03-02T09:00:07Z"), Instant.parse("2026-03-02T09:00:00Z"));
    metrics.updateBacklogCurrent(-3);

    assertThat(registry.get("notification.delivery.e2e.delay").timer().count()).isZero();
    assertThat(registry.get("notification.backlog.current").gauge().value()).isZero();
  }
}
