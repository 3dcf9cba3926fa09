/*
 * Where: Notification service layer
 * What: Records delivery outcomes, channel attempts, claims, device invalidations and backlog
 * Why: Delivery failures have no user-facing surface, so they have to be observable here
 */
package com.salesos.notification.service;

import com.salesos.notification.model.JobStatus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class NotificationMetrics {

  private static final String METRIC_DELIVERY_TOTAL = "notification.delivery.total";
  private static final String METRIC_CHANNEL_ATTEMPT_TOTAL = "notification.channel.attempt.total";
  private static final String METRIC_CLAIMED_TOTAL = "notification.claimed.total";
  private static final String METRIC_DEVICE_INVALIDATED_TOTAL = "notification.device.invalidated.total";
  private static final String METRIC_DELIVERY_E2E_DELAY = "notification.delivery.e2e.delay";
  private static final String METRIC_BACKLOG_CURRENT = "notification.backlog.current";

  public static final String CHANNEL_REALTIME = "realtime";
  public static final String CHANNEL_APNS = "apns";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter deviceInvalidatedCounter;
  private final Timer deliveryE2eDelayTimer;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Due notification jobs still waiting to be claimed")
        .register(meterRegistry);
    this.deviceInvalidatedCounter =
        Counter.builder(METRIC_DEVICE_INVALIDATED_TOTAL)
            .description("Device tokens cleared after a permanent provider rejection")
            .register(meterRegistry);
    this.deliveryE2eDelayTimer =
        Timer.builder(METRIC_DELIVERY_E2E_DELAY)
            .description("Delay from job creation to its terminal status")
            .register(meterRegistry);
  }

  public void recordDeliveryResult(JobStatus status) {
    counter(METRIC_DELIVERY_TOTAL, "Notification job terminal outcomes", Tags.of("status", status.name()))
        .increment();
  }

  public void recordChannelAttempt(String channel, boolean success) {
    counter(
            METRIC_CHANNEL_ATTEMPT_TOTAL,
            "Delivery attempts per channel",
            Tags.of("channel", channel, "result", success ? "success" : "failure"))
        .increment();
  }

  public void recordClaimed(String source, int count) {
    counter(METRIC_CLAIMED_TOTAL, "Jobs won by this worker's claim cycles", Tags.of("source", source))
        .increment(count);
  }

  public void recordDeviceInvalidated() {
    deviceInvalidatedCounter.increment();
  }

  public void recordDeliveryE2eDelay(Instant createdAt, Instant terminalAt) {
    if (createdAt == null || terminalAt == null || terminalAt.isBefore(createdAt)) {
      return;
    }
    deliveryE2eDelayTimer.record(Duration.between(createdAt, terminalAt));
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }

  private Counter counter(String name, String description, Tags tags) {
    return counters.computeIfAbsent(
        name + tags,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
