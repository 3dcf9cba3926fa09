/*
 * Where: Notification domain model
 * What: Snapshot of a notification_jobs row
 * Why: Shared by the claimer, the delivery service and the HTTP API
 */
package com.salesos.notification.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationJob(
    UUID jobId,
    String userId,
    String title,
    String body,
    String type,
    NotificationPriority priority,
    String action,
    String actionDataJson,
    JobStatus status,
    Instant scheduledFor,
    String lockedBy,
    Instant lockedAt,
    Instant leaseUntil,
    String lastError,
    Instant createdAt,
    Instant sentAt,
    Instant deliveredAt) {

  public boolean isOwnedBy(String workerId) {
    return status == JobStatus.IN_FLIGHT && workerId != null && workerId.equals(lockedBy);
  }
}
