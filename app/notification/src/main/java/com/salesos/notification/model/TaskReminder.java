/*
 * Where: Notification domain model
 * What: The slice of a task row needed to build a due-date reminder
 * Why: Reminders are claimed on the owning task, not on a queued job row
 */
package com.salesos.notification.model;

import java.time.Instant;
import java.util.UUID;

public record TaskReminder(
    UUID taskId,
    String ownerId,
    String subject,
    String taskStatus,
    String taskPriority,
    Instant dueDate,
    Instant reminderAt) {

  /** Urgent and high-priority tasks raise a high-priority notification. */
  public NotificationPriority notificationPriority() {
    if ("URGENT".equals(taskPriority) || "HIGH".equals(taskPriority)) {
      return NotificationPriority.HIGH;
    }
    return NotificationPriority.NORMAL;
  }
}
