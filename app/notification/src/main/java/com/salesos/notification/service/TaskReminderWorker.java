/*
 * Where: Notification claim worker
 * What: Starts a task reminder cycle on a fixed delay
 */
package com.salesos.notification.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.reminder.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class TaskReminderWorker {

  private final TaskReminderService reminderService;

  @Scheduled(fixedDelayString = "${notification.reminder.interval}")
  public void run() {
    reminderService.processDueReminders();
  }
}
