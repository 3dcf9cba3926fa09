/*
 * Where: Notification claim worker
 * What: Starts a notification claim cycle on a fixed delay
 * Why: Scheduled and queued jobs are picked up without a broker
 */
package com.salesos.notification.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.claim.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ScheduledNotificationWorker {

  private final NotificationClaimService claimService;

  @Scheduled(fixedDelayString = "${notification.claim.interval}")
  public void run() {
    claimService.processDueBatch();
  }
}
