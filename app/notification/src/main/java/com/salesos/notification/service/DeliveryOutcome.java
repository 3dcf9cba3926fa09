/*
 * Where: Notification service layer
 * What: Result of one delivery pass over a job, before it is written back
 * Why: Separates deciding the terminal status from persisting it
 */
package com.salesos.notification.service;

import com.salesos.notification.model.JobStatus;

public record DeliveryOutcome(
    JobStatus status, String lastError, int devicesAttempted, int devicesAccepted, int devicesInvalidated) {

  public static DeliveryOutcome delivered() {
    return new DeliveryOutcome(JobStatus.DELIVERED, null, 0, 0, 0);
  }

  public static DeliveryOutcome failed(String lastError) {
    return new DeliveryOutcome(JobStatus.FAILED, lastError, 0, 0, 0);
  }
}
