/*
 * Where: Notification domain model
 * What: Lifecycle of a notification job
 * Why: Keep the database column and the delivery logic on the same closed set of states
 */
package com.salesos.notification.model;

public enum JobStatus {
  PENDING,
  IN_FLIGHT,
  DELIVERED,
  SENT,
  FAILED;

  public boolean isTerminal() {
    return this == DELIVERED || this == SENT || this == FAILED;
  }
}
