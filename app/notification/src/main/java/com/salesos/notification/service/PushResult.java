/*
 * Where: Notification service layer
 * What: Outcome of one native push attempt to one device
 * Why: The delivery service decides invalidation and the job status from it
 */
package com.salesos.notification.service;

public record PushResult(
    boolean success, String providerMessageId, int statusCode, String reason, boolean permanent) {

  public static PushResult accepted(String providerMessageId) {
    return new PushResult(true, providerMessageId, 200, null, false);
  }

  public static PushResult rejected(int statusCode, String reason, boolean permanent) {
    return new PushResult(false, null, statusCode, reason, permanent);
  }

  /** No HTTP status was received (connection refused, reset, timeout). */
  public static PushResult unreachable(String reason) {
    return new PushResult(false, null, 0, reason, false);
  }

  public String describe() {
    if (success) {
      return "accepted apnsId=" + providerMessageId;
    }
    return statusCode == 0 ? reason : reason + " (status " + statusCode + ")";
  }
}
