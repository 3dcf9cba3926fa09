/*
 * Where: Notification service layer
 * What: Fire-and-forget push to a user's connected session
 * Why: First delivery stage; the gateway behind it is an external collaborator
 */
package com.salesos.notification.service;

public interface RealtimeChannel {

  /**
   * Pushes to the user's live session.
   *
   * @return true only when the gateway confirms delivery; an absent session is false, not an error
   */
  boolean pushToUser(String userId, RealtimeEnvelope envelope);
}
