/*
 * Where: Notification service layer
 * What: Message handed to the realtime socket gateway
 * Why: The gateway forwards it unchanged to the user's live session
 */
package com.salesos.notification.service;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RealtimeEnvelope(
    String event,
    String notificationId,
    String userId,
    String type,
    String priority,
    String title,
    String body,
    String action,
    @JsonRawValue String actionData,
    String createdAt) {

  public static final String EVENT_NOTIFICATION = "notification";
}
