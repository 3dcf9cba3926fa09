/*
 * Where: Notification debug API model
 * What: A user's notification inbox, newest first
 */
package com.salesos.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationInboxResponse(String userId, List<NotificationSummary> notifications) {
  public NotificationInboxResponse {
    // EI_EXPOSE_REP: keep an unmodifiable copy of the caller's list
    notifications =
        notifications == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(notifications));
  }
}
