/*
 * Where: Notification service layer
 * What: Optional attributes of a job being enqueued
 */
package com.salesos.notification.service;

import com.salesos.notification.model.NotificationPriority;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

@Builder
public record EnqueueOptions(
    String type,
    NotificationPriority priority,
    String action,
    Map<String, Object> actionData,
    Instant scheduledFor) {

  public static final String DEFAULT_TYPE = "SYSTEM";

  public EnqueueOptions {
    type = type == null || type.isBlank() ? DEFAULT_TYPE : type;
    priority = priority == null ? NotificationPriority.NORMAL : priority;
    actionData =
        actionData == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(actionData));
  }

  public static EnqueueOptions defaults() {
    return EnqueueOptions.builder().build();
  }
}
