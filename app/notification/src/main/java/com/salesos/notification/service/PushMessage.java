/*
 * Where: Notification service layer
 * What: Channel-neutral description of one visible native push
 * Why: The delivery service builds it once per job and fans it out to every device
 */
package com.salesos.notification.service;

import com.salesos.notification.model.NotificationPriority;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;

@Builder
public record PushMessage(
    String title,
    String body,
    String subtitle,
    Integer badge,
    String sound,
    String threadId,
    String category,
    Map<String, Object> data,
    String collapseId,
    NotificationPriority priority,
    Instant expiration) {

  public PushMessage {
    // action data may carry JSON nulls, so no Map.copyOf
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }
}
