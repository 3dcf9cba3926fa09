/*
 * Where: Notification API request DTO
 * What: Body of POST /v1/notifications
 */
package com.salesos.notification.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.salesos.notification.model.NotificationPriority;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "request DTO is only read once when the job is built")
public record EnqueueNotificationRequest(
    @NotBlank @Size(max = 128) String userId,
    @NotBlank @Size(max = 255) String title,
    @NotBlank String body,
    @Size(max = 64) String type,
    NotificationPriority priority,
    @Size(max = 64) String action,
    Map<String, Object> actionData,
    Instant scheduledFor) {}
