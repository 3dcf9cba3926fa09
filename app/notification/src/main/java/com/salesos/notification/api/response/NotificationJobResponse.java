/*
 * Where: Notification API response DTO
 * What: Current state of one notification job
 * Why: Callers poll it to see which channel, if any, reached the user
 */
package com.salesos.notification.api.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.salesos.notification.model.JobStatus;
import com.salesos.notification.model.NotificationPriority;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "actionData is a freshly parsed tree owned by this response")
public record NotificationJobResponse(
    UUID notificationId,
    String userId,
    String type,
    NotificationPriority priority,
    String title,
    String body,
    String action,
    JsonNode actionData,
    JobStatus status,
    Instant scheduledFor,
    Instant createdAt,
    Instant sentAt,
    Instant deliveredAt,
    String lastError) {}
