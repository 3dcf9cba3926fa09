/*
 * Where: Notification debug API model
 * What: One row of a user's notification inbox
 * Why: Shows the delivery state next to the content for manual checks
 */
package com.salesos.notification.api;

import com.salesos.notification.model.JobStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "actionData is a freshly parsed tree owned by this summary")
public record NotificationSummary(
    UUID notificationId,
    String type,
    String title,
    JobStatus status,
    Instant createdAt,
    Instant sentAt,
    Instant deliveredAt,
    String lastError,
    JsonNode actionData) {}
