package com.salesos.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.salesos.notification.model.JobStatus;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnqueueNotificationResponse(UUID notificationId, JobStatus status, Instant scheduledFor) {}
