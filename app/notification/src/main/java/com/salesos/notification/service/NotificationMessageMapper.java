/*
 * Where: Notification service layer
 * What: Builds the realtime envelope and the native push message for a job
 * Why: Both channels carry the same notification, shaped for their own transport
 */
package com.salesos.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesos.notification.model.NotificationJob;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class NotificationMessageMapper {

  static final String DEFAULT_SOUND = "default";
  static final String DATA_NOTIFICATION_ID = "notificationId";
  static final String DATA_TYPE = "type";
  static final String DATA_ACTION = "action";
  static final String DATA_ACTION_DATA = "actionData";

  private static final String EMPTY_JSON = "{}";
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a shared Spring-managed component")
  public NotificationMessageMapper(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public RealtimeEnvelope toEnvelope(NotificationJob job) {
    return new RealtimeEnvelope(
        RealtimeEnvelope.EVENT_NOTIFICATION,
        job.jobId().toString(),
        job.userId(),
        job.type(),
        job.priority().name(),
        job.title(),
        job.body(),
        job.action(),
        actionDataJson(job),
        job.createdAt() == null ? null : job.createdAt().toString());
  }

  /** The job id doubles as the collapse id so a re-sent job replaces, not duplicates, the alert. */
  public PushMessage toPushMessage(NotificationJob job) {
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put(DATA_NOTIFICATION_ID, job.jobId().toString());
    data.put(DATA_TYPE, job.type());
    if (job.action() != null) {
      data.put(DATA_ACTION, job.action());
    }
    final Map<String, Object> actionData = parseActionData(job);
    if (!actionData.isEmpty()) {
      data.put(DATA_ACTION_DATA, actionData);
    }
    return PushMessage.builder()
        .title(job.title())
        .body(job.body())
        .sound(DEFAULT_SOUND)
        .threadId(job.type())
        .category(job.action())
        .data(data)
        .collapseId(job.jobId().toString())
        .priority(job.priority())
        .build();
  }

  private Map<String, Object> parseActionData(NotificationJob job) {
    try {
      final Map<String, Object> parsed = objectMapper.readValue(actionDataJson(job), MAP_TYPE);
      return parsed == null ? Map.of() : parsed;
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("notification action data parse failure jobId=" + job.jobId(), ex);
    }
  }

  private static String actionDataJson(NotificationJob job) {
    final String json = job.actionDataJson();
    return json == null || json.isBlank() ? EMPTY_JSON : json;
  }
}
