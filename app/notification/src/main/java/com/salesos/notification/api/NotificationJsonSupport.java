package com.salesos.notification.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

final class NotificationJsonSupport {

  private NotificationJsonSupport() {}

  static JsonNode readActionData(ObjectMapper objectMapper, String json) {
    if (json == null || json.isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("notification action data parse failure", ex);
    }
  }
}
