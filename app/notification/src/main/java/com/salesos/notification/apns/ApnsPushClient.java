/*
 * Where: APNs integration
 * What: Sends one push to one device token over the APNs HTTP/2 API and classifies the answer
 * Why: Turns provider status codes and reasons into results the delivery service can act on
 */
package com.salesos.notification.apns;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import com.salesos.notification.config.ApnsProperties;
import com.salesos.notification.model.NotificationPriority;
import com.salesos.notification.service.NativePushChannel;
import com.salesos.notification.service.PushMessage;
import com.salesos.notification.service.PushResult;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class ApnsPushClient implements NativePushChannel {

  private static final Logger logger = LoggerFactory.getLogger(ApnsPushClient.class);

  static final String DEVICE_PATH = "/3/device/{deviceToken}";
  static final String HEADER_APNS_ID = "apns-id";
  static final String HEADER_TOPIC = "apns-topic";
  static final String HEADER_PUSH_TYPE = "apns-push-type";
  static final String HEADER_PRIORITY = "apns-priority";
  static final String HEADER_COLLAPSE_ID = "apns-collapse-id";
  static final String HEADER_EXPIRATION = "apns-expiration";
  static final String PUSH_TYPE_ALERT = "alert";
  static final String PUSH_TYPE_BACKGROUND = "background";
  static final int PRIORITY_IMMEDIATE = 10;
  static final int PRIORITY_CONSERVE_POWER = 5;

  private final RestClient apnsRestClient;
  private final ApnsCredentialManager credentialManager;
  private final ApnsProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient and ObjectMapper are shared Spring-managed components")
  public ApnsPushClient(
      RestClient apnsRestClient,
      ApnsCredentialManager credentialManager,
      ApnsProperties properties,
      ObjectMapper objectMapper,
      Clock clock) {
    this.apnsRestClient = apnsRestClient;
    this.credentialManager = credentialManager;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public PushResult send(String deviceToken, PushMessage message) {
    final Instant expiration =
        message.expiration() != null
            ? message.expiration()
            : Instant.now(clock).plus(properties.notificationTtl());
    final ApnsRequest request =
        new ApnsRequest(
            PUSH_TYPE_ALERT,
            message.priority() == NotificationPriority.LOW ? PRIORITY_CONSERVE_POWER : PRIORITY_IMMEDIATE,
            message.collapseId(),
            expiration,
            alertPayload(message));
    return post(deviceToken, request);
  }

  @Override
  public PushResult sendSilent(String deviceToken, Map<String, Object> data) {
    final ObjectNode payload = objectMapper.createObjectNode();
    payload.putObject("aps").put("content-available", 1);
    putCustomData(payload, data);
    // background pushes must use priority 5 or the provider rejects them
    return post(deviceToken, new ApnsRequest(PUSH_TYPE_BACKGROUND, PRIORITY_CONSERVE_POWER, null, null, payload));
  }

  private PushResult post(String deviceToken, ApnsRequest request) {
    if (deviceToken == null || deviceToken.isBlank()) {
      // a stored blank token can never be delivered to; report it so the device is invalidated
      logger.warn("apns skipped blank device token");
      return PushResult.rejected(0, ApnsReason.BAD_DEVICE_TOKEN.providerValue(), true);
    }
    final String topic = properties.topic();
    if (topic == null || topic.isBlank()) {
      throw new ApnsConfigurationException("notification.apns.topic is required for native push");
    }
    final String bearer = credentialManager.getToken();
    try {
      final ResponseEntity<Void> response =
          apnsRestClient
              .post()
              .uri(DEVICE_PATH, deviceToken)
              .header(HttpHeaders.AUTHORIZATION, "bearer " + bearer)
              .header(HEADER_TOPIC, topic)
              .header(HEADER_PUSH_TYPE, request.pushType())
              .header(HEADER_PRIORITY, String.valueOf(request.priority()))
              .headers(headers -> optionalHeaders(headers, request))
              .contentType(MediaType.APPLICATION_JSON)
              .body(serialize(request.payload()))
              .retrieve()
              .toBodilessEntity();
      final String apnsId = response.getHeaders().getFirst(HEADER_APNS_ID);
      logger.debug("apns accepted token={} apnsId={}", maskToken(deviceToken), apnsId);
      return PushResult.accepted(apnsId);
    } catch (RestClientResponseException ex) {
      return rejected(deviceToken, ex);
    } catch (ResourceAccessException ex) {
      return unreachable(deviceToken, ex);
    }
  }

  private void optionalHeaders(HttpHeaders headers, ApnsRequest request) {
    if (request.collapseId() != null && !request.collapseId().isBlank()) {
      headers.set(HEADER_COLLAPSE_ID, request.collapseId());
    }
    if (request.expiration() != null) {
      headers.set(HEADER_EXPIRATION, String.valueOf(request.expiration().getEpochSecond()));
    }
  }

  private PushResult rejected(String deviceToken, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    final ApnsReason reason = ApnsReason.fromProviderValue(parseReason(ex.getResponseBodyAsString()));
    if (reason.isProviderTokenRejection()) {
      credentialManager.invalidate();
    }
    logger.warn(
        "apns rejected token={} status={} reason={} permanent={}",
        maskToken(deviceToken),
        status,
        reason.providerValue(),
        reason.isPermanent());
    return PushResult.rejected(status, reason.providerValue(), reason.isPermanent());
  }

  private PushResult unreachable(String deviceToken, ResourceAccessException ex) {
    final ApnsReason reason = isTimeout(ex) ? ApnsReason.TIMEOUT : ApnsReason.CONNECTION_ERROR;
    logger.warn("apns unreachable token={} reason={}", maskToken(deviceToken), reason.providerValue(), ex);
    return PushResult.unreachable(reason.providerValue());
  }

  private ObjectNode alertPayload(PushMessage message) {
    final ObjectNode payload = objectMapper.createObjectNode();
    final ObjectNode aps = payload.putObject("aps");
    final ObjectNode alert = aps.putObject("alert");
    alert.put("title", message.title());
    if (message.subtitle() != null) {
      alert.put("subtitle", message.subtitle());
    }
    alert.put("body", message.body());
    if (message.badge() != null) {
      aps.put("badge", message.badge());
    }
    if (message.sound() != null) {
      aps.put("sound", message.sound());
    }
    if (message.threadId() != null) {
      aps.put("thread-id", message.threadId());
    }
    if (message.category() != null) {
      aps.put("category", message.category());
    }
    putCustomData(payload, message.data());
    return payload;
  }

  private void putCustomData(ObjectNode payload, Map<String, Object> data) {
    if (data == null) {
      return;
    }
    // "aps" is reserved by the provider
    data.entrySet().stream()
        .filter(entry -> !"aps".equals(entry.getKey()))
        .forEach(entry -> payload.set(entry.getKey(), objectMapper.valueToTree(entry.getValue())));
  }

  private String serialize(ObjectNode payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("apns payload serialization failure", ex);
    }
  }

  private String parseReason(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readTree(body).path("reason").asText(null);
    } catch (JsonProcessingException ex) {
      logger.warn("apns error body is not json body={}", body);
      return null;
    }
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  @VisibleForTesting
  static String maskToken(String deviceToken) {
    if (deviceToken.length() <= 8) {
      return "****";
    }
    return "****" + deviceToken.substring(deviceToken.length() - 8);
  }

  private record ApnsRequest(
      String pushType, int priority, String collapseId, Instant expiration, ObjectNode payload) {}
}
