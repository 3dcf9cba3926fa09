/*
 * Where: Notification domain model
 * What: A user's device as seen by the native push channel
 * Why: Fan-out and token invalidation work per device
 */
package com.salesos.notification.model;

import java.time.Instant;
import java.util.UUID;

public record DeviceRegistration(
    UUID deviceId,
    String userId,
    DeviceType deviceType,
    String pushToken,
    PushTokenType pushTokenType,
    boolean pushEnabled,
    boolean active,
    Instant pushTokenUpdatedAt) {}
