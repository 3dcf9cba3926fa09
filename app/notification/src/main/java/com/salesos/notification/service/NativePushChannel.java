/*
 * Where: Notification service layer
 * What: Durable push to a single registered device address
 * Why: Keeps the delivery service independent from the provider protocol
 */
package com.salesos.notification.service;

import java.util.Map;

public interface NativePushChannel {

  /**
   * Sends a visible alert. Provider and network failures come back in the result.
   *
   * @throws com.salesos.notification.apns.ApnsConfigurationException when the channel is not configured
   */
  PushResult send(String deviceToken, PushMessage message);

  /** Sends a content-available push with no alert, for passive state refresh. */
  PushResult sendSilent(String deviceToken, Map<String, Object> data);
}
