/*
 * Where: APNs integration
 * What: Signals missing or unusable provider configuration (key, key id, team id, topic)
 * Why: Configuration errors disable native push until fixed and must not be retried as delivery failures
 */
package com.salesos.notification.apns;

public class ApnsConfigurationException extends RuntimeException {

  public ApnsConfigurationException(String message) {
    super(message);
  }

  public ApnsConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
