/*
 * Where: APNs integration
 * What: Provider environments and their endpoints
 * Why: A device token is only valid against the environment it was registered with
 */
package com.salesos.notification.apns;

public enum ApnsEnvironment {
  PRODUCTION("https://api.push.apple.com"),
  SANDBOX("https://api.sandbox.push.apple.com");

  private final String baseUrl;

  ApnsEnvironment(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String baseUrl() {
    return baseUrl;
  }
}
