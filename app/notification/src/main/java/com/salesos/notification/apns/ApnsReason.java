/*
 * Where: APNs integration
 * What: Classifies provider rejection reasons as permanent, transient or credential related
 * Why: Only permanent reasons may invalidate a device token
 */
package com.salesos.notification.apns;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.Arrays;

public enum ApnsReason {
  BAD_DEVICE_TOKEN("BadDeviceToken", Kind.PERMANENT),
  UNREGISTERED("Unregistered", Kind.PERMANENT),
  DEVICE_TOKEN_NOT_FOR_TOPIC("DeviceTokenNotForTopic", Kind.PERMANENT),
  EXPIRED_TOKEN("ExpiredToken", Kind.PERMANENT),
  EXPIRED_PROVIDER_TOKEN("ExpiredProviderToken", Kind.PROVIDER_TOKEN),
  INVALID_PROVIDER_TOKEN("InvalidProviderToken", Kind.PROVIDER_TOKEN),
  MISSING_PROVIDER_TOKEN("MissingProviderToken", Kind.PROVIDER_TOKEN),
  TOO_MANY_PROVIDER_TOKEN_UPDATES("TooManyProviderTokenUpdates", Kind.TRANSIENT),
  TOO_MANY_REQUESTS("TooManyRequests", Kind.TRANSIENT),
  PAYLOAD_TOO_LARGE("PayloadTooLarge", Kind.TRANSIENT),
  INTERNAL_SERVER_ERROR("InternalServerError", Kind.TRANSIENT),
  SERVICE_UNAVAILABLE("ServiceUnavailable", Kind.TRANSIENT),
  SHUTDOWN("Shutdown", Kind.TRANSIENT),
  CONNECTION_ERROR("ConnectionError", Kind.TRANSIENT),
  TIMEOUT("Timeout", Kind.TRANSIENT),
  UNKNOWN("Unknown", Kind.TRANSIENT);

  enum Kind {
    PERMANENT,
    TRANSIENT,
    PROVIDER_TOKEN
  }

  private static final ImmutableMap<String, ApnsReason> BY_PROVIDER_VALUE =
      Maps.uniqueIndex(Arrays.asList(values()), ApnsReason::providerValue);

  private final String providerValue;
  private final Kind kind;

  ApnsReason(String providerValue, Kind kind) {
    this.providerValue = providerValue;
    this.kind = kind;
  }

  public static ApnsReason fromProviderValue(String value) {
    if (value == null) {
      return UNKNOWN;
    }
    return BY_PROVIDER_VALUE.getOrDefault(value, UNKNOWN);
  }

  public String providerValue() {
    return providerValue;
  }

  /** The address itself is dead; retrying the same token can never succeed. */
  public boolean isPermanent() {
    return kind == Kind.PERMANENT;
  }

  /** Our signed credential was refused; the cached token has to be re-minted. */
  public boolean isProviderTokenRejection() {
    return kind == Kind.PROVIDER_TOKEN;
  }
}
