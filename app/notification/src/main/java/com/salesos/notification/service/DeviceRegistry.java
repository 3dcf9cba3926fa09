/*
 * Where: Notification service layer
 * What: The device registry operations the engine depends on
 * Why: Registration belongs to another service; the engine only reads devices and kills dead tokens
 */
package com.salesos.notification.service;

import com.salesos.notification.model.DeviceRegistration;
import java.util.List;
import java.util.UUID;

public interface DeviceRegistry {

  /** Active, push-enabled APNs devices of the user that still hold a token. */
  List<DeviceRegistration> listActiveNativeDevices(String userId);

  /**
   * Clears the device's token and marks it unusable. Invalidating an already invalid device is a
   * no-op.
   *
   * @return true when a token was cleared by this call
   */
  boolean invalidateAddress(UUID deviceId);
}
