/*
 * Where: Notification service layer
 * What: Sends a background (silent) push to every active device of a user
 * Why: Lets other services wake the app to refresh state without showing an alert
 */
package com.salesos.notification.service;

import com.salesos.notification.apns.ApnsConfigurationException;
import com.salesos.notification.model.DeviceRegistration;

import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SilentPushService {

    private static final Logger logger = LoggerFactory.getLogger(SilentPushService.class);

    private final DeviceRegistry deviceRegistry;
    private final NativePushChannel nativePushChannel;
    private final NotificationMetrics metrics;

    /**
     * Wakes every active device of {@code userId} with a background push. A device that fails is
     * skipped; a permanently rejected one is invalidated.
     *
     * @return number of devices that accepted the push
     * @throws ApnsConfigurationException when native push is not configured
     */
    public int refreshUser(String userId, Map<String, Object> data) {
        List<DeviceRegistration> devices = deviceRegistry.listActiveNativeDevices(userId);
        int accepted = 0;
        for (DeviceRegistration device : devices) {
            PushResult result = sendSilent(device, data);
            metrics.recordChannelAttempt(NotificationMetrics.CHANNEL_APNS, result.success());
            if (result.success()) {
                accepted++;
            } else if (result.permanent()) {
                invalidate(device);
            }
        }
        logger.info("silent push sent userId={} devices={} accepted={}", userId, devices.size(), accepted);
        return accepted;
    }

    private PushResult sendSilent(DeviceRegistration device, Map<String, Object> data) {
        try {
            return nativePushChannel.sendSilent(device.pushToken(), data);
        } catch (ApnsConfigurationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            logger.warn("silent push to device failed deviceId={}", device.deviceId(), ex);
            return PushResult.unreachable(ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
        }
    }

    private void invalidate(DeviceRegistration device) {
        try {
            if (deviceRegistry.invalidateAddress(device.deviceId())) {
                metrics.recordDeviceInvalidated();
            }
        } catch (DataAccessException ex) {
            logger.error("device invalidation failed deviceId={}", device.deviceId(), ex);
        }
    }
}
