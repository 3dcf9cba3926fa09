/*
 * Where: Notification service layer
 * What: Realtime channel used when NATS is disabled
 * Why: Local runs and tests go straight to native push without a socket gateway
 */
package com.salesos.notification.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LocalRealtimeChannel implements RealtimeChannel {

    private static final Logger logger = LoggerFactory.getLogger(LocalRealtimeChannel.class);

    @Override
    public boolean pushToUser(String userId, RealtimeEnvelope envelope) {
        logger.debug("realtime disabled, no live session userId={} notificationId={}",
                userId,
                envelope.notificationId());
        return false;
    }
}
