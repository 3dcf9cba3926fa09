/*
 * Where: Notification NATS integration
 * What: Realtime channel implemented as a NATS request to the socket gateway
 * Why: The gateway answers whether the user had a live session, which decides the native fallback
 */
package com.salesos.notification.nats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesos.notification.config.NotificationRealtimeProperties;
import com.salesos.notification.service.RealtimeChannel;
import com.salesos.notification.service.RealtimeEnvelope;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import io.nats.client.Message;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsRealtimeChannel implements RealtimeChannel {

    private static final Logger logger = LoggerFactory.getLogger(NatsRealtimeChannel.class);

    private final Connection connection;
    private final ObjectMapper objectMapper;
    private final NotificationRealtimeProperties properties;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Connection and ObjectMapper are shared Spring-managed components")
    public NatsRealtimeChannel(Connection connection,
            ObjectMapper objectMapper,
            NotificationRealtimeProperties properties) {
        this.connection = connection;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public boolean pushToUser(String userId, RealtimeEnvelope envelope) {
        String subject = properties.subjectFor(userId);
        Message reply;
        try {
            reply = connection.request(subject, serialize(envelope), properties.requestTimeout());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            logger.warn("realtime push interrupted userId={} notificationId={}", userId, envelope.notificationId());
            return false;
        } catch (IllegalStateException ex) {
            // closed or draining connection
            logger.warn("realtime push skipped, nats connection unavailable userId={}", userId, ex);
            return false;
        }
        if (reply == null) {
            // no responder or timeout: nobody holds a session for this user
            logger.debug("realtime push got no reply subject={}", subject);
            return false;
        }
        return parseDelivered(reply, userId);
    }

    private boolean parseDelivered(Message reply, String userId) {
        try {
            return objectMapper.readTree(reply.getData()).path("delivered").asBoolean(false);
        } catch (IOException ex) {
            logger.warn("realtime gateway reply is not json userId={}", userId, ex);
            return false;
        }
    }

    private byte[] serialize(RealtimeEnvelope envelope) {
        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("realtime envelope serialization failure", ex);
        }
    }
}
