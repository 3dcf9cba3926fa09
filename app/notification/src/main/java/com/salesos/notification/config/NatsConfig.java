/*
 * Where: Notification infrastructure configuration
 * What: Puts the NATS connection to the realtime gateway under Spring management
 * Why: The realtime channel reuses one connection for every push request
 */
package com.salesos.notification.config;

import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

    private static final Logger logger = LoggerFactory.getLogger(NatsConfig.class);
    private static final String CONNECTION_NAME = "notification-engine";
    private static final int RECONNECT_FOREVER = -1;

    @Bean(destroyMethod = "close")
    public Connection natsConnection(NatsProperties properties) throws IOException, InterruptedException {
        // while reconnecting, requests time out and the job falls back to native push
        Options options = new Options.Builder()
                .server(properties.url())
                .connectionName(CONNECTION_NAME)
                .connectionTimeout(Duration.ofSeconds(properties.connectionTimeout()))
                .maxReconnects(RECONNECT_FOREVER)
                .build();
        Connection connection = Nats.connect(options);
        logger.info("nats connected url={} name={}", properties.url(), CONNECTION_NAME);
        return connection;
    }
}
