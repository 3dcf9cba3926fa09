/*
 * Where: Notification configuration binding
 * What: NATS connection settings
 * Why: Switch the gateway connection per environment
 */
package com.salesos.notification.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Integer connectionTimeout) {}
