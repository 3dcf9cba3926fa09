/*
 * Where: Notification configuration
 * What: Provides the RestClient used for APNs over HTTP/2
 * Why: APNs only speaks HTTP/2 and every call needs bounded connect/read timeouts
 */
package com.salesos.notification.config;

import java.net.http.HttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ApnsClientConfig {

  @Bean
  RestClient apnsRestClient(RestClient.Builder builder, ApnsProperties properties) {
    final HttpClient httpClient =
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_2)
            .connectTimeout(properties.connectTimeout())
            .build();
    final JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.requestTimeout());
    return builder.baseUrl(properties.resolveBaseUrl()).requestFactory(requestFactory).build();
  }
}
