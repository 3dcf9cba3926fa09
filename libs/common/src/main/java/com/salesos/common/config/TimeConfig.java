/*
 * Where: Shared configuration
 * What: Exposes Clock as an injectable bean
 * Why: Every component reads time from the same source so tests can pin it
 */
package com.salesos.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
