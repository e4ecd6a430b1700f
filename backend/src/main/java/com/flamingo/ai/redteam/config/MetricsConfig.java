package com.flamingo.ai.redteam.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for analysis metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation on the analysis pipeline.
   *
   * @param meterRegistry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry meterRegistry) {
    return new TimedAspect(meterRegistry);
  }
}
