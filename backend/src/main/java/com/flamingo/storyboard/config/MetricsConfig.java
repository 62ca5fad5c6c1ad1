package com.flamingo.storyboard.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Metrics wiring for the import pipeline. */
@Configuration
public class MetricsConfig {

  /** Backs {@code @Timed} on import batches, recorded as {@code docx.import.batch}. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
