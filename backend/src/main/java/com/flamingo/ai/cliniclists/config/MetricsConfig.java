package com.flamingo.ai.cliniclists.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics setup. Cache hit/miss, extraction and index counters are registered lazily by the
 * services that increment them.
 */
@Configuration
public class MetricsConfig {

  /** Enables @Timed on the ingest, list and index operations. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> commonTags(
      @Value("${spring.application.name:clinical-lists}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }
}
