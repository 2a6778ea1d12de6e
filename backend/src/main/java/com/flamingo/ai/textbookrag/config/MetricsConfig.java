package com.flamingo.ai.textbookrag.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics setup. Chunking, indexing and retrieval entry points are timed with {@code @Timed}; every
 * meter is tagged with the application name.
 */
@Configuration
public class MetricsConfig {

  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> applicationTag(
      @Value("${spring.application.name:textbook-rag}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }
}
