package com.flamingo.ai.chatsearch.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for search, cache and vectorizer metrics. */
@Configuration
public class MetricsConfig {

  /** Enables {@code @Timed} on the backend, vectorizer and orchestrator. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags every meter with the application name so dashboards can tell deployments apart. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> applicationTagCustomizer(
      @Value("${spring.application.name:chat-search}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }
}
