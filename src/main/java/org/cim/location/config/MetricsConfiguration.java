package org.cim.location.config;

import io.micrometer.core.aop.CountedAspect;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Enables {@code @Timed} on command handling and {@code @Counted} on event publication.
 * Every meter is tagged with the service name so location metrics can be told apart
 * on a shared registry.
 */
@Configuration
@EnableAspectJAutoProxy
public class MetricsConfiguration {

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> serviceTag(
      @Value("${spring.application.name:location-server}") String serviceName) {
    return registry -> registry.config().commonTags("service", serviceName);
  }

  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public CountedAspect countedAspect(MeterRegistry registry) {
    return new CountedAspect(registry);
  }
}
