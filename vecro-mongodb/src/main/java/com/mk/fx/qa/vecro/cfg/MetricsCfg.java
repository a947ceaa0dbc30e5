package com.mk.fx.qa.vecro.cfg;

import com.mk.fx.qa.vecro.metrics.WorkloadMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsCfg {

  @Bean
  public WorkloadMetrics workloadMetrics(MeterRegistry registry, VecroSettings settings) {
    return new WorkloadMetrics(registry, settings.subsystem(), settings.name());
  }
}
