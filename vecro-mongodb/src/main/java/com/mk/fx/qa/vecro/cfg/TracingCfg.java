package com.mk.fx.qa.vecro.cfg;

import com.mk.fx.qa.vecro.tracing.TracingBootstrap;
import com.mk.fx.qa.vecro.tracing.TracingHandle;
import io.opentelemetry.api.OpenTelemetry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TracingCfg {

  /** Closed on context shutdown, which flushes buffered spans. */
  @Bean(destroyMethod = "close")
  public TracingHandle tracingHandle(VecroSettings settings) {
    return TracingBootstrap.initialize(settings.tracing());
  }

  @Bean
  public OpenTelemetry openTelemetry(TracingHandle handle) {
    return handle.openTelemetry();
  }
}
