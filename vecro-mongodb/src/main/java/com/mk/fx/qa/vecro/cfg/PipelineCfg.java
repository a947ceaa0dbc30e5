package com.mk.fx.qa.vecro.cfg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.vecro.endpoint.Endpoint;
import com.mk.fx.qa.vecro.endpoint.WorkloadEndpoints;
import com.mk.fx.qa.vecro.metrics.WorkloadMetrics;
import com.mk.fx.qa.vecro.middleware.InstrumentingMiddleware;
import com.mk.fx.qa.vecro.middleware.LoggingMiddleware;
import com.mk.fx.qa.vecro.middleware.ServiceMiddleware;
import com.mk.fx.qa.vecro.service.BaseWorkloadService;
import com.mk.fx.qa.vecro.service.WorkloadService;
import com.mk.fx.qa.vecro.store.StoreGateway;
import com.mk.fx.qa.vecro.tracing.TracingMiddleware;
import com.mk.fx.qa.vecro.transport.WorkloadTransport;
import io.opentelemetry.api.OpenTelemetry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Assembles the request pipeline, outermost first:
 *
 * <pre>
 * transport -> tracing -> endpoint -> logging -> instrumenting -> base service
 * </pre>
 */
@Configuration
public class PipelineCfg {

  @Bean
  public WorkloadService workloadService(
      StoreGateway gateway, WorkloadMetrics metrics, VecroSettings settings) {
    return ServiceMiddleware.chain(new LoggingMiddleware(), new InstrumentingMiddleware(metrics))
        .wrap(BaseWorkloadService.create(gateway, settings.workload()));
  }

  @Bean
  public Endpoint workloadEndpoint(WorkloadService workloadService, OpenTelemetry openTelemetry) {
    return new TracingMiddleware(openTelemetry)
        .wrap(WorkloadEndpoints.baseEndpoint(workloadService));
  }

  @Bean
  public WorkloadTransport workloadTransport(
      Endpoint workloadEndpoint,
      ObjectMapper objectMapper,
      WorkloadMetrics metrics,
      VecroSettings settings) {
    return new WorkloadTransport(
        workloadEndpoint,
        objectMapper,
        settings.requestTimeout(),
        (call, status, responseSize) -> metrics.recordResponseSize(responseSize));
  }
}
