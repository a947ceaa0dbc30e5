package com.mk.fx.qa.vecro.cfg;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

import com.mk.fx.qa.vecro.metrics.WorkloadMetrics;
import com.mk.fx.qa.vecro.service.WorkloadService;
import com.mk.fx.qa.vecro.store.StoreGateway;
import com.mk.fx.qa.vecro.tracing.TracingBootstrap;
import com.mk.fx.qa.vecro.tracing.TracingHandle;
import com.mk.fx.qa.vecro.transport.InboundCall;
import com.mk.fx.qa.vecro.transport.ServerResponse;
import com.mk.fx.qa.vecro.transport.WorkloadTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PipelineCfgTest {

  @Mock StoreGateway gateway;

  private final PipelineCfg cfg = new PipelineCfg();
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final InMemorySpanExporter spans = InMemorySpanExporter.create();

  private TracingHandle tracing;
  private WorkloadMetrics metrics;
  private WorkloadTransport transport;

  @BeforeEach
  void setUp() {
    VecroProperties props = new VecroProperties();
    props.setName("checkout");
    props.setSubsystem("orders");
    props.getDb().setReadOps("3");
    props.getDb().setWriteOps("2");
    VecroSettings settings = VecroSettings.resolve(props);

    tracing = TracingBootstrap.forTesting(SimpleSpanProcessor.create(spans));
    metrics = new WorkloadMetrics(registry, settings.subsystem(), settings.name());
    WorkloadService service = cfg.workloadService(gateway, metrics, settings);
    transport =
        cfg.workloadTransport(
            cfg.workloadEndpoint(service, tracing.openTelemetry()),
            ObjectMapperConfig.standalone(),
            metrics,
            settings);
  }

  @AfterEach
  void tearDown() {
    tracing.close();
  }

  private double count(String shortName) {
    return registry.get(metrics.meterName(shortName)).counter().count();
  }

  @Test
  void request_flowsThroughEveryLayer() {
    when(gateway.readOne(any(), anyInt())).thenReturn(10L);
    when(gateway.writeOne(any(), any())).thenReturn(10L);

    ServerResponse response = transport.handle(new InboundCall("GET", "/", Map.of(), null));

    assertEquals(200, response.status());
    assertEquals(1.0, count(WorkloadMetrics.REQUEST_COUNT));
    assertEquals((double) response.size(), count(WorkloadMetrics.THROUGHPUT));
    assertEquals(1, spans.getFinishedSpanItems().size());
  }

  @Test
  void failingRequest_isCountedTracedAndAccounted() {
    when(gateway.readOne(any(), anyInt())).thenReturn(10L).thenThrow(new RuntimeException("down"));

    ServerResponse response = transport.handle(new InboundCall("POST", "/", Map.of(), null));

    assertEquals(500, response.status());
    assertEquals(1.0, count(WorkloadMetrics.REQUEST_COUNT));
    assertEquals((double) response.size(), count(WorkloadMetrics.THROUGHPUT));
    assertEquals(1, spans.getFinishedSpanItems().size());
  }
}
