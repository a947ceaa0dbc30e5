package com.mk.fx.qa.vecro.tracing;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SdkTracerProviderBuilder;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.Objects;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the OpenTelemetry SDK used by the tracing middleware.
 *
 * <p>Exporter construction failures are logged and the process continues in {@link
 * TracingMode#LOCAL_ONLY}; tracing problems never prevent the service from starting.
 */
@Slf4j
public final class TracingBootstrap {

  static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

  private TracingBootstrap() {
    // Utility class
  }

  public static TracingHandle initialize(TracingSettings settings) {
    return initialize(
        settings, endpoint -> OtlpHttpSpanExporter.builder().setEndpoint(endpoint).build());
  }

  static TracingHandle initialize(
      TracingSettings settings, Function<String, SpanExporter> exporterFactory) {
    Objects.requireNonNull(settings, "settings");
    SdkTracerProviderBuilder builder =
        SdkTracerProvider.builder().setResource(resource(settings.serviceName()));

    TracingMode mode;
    if (settings.exporter() == ExporterType.NONE) {
      log.info("Span exporter disabled (exporter=none); tracing runs in {} mode", TracingMode.LOCAL_ONLY);
      mode = TracingMode.LOCAL_ONLY;
    } else {
      try {
        SpanExporter exporter = exporterFactory.apply(settings.endpoint());
        builder.addSpanProcessor(BatchSpanProcessor.builder(exporter).build());
        mode = TracingMode.EXPORTING;
        log.info("Span exporter built, exporting to {}", settings.endpoint());
      } catch (RuntimeException e) {
        log.error(
            "Failed to create span exporter for {}; tracing runs in {} mode",
            settings.endpoint(),
            TracingMode.LOCAL_ONLY,
            e);
        mode = TracingMode.LOCAL_ONLY;
      }
    }
    return new TracingHandle(build(builder), mode);
  }

  /** SDK that hands every finished span to {@code processor}; used by tests. */
  public static TracingHandle forTesting(SpanProcessor processor) {
    Objects.requireNonNull(processor, "processor");
    SdkTracerProviderBuilder builder =
        SdkTracerProvider.builder()
            .setResource(resource(TracingSettings.DEFAULT_SERVICE_NAME))
            .addSpanProcessor(processor);
    return new TracingHandle(build(builder), TracingMode.EXPORTING);
  }

  private static OpenTelemetrySdk build(SdkTracerProviderBuilder builder) {
    return OpenTelemetrySdk.builder()
        .setTracerProvider(builder.build())
        .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
        .build();
  }

  private static Resource resource(String serviceName) {
    return Resource.getDefault().merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName)));
  }
}
