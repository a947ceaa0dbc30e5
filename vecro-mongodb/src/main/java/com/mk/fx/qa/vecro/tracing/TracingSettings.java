package com.mk.fx.qa.vecro.tracing;

import java.util.Objects;

/**
 * @param serviceName value of the {@code service.name} resource attribute
 * @param exporter span exporter to use
 * @param endpoint OTLP/HTTP traces endpoint
 */
public record TracingSettings(String serviceName, ExporterType exporter, String endpoint) {

  public static final String DEFAULT_SERVICE_NAME = "default-service";
  public static final String DEFAULT_ENDPOINT = "http://jaeger-collector:4318/v1/traces";

  public TracingSettings {
    serviceName = serviceName == null || serviceName.isBlank() ? DEFAULT_SERVICE_NAME : serviceName;
    exporter = Objects.requireNonNullElse(exporter, ExporterType.OTLP);
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint;
  }
}
