package com.mk.fx.qa.vecro.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.common.CompletableResultCode;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/** Owns the tracing SDK for the lifetime of the process; closing it flushes pending spans. */
@Slf4j
public final class TracingHandle implements AutoCloseable {

  private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

  private final OpenTelemetrySdk sdk;
  private final TracingMode mode;

  TracingHandle(OpenTelemetrySdk sdk, TracingMode mode) {
    this.sdk = Objects.requireNonNull(sdk, "sdk");
    this.mode = Objects.requireNonNull(mode, "mode");
  }

  public OpenTelemetry openTelemetry() {
    return sdk;
  }

  public TracingMode mode() {
    return mode;
  }

  @Override
  public void close() {
    CompletableResultCode result =
        sdk.getSdkTracerProvider().shutdown().join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    if (!result.isSuccess()) {
      log.warn("Tracer provider did not shut down cleanly within {}s", SHUTDOWN_TIMEOUT_SECONDS);
    }
  }
}
