package com.mk.fx.qa.vecro.tracing;

import com.mk.fx.qa.vecro.common.CallContext;
import com.mk.fx.qa.vecro.endpoint.Endpoint;
import com.mk.fx.qa.vecro.endpoint.EndpointMiddleware;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapPropagator;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Opens one span per endpoint call.
 *
 * <p>The parent is extracted from the call's propagation carrier; when nothing usable is found
 * the span becomes a root. The span is current for the duration of the call, is passed on in the
 * {@link CallContext}, and is ended on every exit path. Failures are recorded on the span and
 * re-thrown unchanged.
 */
@Slf4j
public final class TracingMiddleware implements EndpointMiddleware {

  public static final String TRACER_NAME = "vecro-service";
  public static final String SPAN_NAME = "BaseRequest";

  private final Tracer tracer;
  private final TextMapPropagator propagator;
  private final String spanName;

  public TracingMiddleware(OpenTelemetry openTelemetry) {
    this(
        openTelemetry.getTracer(TRACER_NAME),
        openTelemetry.getPropagators().getTextMapPropagator(),
        SPAN_NAME);
  }

  public TracingMiddleware(Tracer tracer, TextMapPropagator propagator, String spanName) {
    this.tracer = Objects.requireNonNull(tracer, "tracer");
    this.propagator = Objects.requireNonNull(propagator, "propagator");
    this.spanName = Objects.requireNonNull(spanName, "spanName");
  }

  @Override
  public Endpoint wrap(Endpoint next) {
    Objects.requireNonNull(next, "next");
    return (ctx, request) -> {
      Context parent = extractParent(ctx);
      Span span =
          tracer.spanBuilder(spanName).setParent(parent).setSpanKind(SpanKind.SERVER).startSpan();
      Context spanContext = parent.with(span);
      try (Scope ignored = spanContext.makeCurrent()) {
        return next.invoke(ctx.withTraceContext(spanContext), request);
      } catch (RuntimeException | Error e) {
        span.recordException(e);
        span.setStatus(
            StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        throw e;
      } finally {
        span.end();
      }
    };
  }

  private Context extractParent(CallContext ctx) {
    try {
      return propagator.extract(ctx.traceContext(), ctx.carrier(), CarrierGetter.INSTANCE);
    } catch (RuntimeException e) {
      log.debug("Ignoring unreadable trace context, starting a root span", e);
      return ctx.traceContext();
    }
  }
}
