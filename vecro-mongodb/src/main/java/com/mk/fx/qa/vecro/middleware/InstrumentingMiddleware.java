package com.mk.fx.qa.vecro.middleware;

import com.google.common.base.Ticker;
import com.mk.fx.qa.vecro.metrics.WorkloadMetrics;
import com.mk.fx.qa.vecro.service.WorkloadService;
import java.time.Duration;
import java.util.Objects;

/**
 * Records request count and latency for every call, whether it succeeds or fails. Metrics are
 * emitted after the wrapped call returns and before control goes back to the caller.
 */
public final class InstrumentingMiddleware implements ServiceMiddleware {

  private final WorkloadMetrics metrics;
  private final Ticker ticker;

  public InstrumentingMiddleware(WorkloadMetrics metrics) {
    this(metrics, Ticker.systemTicker());
  }

  public InstrumentingMiddleware(WorkloadMetrics metrics, Ticker ticker) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.ticker = Objects.requireNonNull(ticker, "ticker");
  }

  @Override
  public WorkloadService wrap(WorkloadService next) {
    Objects.requireNonNull(next, "next");
    return (ctx, request) -> {
      long start = ticker.read();
      try {
        return next.execute(ctx, request);
      } finally {
        metrics.recordRequest(Duration.ofNanos(ticker.read() - start));
      }
    };
  }
}
