package com.mk.fx.qa.vecro.middleware;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.mk.fx.qa.vecro.service.WorkloadResponse;
import com.mk.fx.qa.vecro.service.WorkloadService;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/** Logs receipt, outcome and duration of every call. Never alters the result or the error. */
@Slf4j
public final class LoggingMiddleware implements ServiceMiddleware {

  private final Ticker ticker;

  public LoggingMiddleware() {
    this(Ticker.systemTicker());
  }

  public LoggingMiddleware(Ticker ticker) {
    this.ticker = Objects.requireNonNull(ticker, "ticker");
  }

  @Override
  public WorkloadService wrap(WorkloadService next) {
    Objects.requireNonNull(next, "next");
    return (ctx, request) -> {
      log.info("method=execute msg=received");
      Stopwatch stopwatch = Stopwatch.createStarted(ticker);
      try {
        WorkloadResponse response = next.execute(ctx, request);
        log.info(
            "method=execute reads={} writes={} bytes={} took={}",
            response.reads(),
            response.writes(),
            response.totalBytes(),
            stopwatch.elapsed());
        return response;
      } catch (RuntimeException e) {
        log.warn(
            "method=execute err=\"{}\" type={} took={}",
            e.getMessage(),
            e.getClass().getSimpleName(),
            stopwatch.elapsed());
        throw e;
      }
    };
  }
}
