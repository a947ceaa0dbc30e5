package com.mk.fx.qa.vecro.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.time.Duration;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-request meters exposed on the Prometheus endpoint.
 *
 * <p>All meters live under {@code vecro_base.<subsystem>} and carry the constant tag {@value
 * #SERVICE_NAME_TAG}. Micrometer meters are safe for concurrent increments.
 */
@Slf4j
public class WorkloadMetrics {

  public static final String NAMESPACE = "vecro_base";
  public static final String SERVICE_NAME_TAG = "vecrosim_service_name";

  public static final String REQUEST_COUNT = "request_count";
  public static final String LATENCY_COUNTER = "latency_counter";
  public static final String LATENCY_HISTOGRAM = "latency_histogram";
  public static final String THROUGHPUT = "throughput";

  static final double[] LATENCY_BUCKETS_SECONDS = {
    .0002, .001, .005, .01, .025, .05, .1, .25, .5, 1, 2.5, 5, 10, 15, 25
  };

  private final String prefix;
  private final Counter requestCount;
  private final Counter latencyCounter;
  private final DistributionSummary latencyHistogram;
  private final Counter throughput;

  public WorkloadMetrics(MeterRegistry registry, String subsystem, String serviceName) {
    Objects.requireNonNull(registry, "registry");
    this.prefix = NAMESPACE + "." + Objects.requireNonNull(subsystem, "subsystem") + ".";
    Tags tags = Tags.of(SERVICE_NAME_TAG, Objects.requireNonNull(serviceName, "serviceName"));

    this.requestCount =
        Counter.builder(prefix + REQUEST_COUNT)
            .description("Number of requests received.")
            .tags(tags)
            .register(registry);
    this.latencyCounter =
        Counter.builder(prefix + LATENCY_COUNTER)
            .description("Processing time taken of requests in seconds, as counter.")
            .tags(tags)
            .register(registry);
    this.latencyHistogram =
        DistributionSummary.builder(prefix + LATENCY_HISTOGRAM)
            .description("Processing time taken of requests in seconds, as histogram.")
            .serviceLevelObjectives(LATENCY_BUCKETS_SECONDS)
            .tags(tags)
            .register(registry);
    this.throughput =
        Counter.builder(prefix + THROUGHPUT)
            .description("Size of data transmitted in bytes.")
            .tags(tags)
            .register(registry);
  }

  /** Fully qualified meter name for one of the short names declared on this class. */
  public String meterName(String shortName) {
    return prefix + shortName;
  }

  /** One request observed, successful or not. */
  public void recordRequest(Duration elapsed) {
    double seconds = Math.max(0L, elapsed.toNanos()) / 1_000_000_000.0;
    requestCount.increment();
    latencyCounter.increment(seconds);
    latencyHistogram.record(seconds);
  }

  /** Size of one encoded response, counted toward throughput. */
  public void recordResponseSize(long bytes) {
    log.debug("response_size={}", bytes);
    throughput.increment(Math.max(0L, bytes));
  }
}
