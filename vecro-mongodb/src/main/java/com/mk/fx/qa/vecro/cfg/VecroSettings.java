package com.mk.fx.qa.vecro.cfg;

import com.mk.fx.qa.vecro.service.WorkloadConfig;
import com.mk.fx.qa.vecro.store.StoreSettings;
import com.mk.fx.qa.vecro.tracing.ExporterType;
import com.mk.fx.qa.vecro.tracing.TracingSettings;
import com.mk.fx.qa.vecro.utils.ConfigValues;
import com.mk.fx.qa.vecro.utils.ListenAddress;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Configuration resolved once at startup and immutable afterwards.
 *
 * @param name service name used as metric label
 * @param subsystem metric subsystem
 * @param listenAddress HTTP bind address
 * @param requestTimeout deadline applied to every inbound call
 * @param workload per-request workload shape
 * @param store backing store connection settings
 * @param tracing span export settings
 */
@Slf4j
public record VecroSettings(
    String name,
    String subsystem,
    ListenAddress listenAddress,
    Duration requestTimeout,
    WorkloadConfig workload,
    StoreSettings store,
    TracingSettings tracing) {

  static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  public static VecroSettings resolve(VecroProperties props) {
    VecroProperties.Db db = props.getDb();
    VecroProperties.Tracing tr = props.getTracing();

    WorkloadConfig workload =
        new WorkloadConfig(
            ConfigValues.nonNegativeInt("vecro.db.read-ops", db.getReadOps(), 0),
            ConfigValues.nonNegativeInt("vecro.db.write-ops", db.getWriteOps(), 0),
            ConfigValues.positiveInt(
                "vecro.db.key-space", db.getKeySpace(), WorkloadConfig.DEFAULT_KEY_SPACE),
            ConfigValues.nonNegativeInt(
                "vecro.db.value-size", db.getValueSize(), WorkloadConfig.DEFAULT_VALUE_SIZE),
            ConfigValues.optionalLong("vecro.random-seed", props.getRandomSeed()));

    Duration requestTimeout =
        ConfigValues.duration(
            "vecro.request-timeout", props.getRequestTimeout(), DEFAULT_REQUEST_TIMEOUT);

    StoreSettings store =
        new StoreSettings(
            ConfigValues.nonBlank(db.getUri(), StoreSettings.DEFAULT_URI),
            db.getUser(),
            db.getPassword(),
            db.getAuthDatabase(),
            ConfigValues.nonBlank(db.getDatabase(), StoreSettings.DEFAULT_DATABASE),
            ConfigValues.nonBlank(db.getCollection(), StoreSettings.DEFAULT_COLLECTION),
            ConfigValues.duration(
                "vecro.db.connect-timeout",
                db.getConnectTimeout(),
                StoreSettings.DEFAULT_CONNECT_TIMEOUT),
            requestTimeout);

    ExporterType exporter =
        ExporterType.parse(tr.getExporter())
            .orElseGet(
                () -> {
                  log.warn("Unknown vecro.tracing.exporter='{}', using otlp", tr.getExporter());
                  return ExporterType.OTLP;
                });
    TracingSettings tracing = new TracingSettings(tr.getServiceName(), exporter, tr.getEndpoint());

    VecroSettings settings =
        new VecroSettings(
            ConfigValues.nonBlank(props.getName(), "name"),
            ConfigValues.nonBlank(props.getSubsystem(), "subsystem"),
            ListenAddress.parse(props.getListenAddress()),
            requestTimeout,
            workload,
            store,
            tracing);
    settings.logSummary();
    return settings;
  }

  private void logSummary() {
    log.info("db read ops: {}", workload.readOps());
    log.info("db write ops: {}", workload.writeOps());
    log.info("db store: {}", store);
    log.info("listen_address: {}", listenAddress);
    log.info("name: {} subsystem: {}", name, subsystem);
    log.info("request timeout: {}", requestTimeout);
    log.info(
        "tracing service: {} exporter: {} endpoint: {}",
        tracing.serviceName(),
        tracing.exporter(),
        tracing.endpoint());
  }
}
