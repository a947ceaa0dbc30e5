package com.mk.fx.qa.vecro.cfg;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Raw configuration bound from {@code vecro.*}.
 *
 * <p>Numeric and duration values are kept as strings and resolved leniently by {@link
 * VecroSettings}, so a malformed environment value falls back to its default instead of failing
 * startup.
 *
 * <pre>{@code
 * vecro:
 *   name: checkout
 *   subsystem: orders
 *   listen-address: ":8080"
 *   request-timeout: 30s
 *   db:
 *     read-ops: 3
 *     write-ops: 2
 *   tracing:
 *     exporter: otlp
 *     endpoint: http://jaeger-collector:4318/v1/traces
 * }</pre>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "vecro")
public class VecroProperties {

  private String name = "name";

  private String subsystem = "subsystem";

  private String listenAddress = ":8080";

  private String requestTimeout = "30s";

  private String randomSeed;

  @Valid @NotNull private Db db = new Db();

  @Valid @NotNull private Tracing tracing = new Tracing();

  @Data
  public static class Db {
    private String readOps = "0";
    private String writeOps = "0";
    private String uri = "mongodb://localhost";
    private String user = "root";
    private String password = "password";
    private String authDatabase = "admin";
    private String database = "data";
    private String collection = "items";
    private String keySpace = "1000";
    private String valueSize = "128";
    private String connectTimeout = "10s";
  }

  @Data
  public static class Tracing {
    /** Service name on exported spans; falls back to {@code default-service}. */
    private String serviceName;

    /** {@code otlp} or {@code none}. */
    private String exporter = "otlp";

    private String endpoint = "http://jaeger-collector:4318/v1/traces";
  }
}
