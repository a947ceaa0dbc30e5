package com.mk.fx.qa.vecro.utils;

import lombok.extern.slf4j.Slf4j;

/**
 * Host and port the HTTP server binds to.
 *
 * @param host interface to bind, {@code null} for all interfaces
 * @param port TCP port
 */
@Slf4j
public record ListenAddress(String host, int port) {

  public static final ListenAddress DEFAULT = new ListenAddress(null, 8080);

  /** Accepts {@code host:port}, {@code :port} or a bare {@code port}. */
  public static ListenAddress parse(String value) {
    if (value == null || value.isBlank()) {
      return DEFAULT;
    }
    String trimmed = value.trim();
    int idx = trimmed.lastIndexOf(':');
    String host = idx >= 0 ? trimmed.substring(0, idx).trim() : "";
    String port = idx >= 0 ? trimmed.substring(idx + 1).trim() : trimmed;
    try {
      int parsed = Integer.parseInt(port);
      if (parsed < 0 || parsed > 65535) {
        log.warn("Listen port out of range in '{}', using {}", value, DEFAULT);
        return DEFAULT;
      }
      return new ListenAddress(host.isEmpty() ? null : host, parsed);
    } catch (NumberFormatException e) {
      log.warn("Malformed listen address '{}', using {}", value, DEFAULT);
      return DEFAULT;
    }
  }

  @Override
  public String toString() {
    return (host != null ? host : "") + ":" + port;
  }
}
