package com.mk.fx.qa.vecro.tracing;

import io.opentelemetry.context.propagation.TextMapGetter;
import java.util.Map;
import java.util.Set;

/** Reads propagation fields from the header-like carrier of a call. */
enum CarrierGetter implements TextMapGetter<Map<String, String>> {
  INSTANCE;

  @Override
  public Iterable<String> keys(Map<String, String> carrier) {
    return carrier == null ? Set.of() : carrier.keySet();
  }

  @Override
  public String get(Map<String, String> carrier, String key) {
    return carrier == null || key == null ? null : carrier.get(key);
  }
}
