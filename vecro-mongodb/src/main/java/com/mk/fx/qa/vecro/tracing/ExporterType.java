package com.mk.fx.qa.vecro.tracing;

import java.util.Locale;
import java.util.Optional;

public enum ExporterType {
  OTLP,
  NONE;

  public static Optional<ExporterType> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
