package com.mk.fx.qa.vecro.utils;

import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Lenient parsing of configuration values. A malformed or out-of-range value is logged and
 * replaced by the fallback; configuration problems are never fatal.
 */
@Slf4j
public final class ConfigValues {

  /** Upper bound for any configured duration. */
  public static final Duration MAX_DURATION = Duration.ofDays(1);

  private ConfigValues() {
    // Utility class, no instantiation
  }

  public static int nonNegativeInt(String key, String raw, int fallback) {
    return boundedInt(key, raw, fallback, 0);
  }

  public static int positiveInt(String key, String raw, int fallback) {
    return boundedInt(key, raw, fallback, 1);
  }

  public static Long optionalLong(String key, String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException e) {
      log.warn("Ignoring malformed {}='{}'", key, raw);
      return null;
    }
  }

  public static String nonBlank(String raw, String fallback) {
    return raw == null || raw.isBlank() ? fallback : raw.trim();
  }

  public static Duration duration(String key, String raw, Duration fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      Duration parsed = parseDuration(raw);
      if (parsed.isNegative() || parsed.isZero()) {
        log.warn("Invalid {}='{}' (must be positive), using default {}", key, raw, fallback);
        return fallback;
      }
      if (parsed.compareTo(MAX_DURATION) > 0) {
        log.warn(
            "Invalid {}='{}' (must be at most {}), using default {}",
            key,
            raw,
            MAX_DURATION,
            fallback);
        return fallback;
      }
      return parsed;
    } catch (RuntimeException e) {
      log.warn("Malformed {}='{}', using default {}", key, raw, fallback);
      return fallback;
    }
  }

  /** Parses {@code 250ms}, {@code 30s}, {@code 5m}, {@code 1h}; a bare number means seconds. */
  public static Duration parseDuration(String value) {
    if (value == null || value.isBlank()) {
      return Duration.ZERO;
    }
    String trimmed = value.trim().toLowerCase();
    if (trimmed.endsWith("ms")) {
      long ms = Long.parseLong(trimmed.substring(0, trimmed.length() - 2));
      return Duration.ofMillis(ms);
    }
    char unit = trimmed.charAt(trimmed.length() - 1);
    if (Character.isDigit(unit)) {
      return Duration.ofSeconds(Long.parseLong(trimmed));
    }
    long amount = Long.parseLong(trimmed.substring(0, trimmed.length() - 1));
    return switch (unit) {
      case 's' -> Duration.ofSeconds(amount);
      case 'm' -> Duration.ofMinutes(amount);
      case 'h' -> Duration.ofHours(amount);
      default -> throw new IllegalArgumentException("Unrecognised duration unit in " + value);
    };
  }

  private static int boundedInt(String key, String raw, int fallback, int min) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      int value = Integer.parseInt(raw.trim());
      if (value < min) {
        log.warn("Invalid {}={} (must be >= {}), using default {}", key, value, min, fallback);
        return fallback;
      }
      return value;
    } catch (NumberFormatException e) {
      log.warn("Malformed {}='{}', using default {}", key, raw, fallback);
      return fallback;
    }
  }
}
