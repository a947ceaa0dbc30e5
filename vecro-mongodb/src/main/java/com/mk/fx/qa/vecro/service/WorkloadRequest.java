package com.mk.fx.qa.vecro.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Opaque request payload. Its content never influences the workload shape.
 *
 * @param payload decoded JSON object, empty when the call carried no body
 */
public record WorkloadRequest(Map<String, Object> payload) {

  private static final WorkloadRequest EMPTY = new WorkloadRequest(Map.of());

  public WorkloadRequest {
    payload =
        payload == null || payload.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }

  public static WorkloadRequest empty() {
    return EMPTY;
  }
}
