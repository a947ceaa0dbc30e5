package com.mk.fx.qa.vecro.transport;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One inbound HTTP call as seen by the transport adapter.
 *
 * @param method HTTP method
 * @param path request path
 * @param headers request headers, case-insensitive keys, first value per name
 * @param body raw request body, empty when absent
 */
public record InboundCall(String method, String path, Map<String, String> headers, byte[] body) {

  public InboundCall {
    Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    if (headers != null) {
      copy.putAll(headers);
    }
    headers = Collections.unmodifiableMap(copy);
    body = body != null ? body : new byte[0];
  }

  public boolean hasBody() {
    for (byte b : body) {
      if (!Character.isWhitespace(b)) {
        return true;
      }
    }
    return false;
  }
}
