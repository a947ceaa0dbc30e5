package com.mk.fx.qa.vecro.transport;

/**
 * Invoked once per call after the response has been encoded. The encoded size is passed
 * explicitly so accounting does not depend on state stashed elsewhere.
 */
@FunctionalInterface
public interface ServerFinalizer {

  void onResponse(InboundCall call, int status, long responseSize);
}
