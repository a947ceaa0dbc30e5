package com.mk.fx.qa.vecro.tracing;

/** How finished spans are handled. */
public enum TracingMode {
  /** Spans are batched and shipped to the configured collector. */
  EXPORTING,
  /**
   * Spans are created, propagated and ended but never leave the process. Selected when
   * exporting is switched off or the exporter could not be built.
   */
  LOCAL_ONLY
}
