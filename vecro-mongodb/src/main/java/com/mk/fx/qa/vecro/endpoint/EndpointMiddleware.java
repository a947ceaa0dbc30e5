package com.mk.fx.qa.vecro.endpoint;

import java.util.Objects;

/** Decorates an {@link Endpoint}. */
@FunctionalInterface
public interface EndpointMiddleware {

  Endpoint wrap(Endpoint next);

  /** Composes middleware with {@code outer} outermost. */
  static EndpointMiddleware chain(EndpointMiddleware outer, EndpointMiddleware... inner) {
    Objects.requireNonNull(outer, "outer");
    return next -> {
      Endpoint wrapped = next;
      for (int i = inner.length - 1; i >= 0; i--) {
        wrapped = inner[i].wrap(wrapped);
      }
      return outer.wrap(wrapped);
    };
  }
}
