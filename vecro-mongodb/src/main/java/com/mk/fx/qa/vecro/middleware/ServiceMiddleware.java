package com.mk.fx.qa.vecro.middleware;

import com.mk.fx.qa.vecro.service.WorkloadService;
import java.util.Objects;

/** Decorates a {@link WorkloadService} with a cross-cutting behavior. */
@FunctionalInterface
public interface ServiceMiddleware {

  WorkloadService wrap(WorkloadService next);

  /**
   * Composes middleware so that {@code outer} ends up outermost and the last of {@code inner}
   * sits directly around the wrapped service.
   */
  static ServiceMiddleware chain(ServiceMiddleware outer, ServiceMiddleware... inner) {
    Objects.requireNonNull(outer, "outer");
    return next -> {
      WorkloadService wrapped = next;
      for (int i = inner.length - 1; i >= 0; i--) {
        wrapped = inner[i].wrap(wrapped);
      }
      return outer.wrap(wrapped);
    };
  }
}
