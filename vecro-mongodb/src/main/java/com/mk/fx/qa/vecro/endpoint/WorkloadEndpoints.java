package com.mk.fx.qa.vecro.endpoint;

import com.mk.fx.qa.vecro.service.WorkloadRequest;
import com.mk.fx.qa.vecro.service.WorkloadService;
import java.util.Objects;

public final class WorkloadEndpoints {

  private WorkloadEndpoints() {
    // Utility class, no instantiation
  }

  /**
   * Adapts a (middleware-wrapped) {@link WorkloadService} to an {@link Endpoint}. Requests that
   * are not a {@link WorkloadRequest} fail with {@link RequestDecodeException}.
   */
  public static Endpoint baseEndpoint(WorkloadService service) {
    Objects.requireNonNull(service, "service");
    return (ctx, request) -> {
      if (!(request instanceof WorkloadRequest workloadRequest)) {
        throw new RequestDecodeException(
            "Expected "
                + WorkloadRequest.class.getSimpleName()
                + " but got "
                + (request == null ? "null" : request.getClass().getName()));
      }
      return service.execute(ctx, workloadRequest);
    };
  }
}
