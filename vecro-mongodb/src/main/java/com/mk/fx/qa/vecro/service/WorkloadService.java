package com.mk.fx.qa.vecro.service;

import com.mk.fx.qa.vecro.common.CallContext;

/**
 * The capability every layer of the request pipeline implements: the base workload and each
 * middleware wrapped around it.
 */
@FunctionalInterface
public interface WorkloadService {

  /**
   * Executes one workload request.
   *
   * @throws com.mk.fx.qa.vecro.store.StoreOperationException if a store operation fails
   * @throws com.mk.fx.qa.vecro.common.CallCancelledException if the call is cancelled or times out
   */
  WorkloadResponse execute(CallContext ctx, WorkloadRequest request);
}
