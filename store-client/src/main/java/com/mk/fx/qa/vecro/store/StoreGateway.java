package com.mk.fx.qa.vecro.store;

import com.mk.fx.qa.vecro.common.CallContext;

/**
 * Performs one logical read or write against the backing store.
 *
 * <p>Implementations must be safe for concurrent use, must honor the deadline and cancellation
 * signal of the supplied {@link CallContext}, and report failures as
 * {@link StoreOperationException} or {@link com.mk.fx.qa.vecro.common.CallCancelledException}.
 * Connection lifecycle, credentials and retry policy are the implementation's own concern.
 */
public interface StoreGateway {

    /**
     * Reads the first record stored under {@code key}.
     *
     * @return size in bytes of the record read, 0 when no record matched
     */
    long readOne(CallContext ctx, int key);

    /**
     * Persists {@code record}.
     *
     * @return size in bytes of the record written
     */
    long writeOne(CallContext ctx, StoreRecord record);
}
