package com.mk.fx.qa.vecro.store;

import com.mk.fx.qa.vecro.common.ErrorKind;
import com.mk.fx.qa.vecro.common.VecroException;

/**
 * A single read or write against the backing store failed mid-request.
 *
 * <p>{@code position} is the 1-based index of the failed operation within the request, or 0
 * when raised by a gateway that does not know where in the request it was called.
 */
public class StoreOperationException extends VecroException {

    private final StoreOperation operation;
    private final int position;

    public StoreOperationException(StoreOperation operation, String message, Throwable cause) {
        this(operation, 0, message, cause);
    }

    public StoreOperationException(
            StoreOperation operation, int position, String message, Throwable cause) {
        super(ErrorKind.STORE_OPERATION, message, cause);
        this.operation = operation;
        this.position = position;
    }

    public StoreOperation getOperation() {
        return operation;
    }

    public int getPosition() {
        return position;
    }
}
