package com.mk.fx.qa.vecro.common;

/** Raised when a call's deadline has passed or its cancellation signal fired. */
public class CallCancelledException extends VecroException {

    private final boolean deadlineExceeded;

    public CallCancelledException(String message, boolean deadlineExceeded) {
        super(ErrorKind.CANCELLED, message);
        this.deadlineExceeded = deadlineExceeded;
    }

    public CallCancelledException(String message, boolean deadlineExceeded, Throwable cause) {
        super(ErrorKind.CANCELLED, message, cause);
        this.deadlineExceeded = deadlineExceeded;
    }

    public boolean isDeadlineExceeded() {
        return deadlineExceeded;
    }
}
