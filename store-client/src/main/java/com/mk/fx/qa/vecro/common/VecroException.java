package com.mk.fx.qa.vecro.common;

import java.util.Objects;

/** Base type for every failure the workload pipeline raises on purpose. */
public abstract class VecroException extends RuntimeException {

    private final ErrorKind kind;

    protected VecroException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    protected VecroException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
