package com.mk.fx.qa.vecro.common;

/**
 * Coarse classification of failures raised along the request pipeline. Middleware never
 * interprets the kind; only the transport maps it to an externally visible status.
 */
public enum ErrorKind {
    CONFIGURATION,
    STORE_CONNECT,
    STORE_OPERATION,
    CANCELLED,
    DECODE
}
