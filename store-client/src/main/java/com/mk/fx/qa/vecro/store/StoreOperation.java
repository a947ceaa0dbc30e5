package com.mk.fx.qa.vecro.store;

/** The two logical operations a {@link StoreGateway} performs. */
public enum StoreOperation {
    READ,
    WRITE
}
