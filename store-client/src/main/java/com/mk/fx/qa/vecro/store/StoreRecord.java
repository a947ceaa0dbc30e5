package com.mk.fx.qa.vecro.store;

import java.time.Instant;
import java.util.Objects;

/**
 * One document persisted by a write operation.
 *
 * @param key the lookup key, drawn from the configured key space
 * @param value randomly generated content
 * @param createdAt creation time of the record
 */
public record StoreRecord(int key, String value, Instant createdAt) {

    public StoreRecord {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
