package com.mk.fx.qa.vecro.store;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for the MongoDB backing store.
 *
 * @param uri connection string, e.g. {@code mongodb://localhost}
 * @param user user name, blank to connect without credentials
 * @param password password for {@code user}
 * @param authDatabase database the credentials are defined in
 * @param database database holding the workload collection
 * @param collection workload collection name
 * @param connectTimeout bound for connecting and for the startup ping
 * @param operationTimeout bound on waiting for any single server reply
 */
public record StoreSettings(
        String uri,
        String user,
        String password,
        String authDatabase,
        String database,
        String collection,
        Duration connectTimeout,
        Duration operationTimeout) {

    public static final String DEFAULT_URI = "mongodb://localhost";
    public static final String DEFAULT_AUTH_DATABASE = "admin";
    public static final String DEFAULT_DATABASE = "data";
    public static final String DEFAULT_COLLECTION = "items";
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_OPERATION_TIMEOUT = Duration.ofSeconds(30);

    public StoreSettings {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(database, "database");
        Objects.requireNonNull(collection, "collection");
        authDatabase = authDatabase == null || authDatabase.isBlank() ? DEFAULT_AUTH_DATABASE : authDatabase;
        connectTimeout = connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT;
        operationTimeout = operationTimeout != null ? operationTimeout : DEFAULT_OPERATION_TIMEOUT;
    }

    public boolean hasCredentials() {
        return user != null && !user.isBlank();
    }

    @Override
    public String toString() {
        return "StoreSettings[uri=" + uri
                + ", user=" + user
                + ", password=" + (password == null || password.isEmpty() ? "" : "****")
                + ", authDatabase=" + authDatabase
                + ", database=" + database
                + ", collection=" + collection
                + ", connectTimeout=" + connectTimeout
                + ", operationTimeout=" + operationTimeout + "]";
    }
}
