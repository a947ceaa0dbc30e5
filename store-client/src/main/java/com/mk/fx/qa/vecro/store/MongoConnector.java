package com.mk.fx.qa.vecro.store;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Opens the MongoDB client used by the workload and verifies the store is reachable.
 *
 * <p>There is no store-less mode: if the connection string is invalid, the server cannot be
 * selected within the connect timeout or authentication fails, {@link #connect} raises
 * {@link StoreConnectException} and the caller is expected to terminate.
 */
@Slf4j
public final class MongoConnector {

    private static final Duration MAX_SOCKET_TIMEOUT = Duration.ofMillis(Integer.MAX_VALUE);

    private MongoConnector() {
        // Utility class, no instantiation
    }

    public static MongoClient connect(StoreSettings settings) {
        MongoClient client;
        try {
            client = MongoClients.create(clientSettings(settings));
        } catch (RuntimeException e) {
            throw new StoreConnectException("Invalid store settings: " + e.getMessage(), e);
        }

        try {
            client.getDatabase(settings.database()).runCommand(new Document("ping", 1));
        } catch (RuntimeException e) {
            client.close();
            throw new StoreConnectException(
                    "Store unreachable at " + settings.uri() + ": " + e.getMessage(), e);
        }
        log.info("Connected to store {} database={} collection={}",
                settings.uri(), settings.database(), settings.collection());
        return client;
    }

    /**
     * Driver settings for {@code settings}. The socket read timeout bounds every server reply,
     * which is the only limit a write gets once it has been sent.
     */
    static MongoClientSettings clientSettings(StoreSettings settings) {
        int socketConnectMs = toIntMillis(settings.connectTimeout());
        int socketReadMs = toIntMillis(settings.operationTimeout());
        MongoClientSettings.Builder builder =
                MongoClientSettings.builder()
                        .applyConnectionString(new ConnectionString(settings.uri()))
                        .applyToClusterSettings(
                                cluster -> cluster.serverSelectionTimeout(socketConnectMs, TimeUnit.MILLISECONDS))
                        .applyToSocketSettings(
                                socket -> socket.connectTimeout(socketConnectMs, TimeUnit.MILLISECONDS)
                                        .readTimeout(socketReadMs, TimeUnit.MILLISECONDS));
        if (settings.hasCredentials()) {
            String password = settings.password() != null ? settings.password() : "";
            builder.credential(
                    MongoCredential.createCredential(
                            settings.user(), settings.authDatabase(), password.toCharArray()));
        }
        return builder.build();
    }

    /** Socket timeouts are int milliseconds where 0 means unbounded; saturates into [1, MAX_VALUE]. */
    static int toIntMillis(Duration timeout) {
        if (timeout.compareTo(MAX_SOCKET_TIMEOUT) >= 0) {
            return Integer.MAX_VALUE;
        }
        return (int) Math.max(1L, timeout.toMillis());
    }
}
