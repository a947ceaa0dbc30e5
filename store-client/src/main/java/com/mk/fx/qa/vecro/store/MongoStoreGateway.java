package com.mk.fx.qa.vecro.store;

import com.mk.fx.qa.vecro.common.CallCancelledException;
import com.mk.fx.qa.vecro.common.CallContext;
import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoInterruptedException;
import com.mongodb.MongoSocketReadTimeoutException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import org.bson.Document;
import org.bson.RawBsonDocument;
import org.bson.codecs.DocumentCodec;
import org.bson.types.ObjectId;

import java.time.Duration;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link StoreGateway} over a single MongoDB collection.
 *
 * <p>Documents are handled as {@link RawBsonDocument} so the byte size reported for each
 * operation is the exact encoded BSON size. Reads are bounded by the call's remaining deadline
 * through {@code maxTime}; writes check the deadline before being issued and are then bounded by
 * the client's socket read timeout.
 */
public class MongoStoreGateway implements StoreGateway {

    static final String KEY_FIELD = "key";
    static final String VALUE_FIELD = "value";
    static final String CREATED_AT_FIELD = "createdAt";

    private static final DocumentCodec DOCUMENT_CODEC = new DocumentCodec();
    private static final Duration MAX_SERVER_TIME = Duration.ofMillis(Integer.MAX_VALUE);

    private final MongoCollection<RawBsonDocument> collection;

    public MongoStoreGateway(MongoCollection<RawBsonDocument> collection) {
        this.collection = Objects.requireNonNull(collection, "collection");
    }

    public static MongoStoreGateway open(MongoClient client, StoreSettings settings) {
        return new MongoStoreGateway(
                client.getDatabase(settings.database())
                        .getCollection(settings.collection(), RawBsonDocument.class));
    }

    @Override
    public long readOne(CallContext ctx, int key) {
        ctx.ensureActive();
        try {
            FindIterable<RawBsonDocument> find = collection.find(Filters.eq(KEY_FIELD, key)).limit(1);
            Optional<Duration> remaining = ctx.remaining();
            if (remaining.isPresent()) {
                find = find.maxTime(maxTimeMillis(remaining.get()), TimeUnit.MILLISECONDS);
            }
            RawBsonDocument document = find.first();
            return document == null ? 0L : document.getByteBuffer().remaining();
        } catch (MongoException e) {
            throw translate(ctx, StoreOperation.READ, e);
        }
    }

    @Override
    public long writeOne(CallContext ctx, StoreRecord record) {
        Objects.requireNonNull(record, "record");
        ctx.ensureActive();
        RawBsonDocument document = encode(record);
        try {
            collection.insertOne(document);
            return document.getByteBuffer().remaining();
        } catch (MongoException e) {
            throw translate(ctx, StoreOperation.WRITE, e);
        }
    }

    /** The server takes {@code maxTimeMS} as a 32-bit value. */
    static long maxTimeMillis(Duration remaining) {
        if (remaining.compareTo(MAX_SERVER_TIME) >= 0) {
            return Integer.MAX_VALUE;
        }
        return Math.max(1L, remaining.toMillis());
    }

    static RawBsonDocument encode(StoreRecord record) {
        Document document =
                new Document("_id", new ObjectId())
                        .append(KEY_FIELD, record.key())
                        .append(VALUE_FIELD, record.value())
                        .append(CREATED_AT_FIELD, Date.from(record.createdAt()));
        return new RawBsonDocument(document, DOCUMENT_CODEC);
    }

    private static RuntimeException translate(CallContext ctx, StoreOperation operation, MongoException e) {
        if (e instanceof MongoInterruptedException) {
            Thread.currentThread().interrupt();
            return new CallCancelledException(
                    operation.name().toLowerCase() + " interrupted: " + e.getMessage(), false, e);
        }
        boolean timedOut =
                e instanceof MongoExecutionTimeoutException || e instanceof MongoSocketReadTimeoutException;
        if (timedOut || ctx.isDone()) {
            return new CallCancelledException(
                    operation.name().toLowerCase() + " aborted: " + e.getMessage(),
                    ctx.isDeadlineExceeded() || timedOut,
                    e);
        }
        return new StoreOperationException(
                operation, operation.name().toLowerCase() + " failed: " + e.getMessage(), e);
    }
}
