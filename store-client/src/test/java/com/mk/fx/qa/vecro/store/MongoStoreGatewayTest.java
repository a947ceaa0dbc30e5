package com.mk.fx.qa.vecro.store;

import com.mk.fx.qa.vecro.common.CallCancelledException;
import com.mk.fx.qa.vecro.common.CallContext;
import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoInterruptedException;
import com.mongodb.MongoSocketReadTimeoutException;
import com.mongodb.ServerAddress;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import org.bson.RawBsonDocument;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoStoreGatewayTest {

    @Mock
    private MongoCollection<RawBsonDocument> collection;

    @Mock
    private FindIterable<RawBsonDocument> find;

    private MongoStoreGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new MongoStoreGateway(collection);
    }

    @Test
    void readOne_returnsEncodedSizeOfMatchedDocument() {
        RawBsonDocument stored = RawBsonDocument.parse("{\"key\": 7, \"value\": \"abcdef\"}");
        when(collection.find(any(Bson.class))).thenReturn(find);
        when(find.limit(1)).thenReturn(find);
        when(find.first()).thenReturn(stored);

        long bytes = gateway.readOne(CallContext.background(), 7);

        assertEquals(stored.getByteBuffer().remaining(), bytes);
        verify(find, never()).maxTime(anyLong(), any());
    }

    @Test
    void readOne_noMatch_returnsZero() {
        when(collection.find(any(Bson.class))).thenReturn(find);
        when(find.limit(1)).thenReturn(find);
        when(find.first()).thenReturn(null);

        assertEquals(0L, gateway.readOne(CallContext.background(), 42));
    }

    @Test
    void readOne_withDeadline_boundsQueryByRemainingTime() {
        when(collection.find(any(Bson.class))).thenReturn(find);
        when(find.limit(1)).thenReturn(find);
        when(find.maxTime(anyLong(), eq(TimeUnit.MILLISECONDS))).thenReturn(find);
        when(find.first()).thenReturn(null);

        gateway.readOne(CallContext.background().withTimeout(Duration.ofSeconds(20)), 1);

        ArgumentCaptor<Long> maxTime = ArgumentCaptor.forClass(Long.class);
        verify(find).maxTime(maxTime.capture(), eq(TimeUnit.MILLISECONDS));
        assertThat(maxTime.getValue()).isBetween(1L, 20_000L);
    }

    @Test
    void readOne_driverFailure_isWrappedAsStoreOperationError() {
        MongoException failure = new MongoException("socket closed");
        when(collection.find(any(Bson.class))).thenThrow(failure);

        assertThatThrownBy(() -> gateway.readOne(CallContext.background(), 3))
                .isInstanceOf(StoreOperationException.class)
                .hasCause(failure)
                .satisfies(e -> assertEquals(StoreOperation.READ, ((StoreOperationException) e).getOperation()));
    }

    @Test
    void readOne_serverTimeLimit_isReportedAsCancellation() {
        when(collection.find(any(Bson.class))).thenReturn(find);
        when(find.limit(1)).thenReturn(find);
        when(find.maxTime(anyLong(), eq(TimeUnit.MILLISECONDS))).thenReturn(find);
        when(find.first()).thenThrow(new MongoExecutionTimeoutException(50, "operation exceeded time limit"));

        CallContext ctx = CallContext.background().withTimeout(Duration.ofSeconds(5));

        assertThatThrownBy(() -> gateway.readOne(ctx, 3))
                .isInstanceOf(CallCancelledException.class)
                .satisfies(e -> assertThat(((CallCancelledException) e).isDeadlineExceeded()).isTrue());
    }

    @Test
    void readOne_expiredContext_failsBeforeTouchingStore() {
        CallContext expired = CallContext.background().withDeadline(Instant.now().minusMillis(1));

        assertThatThrownBy(() -> gateway.readOne(expired, 1)).isInstanceOf(CallCancelledException.class);
        verifyNoInteractions(collection);
    }

    @Test
    void writeOne_insertsEncodedRecordAndReturnsItsSize() {
        StoreRecord record = new StoreRecord(5, "payload", Instant.parse("2024-01-01T00:00:00Z"));

        long bytes = gateway.writeOne(CallContext.background(), record);

        ArgumentCaptor<RawBsonDocument> inserted = ArgumentCaptor.forClass(RawBsonDocument.class);
        verify(collection).insertOne(inserted.capture());
        RawBsonDocument document = inserted.getValue();
        assertEquals(document.getByteBuffer().remaining(), bytes);
        assertEquals(5, document.getInt32(MongoStoreGateway.KEY_FIELD).getValue());
        assertEquals("payload", document.getString(MongoStoreGateway.VALUE_FIELD).getValue());
        assertThat(document.containsKey("_id")).isTrue();
    }

    @Test
    void writeOne_driverFailure_isWrappedAsStoreOperationError() {
        when(collection.insertOne(any())).thenThrow(new MongoException("duplicate key"));

        StoreRecord record = new StoreRecord(1, "v", Instant.now());

        assertThatThrownBy(() -> gateway.writeOne(CallContext.background(), record))
                .isInstanceOf(StoreOperationException.class)
                .hasMessageContaining("write failed")
                .satisfies(e -> assertEquals(StoreOperation.WRITE, ((StoreOperationException) e).getOperation()));
    }

    @Test
    void writeOne_cancelledContext_doesNotInsert() {
        CallContext cancelled = CallContext.background().withCancellation(() -> true);

        assertThatThrownBy(() -> gateway.writeOne(cancelled, new StoreRecord(1, "v", Instant.now())))
                .isInstanceOf(CallCancelledException.class);
        verifyNoInteractions(collection);
    }

    @Test
    void writeOne_socketReadTimeout_isReportedAsDeadlineExceeded() {
        when(collection.insertOne(any())).thenThrow(new MongoSocketReadTimeoutException(
                "Timed out while receiving message", new ServerAddress(), new SocketTimeoutException("read timed out")));

        StoreRecord record = new StoreRecord(1, "v", Instant.now());

        assertThatThrownBy(() -> gateway.writeOne(CallContext.background(), record))
                .isInstanceOf(CallCancelledException.class)
                .satisfies(e -> assertThat(((CallCancelledException) e).isDeadlineExceeded()).isTrue());
    }

    @Test
    void readOne_interrupted_isCancellationAndKeepsInterruptFlag() {
        when(collection.find(any(Bson.class))).thenReturn(find);
        when(find.limit(1)).thenReturn(find);
        when(find.first()).thenThrow(new MongoInterruptedException("Interrupted waiting for lock", null));

        try {
            assertThatThrownBy(() -> gateway.readOne(CallContext.background(), 3))
                    .isInstanceOf(CallCancelledException.class)
                    .satisfies(e -> assertThat(((CallCancelledException) e).isDeadlineExceeded()).isFalse());
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void maxTimeMillis_staysWithinServerRange() {
        assertThat(MongoStoreGateway.maxTimeMillis(Duration.ZERO)).isEqualTo(1L);
        assertThat(MongoStoreGateway.maxTimeMillis(Duration.ofSeconds(2))).isEqualTo(2_000L);
        assertThat(MongoStoreGateway.maxTimeMillis(Duration.ofSeconds(Long.MAX_VALUE))).isEqualTo(Integer.MAX_VALUE);
    }
}
