package com.mk.fx.qa.vecro.common;

import io.opentelemetry.context.Context;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.BooleanSupplier;

/**
 * Immutable per-call state threaded from the transport down to the store.
 *
 * <p>Carries an optional deadline, a cooperative cancellation signal, the propagation carrier
 * received with the inbound call (header-like, case-insensitive keys) and the OpenTelemetry
 * {@link Context} holding the active span. Every {@code with*} method returns a new instance.
 */
public final class CallContext {

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;
    private static final CallContext BACKGROUND =
            new CallContext(null, NEVER_CANCELLED, Map.of(), Context.root());

    private final Instant deadline;
    private final BooleanSupplier cancellation;
    private final Map<String, String> carrier;
    private final Context traceContext;

    private CallContext(
            Instant deadline,
            BooleanSupplier cancellation,
            Map<String, String> carrier,
            Context traceContext) {
        this.deadline = deadline;
        this.cancellation = cancellation;
        this.carrier = carrier;
        this.traceContext = traceContext;
    }

    /** A context without deadline, cancellation or propagated data. */
    public static CallContext background() {
        return BACKGROUND;
    }

    public CallContext withDeadline(Instant deadline) {
        return new CallContext(deadline, cancellation, carrier, traceContext);
    }

    /** Deadline {@code timeout} from now; timeouts past the end of the time-line saturate. */
    public CallContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        Instant now = Instant.now();
        if (timeout.compareTo(Duration.between(now, Instant.MAX)) >= 0) {
            return withDeadline(Instant.MAX);
        }
        return withDeadline(now.plus(timeout));
    }

    public CallContext withCancellation(BooleanSupplier cancellation) {
        return new CallContext(
                deadline, Objects.requireNonNull(cancellation, "cancellation"), carrier, traceContext);
    }

    public CallContext withCarrier(Map<String, String> carrier) {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (carrier != null) {
            carrier.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
        }
        return new CallContext(deadline, cancellation, Collections.unmodifiableMap(copy), traceContext);
    }

    public CallContext withTraceContext(Context traceContext) {
        return new CallContext(
                deadline, cancellation, carrier, Objects.requireNonNull(traceContext, "traceContext"));
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /** Time left until the deadline, clamped at zero; empty when no deadline is set. */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public Map<String, String> carrier() {
        return carrier;
    }

    public Context traceContext() {
        return traceContext;
    }

    public boolean isCancelled() {
        return cancellation.getAsBoolean();
    }

    public boolean isDeadlineExceeded() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    public boolean isDone() {
        return isCancelled() || isDeadlineExceeded();
    }

    /**
     * Fails fast when the call can no longer make progress.
     *
     * @throws CallCancelledException if the call was cancelled or its deadline has passed
     */
    public void ensureActive() {
        if (isCancelled()) {
            throw new CallCancelledException("call cancelled", false);
        }
        if (isDeadlineExceeded()) {
            throw new CallCancelledException("call deadline exceeded at " + deadline, true);
        }
    }
}
