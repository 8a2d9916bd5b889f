package com.flagship.payment_engine.source;

import com.flagship.payment_engine.ledger.TransactionEvent;

import java.io.Closeable;
import java.io.IOException;
import java.util.stream.Stream;

/**
 * Origin of transaction events for one run.
 *
 * The returned stream is lazy, finite and ordered as the records appear in
 * the origin. It can be obtained once: origins are usually single-pass.
 * Only well-formed events are emitted; malformed records are dropped by the
 * source itself.
 */
public interface EventSource extends Closeable {

    /**
     * Opens the origin and returns its events.
     *
     * @return events in origin order
     * @throws IOException if the origin cannot be opened
     * @throws IllegalStateException if the events were already requested
     */
    Stream<TransactionEvent> events() throws IOException;

    /**
     * Number of records dropped as malformed so far.
     */
    default long rejectedRecords() {
        return 0;
    }

    /**
     * Human readable name of the origin, used in logs.
     */
    String describe();

    @Override
    default void close() throws IOException {
    }
}
