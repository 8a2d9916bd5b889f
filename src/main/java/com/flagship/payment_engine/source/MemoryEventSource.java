package com.flagship.payment_engine.source;

import com.flagship.payment_engine.ledger.TransactionEvent;

import java.util.List;
import java.util.stream.Stream;

/**
 * Event source backed by an in-memory list.
 */
public class MemoryEventSource implements EventSource {

    private final List<TransactionEvent> events;
    private boolean consumed;

    public MemoryEventSource(List<TransactionEvent> events) {
        this.events = List.copyOf(events);
    }

    public static MemoryEventSource of(TransactionEvent... events) {
        return new MemoryEventSource(List.of(events));
    }

    @Override
    public Stream<TransactionEvent> events() {
        if (consumed) {
            throw new IllegalStateException("Events of " + describe() + " were already consumed");
        }
        consumed = true;
        return events.stream();
    }

    @Override
    public String describe() {
        return "memory[" + events.size() + " events]";
    }
}
