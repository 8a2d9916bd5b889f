package com.flagship.payment_engine.observability;

import com.flagship.payment_engine.ledger.TransactionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger runs.
 *
 * Metrics exposed:
 * - ledger.events.applied: events that changed an account, tagged by type
 * - ledger.events.ignored: events absorbed as no-ops, tagged by type
 * - ledger.records.rejected: input records dropped as malformed
 * - ledger.runs: completed runs, tagged by outcome
 * - ledger.run.duration: time taken by a run
 */
@Component
public class EngineMetrics {

    private final MeterRegistry registry;

    private final Counter rejectedRecords;
    private final Timer runTimer;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.rejectedRecords = Counter.builder("ledger.records.rejected")
                .description("Number of input records dropped as malformed")
                .register(registry);

        this.runTimer = Timer.builder("ledger.run.duration")
                .description("Time taken to process one transaction log")
                .register(registry);
    }

    // ==================== Counter Methods ====================

    /**
     * Records the outcome of applying one event.
     * Uses registry.counter() for efficient meter lookup/creation.
     */
    public void recordEvent(TransactionType type, boolean applied) {
        registry.counter(applied ? "ledger.events.applied" : "ledger.events.ignored",
                "type", type.wireName()
        ).increment();
    }

    public void recordRejectedRecords(long count) {
        rejectedRecords.increment(count);
    }

    public void recordRun(String outcome) {
        registry.counter("ledger.runs", "outcome", outcome).increment();
    }

    // ==================== Timer Methods ====================

    public void recordRunDuration(Duration duration) {
        runTimer.record(duration);
    }

    // ==================== Read-back ====================

    public double eventsApplied(TransactionType type) {
        return count("ledger.events.applied", type);
    }

    public double eventsIgnored(TransactionType type) {
        return count("ledger.events.ignored", type);
    }

    public double rejectedRecords() {
        return rejectedRecords.count();
    }

    private double count(String name, TransactionType type) {
        Counter counter = registry.find(name).tag("type", type.wireName()).counter();
        return counter != null ? counter.count() : 0;
    }
}
