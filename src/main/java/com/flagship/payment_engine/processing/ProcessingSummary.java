package com.flagship.payment_engine.processing;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Counts gathered over one run.
 */
@Value
@Builder
public class ProcessingSummary {
    String origin;
    long eventsApplied;
    long eventsIgnored;
    long rejectedRecords;
    int accounts;
    long lockedAccounts;
    Duration duration;

    public long eventsRead() {
        return eventsApplied + eventsIgnored;
    }
}
