package com.flagship.payment_engine.ledger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only index of every event seen, grouped by client and transaction id.
 *
 * Each (clientId, txId) bucket normally holds one deposit or withdrawal
 * followed by the dispute, resolve and chargeback events that referenced it,
 * in arrival order. Reference events that had no effect are recorded too.
 */
public class TransactionHistory {

    private final Map<Integer, Map<Long, List<TransactionEvent>>> buckets = new HashMap<>();
    private long size;

    public void record(TransactionEvent event) {
        buckets.computeIfAbsent(event.getClientId(), id -> new HashMap<>())
                .computeIfAbsent(event.getTxId(), id -> new ArrayList<>())
                .add(event);
        size++;
    }

    /**
     * Events recorded for the given transaction, oldest first; empty if none.
     */
    public List<TransactionEvent> bucket(int clientId, long txId) {
        Map<Long, List<TransactionEvent>> byTx = buckets.get(clientId);
        if (byTx == null) {
            return List.of();
        }
        List<TransactionEvent> events = byTx.get(txId);
        return events == null ? List.of() : Collections.unmodifiableList(events);
    }

    /**
     * First deposit or withdrawal recorded for the transaction.
     * Later postings under the same id are ignored.
     */
    public Optional<TransactionEvent> findPosting(int clientId, long txId) {
        return bucket(clientId, txId).stream()
                .filter(event -> event.getType().isPosting())
                .findFirst();
    }

    public boolean hasDispute(int clientId, long txId) {
        return bucket(clientId, txId).stream()
                .anyMatch(event -> event.getType() == TransactionType.DISPUTE);
    }

    /**
     * Replays the bucket through {@link TransactionState} transitions.
     * Empty when no deposit or withdrawal was ever recorded for the id.
     */
    public Optional<TransactionState> stateOf(int clientId, long txId) {
        List<TransactionEvent> events = bucket(clientId, txId);
        TransactionState state = null;
        for (TransactionEvent event : events) {
            if (state == null) {
                if (event.getType().isPosting()) {
                    state = TransactionState.POSTED;
                }
            } else {
                state = state.next(event.getType());
            }
        }
        return Optional.ofNullable(state);
    }

    /**
     * Total number of events recorded.
     */
    public long size() {
        return size;
    }
}
