package com.flagship.payment_engine.ledger;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of a transaction event as it appears in the input log.
 *
 * DEPOSIT and WITHDRAWAL post a new transaction with an amount.
 * DISPUTE, RESOLVE and CHARGEBACK reference a previously posted transaction
 * by its id and carry no amount of their own.
 */
public enum TransactionType {
    DEPOSIT,
    WITHDRAWAL,
    DISPUTE,
    RESOLVE,
    CHARGEBACK;

    /**
     * Whether this kind posts a new transaction (and therefore carries an amount).
     */
    public boolean isPosting() {
        return this == DEPOSIT || this == WITHDRAWAL;
    }

    /**
     * Lower-case name used in the input and output formats.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Looks up a type by its wire name, ignoring case and surrounding whitespace.
     */
    public static Optional<TransactionType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (TransactionType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
