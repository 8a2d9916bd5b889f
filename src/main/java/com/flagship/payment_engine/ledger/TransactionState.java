package com.flagship.payment_engine.ledger;

/**
 * Lifecycle of a posted transaction as seen through its dispute bucket.
 *
 * POSTED → DISPUTED → RESOLVED | CHARGED_BACK
 *
 * This is a reporting view derived from the history. The engine applies
 * events by re-checking its own preconditions and never consults it.
 */
public enum TransactionState {
    /**
     * Deposit or withdrawal recorded, no dispute yet.
     */
    POSTED,

    /**
     * A dispute is open; the amount sits in held funds.
     */
    DISPUTED,

    /**
     * The dispute was resolved in favour of the client.
     * Terminal state.
     */
    RESOLVED,

    /**
     * The dispute ended in a chargeback and the account was locked.
     * Terminal state.
     */
    CHARGED_BACK;

    public boolean isTerminal() {
        return this == RESOLVED || this == CHARGED_BACK;
    }

    /**
     * Returns the state reached when an event of the given type arrives in
     * this state, or this state itself when the event is not a transition.
     */
    public TransactionState next(TransactionType type) {
        return switch (this) {
            case POSTED -> type == TransactionType.DISPUTE ? DISPUTED : this;
            case DISPUTED -> switch (type) {
                case RESOLVE -> RESOLVED;
                case CHARGEBACK -> CHARGED_BACK;
                default -> this;
            };
            case RESOLVED, CHARGED_BACK -> this;
        };
    }
}
