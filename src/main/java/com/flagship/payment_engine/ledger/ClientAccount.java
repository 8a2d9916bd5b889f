package com.flagship.payment_engine.ledger;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Balance state of one client.
 *
 * Invariant: total == available + held. The total is derived on every read
 * and never stored, so no mutation can break it.
 *
 * Only {@link LedgerEngine} mutates accounts; the mutators are package-private.
 * Locking is one-way: there is no unlock operation.
 */
@Getter
@ToString
public class ClientAccount {

    private final int clientId;
    private BigDecimal available = BigDecimal.ZERO;
    private BigDecimal held = BigDecimal.ZERO;
    private boolean locked;

    ClientAccount(int clientId) {
        this.clientId = clientId;
    }

    @ToString.Include
    public BigDecimal getTotal() {
        return available.add(held);
    }

    boolean canCover(BigDecimal amount) {
        return available.compareTo(amount) >= 0;
    }

    void credit(BigDecimal amount) {
        available = available.add(amount);
    }

    void debit(BigDecimal amount) {
        available = available.subtract(amount);
    }

    void hold(BigDecimal amount) {
        available = available.subtract(amount);
        held = held.add(amount);
    }

    void release(BigDecimal amount) {
        held = held.subtract(amount);
        available = available.add(amount);
    }

    void reverse(BigDecimal amount) {
        held = held.subtract(amount);
        available = available.subtract(amount);
        locked = true;
    }
}
