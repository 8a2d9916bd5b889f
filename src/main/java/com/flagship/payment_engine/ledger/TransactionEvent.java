package com.flagship.payment_engine.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A single entry of the transaction log.
 *
 * Client ids are unsigned 16-bit and transaction ids unsigned 32-bit values,
 * widened to {@code int} and {@code long}. The amount is only meaningful for
 * deposits and withdrawals; reference events (dispute, resolve, chargeback)
 * always have a {@code null} amount.
 */
@Value
public class TransactionEvent {

    public static final int MAX_CLIENT_ID = 0xFFFF;
    public static final long MAX_TX_ID = 0xFFFF_FFFFL;

    TransactionType type;
    int clientId;
    long txId;
    BigDecimal amount;

    public TransactionEvent(TransactionType type, int clientId, long txId, BigDecimal amount) {
        if (type == null) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        if (clientId < 0 || clientId > MAX_CLIENT_ID) {
            throw new IllegalArgumentException("Client id out of range: " + clientId);
        }
        if (txId < 0 || txId > MAX_TX_ID) {
            throw new IllegalArgumentException("Transaction id out of range: " + txId);
        }
        this.type = type;
        this.clientId = clientId;
        this.txId = txId;
        this.amount = type.isPosting() ? amount : null;
    }

    public static TransactionEvent deposit(int clientId, long txId, BigDecimal amount) {
        return new TransactionEvent(TransactionType.DEPOSIT, clientId, txId, amount);
    }

    public static TransactionEvent withdrawal(int clientId, long txId, BigDecimal amount) {
        return new TransactionEvent(TransactionType.WITHDRAWAL, clientId, txId, amount);
    }

    public static TransactionEvent dispute(int clientId, long txId) {
        return new TransactionEvent(TransactionType.DISPUTE, clientId, txId, null);
    }

    public static TransactionEvent resolve(int clientId, long txId) {
        return new TransactionEvent(TransactionType.RESOLVE, clientId, txId, null);
    }

    public static TransactionEvent chargeback(int clientId, long txId) {
        return new TransactionEvent(TransactionType.CHARGEBACK, clientId, txId, null);
    }

    /**
     * Amount of a posting, with a missing amount read as zero.
     */
    public BigDecimal amountOrZero() {
        return amount != null ? amount : BigDecimal.ZERO;
    }
}
