package com.flagship.payment_engine.ledger;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Applies transaction events to client accounts.
 *
 * Rules per event type:
 * - DEPOSIT: creates the account if needed, available += amount
 * - WITHDRAWAL: only if the account exists and available >= amount
 * - DISPUTE: moves the referenced amount from available to held
 * - RESOLVE: moves it back from held to available, only after a dispute
 * - CHARGEBACK: removes it from held and available and locks the account,
 *   only after a dispute
 *
 * Events whose preconditions fail are absorbed as no-ops. They are not errors
 * and are not reported. Every event is recorded in the history after being
 * applied, whether or not it changed anything.
 *
 * The lock flag is informational: no rule checks it.
 *
 * One instance holds the state of one run and is not thread-safe.
 */
@Slf4j
public class LedgerEngine {

    private final Map<Integer, ClientAccount> accounts = new TreeMap<>();
    private final TransactionHistory history = new TransactionHistory();

    /**
     * Applies a single event.
     *
     * @param event The event to apply
     * @return true if an account changed, false if the event was a no-op
     */
    public boolean apply(TransactionEvent event) {
        boolean applied = switch (event.getType()) {
            case DEPOSIT -> deposit(event);
            case WITHDRAWAL -> withdraw(event);
            case DISPUTE -> dispute(event);
            case RESOLVE -> resolve(event);
            case CHARGEBACK -> chargeback(event);
        };

        history.record(event);

        if (log.isTraceEnabled()) {
            log.trace("{} client={} tx={} applied={}",
                    event.getType(), event.getClientId(), event.getTxId(), applied);
        }
        return applied;
    }

    /**
     * Accounts by client id, in ascending client order. Read-only view.
     */
    public Map<Integer, ClientAccount> accounts() {
        return Collections.unmodifiableMap(accounts);
    }

    public Optional<ClientAccount> account(int clientId) {
        return Optional.ofNullable(accounts.get(clientId));
    }

    public Optional<TransactionState> transactionState(int clientId, long txId) {
        return history.stateOf(clientId, txId);
    }

    public TransactionHistory history() {
        return history;
    }

    private boolean deposit(TransactionEvent event) {
        accountFor(event.getClientId()).credit(event.amountOrZero());
        return true;
    }

    private boolean withdraw(TransactionEvent event) {
        ClientAccount account = accounts.get(event.getClientId());
        BigDecimal amount = event.amountOrZero();
        if (account == null || !account.canCover(amount)) {
            return false;
        }
        account.debit(amount);
        return true;
    }

    private boolean dispute(TransactionEvent event) {
        Optional<BigDecimal> amount = referencedAmount(event);
        if (amount.isEmpty()) {
            return false;
        }
        accountFor(event.getClientId()).hold(amount.get());
        return true;
    }

    private boolean resolve(TransactionEvent event) {
        Optional<ClientAccount> account = disputedAccount(event);
        if (account.isEmpty()) {
            return false;
        }
        account.get().release(referencedAmount(event).orElse(BigDecimal.ZERO));
        return true;
    }

    private boolean chargeback(TransactionEvent event) {
        Optional<ClientAccount> account = disputedAccount(event);
        if (account.isEmpty()) {
            return false;
        }
        account.get().reverse(referencedAmount(event).orElse(BigDecimal.ZERO));
        return true;
    }

    /**
     * Account to settle a dispute on: requires a posting and a prior dispute
     * in the bucket, and an existing account.
     */
    private Optional<ClientAccount> disputedAccount(TransactionEvent event) {
        if (referencedAmount(event).isEmpty()
                || !history.hasDispute(event.getClientId(), event.getTxId())) {
            return Optional.empty();
        }
        return account(event.getClientId());
    }

    private Optional<BigDecimal> referencedAmount(TransactionEvent event) {
        return history.findPosting(event.getClientId(), event.getTxId())
                .map(TransactionEvent::amountOrZero);
    }

    private ClientAccount accountFor(int clientId) {
        return accounts.computeIfAbsent(clientId, ClientAccount::new);
    }
}
