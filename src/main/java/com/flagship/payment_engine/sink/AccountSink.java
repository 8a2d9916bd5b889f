package com.flagship.payment_engine.sink;

import com.flagship.payment_engine.ledger.ClientAccount;

import java.io.IOException;
import java.util.Collection;

/**
 * Renders the final account states of a run.
 *
 * Implementations flush what they write but leave the underlying output
 * open, since it may be standard output.
 */
public interface AccountSink {

    /**
     * Writes one entry per account, in the iteration order of the collection.
     *
     * @throws IOException if the output cannot be written
     */
    void write(Collection<ClientAccount> accounts) throws IOException;
}
