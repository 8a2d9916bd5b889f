package com.flagship.payment_engine.sink;

import com.flagship.payment_engine.ledger.ClientAccount;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.util.Collection;

/**
 * Writes accounts as CSV: {@code client,available,held,total,locked}.
 */
public class CsvAccountSink implements AccountSink {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader("client", "available", "held", "total", "locked")
            .setRecordSeparator('\n')
            .build();

    private final Writer writer;

    public CsvAccountSink(Writer writer) {
        this.writer = writer;
    }

    @Override
    public void write(Collection<ClientAccount> accounts) throws IOException {
        // not closed: that would close the caller's writer
        CSVPrinter printer = new CSVPrinter(writer, FORMAT);
        for (ClientAccount account : accounts) {
            AccountSnapshot row = AccountSnapshot.from(account);
            printer.printRecord(
                    row.getClient(),
                    row.getAvailable().toPlainString(),
                    row.getHeld().toPlainString(),
                    row.getTotal().toPlainString(),
                    row.isLocked());
        }
        printer.flush();
    }
}
