package com.flagship.payment_engine.source;

import com.flagship.payment_engine.ledger.TransactionEvent;
import com.flagship.payment_engine.ledger.TransactionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.flagship.payment_engine.testing.TestFixtures.fixture;
import static org.junit.jupiter.api.Assertions.*;

class CsvEventSourceTest {

    private static List<TransactionEvent> readAll(EventSource source) throws IOException {
        try (source; Stream<TransactionEvent> events = source.events()) {
            return events.collect(Collectors.toList());
        }
    }

    private static CsvEventSource fromString(String csv) {
        return new CsvEventSource(new StringReader(csv), "inline");
    }

    @Test
    @DisplayName("Reads events in file order")
    void readsEventsInOrder() throws IOException {
        List<TransactionEvent> events = readAll(new CsvEventSource(fixture("transactions.csv")));

        assertEquals(5, events.size());
        assertEquals(TransactionEvent.deposit(1, 1, new BigDecimal("1.0")), events.get(0));
        assertEquals(TransactionEvent.deposit(2, 2, new BigDecimal("2.0")), events.get(1));
        assertEquals(TransactionEvent.withdrawal(2, 5, new BigDecimal("3.0")), events.get(4));
    }

    @Test
    @DisplayName("Reference rows may leave the amount empty or omit the column")
    void referenceRowsWithoutAmount() throws IOException {
        List<TransactionEvent> events = readAll(fromString("""
                type,client,tx,amount
                deposit,1,1,10.0
                dispute,1,1,
                resolve,1,1
                chargeback,1,1,3.0
                """));

        assertEquals(List.of(
                TransactionEvent.deposit(1, 1, new BigDecimal("10.0")),
                TransactionEvent.dispute(1, 1),
                TransactionEvent.resolve(1, 1),
                TransactionEvent.chargeback(1, 1)), events);
        assertNull(events.get(3).getAmount());
    }

    @Test
    @DisplayName("Whitespace is trimmed and amounts keep their full precision")
    void trimsWhitespaceAndKeepsPrecision() throws IOException {
        List<TransactionEvent> events = readAll(fromString("""
                type , client , tx , amount
                  deposit ,  7 ,  4294967295 , 0.123456789
                """));

        TransactionEvent event = events.get(0);
        assertEquals(TransactionType.DEPOSIT, event.getType());
        assertEquals(7, event.getClientId());
        assertEquals(4294967295L, event.getTxId());
        assertEquals(new BigDecimal("0.123456789"), event.getAmount());
    }

    @Test
    @DisplayName("Malformed records are skipped and counted; the rest is read")
    void skipsMalformedRecords() throws IOException {
        CsvEventSource source = new CsvEventSource(fixture("malformed.csv"));

        List<TransactionEvent> events = readAll(source);

        assertEquals(List.of(
                TransactionEvent.deposit(1, 1, new BigDecimal("1.23456")),
                TransactionEvent.deposit(2, 6, new BigDecimal("3.00005")),
                TransactionEvent.withdrawal(1, 7, new BigDecimal("0.2")),
                TransactionEvent.dispute(1, 1),
                TransactionEvent.dispute(2, 6)), events);
        assertEquals(6, source.rejectedRecords());
    }

    @Test
    @DisplayName("A record with broken quoting is skipped and reading goes on")
    void skipsRecordWithBrokenQuoting() throws IOException {
        CsvEventSource source = fromString("""
                type,client,tx,amount
                deposit,1,1,1.0
                deposit,1,2,"2.0"x
                deposit,1,3,3.0
                """);

        List<TransactionEvent> events = readAll(source);

        assertEquals(List.of(
                TransactionEvent.deposit(1, 1, new BigDecimal("1.0")),
                TransactionEvent.deposit(1, 3, new BigDecimal("3.0"))), events);
        assertEquals(1, source.rejectedRecords());
    }

    @Test
    @DisplayName("An unterminated quote only costs its own line")
    void skipsUnterminatedQuote() throws IOException {
        CsvEventSource source = fromString("""
                type,client,tx,amount
                deposit,1,"1,1.0
                deposit,1,2,2.0
                """);

        List<TransactionEvent> events = readAll(source);

        assertEquals(List.of(TransactionEvent.deposit(1, 2, new BigDecimal("2.0"))), events);
        assertEquals(1, source.rejectedRecords());
    }

    @Test
    @DisplayName("Well-formed quoted values are read")
    void readsQuotedValues() throws IOException {
        List<TransactionEvent> events = readAll(fromString("type,client,tx,amount\n\"deposit\",\"4\",\"5\",\"2.5\"\n"));

        assertEquals(List.of(TransactionEvent.deposit(4, 5, new BigDecimal("2.5"))), events);
    }

    @Test
    @DisplayName("Posting without amount is kept with no amount")
    void postingWithoutAmount() throws IOException {
        List<TransactionEvent> events = readAll(fromString("type,client,tx,amount\ndeposit,1,1,\n"));

        assertEquals(1, events.size());
        assertNull(events.get(0).getAmount());
    }

    @Test
    @DisplayName("Empty input yields no events")
    void emptyInput() throws IOException {
        assertTrue(readAll(fromString("")).isEmpty());
        assertTrue(readAll(fromString("type,client,tx,amount\n")).isEmpty());
    }

    @Test
    @DisplayName("Events can only be requested once")
    void singleUse() throws IOException {
        CsvEventSource source = new CsvEventSource(fixture("transactions.csv"));
        readAll(source);

        assertThrows(IllegalStateException.class, source::events);
    }

    @Test
    @DisplayName("Missing file fails when the events are requested")
    void missingFile(@TempDir Path tempDir) {
        CsvEventSource source = new CsvEventSource(tempDir.resolve("absent.csv"));

        assertThrows(IOException.class, source::events);
    }

    @Test
    @DisplayName("Header without the required columns is rejected")
    void wrongHeader() {
        CsvEventSource source = fromString("name,value\nfoo,1\n");

        IOException e = assertThrows(IOException.class, source::events);
        assertTrue(e.getMessage().contains("missing column 'type'"));
    }

    @Test
    @DisplayName("Header names are matched case-insensitively")
    void headerCaseInsensitive() throws IOException {
        List<TransactionEvent> events = readAll(fromString("Type,Client,TX,Amount\nwithdrawal,3,9,1.5\n"));

        assertEquals(List.of(TransactionEvent.withdrawal(3, 9, new BigDecimal("1.5"))), events);
    }
}
