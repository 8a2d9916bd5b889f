package com.flagship.payment_engine.source;

import com.flagship.payment_engine.ledger.TransactionEvent;
import com.flagship.payment_engine.ledger.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads transaction events from CSV with the header {@code type,client,tx,amount}.
 *
 * Whitespace around values is ignored. The amount column may be empty or
 * missing altogether on dispute, resolve and chargeback rows. A record that
 * cannot be turned into an event, including one with broken quoting, is
 * logged and skipped; reading continues with the next line.
 *
 * Each line is parsed on its own, so a record cannot span several lines.
 */
@Slf4j
public class CsvEventSource implements EventSource {

    static final String TYPE = "type";
    static final String CLIENT = "client";
    static final String TX = "tx";
    static final String AMOUNT = "amount";

    private static final List<String> REQUIRED_COLUMNS = List.of(TYPE, CLIENT, TX);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreSurroundingSpaces(true)
            .setTrim(true)
            .build();

    private final ReaderSupplier readerSupplier;
    private final String origin;

    private BufferedReader reader;
    private Map<String, Integer> columns = Map.of();
    private boolean consumed;
    private long lineNumber;
    private long rejectedRecords;

    /**
     * Source reading a UTF-8 file. The file is opened by {@link #events()}.
     */
    public CsvEventSource(Path path) {
        this(() -> Files.newBufferedReader(path, StandardCharsets.UTF_8), path.toString());
    }

    /**
     * Source reading from an already opened reader.
     */
    public CsvEventSource(Reader reader, String origin) {
        this(() -> reader, origin);
    }

    private CsvEventSource(ReaderSupplier readerSupplier, String origin) {
        this.readerSupplier = readerSupplier;
        this.origin = origin;
    }

    @Override
    public Stream<TransactionEvent> events() throws IOException {
        if (consumed) {
            throw new IllegalStateException("Events of " + origin + " were already consumed");
        }
        consumed = true;

        reader = new BufferedReader(readerSupplier.open());

        List<String> header = readHeader();
        if (header.isEmpty()) {
            // empty input, nothing to read
            return Stream.empty();
        }
        columns = verifyHeader(header);

        log.debug("Reading transaction events from {}", origin);
        return reader.lines()
                .map(this::toEvent)
                .flatMap(Optional::stream);
    }

    @Override
    public long rejectedRecords() {
        return rejectedRecords;
    }

    @Override
    public String describe() {
        return origin;
    }

    @Override
    public void close() throws IOException {
        if (reader != null) {
            reader.close();
        }
    }

    /**
     * Column names of the first non-blank line, or an empty list at end of input.
     */
    private List<String> readHeader() throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (!line.isBlank()) {
                return parseLine(line).toList();
            }
        }
        return List.of();
    }

    private Map<String, Integer> verifyHeader(List<String> header) throws IOException {
        Map<String, Integer> indexes = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            indexes.putIfAbsent(header.get(i).toLowerCase(Locale.ROOT), i);
        }
        for (String column : REQUIRED_COLUMNS) {
            if (!indexes.containsKey(column)) {
                throw new IOException(String.format(
                        "%s is not a transaction log: missing column '%s' in header %s",
                        origin, column, header));
            }
        }
        return indexes;
    }

    private Optional<TransactionEvent> toEvent(String line) {
        lineNumber++;
        if (line.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(parseRecord(parseLine(line)));
        } catch (IOException | UncheckedIOException e) {
            reject(line, "unparseable record: " + rootMessage(e));
        } catch (NumberFormatException e) {
            reject(line, "invalid number: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            reject(line, e.getMessage());
        }
        return Optional.empty();
    }

    private CSVRecord parseLine(String line) throws IOException {
        try (CSVParser lineParser = CSVParser.parse(line, FORMAT)) {
            Iterator<CSVRecord> records = lineParser.iterator();
            if (!records.hasNext()) {
                throw new IOException("no record on line");
            }
            return records.next();
        }
    }

    private TransactionEvent parseRecord(CSVRecord record) {
        String rawType = value(record, TYPE);
        TransactionType type = TransactionType.fromWireName(rawType)
                .orElseThrow(() -> new IllegalArgumentException("unknown transaction type '" + rawType + "'"));

        int clientId = Integer.parseInt(required(record, CLIENT));
        long txId = Long.parseLong(required(record, TX));

        BigDecimal amount = null;
        if (type.isPosting()) {
            String rawAmount = value(record, AMOUNT);
            if (rawAmount != null && !rawAmount.isEmpty()) {
                amount = new BigDecimal(rawAmount);
            }
        }
        return new TransactionEvent(type, clientId, txId, amount);
    }

    private String required(CSVRecord record, String column) {
        String value = value(record, column);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("missing value for '" + column + "'");
        }
        return value;
    }

    /**
     * Column value, or null when the record is too short to have it.
     */
    private String value(CSVRecord record, String column) {
        Integer index = columns.get(column);
        return index != null && index < record.size() ? record.get(index) : null;
    }

    private void reject(String line, String reason) {
        rejectedRecords++;
        log.warn("Skipping malformed record on line {} of {}: {}. Record: {}",
                lineNumber, origin, reason, line);
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }

    @FunctionalInterface
    private interface ReaderSupplier {
        Reader open() throws IOException;
    }
}
