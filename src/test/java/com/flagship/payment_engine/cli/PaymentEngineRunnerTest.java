package com.flagship.payment_engine.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payment_engine.processing.EngineRunException;
import com.flagship.payment_engine.processing.LedgerProcessingService;
import com.flagship.payment_engine.processing.ProcessingSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.flagship.payment_engine.testing.TestFixtures.fixture;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Command line handling of the payment engine.
 *
 * These tests verify that:
 * - Accounts are written to the output file, or to standard output without one
 * - The output format follows engine.output.format
 * - Bad usage exits with code 2, unreadable input with code 1
 */
@SpringBootTest(properties = "engine.runner.enabled=false")
class PaymentEngineRunnerTest {

    private static final String TRANSACTIONS_CSV = """
            client,available,held,total,locked
            1,1.5000,0.0000,1.5000,false
            2,2.0000,0.0000,2.0000,false
            """;

    @Autowired
    private LedgerProcessingService processingService;

    @Autowired
    private ObjectMapper objectMapper;

    @TempDir
    Path tempDir;

    private PaymentEngineRunner runner;

    @BeforeEach
    void setUp() {
        runner = runnerWithFormat("csv");
    }

    private PaymentEngineRunner runnerWithFormat(String format) {
        return new PaymentEngineRunner(processingService, objectMapper, format);
    }

    private void run(String... args) {
        runner.run(new DefaultApplicationArguments(args));
    }

    @Nested
    @DisplayName("Output")
    class Output {

        @Test
        @DisplayName("Writes CSV accounts to the output file")
        void writesCsvFile() throws IOException {
            Path output = tempDir.resolve("accounts.csv");

            run(fixture("transactions.csv").toString(), output.toString());

            assertEquals(TRANSACTIONS_CSV, Files.readString(output));
        }

        @Test
        @DisplayName("Replaces an existing output file")
        void replacesOutputFile() throws IOException {
            Path output = tempDir.resolve("accounts.csv");
            Files.writeString(output, "stale content that is longer than the new output ".repeat(10));

            run(fixture("transactions.csv").toString(), output.toString());

            assertEquals(TRANSACTIONS_CSV, Files.readString(output));
            assertFalse(Files.exists(tempDir.resolve("accounts.csv.partial")));
        }

        @Test
        @DisplayName("Writes JSON when engine.output.format is json")
        void writesJsonFile() throws IOException {
            runner = runnerWithFormat("JSON");
            Path output = tempDir.resolve("accounts.json");

            run(fixture("dispute.csv").toString(), output.toString());

            String json = Files.readString(output);
            JsonNode accounts = objectMapper.readTree(json);
            assertEquals(1, accounts.size());
            assertEquals(1, accounts.get(0).get("client").asInt());
            assertTrue(accounts.get(0).get("locked").asBoolean());
            assertTrue(json.contains("\"available\":5.0000"), json);
        }

        @Test
        @DisplayName("Writes to standard output without an output path")
        void writesToStdout() {
            PrintStream original = System.out;
            ByteArrayOutputStream captured = new ByteArrayOutputStream();
            System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
            try {
                run(fixture("transactions.csv").toString());
            } finally {
                System.setOut(original);
            }

            assertEquals(TRANSACTIONS_CSV, captured.toString(StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("Returns the run summary")
        void returnsSummary() {
            ProcessingSummary summary = runner.writeToFile(
                    fixture("insufficient_funds.csv"), tempDir.resolve("out.csv"), OutputFormat.CSV);

            assertEquals(2, summary.getEventsApplied());
            assertEquals(1, summary.getEventsIgnored());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("No arguments is a usage error")
        void noArguments() {
            EngineRunException e = assertThrows(EngineRunException.class, () -> run());

            assertEquals(EngineRunException.USAGE, e.getExitCode());
            assertTrue(e.getMessage().startsWith("Usage:"));
        }

        @Test
        @DisplayName("More than two paths is a usage error")
        void tooManyArguments() {
            EngineRunException e = assertThrows(EngineRunException.class, () -> run("a.csv", "b.csv", "c.csv"));

            assertEquals(EngineRunException.USAGE, e.getExitCode());
        }

        @Test
        @DisplayName("An unknown output format is a usage error")
        void unknownFormat() {
            runner = runnerWithFormat("xml");

            EngineRunException e = assertThrows(EngineRunException.class,
                    () -> run(fixture("transactions.csv").toString()));

            assertEquals(EngineRunException.USAGE, e.getExitCode());
            assertTrue(e.getMessage().contains("'xml'"));
        }

        @Test
        @DisplayName("A missing input file exits with the I/O code")
        void missingInput() {
            Path output = tempDir.resolve("accounts.csv");

            EngineRunException e = assertThrows(EngineRunException.class,
                    () -> run(tempDir.resolve("missing.csv").toString(), output.toString()));

            assertEquals(EngineRunException.IO_FAILURE, e.getExitCode());
            assertFalse(Files.exists(output));
        }

        @Test
        @DisplayName("A failed run leaves an existing output file untouched")
        void failedRunKeepsExistingOutput() throws IOException {
            Path output = tempDir.resolve("accounts.csv");
            Files.writeString(output, "previous results\n");

            EngineRunException e = assertThrows(EngineRunException.class,
                    () -> run(tempDir.resolve("missing.csv").toString(), output.toString()));

            assertEquals(EngineRunException.IO_FAILURE, e.getExitCode());
            assertEquals("previous results\n", Files.readString(output));
            assertFalse(Files.exists(tempDir.resolve("accounts.csv.partial")));
        }

        @Test
        @DisplayName("An output path inside a missing directory exits with the I/O code")
        void unwritableOutput() {
            Path output = tempDir.resolve("no-such-dir").resolve("accounts.csv");

            EngineRunException e = assertThrows(EngineRunException.class,
                    () -> run(fixture("transactions.csv").toString(), output.toString()));

            assertEquals(EngineRunException.IO_FAILURE, e.getExitCode());
        }
    }
}
