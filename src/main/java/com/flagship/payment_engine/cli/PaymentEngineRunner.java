package com.flagship.payment_engine.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payment_engine.processing.EngineRunException;
import com.flagship.payment_engine.processing.LedgerProcessingService;
import com.flagship.payment_engine.processing.ProcessingSummary;
import com.flagship.payment_engine.source.CsvEventSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Command line entry point.
 *
 * Usage: {@code payment-engine <transactions.csv> [output]}
 *
 * Without an output path the accounts are written to standard output.
 * The format comes from {@code engine.output.format} (csv or json), which can
 * also be given on the command line as {@code --engine.output.format=json}.
 *
 * Fatal failures surface as {@link EngineRunException}; Spring Boot turns its
 * exit code into the process exit status.
 */
@Component
@ConditionalOnProperty(name = "engine.runner.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class PaymentEngineRunner implements ApplicationRunner {

    static final String USAGE = "Usage: payment-engine <transactions.csv> [output] [--engine.output.format=csv|json]";

    private static final String PARTIAL_SUFFIX = ".partial";

    private final LedgerProcessingService processingService;
    private final ObjectMapper objectMapper;
    private final String outputFormat;

    public PaymentEngineRunner(LedgerProcessingService processingService,
                               ObjectMapper objectMapper,
                               @Value("${engine.output.format:csv}") String outputFormat) {
        this.processingService = processingService;
        this.objectMapper = objectMapper;
        this.outputFormat = outputFormat;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> paths = args.getNonOptionArgs();
        if (paths.isEmpty() || paths.size() > 2) {
            throw EngineRunException.usage(USAGE);
        }

        OutputFormat format = OutputFormat.parse(outputFormat)
                .orElseThrow(() -> EngineRunException.usage(
                        "Unknown output format '" + outputFormat + "'. " + USAGE));

        Path input = Path.of(paths.get(0));
        if (paths.size() == 2) {
            writeToFile(input, Path.of(paths.get(1)), format);
        } else {
            writeToStdout(input, format);
        }
    }

    /**
     * Processes the input file and writes the accounts to the given file,
     * replacing it if it exists.
     *
     * The accounts are first written next to the output and moved over it
     * once the run has succeeded. A failed run leaves an existing output
     * file as it was.
     */
    public ProcessingSummary writeToFile(Path input, Path output, OutputFormat format) {
        Path partial = output.resolveSibling(output.getFileName() + PARTIAL_SUFFIX);
        log.debug("Writing {} accounts to {} through {}", format, output, partial);
        try {
            ProcessingSummary summary;
            try (Writer writer = Files.newBufferedWriter(partial, StandardCharsets.UTF_8)) {
                summary = process(input, writer, format);
            }
            Files.move(partial, output, StandardCopyOption.REPLACE_EXISTING);
            return summary;
        } catch (IOException e) {
            throw EngineRunException.unwritableOutput(output.toString(), e);
        } finally {
            discard(partial);
        }
    }

    /**
     * Processes the input file and writes the accounts to standard output.
     * Standard output is flushed, not closed.
     */
    public ProcessingSummary writeToStdout(Path input, OutputFormat format) {
        Writer stdout = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        return process(input, stdout, format);
    }

    /**
     * Processes the input file and writes the accounts to the given writer.
     */
    public ProcessingSummary process(Path input, Writer writer, OutputFormat format) {
        return processingService.process(
                new CsvEventSource(input),
                format.sinkFor(writer, objectMapper));
    }

    private void discard(Path partial) {
        try {
            Files.deleteIfExists(partial);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", partial, e.getMessage());
        }
    }
}
