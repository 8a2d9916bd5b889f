package com.flagship.payment_engine.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payment_engine.sink.AccountSink;
import com.flagship.payment_engine.sink.CsvAccountSink;
import com.flagship.payment_engine.sink.JsonAccountSink;

import java.io.Writer;
import java.util.Locale;
import java.util.Optional;

/**
 * Output formats selectable with {@code engine.output.format}.
 */
public enum OutputFormat {
    CSV,
    JSON;

    public AccountSink sinkFor(Writer writer, ObjectMapper objectMapper) {
        return switch (this) {
            case CSV -> new CsvAccountSink(writer);
            case JSON -> new JsonAccountSink(writer, objectMapper);
        };
    }

    public static Optional<OutputFormat> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
