package com.flagship.payment_engine.sink;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payment_engine.ledger.ClientAccount;

import java.io.IOException;
import java.io.Writer;
import java.util.Collection;
import java.util.List;

/**
 * Writes accounts as a JSON array of {@link AccountSnapshot} objects.
 */
public class JsonAccountSink implements AccountSink {

    private final Writer writer;
    private final ObjectMapper objectMapper;

    public JsonAccountSink(Writer writer, ObjectMapper objectMapper) {
        this.writer = writer;
        this.objectMapper = objectMapper;
    }

    @Override
    public void write(Collection<ClientAccount> accounts) throws IOException {
        List<AccountSnapshot> rows = accounts.stream()
                .map(AccountSnapshot::from)
                .toList();

        objectMapper.writer()
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValue(writer, rows);
        writer.write(System.lineSeparator());
        writer.flush();
    }
}
