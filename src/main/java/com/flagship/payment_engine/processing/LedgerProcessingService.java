package com.flagship.payment_engine.processing;

import com.flagship.payment_engine.ledger.ClientAccount;
import com.flagship.payment_engine.ledger.LedgerEngine;
import com.flagship.payment_engine.ledger.TransactionEvent;
import com.flagship.payment_engine.observability.EngineMetrics;
import com.flagship.payment_engine.sink.AccountSink;
import com.flagship.payment_engine.source.EventSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Collection;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Runs one transaction log through a fresh {@link LedgerEngine}.
 *
 * This method:
 * 1. Opens the event source
 * 2. Applies every event in source order
 * 3. Writes the final accounts to the sink
 * 4. Records metrics and logs a summary
 * 5. Closes the source
 *
 * The service itself is stateless; all ledger state lives in the engine
 * created for the run and is dropped when the run ends.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerProcessingService {

    public static final String ORIGIN_MDC_KEY = "origin";

    private final EngineMetrics metrics;

    /**
     * Processes all events of the source and renders the resulting accounts.
     *
     * @param source Where the events come from
     * @param sink Where the accounts go
     * @return Counts for the run
     * @throws EngineRunException if the source cannot be read or the sink cannot be written
     */
    public ProcessingSummary process(EventSource source, AccountSink sink) {
        long startTime = System.nanoTime();
        MDC.put(ORIGIN_MDC_KEY, source.describe());

        try {
            LedgerEngine engine = new LedgerEngine();
            long applied = 0;
            long ignored = 0;

            try (Stream<TransactionEvent> events = source.events()) {
                Iterator<TransactionEvent> iterator = events.iterator();
                while (iterator.hasNext()) {
                    TransactionEvent event = iterator.next();
                    boolean changed = engine.apply(event);
                    metrics.recordEvent(event.getType(), changed);
                    if (changed) {
                        applied++;
                    } else {
                        ignored++;
                    }
                }
            } catch (IOException e) {
                throw EngineRunException.unreadableInput(source.describe(), e);
            } catch (UncheckedIOException e) {
                throw EngineRunException.unreadableInput(source.describe(), e.getCause());
            }

            Collection<ClientAccount> accounts = engine.accounts().values();
            try {
                sink.write(accounts);
            } catch (IOException e) {
                throw EngineRunException.unwritableOutput(sink.getClass().getSimpleName(), e);
            }

            Duration duration = Duration.ofNanos(System.nanoTime() - startTime);
            metrics.recordRejectedRecords(source.rejectedRecords());
            metrics.recordRunDuration(duration);
            metrics.recordRun("success");

            ProcessingSummary summary = ProcessingSummary.builder()
                    .origin(source.describe())
                    .eventsApplied(applied)
                    .eventsIgnored(ignored)
                    .rejectedRecords(source.rejectedRecords())
                    .accounts(accounts.size())
                    .lockedAccounts(accounts.stream().filter(ClientAccount::isLocked).count())
                    .duration(duration)
                    .build();

            log.info("Processed {}: events={}, applied={}, ignored={}, rejected={}, accounts={}, locked={}, duration={}ms",
                    summary.getOrigin(), summary.eventsRead(), applied, ignored,
                    summary.getRejectedRecords(), summary.getAccounts(), summary.getLockedAccounts(),
                    duration.toMillis());
            return summary;

        } catch (EngineRunException e) {
            metrics.recordRun("failure");
            log.error("Run failed: {}", e.getMessage());
            throw e;
        } finally {
            closeSource(source);
            MDC.remove(ORIGIN_MDC_KEY);
        }
    }

    private void closeSource(EventSource source) {
        try {
            source.close();
        } catch (IOException e) {
            log.warn("Failed to close {}: {}", source.describe(), e.getMessage());
        }
    }
}
