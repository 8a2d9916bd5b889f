package com.flagship.payment_engine.processing;

import lombok.Getter;
import org.springframework.boot.ExitCodeGenerator;

/**
 * Fatal failure of a run: the input could not be read, the output could not
 * be written, or the command line was unusable.
 *
 * Spring Boot maps it to the process exit status through {@link ExitCodeGenerator}.
 */
@Getter
public class EngineRunException extends RuntimeException implements ExitCodeGenerator {

    public static final int IO_FAILURE = 1;
    public static final int USAGE = 2;

    private final int exitCode;

    private EngineRunException(String message, Throwable cause, int exitCode) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    public static EngineRunException unreadableInput(String origin, Throwable cause) {
        return new EngineRunException(
                String.format("Cannot read transactions from %s: %s", origin, cause.getMessage()),
                cause, IO_FAILURE);
    }

    public static EngineRunException unwritableOutput(String target, Throwable cause) {
        return new EngineRunException(
                String.format("Cannot write accounts to %s: %s", target, cause.getMessage()),
                cause, IO_FAILURE);
    }

    public static EngineRunException usage(String message) {
        return new EngineRunException(message, null, USAGE);
    }
}
