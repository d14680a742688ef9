package io.github.jakubt4.satti.exception;

/**
 * Base class for all simulator failures surfaced to callers.
 */
public class SimulatorException extends RuntimeException {

    public SimulatorException(final String message) {
        super(message);
    }

    public SimulatorException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
