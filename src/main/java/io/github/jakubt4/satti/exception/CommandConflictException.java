package io.github.jakubt4.satti.exception;

/**
 * Thrown when an operation is not allowed in the command's current lifecycle state.
 */
public class CommandConflictException extends SimulatorException {

    public CommandConflictException(final String message) {
        super(message);
    }
}
