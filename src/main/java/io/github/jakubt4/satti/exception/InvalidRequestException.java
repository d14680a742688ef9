package io.github.jakubt4.satti.exception;

import java.util.List;

/**
 * Thrown when an inbound request violates field or cross-field rules.
 */
public class InvalidRequestException extends SimulatorException {

    private final List<String> violations;

    public InvalidRequestException(final List<String> violations) {
        super(String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public InvalidRequestException(final String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
