package io.github.jakubt4.satti.exception;

/**
 * Thrown when a satellite, ground station, command or image file does not exist.
 */
public class ResourceNotFoundException extends SimulatorException {

    public ResourceNotFoundException(final String message) {
        super(message);
    }
}
