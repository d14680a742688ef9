package io.github.jakubt4.satti.exception;

/**
 * A map tile could not be downloaded or decoded. Always fatal for the enclosing mosaic.
 */
public class TileFetchException extends ImageSynthesisException {

    public TileFetchException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public TileFetchException(final String message) {
        super(message);
    }
}
