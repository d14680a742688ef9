package io.github.jakubt4.satti.exception;

/**
 * Thrown when a raster cannot be produced or written: missing AOI, unsupported map source,
 * disk errors.
 */
public class ImageSynthesisException extends SimulatorException {

    public ImageSynthesisException(final String message) {
        super(message);
    }

    public ImageSynthesisException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
