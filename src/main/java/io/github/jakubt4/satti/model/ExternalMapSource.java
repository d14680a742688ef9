package io.github.jakubt4.satti.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Tile providers the external map mosaic can draw from. Requests carry the source
 * as free text, so lookups go through {@link #parse(String)}.
 */
public enum ExternalMapSource {
    OSM;

    public static Optional<ExternalMapSource> parse(final String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(source -> source.name().equalsIgnoreCase(name.trim()))
                .findFirst();
    }
}
