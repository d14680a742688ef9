package io.github.jakubt4.satti.model;

/**
 * Simulator-only switch between procedural imagery ({@code INTERNAL}) and an
 * OpenStreetMap mosaic of the AOI ({@code EXTERNAL}).
 */
public enum GenerationMode {
    INTERNAL,
    EXTERNAL
}
