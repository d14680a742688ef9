package io.github.jakubt4.satti.dto;

/**
 * Error body returned by every endpoint and by the web filters.
 *
 * @param status  HTTP reason phrase in upper snake case, e.g. {@code "CONFLICT"}
 * @param message human-readable detail
 */
public record ErrorResponse(String status, String message) {
}
