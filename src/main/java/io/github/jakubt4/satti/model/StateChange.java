package io.github.jakubt4.satti.model;

import java.time.Instant;

/**
 * One entry of a command's transition history.
 */
public record StateChange(CommandState state, String message, Instant at) {
}
