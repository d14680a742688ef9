package io.github.jakubt4.satti.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an uplink command.
 *
 * <pre>
 * QUEUED ──► ACKED ──► CAPTURING ──► DOWNLINK_READY
 *   │          │           │
 *   └──────────┴───────────┴──► FAILED ──(rerun)──► QUEUED
 * </pre>
 *
 * <p>{@code QUEUED → QUEUED} is allowed so the pipeline can re-stamp the message when it
 * picks a command up. {@code FAILED → QUEUED} is the operator rerun; no other backward
 * edge exists and {@code DOWNLINK_READY} is final.
 */
public enum CommandState {
    QUEUED,
    ACKED,
    CAPTURING,
    DOWNLINK_READY,
    FAILED;

    public boolean isTerminal() {
        return this == DOWNLINK_READY || this == FAILED;
    }

    public boolean isInFlight() {
        return !isTerminal();
    }

    public boolean canTransitionTo(final CommandState next) {
        return allowedSuccessors().contains(next);
    }

    private Set<CommandState> allowedSuccessors() {
        return switch (this) {
            case QUEUED -> EnumSet.of(QUEUED, ACKED, FAILED);
            case ACKED -> EnumSet.of(CAPTURING, FAILED);
            case CAPTURING -> EnumSet.of(DOWNLINK_READY, FAILED);
            case FAILED -> EnumSet.of(QUEUED);
            case DOWNLINK_READY -> EnumSet.noneOf(CommandState.class);
        };
    }
}
