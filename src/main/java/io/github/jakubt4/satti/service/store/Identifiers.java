package io.github.jakubt4.satti.service.store;

import java.util.UUID;

/**
 * Short prefixed identifiers: {@code sat-1a2b3c4d}, {@code gnd-...}, {@code cmd-...}.
 */
public final class Identifiers {

    private Identifiers() {
    }

    public static String satelliteId() {
        return next("sat-", 8);
    }

    public static String groundStationId() {
        return next("gnd-", 8);
    }

    public static String commandId() {
        return next("cmd-", 12);
    }

    private static String next(final String prefix, final int length) {
        return prefix + UUID.randomUUID().toString().replace("-", "").substring(0, length);
    }
}
