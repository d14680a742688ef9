package io.github.jakubt4.satti.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static platform characteristics per {@link SatelliteType}. Seeded once, never mutated.
 */
public record SatelliteTypeProfile(
        String platform,
        String orbitType,
        int nominalAltitudeKm,
        int nominalSwathKm,
        int revisitHours,
        List<String> sensorModes,
        String defaultProductType,
        List<String> defaultBandsOrPolarization
) {

    private static final Map<SatelliteType, SatelliteTypeProfile> PROFILES;

    static {
        final var profiles = new EnumMap<SatelliteType, SatelliteTypeProfile>(SatelliteType.class);
        profiles.put(SatelliteType.EO_OPTICAL, new SatelliteTypeProfile(
                "Sun-synchronous LEO", "SSO", 500, 24, 24,
                List.of("NADIR", "OFF_NADIR"),
                "L1B_ORTHOREADY",
                List.of("R", "G", "B", "NIR")));
        profiles.put(SatelliteType.SAR, new SatelliteTypeProfile(
                "Low Earth Orbit radar", "LEO", 550, 30, 12,
                List.of("SPOTLIGHT", "STRIPMAP"),
                "GRD",
                List.of("VV", "VH")));
        PROFILES = Collections.unmodifiableMap(profiles);
    }

    public static SatelliteTypeProfile forType(final SatelliteType type) {
        return PROFILES.get(type);
    }

    public static Map<SatelliteType, SatelliteTypeProfile> all() {
        return PROFILES;
    }
}
