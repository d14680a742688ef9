package io.github.jakubt4.satti.dto;

import io.github.jakubt4.satti.model.Satellite;
import io.github.jakubt4.satti.model.SatelliteStatus;
import io.github.jakubt4.satti.model.SatelliteType;
import io.github.jakubt4.satti.model.SatelliteTypeProfile;

public record SatelliteResponse(
        String satelliteId,
        String name,
        SatelliteType type,
        SatelliteStatus status,
        SatelliteTypeProfile profile
) {

    public static SatelliteResponse of(final Satellite satellite) {
        return new SatelliteResponse(
                satellite.getSatelliteId(),
                satellite.getName(),
                satellite.getType(),
                satellite.getStatus(),
                SatelliteTypeProfile.forType(satellite.getType()));
    }
}
