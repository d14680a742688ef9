package io.github.jakubt4.satti.dto;

import io.github.jakubt4.satti.model.GroundStation;
import io.github.jakubt4.satti.model.GroundStationStatus;
import io.github.jakubt4.satti.model.GroundStationType;

public record GroundStationResponse(
        String groundStationId,
        String name,
        GroundStationType type,
        GroundStationStatus status,
        String location
) {

    public static GroundStationResponse of(final GroundStation station) {
        return new GroundStationResponse(
                station.getGroundStationId(),
                station.getName(),
                station.getType(),
                station.getStatus(),
                station.getLocation());
    }
}
