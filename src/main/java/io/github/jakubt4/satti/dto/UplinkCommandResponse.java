package io.github.jakubt4.satti.dto;

import io.github.jakubt4.satti.model.CommandState;
import io.github.jakubt4.satti.model.GroundStationType;
import io.github.jakubt4.satti.model.SatelliteType;

import java.time.Instant;

/**
 * Immediate acknowledgement of a submission; the pipeline has not run yet.
 *
 * @param satelliteType {@code null} when the satellite is unknown (the pipeline will fail the command)
 */
public record UplinkCommandResponse(
        String commandId,
        CommandState state,
        String satelliteId,
        SatelliteType satelliteType,
        String groundStationId,
        String groundStationName,
        GroundStationType groundStationType,
        String missionName,
        String aoiName,
        Instant createdAt
) {
}
