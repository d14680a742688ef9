package io.github.jakubt4.satti.dto;

import io.github.jakubt4.satti.model.AcquisitionMetadata;
import io.github.jakubt4.satti.model.CommandState;
import io.github.jakubt4.satti.model.GroundStationType;
import io.github.jakubt4.satti.model.ProductMetadata;
import io.github.jakubt4.satti.model.RequestProfile;
import io.github.jakubt4.satti.model.SatelliteType;
import io.github.jakubt4.satti.model.StateChange;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a command.
 *
 * @param downloadUrl set only when the image is ready and its file still exists
 */
public record CommandStatusResponse(
        String commandId,
        String satelliteId,
        SatelliteType satelliteType,
        String groundStationId,
        String groundStationName,
        GroundStationType groundStationType,
        String missionName,
        String aoiName,
        int width,
        int height,
        int cloudPercent,
        double failProbability,
        CommandState state,
        String message,
        Instant createdAt,
        Instant updatedAt,
        String downloadUrl,
        RequestProfile requestProfile,
        AcquisitionMetadata acquisitionMetadata,
        ProductMetadata productMetadata,
        List<StateChange> history
) {
}
