package io.github.jakubt4.satti.model;

import io.github.jakubt4.satti.model.RequestProfile.AoiCenter;

import java.time.Instant;
import java.util.List;

/**
 * Simulated acquisition parameters attached to a command once its image is downlinked.
 * The shape depends on the sensor type of the tasked satellite.
 */
public sealed interface AcquisitionMetadata {

    Instant capturedAt();

    String sensorMode();

    record Optical(
            Instant capturedAt,
            String sensorMode,
            double offNadirDeg,
            double sunElevationDeg,
            int cloudCoverPercent,
            String groundTrack,
            String aoiName,
            AoiCenter aoiCenter,
            List<Double> aoiBbox,
            GenerationMode generationMode
    ) implements AcquisitionMetadata {
    }

    record Sar(
            Instant capturedAt,
            String sensorMode,
            double incidenceAngleDeg,
            String lookSide,
            String passDirection,
            String polarization,
            String aoiName,
            AoiCenter aoiCenter,
            List<Double> aoiBbox,
            GenerationMode generationMode
    ) implements AcquisitionMetadata {
    }
}
