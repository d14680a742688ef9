package io.github.jakubt4.satti.dto;

import io.github.jakubt4.satti.model.GroundStationStatus;
import io.github.jakubt4.satti.model.GroundStationType;

/**
 * @param status defaults to {@code OPERATIONAL} when omitted
 */
public record CreateGroundStationRequest(
        String name,
        GroundStationType type,
        GroundStationStatus status,
        String location
) {
}
