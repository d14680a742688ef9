package io.github.jakubt4.satti.dto;

import io.github.jakubt4.satti.model.SatelliteStatus;
import io.github.jakubt4.satti.model.SatelliteType;

/**
 * @param status defaults to {@code AVAILABLE} when omitted
 */
public record CreateSatelliteRequest(String name, SatelliteType type, SatelliteStatus status) {
}
