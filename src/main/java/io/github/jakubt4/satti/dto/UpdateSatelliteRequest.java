package io.github.jakubt4.satti.dto;

import io.github.jakubt4.satti.model.SatelliteStatus;

/**
 * Partial update; {@code null} fields are left unchanged.
 */
public record UpdateSatelliteRequest(String name, SatelliteStatus status) {
}
