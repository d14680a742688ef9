package io.github.jakubt4.satti.dto;

import io.github.jakubt4.satti.model.GroundStationStatus;

public record UpdateGroundStationRequest(String name, GroundStationStatus status, String location) {
}
