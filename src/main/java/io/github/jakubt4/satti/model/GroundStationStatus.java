package io.github.jakubt4.satti.model;

public enum GroundStationStatus {
    OPERATIONAL,
    MAINTENANCE
}
