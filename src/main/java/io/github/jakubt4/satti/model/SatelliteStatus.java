package io.github.jakubt4.satti.model;

public enum SatelliteStatus {
    AVAILABLE,
    MAINTENANCE
}
