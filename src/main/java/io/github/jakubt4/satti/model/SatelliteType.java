package io.github.jakubt4.satti.model;

public enum SatelliteType {
    EO_OPTICAL,
    SAR
}
