package io.github.jakubt4.satti.model;

public enum GroundStationType {
    FIXED,
    LAND_MOBILE,
    MARITIME,
    AIRBORNE
}
