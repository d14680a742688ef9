package io.github.jakubt4.satti.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;

/**
 * Registry entry for a simulated spacecraft. The sensor type is fixed at creation;
 * name and status may be patched by operators.
 */
@Getter
@AllArgsConstructor
public class Satellite {

    private final String satelliteId;
    @Setter
    private String name;
    private final SatelliteType type;
    @Setter
    private SatelliteStatus status;

    public boolean isAvailable() {
        return status == SatelliteStatus.AVAILABLE;
    }
}
