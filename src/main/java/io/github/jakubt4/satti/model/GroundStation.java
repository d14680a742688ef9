package io.github.jakubt4.satti.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@AllArgsConstructor
public class GroundStation {

    private final String groundStationId;
    private String name;
    private final GroundStationType type;
    private GroundStationStatus status;
    private String location;

    public boolean isOperational() {
        return status == GroundStationStatus.OPERATIONAL;
    }
}
