package io.github.jakubt4.satti.service.imaging;

import io.github.jakubt4.satti.model.GenerationMode;
import io.github.jakubt4.satti.model.SatelliteType;

/**
 * The three ways a downlinked image can be produced. Chosen once per command.
 */
public enum ImageStrategy {
    OPTICAL,
    SAR,
    EXTERNAL_MAP;

    /**
     * {@code EXTERNAL} generation always wins over the sensor type; otherwise the sensor decides.
     */
    public static ImageStrategy select(final GenerationMode mode, final SatelliteType satelliteType) {
        if (mode == GenerationMode.EXTERNAL) {
            return EXTERNAL_MAP;
        }
        return switch (satelliteType) {
            case EO_OPTICAL -> OPTICAL;
            case SAR -> SAR;
        };
    }
}
