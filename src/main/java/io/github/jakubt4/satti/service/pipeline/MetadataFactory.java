package io.github.jakubt4.satti.service.pipeline;

import io.github.jakubt4.satti.model.AcquisitionMetadata;
import io.github.jakubt4.satti.model.Command;
import io.github.jakubt4.satti.model.ProductMetadata;
import io.github.jakubt4.satti.model.SatelliteType;
import io.github.jakubt4.satti.model.SatelliteTypeProfile;
import io.github.jakubt4.satti.service.imaging.ImageSynthesisService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Random;

/**
 * Fabricates plausible acquisition and product metadata for a completed capture.
 * Every call draws fresh values; nothing is cached between reruns.
 */
@Component
@RequiredArgsConstructor
public class MetadataFactory {

    private static final List<String> PASS_DIRECTIONS = List.of("ASCENDING", "DESCENDING");
    private static final List<String> LOOK_SIDES = List.of("LEFT", "RIGHT");
    private static final List<String> SPECKLE_FILTERS = List.of("NONE", "LEE_3x3");
    private static final int OPTICAL_BIT_DEPTH = 8;

    private final Random random;
    private final Clock clock;

    public Metadata create(final SatelliteType type, final Command command) {
        final var profile = SatelliteTypeProfile.forType(type);
        final var capturedAt = Instant.now(clock);
        return switch (type) {
            case EO_OPTICAL -> optical(profile, command, capturedAt);
            case SAR -> sar(profile, command, capturedAt);
        };
    }

    private Metadata optical(final SatelliteTypeProfile profile, final Command command, final Instant capturedAt) {
        final var request = command.getRequestProfile();
        final var acquisition = new AcquisitionMetadata.Optical(
                capturedAt,
                pick(profile.sensorModes()),
                uniform(2.0, 28.0),
                uniform(20.0, 65.0),
                command.getCloudPercent(),
                pick(PASS_DIRECTIONS),
                command.getAoiName(),
                request.aoiCenter(),
                request.aoiBbox(),
                request.generationMode());
        final var product = new ProductMetadata.Optical(
                profile.defaultProductType(),
                profile.defaultBandsOrPolarization(),
                uniform(0.5, 1.5),
                command.getWidth(),
                command.getHeight(),
                OPTICAL_BIT_DEPTH,
                ImageSynthesisService.FORMAT,
                request.generation());
        return new Metadata(acquisition, product);
    }

    private Metadata sar(final SatelliteTypeProfile profile, final Command command, final Instant capturedAt) {
        final var request = command.getRequestProfile();
        final var acquisition = new AcquisitionMetadata.Sar(
                capturedAt,
                pick(profile.sensorModes()),
                uniform(20.0, 45.0),
                pick(LOOK_SIDES),
                pick(PASS_DIRECTIONS),
                pick(profile.defaultBandsOrPolarization()),
                command.getAoiName(),
                request.aoiCenter(),
                request.aoiBbox(),
                request.generationMode());
        final var product = new ProductMetadata.Sar(
                profile.defaultProductType(),
                uniform(0.8, 3.0),
                command.getWidth(),
                command.getHeight(),
                ImageSynthesisService.FORMAT,
                pick(SPECKLE_FILTERS),
                request.generation());
        return new Metadata(acquisition, product);
    }

    // rounded to 2 decimals
    private double uniform(final double min, final double max) {
        final var value = min + random.nextDouble() * (max - min);
        return Math.round(value * 100.0) / 100.0;
    }

    private <T> T pick(final List<T> options) {
        return options.get(random.nextInt(options.size()));
    }

    public record Metadata(AcquisitionMetadata acquisition, ProductMetadata product) {
    }
}
