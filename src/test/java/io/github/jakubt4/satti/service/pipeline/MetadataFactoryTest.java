package io.github.jakubt4.satti.service.pipeline;

import io.github.jakubt4.satti.model.AcquisitionMetadata;
import io.github.jakubt4.satti.model.CommandFixtures;
import io.github.jakubt4.satti.model.GenerationMode;
import io.github.jakubt4.satti.model.ProductMetadata;
import io.github.jakubt4.satti.model.SatelliteType;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataFactoryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:07Z");

    private final MetadataFactory factory =
            new MetadataFactory(new Random(21), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void opticalMetadataStaysWithinPlausibleRanges() {
        final var command = CommandFixtures.command("sat-1", 0.0, CommandFixtures.internalProfile());

        final var metadata = factory.create(SatelliteType.EO_OPTICAL, command);

        assertThat(metadata.acquisition()).isInstanceOf(AcquisitionMetadata.Optical.class);
        final var acquisition = (AcquisitionMetadata.Optical) metadata.acquisition();
        assertThat(acquisition.capturedAt()).isEqualTo(NOW);
        assertThat(acquisition.sensorMode()).isIn("NADIR", "OFF_NADIR");
        assertThat(acquisition.offNadirDeg()).isBetween(2.0, 28.0);
        assertThat(acquisition.sunElevationDeg()).isBetween(20.0, 65.0);
        assertThat(acquisition.cloudCoverPercent()).isEqualTo(command.getCloudPercent());
        assertThat(acquisition.groundTrack()).isIn("ASCENDING", "DESCENDING");
        assertThat(acquisition.aoiName()).isEqualTo("busan-port");
        assertThat(acquisition.generationMode()).isEqualTo(GenerationMode.INTERNAL);
        assertThat(hasAtMostTwoDecimals(acquisition.offNadirDeg())).isTrue();

        final var product = (ProductMetadata.Optical) metadata.product();
        assertThat(product.productType()).isEqualTo("L1B_ORTHOREADY");
        assertThat(product.bands()).containsExactly("R", "G", "B", "NIR");
        assertThat(product.gsdM()).isBetween(0.5, 1.5);
        assertThat(product.widthPx()).isEqualTo(command.getWidth());
        assertThat(product.bitDepth()).isEqualTo(8);
        assertThat(product.format()).isEqualTo("PNG");
    }

    @Test
    void sarMetadataUsesRadarProfile() {
        final var command = CommandFixtures.command("sat-2", 0.0, CommandFixtures.internalProfile());

        final var metadata = factory.create(SatelliteType.SAR, command);

        final var acquisition = (AcquisitionMetadata.Sar) metadata.acquisition();
        assertThat(acquisition.sensorMode()).isIn("SPOTLIGHT", "STRIPMAP");
        assertThat(acquisition.incidenceAngleDeg()).isBetween(20.0, 45.0);
        assertThat(acquisition.lookSide()).isIn("LEFT", "RIGHT");
        assertThat(acquisition.polarization()).isIn("VV", "VH");

        final var product = (ProductMetadata.Sar) metadata.product();
        assertThat(product.productType()).isEqualTo("GRD");
        assertThat(product.resolutionM()).isBetween(0.8, 3.0);
        assertThat(product.speckleFilter()).isIn("NONE", "LEE_3x3");
        assertThat(product.heightPx()).isEqualTo(command.getHeight());
    }

    private static boolean hasAtMostTwoDecimals(final double value) {
        return Math.abs(value * 100 - Math.round(value * 100)) < 1e-6;
    }
}
