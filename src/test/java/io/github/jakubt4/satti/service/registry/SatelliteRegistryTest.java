package io.github.jakubt4.satti.service.registry;

import io.github.jakubt4.satti.dto.CreateSatelliteRequest;
import io.github.jakubt4.satti.dto.UpdateSatelliteRequest;
import io.github.jakubt4.satti.exception.InvalidRequestException;
import io.github.jakubt4.satti.exception.ResourceNotFoundException;
import io.github.jakubt4.satti.model.SatelliteStatus;
import io.github.jakubt4.satti.model.SatelliteType;
import io.github.jakubt4.satti.service.store.MissionStore;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SatelliteRegistryTest {

    private final SatelliteRegistry registry = new SatelliteRegistry(new MissionStore());

    @Test
    void createDefaultsToAvailableAndAttachesTypeProfile() {
        final var created = registry.create(new CreateSatelliteRequest("KOMPSAT-3", SatelliteType.EO_OPTICAL, null));

        assertThat(created.satelliteId()).startsWith("sat-");
        assertThat(created.status()).isEqualTo(SatelliteStatus.AVAILABLE);
        assertThat(created.profile().defaultProductType()).isEqualTo("L1B_ORTHOREADY");
        assertThat(registry.list()).hasSize(1);
    }

    @Test
    void createValidatesNameAndType() {
        assertThatThrownBy(() -> registry.create(new CreateSatelliteRequest(" ", SatelliteType.SAR, null)))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> registry.create(new CreateSatelliteRequest("x".repeat(101), SatelliteType.SAR, null)))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> registry.create(new CreateSatelliteRequest("KOMPSAT-5", null, null)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("type is required");
    }

    @Test
    void updateChangesOnlyProvidedFields() {
        final var created = registry.create(new CreateSatelliteRequest("KOMPSAT-5", SatelliteType.SAR, null));

        final var updated = registry.update(created.satelliteId(),
                new UpdateSatelliteRequest(null, SatelliteStatus.MAINTENANCE));

        assertThat(updated.name()).isEqualTo("KOMPSAT-5");
        assertThat(updated.status()).isEqualTo(SatelliteStatus.MAINTENANCE);
    }

    @Test
    void missingSatelliteIsNotFound() {
        assertThatThrownBy(() -> registry.update("sat-nothere", new UpdateSatelliteRequest("x", null)))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Satellite not found");
        assertThatThrownBy(() -> registry.delete("sat-nothere"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void seedingSkipsExistingNames() {
        registry.create(new CreateSatelliteRequest("KOMPSAT-3 (Arirang-3)", SatelliteType.EO_OPTICAL, null));

        final var first = registry.seedDefaults();
        final var second = registry.seedDefaults();

        assertThat(first).hasSize(6);
        assertThat(second).isEmpty();
        assertThat(registry.list()).hasSize(7);
    }

    @Test
    void deleteReturnsRemovedName() {
        final var created = registry.create(new CreateSatelliteRequest("CAS500-1", SatelliteType.EO_OPTICAL, null));

        final var deleted = registry.delete(created.satelliteId());

        assertThat(deleted.deletedName()).isEqualTo("CAS500-1");
        assertThat(registry.list()).isEmpty();
    }
}
