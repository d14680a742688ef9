package io.github.jakubt4.satti.service.registry;

import io.github.jakubt4.satti.dto.CreateGroundStationRequest;
import io.github.jakubt4.satti.dto.GroundStationResponse;
import io.github.jakubt4.satti.dto.UpdateGroundStationRequest;
import io.github.jakubt4.satti.exception.ResourceNotFoundException;
import io.github.jakubt4.satti.model.GroundStationStatus;
import io.github.jakubt4.satti.model.GroundStationType;
import io.github.jakubt4.satti.service.store.MissionStore;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GroundStationRegistryTest {

    private final GroundStationRegistry registry = new GroundStationRegistry(new MissionStore());

    @Test
    void createDefaultsToOperational() {
        final var created = registry.create(
                new CreateGroundStationRequest("Busan Harbour", GroundStationType.MARITIME, null, "Busan"));

        assertThat(created.groundStationId()).startsWith("gnd-");
        assertThat(created.status()).isEqualTo(GroundStationStatus.OPERATIONAL);
    }

    @Test
    void updateMovesStationIntoMaintenance() {
        final var created = registry.create(
                new CreateGroundStationRequest("Busan Harbour", GroundStationType.MARITIME, null, "Busan"));

        final var updated = registry.update(created.groundStationId(),
                new UpdateGroundStationRequest(null, GroundStationStatus.MAINTENANCE, "Busan New Port"));

        assertThat(updated.status()).isEqualTo(GroundStationStatus.MAINTENANCE);
        assertThat(updated.location()).isEqualTo("Busan New Port");
        assertThat(updated.name()).isEqualTo("Busan Harbour");
    }

    @Test
    void seedsThreePresetsOnce() {
        assertThat(registry.seedDefaults()).hasSize(3);
        assertThat(registry.seedDefaults()).isEmpty();
        assertThat(registry.list()).extracting(GroundStationResponse::type)
                .containsExactly(GroundStationType.FIXED, GroundStationType.MARITIME, GroundStationType.AIRBORNE);
    }

    @Test
    void missingStationIsNotFound() {
        assertThatThrownBy(() -> registry.delete("gnd-nothere"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Ground station not found");
    }
}
