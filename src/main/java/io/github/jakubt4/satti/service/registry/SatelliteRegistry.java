package io.github.jakubt4.satti.service.registry;

import io.github.jakubt4.satti.dto.CreateSatelliteRequest;
import io.github.jakubt4.satti.dto.DeletedResponse;
import io.github.jakubt4.satti.dto.SatelliteResponse;
import io.github.jakubt4.satti.dto.UpdateSatelliteRequest;
import io.github.jakubt4.satti.exception.InvalidRequestException;
import io.github.jakubt4.satti.exception.ResourceNotFoundException;
import io.github.jakubt4.satti.model.Satellite;
import io.github.jakubt4.satti.model.SatelliteStatus;
import io.github.jakubt4.satti.model.SatelliteType;
import io.github.jakubt4.satti.service.store.Identifiers;
import io.github.jakubt4.satti.service.store.MissionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * CRUD over the satellite fleet held in the {@link MissionStore}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SatelliteRegistry {

    static final int MAX_NAME_LENGTH = 100;

    private static final List<Preset> PRESETS = List.of(
            new Preset("KOMPSAT-3 (Arirang-3)", SatelliteType.EO_OPTICAL),
            new Preset("KOMPSAT-3A (Arirang-3A)", SatelliteType.EO_OPTICAL),
            new Preset("CAS500-1 (NextSat-1)", SatelliteType.EO_OPTICAL),
            new Preset("Cheollian-2B (GEO-KOMPSAT-2B)", SatelliteType.EO_OPTICAL),
            new Preset("KOMPSAT-5 (Arirang-5, SAR)", SatelliteType.SAR),
            new Preset("KOMPSAT-6 (Arirang-6, SAR)", SatelliteType.SAR),
            new Preset("KOMPSAT-Next-5 (C-band SAR)", SatelliteType.SAR)
    );

    private final MissionStore store;

    public SatelliteResponse create(final CreateSatelliteRequest request) {
        requireName(request.name());
        if (request.type() == null) {
            throw new InvalidRequestException("type is required");
        }
        final var status = request.status() == null ? SatelliteStatus.AVAILABLE : request.status();
        final var satellite = new Satellite(Identifiers.satelliteId(), request.name(), request.type(), status);

        store.runLocked(() -> store.satellites().put(satellite.getSatelliteId(), satellite));
        log.info("[REGISTRY] Satellite registered — id={}, name=[{}], type={}",
                satellite.getSatelliteId(), satellite.getName(), satellite.getType());
        return SatelliteResponse.of(satellite);
    }

    public List<SatelliteResponse> list() {
        return store.withLock(() -> store.satellites().values().stream()
                .map(SatelliteResponse::of)
                .toList());
    }

    public SatelliteResponse update(final String satelliteId, final UpdateSatelliteRequest request) {
        if (request.name() != null) {
            requireName(request.name());
        }
        return store.withLock(() -> {
            final var satellite = store.satellites().get(satelliteId);
            if (satellite == null) {
                throw new ResourceNotFoundException("Satellite not found");
            }
            if (request.name() != null) {
                satellite.setName(request.name());
            }
            if (request.status() != null) {
                satellite.setStatus(request.status());
            }
            return SatelliteResponse.of(satellite);
        });
    }

    public DeletedResponse delete(final String satelliteId) {
        final var removed = store.withLock(() -> store.satellites().remove(satelliteId));
        if (removed == null) {
            throw new ResourceNotFoundException("Satellite not found");
        }
        log.info("[REGISTRY] Satellite removed — id={}, name=[{}]", satelliteId, removed.getName());
        return new DeletedResponse(satelliteId, removed.getName());
    }

    /**
     * Registers the Korean fleet presets whose names are not yet taken.
     *
     * @return identifiers of the newly created satellites
     */
    public List<String> seedDefaults() {
        final var seeded = store.withLock(() -> {
            final var ids = new ArrayList<String>();
            for (final var preset : PRESETS) {
                final var exists = store.satellites().values().stream()
                        .anyMatch(satellite -> satellite.getName().equals(preset.name()));
                if (exists) {
                    continue;
                }
                final var satellite = new Satellite(
                        Identifiers.satelliteId(), preset.name(), preset.type(), SatelliteStatus.AVAILABLE);
                store.satellites().put(satellite.getSatelliteId(), satellite);
                ids.add(satellite.getSatelliteId());
            }
            return List.copyOf(ids);
        });
        log.info("[REGISTRY] Seeded {} mock satellites", seeded.size());
        return seeded;
    }

    private static void requireName(final String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidRequestException("name is required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new InvalidRequestException("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
    }

    private record Preset(String name, SatelliteType type) {
    }
}
