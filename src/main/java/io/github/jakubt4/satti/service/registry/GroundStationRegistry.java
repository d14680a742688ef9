package io.github.jakubt4.satti.service.registry;

import io.github.jakubt4.satti.dto.CreateGroundStationRequest;
import io.github.jakubt4.satti.dto.DeletedResponse;
import io.github.jakubt4.satti.dto.GroundStationResponse;
import io.github.jakubt4.satti.dto.UpdateGroundStationRequest;
import io.github.jakubt4.satti.exception.InvalidRequestException;
import io.github.jakubt4.satti.exception.ResourceNotFoundException;
import io.github.jakubt4.satti.model.GroundStation;
import io.github.jakubt4.satti.model.GroundStationStatus;
import io.github.jakubt4.satti.model.GroundStationType;
import io.github.jakubt4.satti.service.store.Identifiers;
import io.github.jakubt4.satti.service.store.MissionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class GroundStationRegistry {

    static final int MAX_NAME_LENGTH = 120;
    static final int MAX_LOCATION_LENGTH = 120;

    private static final List<Preset> PRESETS = List.of(
            new Preset("Daejeon Mission Control Ground Station", GroundStationType.FIXED, "Daejeon"),
            new Preset("Jeju Maritime Satellite Ground Station", GroundStationType.MARITIME, "Jeju"),
            new Preset("Incheon Airborne Relay Ground Station", GroundStationType.AIRBORNE, "Incheon")
    );

    private final MissionStore store;

    public GroundStationResponse create(final CreateGroundStationRequest request) {
        requireName(request.name());
        requireLocation(request.location());
        if (request.type() == null) {
            throw new InvalidRequestException("type is required");
        }
        final var status = request.status() == null ? GroundStationStatus.OPERATIONAL : request.status();
        final var station = new GroundStation(
                Identifiers.groundStationId(), request.name(), request.type(), status, request.location());

        store.runLocked(() -> store.groundStations().put(station.getGroundStationId(), station));
        log.info("[REGISTRY] Ground station registered — id={}, name=[{}], type={}",
                station.getGroundStationId(), station.getName(), station.getType());
        return GroundStationResponse.of(station);
    }

    public List<GroundStationResponse> list() {
        return store.withLock(() -> store.groundStations().values().stream()
                .map(GroundStationResponse::of)
                .toList());
    }

    public GroundStationResponse update(final String groundStationId, final UpdateGroundStationRequest request) {
        if (request.name() != null) {
            requireName(request.name());
        }
        requireLocation(request.location());
        return store.withLock(() -> {
            final var station = store.groundStations().get(groundStationId);
            if (station == null) {
                throw new ResourceNotFoundException("Ground station not found");
            }
            if (request.name() != null) {
                station.setName(request.name());
            }
            if (request.status() != null) {
                station.setStatus(request.status());
            }
            if (request.location() != null) {
                station.setLocation(request.location());
            }
            return GroundStationResponse.of(station);
        });
    }

    public DeletedResponse delete(final String groundStationId) {
        final var removed = store.withLock(() -> store.groundStations().remove(groundStationId));
        if (removed == null) {
            throw new ResourceNotFoundException("Ground station not found");
        }
        log.info("[REGISTRY] Ground station removed — id={}, name=[{}]", groundStationId, removed.getName());
        return new DeletedResponse(groundStationId, removed.getName());
    }

    public List<String> seedDefaults() {
        final var seeded = store.withLock(() -> {
            final var ids = new ArrayList<String>();
            for (final var preset : PRESETS) {
                final var exists = store.groundStations().values().stream()
                        .anyMatch(station -> station.getName().equals(preset.name()));
                if (exists) {
                    continue;
                }
                final var station = new GroundStation(Identifiers.groundStationId(), preset.name(),
                        preset.type(), GroundStationStatus.OPERATIONAL, preset.location());
                store.groundStations().put(station.getGroundStationId(), station);
                ids.add(station.getGroundStationId());
            }
            return List.copyOf(ids);
        });
        log.info("[REGISTRY] Seeded {} mock ground stations", seeded.size());
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

    private static void requireLocation(final String location) {
        if (location != null && location.length() > MAX_LOCATION_LENGTH) {
            throw new InvalidRequestException("location must be at most " + MAX_LOCATION_LENGTH + " characters");
        }
    }

    private record Preset(String name, GroundStationType type, String location) {
    }
}
