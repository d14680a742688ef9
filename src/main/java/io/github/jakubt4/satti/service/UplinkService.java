package io.github.jakubt4.satti.service;

import io.github.jakubt4.satti.dto.ClearImagesResponse;
import io.github.jakubt4.satti.dto.CommandStatusResponse;
import io.github.jakubt4.satti.dto.SaveLocalResponse;
import io.github.jakubt4.satti.dto.UplinkCommandRequest;
import io.github.jakubt4.satti.dto.UplinkCommandResponse;
import io.github.jakubt4.satti.exception.CommandConflictException;
import io.github.jakubt4.satti.exception.ResourceNotFoundException;
import io.github.jakubt4.satti.exception.SimulatorException;
import io.github.jakubt4.satti.model.AcquisitionMetadata;
import io.github.jakubt4.satti.model.Command;
import io.github.jakubt4.satti.model.CommandState;
import io.github.jakubt4.satti.model.ProductMetadata;
import io.github.jakubt4.satti.model.RequestProfile;
import io.github.jakubt4.satti.model.RequestProfile.AoiCenter;
import io.github.jakubt4.satti.model.RequestProfile.GroundStationSnapshot;
import io.github.jakubt4.satti.model.SatelliteType;
import io.github.jakubt4.satti.model.StateChange;
import io.github.jakubt4.satti.service.imaging.ImageSynthesisService;
import io.github.jakubt4.satti.service.pipeline.CommandPipeline;
import io.github.jakubt4.satti.service.store.Identifiers;
import io.github.jakubt4.satti.service.store.MissionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for uplink commands: submission, status queries, rerun, downloads and image cleanup.
 *
 * <p>Submission and rerun return as soon as the command is stored in {@code QUEUED}; the
 * lifecycle itself runs as one task per command on the pipeline executor and reports back only
 * through the {@link MissionStore}. File system work happens outside the store lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UplinkService {

    static final String DOWNLOAD_PATH = "/downloads/";
    private static final Set<String> IMAGE_EXTENSIONS = Set.of(".png", ".jpg", ".jpeg", ".webp");

    private final MissionStore store;
    private final CommandPipeline pipeline;
    private final ExecutorService pipelineExecutor;
    private final ImageSynthesisService imageSynthesisService;
    private final UplinkRequestValidator validator;
    private final Clock clock;

    public UplinkCommandResponse submit(final UplinkCommandRequest request) {
        validator.validate(request);

        final var accepted = store.withLock(() -> {
            final var satellite = store.satellites().get(request.satelliteId());
            GroundStationSnapshot station = null;
            if (request.groundStationId() != null) {
                final var registered = store.groundStations().get(request.groundStationId());
                station = registered == null ? null : GroundStationSnapshot.of(registered);
            }

            final var command = Command.builder()
                    .commandId(Identifiers.commandId())
                    .satelliteId(request.satelliteId())
                    .missionName(request.missionName())
                    .aoiName(request.aoiName())
                    .width(request.width())
                    .height(request.height())
                    .cloudPercent(request.cloudPercent())
                    .failProbability(request.failProbability())
                    .requestProfile(toProfile(request, station))
                    .createdAt(now())
                    .build();
            store.commands().put(command.getCommandId(), command);

            return new UplinkCommandResponse(
                    command.getCommandId(),
                    command.getState(),
                    command.getSatelliteId(),
                    satellite == null ? null : satellite.getType(),
                    station == null ? null : station.groundStationId(),
                    station == null ? null : station.name(),
                    station == null ? null : station.type(),
                    command.getMissionName(),
                    command.getAoiName(),
                    command.getCreatedAt());
        });

        log.info("[UPLINK] Command [{}] accepted — satellite={}, mission=[{}], p(fail)={}",
                accepted.commandId(), accepted.satelliteId(), accepted.missionName(), request.failProbability());
        dispatch(accepted.commandId());
        return accepted;
    }

    public List<CommandStatusResponse> listStatus() {
        final var snapshots = store.withLock(() -> store.commands().values().stream()
                .map(this::snapshot)
                .toList());
        return snapshots.stream().map(UplinkService::toResponse).toList();
    }

    public CommandStatusResponse getStatus(final String commandId) {
        return toResponse(store.withLock(() -> snapshot(requireCommand(commandId))));
    }

    /**
     * Resets a {@code FAILED} command to {@code QUEUED} and runs the pipeline again from scratch.
     *
     * @throws CommandConflictException when the command is in flight or already succeeded
     */
    public CommandStatusResponse rerun(final String commandId) {
        final var previousImage = store.withLock(() -> {
            final var command = requireCommand(commandId);
            if (command.getState().isInFlight()) {
                throw new CommandConflictException("Command is already in progress");
            }
            if (command.getState() != CommandState.FAILED) {
                throw new CommandConflictException("Only FAILED commands can be rerun");
            }
            final var image = command.getImagePath();
            command.resetForRerun("Re-run requested by operator", now());
            return image;
        });

        if (previousImage != null) {
            deleteQuietly(previousImage);
        }
        log.info("[UPLINK] Command [{}] re-queued by operator", commandId);
        dispatch(commandId);
        return getStatus(commandId);
    }

    /**
     * Reads the downlinked PNG.
     *
     * @throws CommandConflictException  if the command has not reached {@code DOWNLINK_READY}
     * @throws ResourceNotFoundException if the command or its file does not exist
     */
    public byte[] download(final String commandId) {
        final var imagePath = readyImage(commandId);
        try {
            return Files.readAllBytes(imagePath);
        } catch (final NoSuchFileException e) {
            throw new ResourceNotFoundException("Image file not found");
        } catch (final IOException e) {
            throw new SimulatorException("Failed to read image for " + commandId + ": " + e.getMessage(), e);
        }
    }

    public SaveLocalResponse saveLocal(final String commandId) {
        final var resolved = readyImage(commandId).toAbsolutePath().normalize();
        try {
            return new SaveLocalResponse(commandId, resolved.toString(), Files.size(resolved),
                    "Image is saved in local data/images directory");
        } catch (final NoSuchFileException e) {
            throw new ResourceNotFoundException("Image file not found");
        } catch (final IOException e) {
            throw new SimulatorException("Failed to stat image for " + commandId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Deletes every generated image file and drops the matching command references.
     * Lifecycle states are not touched.
     */
    public ClearImagesResponse clearImages() {
        var deleted = 0;
        final var directory = imageSynthesisService.imageDirectory();
        if (Files.isDirectory(directory)) {
            try (var files = Files.list(directory)) {
                for (final var file : files.filter(UplinkService::isImageFile).toList()) {
                    if (Files.deleteIfExists(file)) {
                        deleted++;
                    }
                }
            } catch (final IOException e) {
                throw new SimulatorException("Failed to clear image directory: " + e.getMessage(), e);
            }
        }

        final var cleared = store.withLock(() -> {
            var count = 0;
            for (final var command : store.commands().values()) {
                if (command.getImagePath() != null) {
                    command.clearImage("Image cleared by operator", now());
                    count++;
                }
            }
            return count;
        });

        log.info("[UPLINK] Cleared {} image files, {} command references", deleted, cleared);
        return new ClearImagesResponse(deleted, cleared, "All generated sample images were cleared");
    }

    private void dispatch(final String commandId) {
        pipelineExecutor.execute(() -> pipeline.run(commandId));
    }

    private Path readyImage(final String commandId) {
        return store.withLock(() -> {
            final var command = requireCommand(commandId);
            if (command.getState() != CommandState.DOWNLINK_READY || command.getImagePath() == null) {
                throw new CommandConflictException("Image is not ready");
            }
            return command.getImagePath();
        });
    }

    // caller holds the store lock
    private Command requireCommand(final String commandId) {
        final var command = store.commands().get(commandId);
        if (command == null) {
            throw new ResourceNotFoundException("Command not found");
        }
        return command;
    }

    // caller holds the store lock
    private Snapshot snapshot(final Command command) {
        final var satellite = store.satellites().get(command.getSatelliteId());
        return new Snapshot(command, satellite == null ? null : satellite.getType(),
                command.getState(), command.getMessage(), command.getUpdatedAt(), command.getImagePath(),
                command.getAcquisitionMetadata(), command.getProductMetadata(), command.getHistory());
    }

    private static CommandStatusResponse toResponse(final Snapshot snapshot) {
        final var command = snapshot.command();
        final var station = command.getRequestProfile().groundStation();
        final var downloadable = snapshot.state() == CommandState.DOWNLINK_READY
                && snapshot.imagePath() != null
                && Files.exists(snapshot.imagePath());

        return new CommandStatusResponse(
                command.getCommandId(),
                command.getSatelliteId(),
                snapshot.satelliteType(),
                station == null ? command.getRequestProfile().groundStationId() : station.groundStationId(),
                station == null ? null : station.name(),
                station == null ? null : station.type(),
                command.getMissionName(),
                command.getAoiName(),
                command.getWidth(),
                command.getHeight(),
                command.getCloudPercent(),
                command.getFailProbability(),
                snapshot.state(),
                snapshot.message(),
                command.getCreatedAt(),
                snapshot.updatedAt(),
                downloadable ? DOWNLOAD_PATH + command.getCommandId() : null,
                command.getRequestProfile(),
                snapshot.acquisitionMetadata(),
                snapshot.productMetadata(),
                snapshot.history());
    }

    private static RequestProfile toProfile(final UplinkCommandRequest request, final GroundStationSnapshot station) {
        return new RequestProfile(
                request.groundStationId(),
                station,
                request.hasCenter() ? new AoiCenter(request.aoiCenterLat(), request.aoiCenterLon()) : null,
                request.aoiBbox(),
                request.windowOpenUtc(),
                request.windowCloseUtc(),
                request.priority(),
                new RequestProfile.EoConstraints(
                        request.maxCloudCoverPercent(),
                        request.maxOffNadirDeg(),
                        request.minSunElevationDeg()),
                new RequestProfile.SarConstraints(
                        request.incidenceMinDeg(),
                        request.incidenceMaxDeg(),
                        request.lookSide(),
                        request.passDirection(),
                        request.polarization()),
                new RequestProfile.Delivery(request.deliveryMethod(), request.deliveryPath()),
                new RequestProfile.Generation(
                        request.generationMode(),
                        request.externalMapSource(),
                        request.externalMapZoom()));
    }

    private static boolean isImageFile(final Path file) {
        final var name = file.getFileName().toString().toLowerCase();
        final var dot = name.lastIndexOf('.');
        return Files.isRegularFile(file) && dot >= 0 && IMAGE_EXTENSIONS.contains(name.substring(dot));
    }

    private static void deleteQuietly(final Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (final IOException e) {
            log.warn("[UPLINK] Could not delete previous image {}: {}", file, e.getMessage());
        }
    }

    private Instant now() {
        return Instant.now(clock);
    }

    /**
     * Mutable command fields copied under the lock; immutable fields are read from the command directly.
     */
    private record Snapshot(
            Command command,
            SatelliteType satelliteType,
            CommandState state,
            String message,
            Instant updatedAt,
            Path imagePath,
            AcquisitionMetadata acquisitionMetadata,
            ProductMetadata productMetadata,
            List<StateChange> history
    ) {
    }
}
