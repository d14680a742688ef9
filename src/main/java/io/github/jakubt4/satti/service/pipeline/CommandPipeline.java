package io.github.jakubt4.satti.service.pipeline;

import io.github.jakubt4.satti.config.PipelineProperties;
import io.github.jakubt4.satti.config.PipelineProperties.StageWindow;
import io.github.jakubt4.satti.model.Command;
import io.github.jakubt4.satti.model.CommandState;
import io.github.jakubt4.satti.model.ExternalMapSource;
import io.github.jakubt4.satti.model.GenerationMode;
import io.github.jakubt4.satti.model.SatelliteType;
import io.github.jakubt4.satti.service.imaging.ImageSynthesisService;
import io.github.jakubt4.satti.service.store.MissionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Random;

/**
 * Drives one uplink command from {@code QUEUED} to {@code DOWNLINK_READY} or {@code FAILED}.
 *
 * <p>Stages:
 * <ol>
 *   <li>admission: satellite, ground station and map source checks; a fault here fails the
 *       command immediately, without any simulated delay</li>
 *   <li>contact window wait, then {@code ACKED}</li>
 *   <li>command prep, then the uplink fault gate ({@code p × 0.6}), then {@code CAPTURING}</li>
 *   <li>capture, then the capture fault gate ({@code p × 0.4})</li>
 *   <li>image synthesis and metadata, then {@code DOWNLINK_READY}</li>
 * </ol>
 *
 * <p>The store lock is taken only to inspect preconditions or write a transition. Sleeps and
 * image I/O run unlocked so other commands stay readable while this one is in flight. Every
 * outcome, including synthesis errors, ends up as a state on the command; nothing is thrown
 * back to the executor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommandPipeline {

    static final double UPLINK_FAILURE_WEIGHT = 0.6;
    static final double CAPTURE_FAILURE_WEIGHT = 0.4;

    static final String MSG_QUEUED = "Queued for next contact window";
    static final String MSG_ACKED = "Uplink ACK received from satellite";
    static final String MSG_CAPTURING = "Satellite is capturing image";
    static final String MSG_DOWNLINK_READY = "Image downlinked and ready";
    static final String MSG_UPLINK_FAILED = "Uplink transmission failed";
    static final String MSG_CAPTURE_ABORTED = "Capture aborted due to onboard condition";
    static final String MSG_POST_CAPTURE_FAILED = "Post-capture pipeline failed: ";
    static final String MSG_INTERRUPTED = "Pipeline interrupted";

    private final MissionStore store;
    private final ImageSynthesisService imageSynthesisService;
    private final MetadataFactory metadataFactory;
    private final FaultInjector faultInjector;
    private final PipelineProperties properties;
    private final Random random;
    private final Clock clock;

    /**
     * Runs the whole lifecycle on the calling thread. Intended to be submitted once per command
     * to the pipeline executor.
     */
    public void run(final String commandId) {
        final var admission = admit(commandId);
        if (admission.isEmpty()) {
            return;
        }
        final var command = admission.get().command();
        try {
            execute(command, admission.get().satelliteType());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[PIPELINE] [{}] Interrupted before reaching a terminal state", commandId);
            fail(command, MSG_INTERRUPTED);
        }
    }

    private Optional<Admission> admit(final String commandId) {
        return store.withLock(() -> {
            final var command = store.commands().get(commandId);
            if (command == null) {
                log.warn("[PIPELINE] [{}] Unknown command, nothing to run", commandId);
                return Optional.empty();
            }

            final var satellite = store.satellites().get(command.getSatelliteId());
            final var fault = satellite == null
                    ? Optional.of("Satellite not found")
                    : satellite.isAvailable() ? preconditionFault(command) : Optional.of("Satellite is not available");

            if (fault.isPresent()) {
                command.transitionTo(CommandState.FAILED, fault.get(), now());
                log.warn("[PIPELINE] [{}] Rejected at admission: {}", commandId, fault.get());
                return Optional.empty();
            }

            command.transitionTo(CommandState.QUEUED, MSG_QUEUED, now());
            log.info("[PIPELINE] [{}] Queued on [{}] ({})", commandId, satellite.getName(), satellite.getType());
            return Optional.of(new Admission(command, satellite.getType()));
        });
    }

    // caller holds the store lock
    private Optional<String> preconditionFault(final Command command) {
        final var profile = command.getRequestProfile();
        if (profile.groundStationId() != null) {
            final var station = store.groundStations().get(profile.groundStationId());
            if (station == null) {
                return Optional.of("Ground station not found");
            }
            if (!station.isOperational()) {
                return Optional.of("Ground station is not operational");
            }
        }
        if (profile.generationMode() == GenerationMode.EXTERNAL) {
            final var source = profile.generation().externalMapSource();
            if (ExternalMapSource.parse(source).isEmpty()) {
                return Optional.of("Unsupported external map source: " + source);
            }
        }
        return Optional.empty();
    }

    private void execute(final Command command, final SatelliteType satelliteType) throws InterruptedException {
        final var commandId = command.getCommandId();

        pause(properties.contactWindow());
        transition(command, CommandState.ACKED, MSG_ACKED);

        pause(properties.commandPrep());
        if (faultInjector.shouldFail(command.getFailProbability(), UPLINK_FAILURE_WEIGHT)) {
            fail(command, MSG_UPLINK_FAILED);
            return;
        }
        transition(command, CommandState.CAPTURING, MSG_CAPTURING);

        pause(properties.capture());
        if (faultInjector.shouldFail(command.getFailProbability(), CAPTURE_FAILURE_WEIGHT)) {
            fail(command, MSG_CAPTURE_ABORTED);
            return;
        }

        try {
            final var imagePath = imageSynthesisService.renderAndStore(command, satelliteType);
            store.runLocked(() -> {
                final var metadata = metadataFactory.create(satelliteType, command);
                command.completeDownlink(imagePath, metadata.acquisition(), metadata.product(),
                        MSG_DOWNLINK_READY, now());
            });
            log.info("[PIPELINE] [{}] DOWNLINK_READY — {}", commandId, imagePath);
        } catch (final Exception e) {
            log.error("[PIPELINE] [{}] Post-capture failure: {}", commandId, e.getMessage());
            fail(command, MSG_POST_CAPTURE_FAILED + e.getMessage());
        }
    }

    private void transition(final Command command, final CommandState next, final String message) {
        store.runLocked(() -> command.transitionTo(next, message, now()));
        log.info("[PIPELINE] [{}] {} — {}", command.getCommandId(), next, message);
    }

    private void fail(final Command command, final String message) {
        store.runLocked(() -> command.transitionTo(CommandState.FAILED, message, now()));
        log.warn("[PIPELINE] [{}] FAILED — {}", command.getCommandId(), message);
    }

    private void pause(final StageWindow window) throws InterruptedException {
        final var delay = window.sample(random);
        if (!delay.isZero()) {
            Thread.sleep(delay.toMillis());
        }
    }

    private Instant now() {
        return Instant.now(clock);
    }

    private record Admission(Command command, SatelliteType satelliteType) {
    }
}
