package io.github.jakubt4.satti.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * An imaging request travelling through the uplink lifecycle.
 *
 * <p>The request parameters are final and may be read from any thread. Lifecycle state,
 * message, image reference and metadata are mutable and must only be touched while
 * holding the {@link io.github.jakubt4.satti.service.store.MissionStore} lock.
 */
@Getter
public class Command {

    private final String commandId;
    private final String satelliteId;
    private final String missionName;
    private final String aoiName;
    private final int width;
    private final int height;
    private final int cloudPercent;
    private final double failProbability;
    private final RequestProfile requestProfile;
    private final Instant createdAt;

    private CommandState state;
    private String message;
    private Path imagePath;
    private AcquisitionMetadata acquisitionMetadata;
    private ProductMetadata productMetadata;
    private Instant updatedAt;

    @Getter(AccessLevel.NONE)
    private final List<StateChange> history = new ArrayList<>();

    @Builder
    public Command(final String commandId,
                   final String satelliteId,
                   final String missionName,
                   final String aoiName,
                   final int width,
                   final int height,
                   final int cloudPercent,
                   final double failProbability,
                   final RequestProfile requestProfile,
                   final Instant createdAt) {
        this.commandId = commandId;
        this.satelliteId = satelliteId;
        this.missionName = missionName;
        this.aoiName = aoiName;
        this.width = width;
        this.height = height;
        this.cloudPercent = cloudPercent;
        this.failProbability = failProbability;
        this.requestProfile = requestProfile;
        this.createdAt = createdAt;
        this.state = CommandState.QUEUED;
        this.updatedAt = createdAt;
        this.history.add(new StateChange(CommandState.QUEUED, null, createdAt));
    }

    /**
     * Moves the command along the lifecycle graph.
     *
     * @throws IllegalStateException if {@code next} is not a successor of the current state
     */
    public void transitionTo(final CommandState next, final String message, final Instant at) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                    String.format("Invalid command transition for %s: %s -> %s", commandId, state, next));
        }
        this.state = next;
        this.message = message;
        this.updatedAt = at;
        history.add(new StateChange(next, message, at));
    }

    /**
     * Final success transition: records the artifact and its metadata together with {@code DOWNLINK_READY}.
     */
    public void completeDownlink(final Path imagePath,
                                 final AcquisitionMetadata acquisitionMetadata,
                                 final ProductMetadata productMetadata,
                                 final String message,
                                 final Instant at) {
        transitionTo(CommandState.DOWNLINK_READY, message, at);
        this.imagePath = imagePath;
        this.acquisitionMetadata = acquisitionMetadata;
        this.productMetadata = productMetadata;
    }

    /**
     * Operator rerun: only valid from {@code FAILED}. Drops any previous artifact reference and metadata.
     */
    public void resetForRerun(final String message, final Instant at) {
        transitionTo(CommandState.QUEUED, message, at);
        this.imagePath = null;
        this.acquisitionMetadata = null;
        this.productMetadata = null;
    }

    /**
     * Forgets the artifact reference after its file was removed. Lifecycle state is left untouched.
     */
    public void clearImage(final String message, final Instant at) {
        this.imagePath = null;
        this.message = message;
        this.updatedAt = at;
    }

    public List<StateChange> getHistory() {
        return List.copyOf(history);
    }
}
