package io.github.jakubt4.satti.model;

import io.github.jakubt4.satti.model.RequestProfile.AoiCenter;
import io.github.jakubt4.satti.service.store.Identifiers;

import java.time.Instant;

public final class CommandFixtures {

    public static final Instant CREATED_AT = Instant.parse("2026-03-01T10:00:00Z");

    private CommandFixtures() {
    }

    public static RequestProfile internalProfile() {
        return profile(GenerationMode.INTERNAL, null, "OSM", null);
    }

    public static RequestProfile externalProfile(final AoiCenter center, final String source) {
        return profile(GenerationMode.EXTERNAL, center, source, null);
    }

    public static RequestProfile profile(final GenerationMode mode,
                                         final AoiCenter center,
                                         final String source,
                                         final String groundStationId) {
        return new RequestProfile(
                groundStationId,
                null,
                center,
                null,
                null,
                null,
                TaskPriority.COMMERCIAL,
                new RequestProfile.EoConstraints(null, null, null),
                new RequestProfile.SarConstraints(null, null, LookSide.ANY, PassDirection.ANY, null),
                new RequestProfile.Delivery(DeliveryMethod.DOWNLOAD, null),
                new RequestProfile.Generation(mode, source, 12));
    }

    public static Command command(final String satelliteId, final double failProbability, final RequestProfile profile) {
        return Command.builder()
                .commandId(Identifiers.commandId())
                .satelliteId(satelliteId)
                .missionName("harbour-survey")
                .aoiName("busan-port")
                .width(160)
                .height(128)
                .cloudPercent(20)
                .failProbability(failProbability)
                .requestProfile(profile)
                .createdAt(CREATED_AT)
                .build();
    }
}
