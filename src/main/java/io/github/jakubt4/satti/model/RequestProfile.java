package io.github.jakubt4.satti.model;

import java.util.List;
import java.util.Optional;

/**
 * Everything the requester asked for beyond the basic raster parameters, captured
 * verbatim when the command is submitted and never changed afterwards.
 *
 * @param groundStationId requested ground station, {@code null} when none was named
 * @param groundStation   snapshot of that station at submission time, {@code null} if it did not exist
 * @param aoiCenter       explicit AOI center, may be {@code null}
 * @param aoiBbox         {@code [minLon, minLat, maxLon, maxLat]}, may be {@code null}
 */
public record RequestProfile(
        String groundStationId,
        GroundStationSnapshot groundStation,
        AoiCenter aoiCenter,
        List<Double> aoiBbox,
        String windowOpenUtc,
        String windowCloseUtc,
        TaskPriority priority,
        EoConstraints eoConstraints,
        SarConstraints sarConstraints,
        Delivery delivery,
        Generation generation
) {

    public RequestProfile {
        aoiBbox = aoiBbox == null ? null : List.copyOf(aoiBbox);
    }

    /**
     * Center of the AOI: the explicit center when given, otherwise the midpoint of the bounding box.
     */
    public Optional<AoiCenter> resolveCenter() {
        if (aoiCenter != null) {
            return Optional.of(aoiCenter);
        }
        if (aoiBbox != null && aoiBbox.size() == 4) {
            final var minLon = aoiBbox.get(0);
            final var minLat = aoiBbox.get(1);
            final var maxLon = aoiBbox.get(2);
            final var maxLat = aoiBbox.get(3);
            return Optional.of(new AoiCenter((minLat + maxLat) / 2.0, (minLon + maxLon) / 2.0));
        }
        return Optional.empty();
    }

    public GenerationMode generationMode() {
        return generation == null ? GenerationMode.INTERNAL : generation.mode();
    }

    public record AoiCenter(double lat, double lon) {
    }

    public record GroundStationSnapshot(
            String groundStationId,
            String name,
            GroundStationType type,
            GroundStationStatus status,
            String location
    ) {

        public static GroundStationSnapshot of(final GroundStation station) {
            return new GroundStationSnapshot(
                    station.getGroundStationId(),
                    station.getName(),
                    station.getType(),
                    station.getStatus(),
                    station.getLocation());
        }
    }

    public record EoConstraints(
            Integer maxCloudCoverPercent,
            Double maxOffNadirDeg,
            Double minSunElevationDeg
    ) {
    }

    public record SarConstraints(
            Double incidenceMinDeg,
            Double incidenceMaxDeg,
            LookSide lookSide,
            PassDirection passDirection,
            String polarization
    ) {
    }

    public record Delivery(DeliveryMethod method, String path) {
    }

    /**
     * @param externalMapSource tile provider name as requested; validated when the command runs
     * @param externalMapZoom   slippy-map zoom level, 1..19
     */
    public record Generation(GenerationMode mode, String externalMapSource, int externalMapZoom) {
    }
}
