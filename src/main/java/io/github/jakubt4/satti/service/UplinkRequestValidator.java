package io.github.jakubt4.satti.service;

import io.github.jakubt4.satti.dto.UplinkCommandRequest;
import io.github.jakubt4.satti.exception.InvalidRequestException;
import io.github.jakubt4.satti.model.GenerationMode;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Field and cross-field rules for {@link UplinkCommandRequest}. Satellite existence is not
 * checked here; the pipeline fails commands against unknown satellites.
 */
@Component
public class UplinkRequestValidator {

    static final int MIN_SIZE = 128;
    static final int MAX_SIZE = 4096;
    static final int MAX_ZOOM = 19;

    /**
     * @throws InvalidRequestException listing every violated rule
     */
    public void validate(final UplinkCommandRequest request) {
        final var violations = new ArrayList<String>();

        if (request.satelliteId() == null || request.satelliteId().isBlank()) {
            violations.add("satelliteId is required");
        }
        requireText(violations, "missionName", request.missionName(), 150);
        requireText(violations, "aoiName", request.aoiName(), 120);
        if (request.groundStationId() != null && (request.groundStationId().isBlank()
                || request.groundStationId().length() > 40)) {
            violations.add("groundStationId must be 1-40 characters");
        }

        inRange(violations, "width", request.width(), MIN_SIZE, MAX_SIZE);
        inRange(violations, "height", request.height(), MIN_SIZE, MAX_SIZE);
        inRange(violations, "cloudPercent", request.cloudPercent(), 0, 100);
        inRange(violations, "maxCloudCoverPercent", request.maxCloudCoverPercent(), 0, 100);
        inRange(violations, "maxOffNadirDeg", request.maxOffNadirDeg(), 0, 45);
        inRange(violations, "minSunElevationDeg", request.minSunElevationDeg(), 0, 90);
        inRange(violations, "incidenceMinDeg", request.incidenceMinDeg(), 0, 90);
        inRange(violations, "incidenceMaxDeg", request.incidenceMaxDeg(), 0, 90);
        inRange(violations, "externalMapZoom", request.externalMapZoom(), 1, MAX_ZOOM);
        inRange(violations, "failProbability", request.failProbability(), 0.0, 1.0);
        inRange(violations, "aoiCenterLat", request.aoiCenterLat(), -90, 90);
        inRange(violations, "aoiCenterLon", request.aoiCenterLon(), -180, 180);

        if ((request.aoiCenterLat() == null) != (request.aoiCenterLon() == null)) {
            violations.add("aoiCenterLat and aoiCenterLon must be provided together");
        }
        validateBbox(violations, request.aoiBbox());
        validateWindow(violations, request.windowOpenUtc(), request.windowCloseUtc());

        if (request.incidenceMinDeg() != null && request.incidenceMaxDeg() != null
                && request.incidenceMinDeg() > request.incidenceMaxDeg()) {
            violations.add("incidenceMinDeg must be <= incidenceMaxDeg");
        }
        if (request.polarization() != null && request.polarization().length() > 10) {
            violations.add("polarization must be at most 10 characters");
        }
        if (request.deliveryMethod().requiresPath()
                && (request.deliveryPath() == null || request.deliveryPath().isBlank())) {
            violations.add("deliveryPath is required when deliveryMethod is S3 or WEBHOOK");
        }
        if (request.deliveryPath() != null && request.deliveryPath().length() > 500) {
            violations.add("deliveryPath must be at most 500 characters");
        }
        if (request.generationMode() == GenerationMode.EXTERNAL && !request.hasCenter() && request.aoiBbox() == null) {
            violations.add("EXTERNAL generation requires aoiCenterLat/aoiCenterLon or aoiBbox");
        }

        if (!violations.isEmpty()) {
            throw new InvalidRequestException(violations);
        }
    }

    private static void validateBbox(final List<String> violations, final List<Double> bbox) {
        if (bbox == null) {
            return;
        }
        if (bbox.size() != 4 || bbox.contains(null)) {
            violations.add("aoiBbox must contain exactly 4 numbers");
            return;
        }
        final var minLon = bbox.get(0);
        final var minLat = bbox.get(1);
        final var maxLon = bbox.get(2);
        final var maxLat = bbox.get(3);
        if (minLon >= maxLon || minLat >= maxLat) {
            violations.add("aoiBbox must be [minLon, minLat, maxLon, maxLat] with min < max");
        }
    }

    private static void validateWindow(final List<String> violations, final String open, final String close) {
        if (open == null || close == null || open.isBlank() || close.isBlank()) {
            return;
        }
        try {
            final var openAt = OffsetDateTime.parse(open);
            final var closeAt = OffsetDateTime.parse(close);
            if (!openAt.isBefore(closeAt)) {
                violations.add("windowOpenUtc must be earlier than windowCloseUtc");
            }
        } catch (final DateTimeParseException e) {
            violations.add("windowOpenUtc/windowCloseUtc must be ISO-8601 timestamps with offset");
        }
    }

    private static void requireText(final List<String> violations, final String field,
                                    final String value, final int maxLength) {
        if (value == null || value.isBlank()) {
            violations.add(field + " is required");
        } else if (value.length() > maxLength) {
            violations.add(field + " must be at most " + maxLength + " characters");
        }
    }

    private static void inRange(final List<String> violations, final String field,
                                final Number value, final double min, final double max) {
        if (value != null && (value.doubleValue() < min || value.doubleValue() > max)) {
            violations.add(String.format("%s must be between %s and %s", field, format(min), format(max)));
        }
    }

    private static String format(final double bound) {
        return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
    }
}
