package io.github.jakubt4.satti.dto;

import io.github.jakubt4.satti.model.DeliveryMethod;
import io.github.jakubt4.satti.model.GenerationMode;
import io.github.jakubt4.satti.model.LookSide;
import io.github.jakubt4.satti.model.PassDirection;
import io.github.jakubt4.satti.model.TaskPriority;
import lombok.Builder;

import java.util.List;

/**
 * Imaging request submitted via {@code POST /uplink}. Omitted optional fields take the
 * defaults applied in the compact constructor.
 *
 * @param aoiBbox           {@code [minLon, minLat, maxLon, maxLat]}
 * @param externalMapSource tile provider for {@code EXTERNAL} generation, {@code "OSM"} by default
 * @param failProbability   base probability of a simulated fault, {@code [0, 1]}
 */
@Builder(toBuilder = true)
public record UplinkCommandRequest(
        String satelliteId,
        String groundStationId,
        String missionName,
        String aoiName,
        Double aoiCenterLat,
        Double aoiCenterLon,
        List<Double> aoiBbox,
        String windowOpenUtc,
        String windowCloseUtc,
        TaskPriority priority,
        Integer width,
        Integer height,
        Integer cloudPercent,
        Integer maxCloudCoverPercent,
        Double maxOffNadirDeg,
        Double minSunElevationDeg,
        Double incidenceMinDeg,
        Double incidenceMaxDeg,
        LookSide lookSide,
        PassDirection passDirection,
        String polarization,
        DeliveryMethod deliveryMethod,
        String deliveryPath,
        GenerationMode generationMode,
        String externalMapSource,
        Integer externalMapZoom,
        Double failProbability
) {

    public static final int DEFAULT_SIZE = 1024;
    public static final int DEFAULT_CLOUD_PERCENT = 20;
    public static final int DEFAULT_ZOOM = 19;
    public static final double DEFAULT_FAIL_PROBABILITY = 0.05;

    public UplinkCommandRequest {
        aoiName = aoiName == null ? "unknown-aoi" : aoiName;
        priority = priority == null ? TaskPriority.COMMERCIAL : priority;
        width = width == null ? DEFAULT_SIZE : width;
        height = height == null ? DEFAULT_SIZE : height;
        cloudPercent = cloudPercent == null ? DEFAULT_CLOUD_PERCENT : cloudPercent;
        lookSide = lookSide == null ? LookSide.ANY : lookSide;
        passDirection = passDirection == null ? PassDirection.ANY : passDirection;
        deliveryMethod = deliveryMethod == null ? DeliveryMethod.DOWNLOAD : deliveryMethod;
        generationMode = generationMode == null ? GenerationMode.INTERNAL : generationMode;
        externalMapSource = externalMapSource == null ? "OSM" : externalMapSource;
        externalMapZoom = externalMapZoom == null ? DEFAULT_ZOOM : externalMapZoom;
        failProbability = failProbability == null ? DEFAULT_FAIL_PROBABILITY : failProbability;
    }

    public boolean hasCenter() {
        return aoiCenterLat != null && aoiCenterLon != null;
    }
}
