package io.github.jakubt4.satti.controller;

import io.github.jakubt4.satti.exception.InvalidRequestException;
import io.github.jakubt4.satti.model.ExternalMapSource;
import io.github.jakubt4.satti.service.imaging.ImageSynthesisService;
import io.github.jakubt4.satti.service.imaging.MapMosaicSynthesizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;

/**
 * Renders a map mosaic on demand without creating a command.
 *
 * <p>Bad parameters answer {@code 400}; a tile provider failure answers {@code 502}.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class PreviewController {

    static final int MIN_SIZE = 128;
    static final int MAX_SIZE = 4096;

    private final MapMosaicSynthesizer mapMosaicSynthesizer;
    private final ImageSynthesisService imageSynthesisService;

    @GetMapping("/preview/external-map")
    public ResponseEntity<byte[]> externalMap(@RequestParam final double lat,
                                              @RequestParam final double lon,
                                              @RequestParam(defaultValue = "19") final int zoom,
                                              @RequestParam(defaultValue = "768") final int width,
                                              @RequestParam(defaultValue = "768") final int height,
                                              @RequestParam(defaultValue = "OSM") final String source) {
        final var violations = new ArrayList<String>();
        if (lat < -90 || lat > 90) {
            violations.add("lat must be between -90 and 90");
        }
        if (lon < -180 || lon > 180) {
            violations.add("lon must be between -180 and 180");
        }
        if (zoom < 1 || zoom > 19) {
            violations.add("zoom must be between 1 and 19");
        }
        if (width < MIN_SIZE || width > MAX_SIZE) {
            violations.add("width must be between " + MIN_SIZE + " and " + MAX_SIZE);
        }
        if (height < MIN_SIZE || height > MAX_SIZE) {
            violations.add("height must be between " + MIN_SIZE + " and " + MAX_SIZE);
        }
        if (ExternalMapSource.parse(source).isEmpty()) {
            violations.add("Unsupported external map source: " + source);
        }
        if (!violations.isEmpty()) {
            throw new InvalidRequestException(violations);
        }

        log.info("[PREVIEW] {} z={} at ({}, {}) {}x{}", source, zoom, lat, lon, width, height);
        final var image = mapMosaicSynthesizer.render(lat, lon, zoom, width, height, source);
        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_PNG)
                .body(imageSynthesisService.encode(image));
    }
}
