package io.github.jakubt4.satti.client;

import io.github.jakubt4.satti.exception.TileFetchException;
import io.github.jakubt4.satti.service.imaging.TileSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Downloads OpenStreetMap raster tiles ({@code {zoom}/{x}/{y}.png}).
 *
 * <p>Timeouts come from the shared {@code RestClientCustomizer}. Retries are off by default
 * ({@code satti.tiles.max-attempts=1}) so a failed tile fails the mosaic straight away.
 */
@Slf4j
@Service
public class OsmTileClient implements TileSource {

    private static final String TILE_PATH = "/{zoom}/{x}/{y}.png";

    private final RestClient restClient;
    private final String userAgent;

    public OsmTileClient(final RestClient.Builder restClientBuilder,
                         @Value("${satti.tiles.base-url}") final String baseUrl,
                         @Value("${satti.tiles.user-agent}") final String userAgent) {
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .build();
        this.userAgent = userAgent;
    }

    @Override
    @Retryable(retryFor = TileFetchException.class, maxAttemptsExpression = "${satti.tiles.max-attempts:1}",
               backoff = @Backoff(delay = 250, maxDelay = 1000))
    public BufferedImage fetchTile(final int zoom, final int x, final int y) {
        final var n = 1 << zoom;
        final var wrappedX = Math.floorMod(x, n);
        final var clampedY = Math.max(0, Math.min(n - 1, y));

        final byte[] body;
        try {
            body = restClient.get()
                    .uri(TILE_PATH, zoom, wrappedX, clampedY)
                    .header(HttpHeaders.USER_AGENT, userAgent)
                    .retrieve()
                    .body(byte[].class);
        } catch (final RestClientException e) {
            log.warn("[TILES] Fetch failed for z={} x={} y={}: {}", zoom, wrappedX, clampedY, e.getMessage());
            throw new TileFetchException("External map tile fetch failed: " + e.getMessage(), e);
        }

        if (body == null || body.length == 0) {
            throw new TileFetchException(
                    String.format("External map tile fetch failed: empty body for %d/%d/%d", zoom, wrappedX, clampedY));
        }
        try {
            final var image = ImageIO.read(new ByteArrayInputStream(body));
            if (image == null) {
                throw new TileFetchException(
                        String.format("External map tile %d/%d/%d is not a decodable image", zoom, wrappedX, clampedY));
            }
            return image;
        } catch (final IOException e) {
            throw new TileFetchException("External map tile decode failed: " + e.getMessage(), e);
        }
    }
}
