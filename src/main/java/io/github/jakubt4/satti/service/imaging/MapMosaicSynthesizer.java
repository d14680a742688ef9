package io.github.jakubt4.satti.service.imaging;

import io.github.jakubt4.satti.exception.ImageSynthesisException;
import io.github.jakubt4.satti.model.Command;
import io.github.jakubt4.satti.model.ExternalMapSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

import static io.github.jakubt4.satti.service.imaging.TileMath.TILE_SIZE;

/**
 * Geographically accurate preview built from real map tiles.
 *
 * <p>Fetches the 3×3 block of tiles around the AOI center into a 768×768 mosaic, crops a
 * 512×512 window centred on the true point (clamped to the mosaic edges) and resamples it
 * bilinearly to the requested size. A single failed tile aborts the whole render.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MapMosaicSynthesizer implements ImageSynthesizer {

    private static final int GRID = 3;
    private static final int MOSAIC_SIZE = GRID * TILE_SIZE;
    private static final int HALF_WINDOW = TILE_SIZE;

    private final TileSource tileSource;

    @Override
    public ImageStrategy strategy() {
        return ImageStrategy.EXTERNAL_MAP;
    }

    @Override
    public BufferedImage synthesize(final Command command) {
        final var profile = command.getRequestProfile();
        final var generation = profile.generation();
        final var center = profile.resolveCenter()
                .orElseThrow(() -> new ImageSynthesisException("External generation requires AOI center or bbox"));
        return render(center.lat(), center.lon(), generation.externalMapZoom(),
                command.getWidth(), command.getHeight(), generation.externalMapSource());
    }

    public BufferedImage render(final double lat, final double lon, final int zoom,
                                final int width, final int height, final String sourceName) {
        final var source = ExternalMapSource.parse(sourceName)
                .orElseThrow(() -> new ImageSynthesisException("Unsupported external map source: " + sourceName));

        final var tile = TileMath.latLonToTile(lat, lon, zoom);
        final var tileX = (int) tile.x();
        final var tileY = (int) tile.y();
        log.debug("[MOSAIC] {} z={} center tile=({}, {}) for lat={}, lon={}", source, zoom, tileX, tileY, lat, lon);

        final var mosaic = new BufferedImage(MOSAIC_SIZE, MOSAIC_SIZE, BufferedImage.TYPE_INT_RGB);
        final var graphics = mosaic.createGraphics();
        try {
            for (var dy = -1; dy <= 1; dy++) {
                for (var dx = -1; dx <= 1; dx++) {
                    final var tileImage = tileSource.fetchTile(zoom, tileX + dx, tileY + dy);
                    graphics.drawImage(tileImage, (dx + 1) * TILE_SIZE, (dy + 1) * TILE_SIZE, null);
                }
            }
        } finally {
            graphics.dispose();
        }

        final var px = (int) ((tile.x() - tileX) * TILE_SIZE) + TILE_SIZE;
        final var py = (int) ((tile.y() - tileY) * TILE_SIZE) + TILE_SIZE;
        final var left = Math.max(0, px - HALF_WINDOW);
        final var top = Math.max(0, py - HALF_WINDOW);
        final var right = Math.min(MOSAIC_SIZE, px + HALF_WINDOW);
        final var bottom = Math.min(MOSAIC_SIZE, py + HALF_WINDOW);
        final var cropped = mosaic.getSubimage(left, top, right - left, bottom - top);

        return resizeBilinear(cropped, width, height);
    }

    private static BufferedImage resizeBilinear(final BufferedImage source, final int width, final int height) {
        final var target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        final var graphics = target.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.drawImage(source, 0, 0, width, height, null);
        } finally {
            graphics.dispose();
        }
        return target;
    }
}
