package io.github.jakubt4.satti.service.imaging;

/**
 * Spherical (Web) Mercator slippy-map tile arithmetic.
 */
public final class TileMath {

    public static final int TILE_SIZE = 256;
    public static final double MAX_LATITUDE = 85.05112878;

    private TileMath() {
    }

    /**
     * Fractional tile coordinates of a point. Latitude is clamped to ±{@value #MAX_LATITUDE}
     * first, which keeps {@code tan}/{@code log} finite at the poles.
     */
    public static TilePoint latLonToTile(final double lat, final double lon, final int zoom) {
        final var clampedLat = Math.max(-MAX_LATITUDE, Math.min(MAX_LATITUDE, lat));
        final var n = Math.pow(2, zoom);
        final var x = (lon + 180.0) / 360.0 * n;
        final var latRad = Math.toRadians(clampedLat);
        final var y = (1.0 - Math.log(Math.tan(latRad) + 1 / Math.cos(latRad)) / Math.PI) / 2.0 * n;
        return new TilePoint(x, y);
    }

    public record TilePoint(double x, double y) {
    }
}
