package io.github.jakubt4.satti.service.imaging;

import java.awt.image.BufferedImage;

/**
 * Supplier of 256×256 map tiles.
 */
public interface TileSource {

    /**
     * Fetches one tile. Implementations wrap {@code x} modulo {@code 2^zoom} and clamp {@code y}
     * to {@code [0, 2^zoom - 1]}.
     *
     * @throws io.github.jakubt4.satti.exception.TileFetchException on any transport, timeout or decode failure
     */
    BufferedImage fetchTile(int zoom, int x, int y);
}
