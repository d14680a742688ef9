package io.github.jakubt4.satti.service.imaging;

import io.github.jakubt4.satti.model.Command;

import java.awt.image.BufferedImage;

/**
 * Produces a raster of exactly {@code command.getWidth() × command.getHeight()} pixels.
 *
 * <p>Implementations only read the command's immutable request fields, so they may run
 * outside the mission store lock.
 */
public interface ImageSynthesizer {

    ImageStrategy strategy();

    BufferedImage synthesize(Command command);
}
