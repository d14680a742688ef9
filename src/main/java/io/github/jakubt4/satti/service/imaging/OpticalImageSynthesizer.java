package io.github.jakubt4.satti.service.imaging;

import io.github.jakubt4.satti.model.Command;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.Random;

/**
 * Placeholder EO scene: a two-dimensional blend of three random base colours with
 * near-white speckles standing in for cloud cover.
 */
@Component
@RequiredArgsConstructor
public class OpticalImageSynthesizer implements ImageSynthesizer {

    private static final double CLOUD_DENSITY = 0.03;
    private static final int CLOUD_MIN_GREY = 190;

    private final Random random;

    @Override
    public ImageStrategy strategy() {
        return ImageStrategy.OPTICAL;
    }

    @Override
    public BufferedImage synthesize(final Command command) {
        return render(command.getWidth(), command.getHeight(), command.getCloudPercent());
    }

    public BufferedImage render(final int width, final int height, final int cloudPercent) {
        final var image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);

        final var c1 = randomColour();
        final var c2 = randomColour();
        final var c3 = randomColour();

        for (var y = 0; y < height; y++) {
            final var t = y / (double) Math.max(1, height - 1);
            for (var x = 0; x < width; x++) {
                final var s = x / (double) Math.max(1, width - 1);
                final var r = (int) ((1 - t) * c1[0] + t * c2[0] * (0.6 + 0.4 * s)) % 256;
                final var g = (int) ((1 - s) * c2[1] + s * c3[1] * (0.6 + 0.4 * t)) % 256;
                final var b = (int) ((1 - t) * c3[2] + t * c1[2] * (0.6 + 0.4 * s)) % 256;
                image.setRGB(x, y, rgb(r, g, b));
            }
        }

        final var samples = cloudSampleCount(width, height, cloudPercent);
        for (var i = 0; i < samples; i++) {
            final var x = random.nextInt(width);
            final var y = random.nextInt(height);
            final var grey = CLOUD_MIN_GREY + random.nextInt(256 - CLOUD_MIN_GREY);
            image.setRGB(x, y, rgb(grey, grey, grey));
        }
        return image;
    }

    /**
     * Number of cloud pixels painted: linear in both image area and cloud percentage.
     */
    public static int cloudSampleCount(final int width, final int height, final int cloudPercent) {
        return (int) ((double) width * height * (cloudPercent / 100.0) * CLOUD_DENSITY);
    }

    private int[] randomColour() {
        return new int[]{random.nextInt(256), random.nextInt(256), random.nextInt(256)};
    }

    private static int rgb(final int r, final int g, final int b) {
        return (r << 16) | (g << 8) | b;
    }
}
