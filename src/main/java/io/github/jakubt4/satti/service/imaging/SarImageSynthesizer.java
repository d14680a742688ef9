package io.github.jakubt4.satti.service.imaging;

import io.github.jakubt4.satti.model.Command;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.Random;

/**
 * Placeholder radar scene: single-channel brightness ramp from top to bottom with uniform
 * speckle on every pixel.
 */
@Component
@RequiredArgsConstructor
public class SarImageSynthesizer implements ImageSynthesizer {

    private static final int RAMP_START = 70;
    private static final int RAMP_SPAN = 185;
    private static final int SPECKLE_AMPLITUDE = 45;

    private final Random random;

    @Override
    public ImageStrategy strategy() {
        return ImageStrategy.SAR;
    }

    @Override
    public BufferedImage synthesize(final Command command) {
        return render(command.getWidth(), command.getHeight());
    }

    public BufferedImage render(final int width, final int height) {
        final var image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        final var raster = image.getRaster();

        for (var y = 0; y < height; y++) {
            final var base = (int) (RAMP_START + (RAMP_SPAN * (double) y / Math.max(1, height - 1)));
            for (var x = 0; x < width; x++) {
                final var speckle = random.nextInt(2 * SPECKLE_AMPLITUDE + 1) - SPECKLE_AMPLITUDE;
                raster.setSample(x, y, 0, Math.max(0, Math.min(255, base + speckle)));
            }
        }
        return image;
    }
}
