package io.github.jakubt4.satti.service.imaging;

import io.github.jakubt4.satti.model.CommandFixtures;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class OpticalImageSynthesizerTest {

    private final OpticalImageSynthesizer synthesizer = new OpticalImageSynthesizer(new Random(3));

    @Test
    void rendersRgbImageOfRequestedSize() {
        final var image = synthesizer.render(300, 200, 20);

        assertThat(image.getWidth()).isEqualTo(300);
        assertThat(image.getHeight()).isEqualTo(200);
        assertThat(image.getType()).isEqualTo(BufferedImage.TYPE_INT_RGB);
    }

    @Test
    void synthesizeUsesCommandDimensions() {
        final var command = CommandFixtures.command("sat-1", 0.0, CommandFixtures.internalProfile());

        final var image = synthesizer.synthesize(command);

        assertThat(image.getWidth()).isEqualTo(command.getWidth());
        assertThat(image.getHeight()).isEqualTo(command.getHeight());
        assertThat(synthesizer.strategy()).isEqualTo(ImageStrategy.OPTICAL);
    }

    @Test
    void cloudSampleCountScalesWithAreaAndCloudPercent() {
        assertThat(OpticalImageSynthesizer.cloudSampleCount(1000, 1000, 0)).isZero();
        assertThat(OpticalImageSynthesizer.cloudSampleCount(1000, 1000, 50)).isEqualTo(15_000);
        assertThat(OpticalImageSynthesizer.cloudSampleCount(1000, 1000, 100)).isEqualTo(30_000);
        assertThat(OpticalImageSynthesizer.cloudSampleCount(2000, 1000, 50)).isEqualTo(30_000);
    }

    @Test
    void fullCloudCoverBrightensTheScene() {
        final var clear = new OpticalImageSynthesizer(new Random(11)).render(200, 200, 0);
        final var overcast = new OpticalImageSynthesizer(new Random(11)).render(200, 200, 100);

        assertThat(countCloudPixels(overcast)).isGreaterThan(countCloudPixels(clear));
    }

    private static int countCloudPixels(final BufferedImage image) {
        var count = 0;
        for (var y = 0; y < image.getHeight(); y++) {
            for (var x = 0; x < image.getWidth(); x++) {
                final var rgb = image.getRGB(x, y);
                final var r = (rgb >> 16) & 0xFF;
                final var g = (rgb >> 8) & 0xFF;
                final var b = rgb & 0xFF;
                if (r == g && g == b && r >= 190) {
                    count++;
                }
            }
        }
        return count;
    }
}
