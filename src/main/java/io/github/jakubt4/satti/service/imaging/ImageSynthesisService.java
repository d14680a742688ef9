package io.github.jakubt4.satti.service.imaging;

import io.github.jakubt4.satti.exception.ImageSynthesisException;
import io.github.jakubt4.satti.model.Command;
import io.github.jakubt4.satti.model.SatelliteType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches a command to its {@link ImageStrategy} and persists the result as
 * {@code <image-dir>/<commandId>.png}.
 */
@Slf4j
@Service
public class ImageSynthesisService {

    public static final String FORMAT = "PNG";

    private final Map<ImageStrategy, ImageSynthesizer> synthesizers = new EnumMap<>(ImageStrategy.class);
    private final Path imageDirectory;

    public ImageSynthesisService(final List<ImageSynthesizer> synthesizers,
                                 @Value("${satti.images.dir}") final Path imageDirectory) {
        synthesizers.forEach(synthesizer -> this.synthesizers.put(synthesizer.strategy(), synthesizer));
        this.imageDirectory = imageDirectory;
    }

    @PostConstruct
    void init() throws IOException {
        Files.createDirectories(imageDirectory);
        log.info("Image store ready — dir={}", imageDirectory.toAbsolutePath());
    }

    /**
     * Renders the image for {@code command} and writes it to disk.
     *
     * @return path of the written PNG
     * @throws ImageSynthesisException if rendering or writing fails; no file is left behind for render failures
     */
    public Path renderAndStore(final Command command, final SatelliteType satelliteType) {
        final var strategy = ImageStrategy.select(command.getRequestProfile().generationMode(), satelliteType);
        final var synthesizer = synthesizers.get(strategy);
        if (synthesizer == null) {
            throw new ImageSynthesisException("No synthesizer registered for " + strategy);
        }

        final var image = synthesizer.synthesize(command);
        final var output = imagePathFor(command.getCommandId());
        try {
            Files.createDirectories(imageDirectory);
            if (!ImageIO.write(image, FORMAT, output.toFile())) {
                throw new ImageSynthesisException("No " + FORMAT + " writer available");
            }
        } catch (final IOException e) {
            throw new ImageSynthesisException("Failed to write image " + output + ": " + e.getMessage(), e);
        }
        log.info("[IMAGING] {} image written for [{}] — {}x{} -> {}",
                strategy, command.getCommandId(), image.getWidth(), image.getHeight(), output);
        return output;
    }

    public byte[] encode(final BufferedImage image) {
        final var buffer = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, FORMAT, buffer);
        } catch (final IOException e) {
            throw new ImageSynthesisException("Failed to encode image: " + e.getMessage(), e);
        }
        return buffer.toByteArray();
    }

    public Path imagePathFor(final String commandId) {
        return imageDirectory.resolve(commandId + ".png");
    }

    public Path imageDirectory() {
        return imageDirectory;
    }
}
