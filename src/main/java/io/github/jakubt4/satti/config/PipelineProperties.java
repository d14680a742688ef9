package io.github.jakubt4.satti.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Random;

/**
 * Simulated stage latencies of the uplink pipeline.
 *
 * <pre>
 * satti:
 *   pipeline:
 *     contact-window: { min: 700ms,  max: 1800ms }
 *     command-prep:   { min: 600ms,  max: 1600ms }
 *     capture:        { min: 1500ms, max: 3800ms }
 * </pre>
 */
@ConfigurationProperties(prefix = "satti.pipeline")
public record PipelineProperties(StageWindow contactWindow, StageWindow commandPrep, StageWindow capture) {

    public PipelineProperties {
        contactWindow = contactWindow == null ? StageWindow.ofMillis(700, 1800) : contactWindow;
        commandPrep = commandPrep == null ? StageWindow.ofMillis(600, 1600) : commandPrep;
        capture = capture == null ? StageWindow.ofMillis(1500, 3800) : capture;
    }

    /**
     * All stages complete instantly. Meant for tests.
     */
    public static PipelineProperties instant() {
        return new PipelineProperties(StageWindow.ZERO, StageWindow.ZERO, StageWindow.ZERO);
    }

    /**
     * Uniform duration range {@code [min, max]}.
     */
    public record StageWindow(Duration min, Duration max) {

        public static final StageWindow ZERO = new StageWindow(Duration.ZERO, Duration.ZERO);

        public StageWindow {
            min = min == null ? Duration.ZERO : min;
            max = max == null ? min : max;
            if (min.isNegative() || max.compareTo(min) < 0) {
                throw new IllegalArgumentException("Stage window requires 0 <= min <= max, got " + min + ".." + max);
            }
        }

        public static StageWindow ofMillis(final long min, final long max) {
            return new StageWindow(Duration.ofMillis(min), Duration.ofMillis(max));
        }

        public Duration sample(final Random random) {
            final var spread = max.toMillis() - min.toMillis();
            if (spread <= 0) {
                return min;
            }
            return min.plusMillis((long) (random.nextDouble() * (spread + 1)));
        }
    }
}
