package io.github.jakubt4.satti.service.pipeline;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Probability gate for simulated transmission and capture faults.
 *
 * <p>Boundary semantics: a requested probability of {@code 1.0} or more always fails and
 * {@code 0.0} or less never does, regardless of the stage weight. In between a fresh draw
 * from {@code [0, 1)} fails when strictly below {@code probability × weight}.
 */
@Component
@RequiredArgsConstructor
public class FaultInjector {

    private final Random random;

    public boolean shouldFail(final double failProbability, final double stageWeight) {
        if (failProbability >= 1.0) {
            return true;
        }
        final var threshold = failProbability * stageWeight;
        if (threshold <= 0.0) {
            return false;
        }
        return random.nextDouble() < threshold;
    }
}
