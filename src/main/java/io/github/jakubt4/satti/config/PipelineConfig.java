package io.github.jakubt4.satti.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Execution resources of the command pipeline.
 *
 * <p>Every submitted or rerun command gets its own task on an unbounded cached pool: there is
 * no admission control and no queue limit. On shutdown in-flight pipelines are interrupted.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService pipelineExecutor() {
        final var threadFactory = new CustomizableThreadFactory("satti-pipeline-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    /**
     * Shared source of simulation randomness. Set {@code satti.simulation.seed} for reproducible runs.
     */
    @Bean
    Random simulationRandom(@Value("${satti.simulation.seed:#{null}}") final Long seed) {
        if (seed == null) {
            return new Random();
        }
        log.info("Simulation random source seeded with {}", seed);
        return new Random(seed);
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
