package io.github.jakubt4.satti;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Satti — virtual satellite tasking simulator.
 *
 * <p>Accepts imaging requests over REST, walks each one through a simulated uplink lifecycle
 * (contact window, ACK, capture, downlink) with probabilistic fault injection, and synthesizes
 * an optical, SAR or map-mosaic PNG as the downlinked product.
 *
 * @see io.github.jakubt4.satti.service.pipeline.CommandPipeline
 * @see io.github.jakubt4.satti.service.imaging.ImageSynthesisService
 */
@SpringBootApplication
@EnableRetry
public class SattiApplication {

    public static void main(String[] args) {
        SpringApplication.run(SattiApplication.class, args);
    }
}
