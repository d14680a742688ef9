package io.github.jakubt4.satti.model;

import io.github.jakubt4.satti.model.RequestProfile.Generation;

import java.util.List;

/**
 * Simulated product description of a downlinked image.
 */
public sealed interface ProductMetadata {

    String productType();

    int widthPx();

    int heightPx();

    String format();

    record Optical(
            String productType,
            List<String> bands,
            double gsdM,
            int widthPx,
            int heightPx,
            int bitDepth,
            String format,
            Generation imageSource
    ) implements ProductMetadata {
    }

    record Sar(
            String productType,
            double resolutionM,
            int widthPx,
            int heightPx,
            String format,
            String speckleFilter,
            Generation imageSource
    ) implements ProductMetadata {
    }
}
