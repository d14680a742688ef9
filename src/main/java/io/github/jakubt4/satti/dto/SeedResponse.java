package io.github.jakubt4.satti.dto;

import java.util.List;

/**
 * @param createdIds identifiers of the presets that were actually inserted (existing names are skipped)
 */
public record SeedResponse(List<String> createdIds) {
}
