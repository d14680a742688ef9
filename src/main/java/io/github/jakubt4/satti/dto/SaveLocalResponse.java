package io.github.jakubt4.satti.dto;

public record SaveLocalResponse(String commandId, String savedPath, long fileSizeBytes, String message) {
}
