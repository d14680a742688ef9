package io.github.jakubt4.satti.dto;

public record ClearImagesResponse(int deletedCount, int clearedCommandCount, String message) {
}
