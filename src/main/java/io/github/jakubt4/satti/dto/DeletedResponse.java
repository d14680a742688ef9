package io.github.jakubt4.satti.dto;

public record DeletedResponse(String deletedId, String deletedName) {
}
