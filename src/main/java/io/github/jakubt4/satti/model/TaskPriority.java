package io.github.jakubt4.satti.model;

public enum TaskPriority {
    BACKGROUND,
    COMMERCIAL,
    URGENT
}
