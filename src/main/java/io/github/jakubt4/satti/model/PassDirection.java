package io.github.jakubt4.satti.model;

public enum PassDirection {
    ANY,
    ASCENDING,
    DESCENDING
}
