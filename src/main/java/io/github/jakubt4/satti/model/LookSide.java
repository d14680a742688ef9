package io.github.jakubt4.satti.model;

public enum LookSide {
    ANY,
    LEFT,
    RIGHT
}
