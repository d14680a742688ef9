package io.github.jakubt4.satti.model;

public enum DeliveryMethod {
    DOWNLOAD,
    S3,
    WEBHOOK;

    /**
     * @return {@code true} if the method pushes the product somewhere and therefore needs a target path
     */
    public boolean requiresPath() {
        return this == S3 || this == WEBHOOK;
    }
}
