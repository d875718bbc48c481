package com.vmturbo.protoc.http.bridge.json;

import javax.annotation.Nonnull;

/**
 * When a field is left out of the JSON output.
 */
public enum Omission {
    /**
     * Omitted when the value is absent (null).
     */
    WHEN_ABSENT("@JsonInclude(Include.NON_NULL)"),

    /**
     * Omitted when the value is absent or empty, e.g. a zero-length string.
     */
    WHEN_EMPTY("@JsonInclude(Include.NON_EMPTY)");

    private final String annotation;

    Omission(@Nonnull final String annotation) {
        this.annotation = annotation;
    }

    /**
     * @return The Jackson annotation that implements the omission on a field.
     */
    @Nonnull
    public String getAnnotation() {
        return annotation;
    }
}
