package com.vmturbo.protoc.http.bridge.enums;

import javax.annotation.Nonnull;

import com.vmturbo.protoc.http.bridge.generator.FieldDescriptor;

/**
 * How many values an enum field holds, which decides the shape of its JSON codecs.
 */
public enum Cardinality {
    /**
     * Exactly one value, defaulting to 0.
     */
    SINGLE(""),

    /**
     * A value that may be absent: proto3 "optional", a oneof member or a proto2 optional field.
     */
    OPTION("option_"),

    /**
     * An ordered sequence of values.
     */
    REPEATED("repeated_");

    private final String namePrefix;

    Cardinality(@Nonnull final String namePrefix) {
        this.namePrefix = namePrefix;
    }

    /**
     * @return The infix of the codec function names, e.g. "option_" in
     *         serialize_option_hello_request_greeting_type_as_string.
     */
    @Nonnull
    public String getNamePrefix() {
        return namePrefix;
    }

    /**
     * @param field An enum field.
     * @return The cardinality of the field.
     */
    @Nonnull
    public static Cardinality of(@Nonnull final FieldDescriptor field) {
        if (field.isRepeated()) {
            return REPEATED;
        } else if (field.hasExplicitPresence()) {
            return OPTION;
        } else {
            return SINGLE;
        }
    }
}
