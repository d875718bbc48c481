package com.vmturbo.protoc.http.bridge.runtime.json;

import java.util.function.IntFunction;

import javax.annotation.Nonnull;

/**
 * Lookup of closed (proto2) enum values, which protobuf builders only accept as enum constants.
 */
public class ClosedEnumValues {

    private ClosedEnumValues() {}

    /**
     * @param number The wire value.
     * @param forNumber The lookup protoc generates for the enum, e.g. {@code Status::forNumber}.
     * @param enumName The qualified proto name of the enum, for the error message.
     * @param <E> The enum type.
     * @return The enum constant.
     * @throws IllegalArgumentException If the enum has no value with the number.
     */
    @Nonnull
    public static <E> E forNumber(final int number,
                                  @Nonnull final IntFunction<E> forNumber,
                                  @Nonnull final String enumName) {
        final E value = forNumber.apply(number);
        if (value == null) {
            throw new IllegalArgumentException("Unknown value " + number + " for enum " + enumName);
        }
        return value;
    }
}
