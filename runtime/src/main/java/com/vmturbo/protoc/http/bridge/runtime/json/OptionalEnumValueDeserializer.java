package com.vmturbo.protoc.http.bridge.runtime.json;

import javax.annotation.Nonnull;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.google.protobuf.Descriptors.EnumDescriptor;

/**
 * Reads the wire value of an enum field with explicit presence. JSON null reads as absent.
 */
public class OptionalEnumValueDeserializer extends EnumValueDeserializer {

    protected OptionalEnumValueDeserializer(@Nonnull final EnumDescriptor enumDescriptor) {
        super(enumDescriptor);
    }

    @Override
    public Integer getNullValue(final DeserializationContext context) {
        return null;
    }
}
