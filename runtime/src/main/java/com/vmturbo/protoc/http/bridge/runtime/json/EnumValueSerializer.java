package com.vmturbo.protoc.http.bridge.runtime.json;

import java.io.IOException;

import javax.annotation.Nonnull;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.google.protobuf.Descriptors.EnumDescriptor;

/**
 * Writes the wire value of a single (or optional) enum field as the name of the value. Generated
 * code subclasses this once per field, binding it to the enum the field is declared with.
 */
public class EnumValueSerializer extends StdSerializer<Integer> {

    private final EnumValueCodec codec;

    protected EnumValueSerializer(@Nonnull final EnumDescriptor enumDescriptor) {
        super(Integer.class);
        this.codec = new EnumValueCodec(enumDescriptor);
    }

    @Override
    public void serialize(final Integer value, final JsonGenerator generator,
                          final SerializerProvider provider) throws IOException {
        codec.write(value, generator);
    }
}
