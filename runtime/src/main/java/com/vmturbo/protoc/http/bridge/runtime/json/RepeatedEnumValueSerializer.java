package com.vmturbo.protoc.http.bridge.runtime.json;

import java.io.IOException;
import java.util.List;

import javax.annotation.Nonnull;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.google.protobuf.Descriptors.EnumDescriptor;

/**
 * Writes the wire values of a repeated enum field as an array of names, in order.
 */
public class RepeatedEnumValueSerializer extends StdSerializer<List<Integer>> {

    private final EnumValueCodec codec;

    protected RepeatedEnumValueSerializer(@Nonnull final EnumDescriptor enumDescriptor) {
        super(List.class, false);
        this.codec = new EnumValueCodec(enumDescriptor);
    }

    @Override
    public void serialize(final List<Integer> values, final JsonGenerator generator,
                          final SerializerProvider provider) throws IOException {
        generator.writeStartArray();
        for (Integer value : values) {
            if (value == null) {
                generator.writeNull();
            } else {
                codec.write(value, generator);
            }
        }
        generator.writeEndArray();
    }
}
