package com.vmturbo.protoc.http.bridge.runtime.json;

import java.io.IOException;

import javax.annotation.Nonnull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.google.protobuf.Descriptors.EnumDescriptor;

/**
 * Reads the wire value of a single enum field from a name or a number of the enum the field
 * is declared with. JSON null reads as 0, the default of every enum field.
 */
public class EnumValueDeserializer extends StdDeserializer<Integer> {

    private final EnumValueCodec codec;

    protected EnumValueDeserializer(@Nonnull final EnumDescriptor enumDescriptor) {
        super(Integer.class);
        this.codec = new EnumValueCodec(enumDescriptor);
    }

    @Override
    public Integer deserialize(final JsonParser parser, final DeserializationContext context)
            throws IOException {
        return codec.read(parser);
    }

    @Override
    public Integer getNullValue(final DeserializationContext context) {
        return 0;
    }
}
