package com.vmturbo.protoc.http.bridge.runtime.json;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import javax.annotation.Nonnull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.google.protobuf.Descriptors.EnumDescriptor;

/**
 * Reads the wire values of a repeated enum field from an array of names or numbers. The
 * whole array fails if any element fails. JSON null reads as an empty list.
 */
public class RepeatedEnumValueDeserializer extends StdDeserializer<List<Integer>> {

    private final EnumValueCodec codec;

    protected RepeatedEnumValueDeserializer(@Nonnull final EnumDescriptor enumDescriptor) {
        super(List.class);
        this.codec = new EnumValueCodec(enumDescriptor);
    }

    @Override
    public List<Integer> deserialize(final JsonParser parser, final DeserializationContext context)
            throws IOException {
        if (!parser.isExpectedStartArrayToken()) {
            throw MismatchedInputException.from(parser, List.class,
                    "Expected an array of enum " + codec.getEnumName());
        }
        final List<Integer> values = new ArrayList<>();
        for (JsonToken token = parser.nextToken(); token != JsonToken.END_ARRAY; token = parser.nextToken()) {
            values.add(codec.read(parser));
        }
        return values;
    }

    @Override
    public List<Integer> getNullValue(final DeserializationContext context) {
        return new ArrayList<>();
    }
}
