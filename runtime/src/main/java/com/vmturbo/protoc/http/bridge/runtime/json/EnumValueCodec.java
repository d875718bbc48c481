package com.vmturbo.protoc.http.bridge.runtime.json;

import java.io.IOException;
import java.util.Optional;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.google.protobuf.Descriptors.EnumDescriptor;
import com.google.protobuf.Descriptors.EnumValueDescriptor;

/**
 * Converts between the wire values of one enum type and their JSON representation.
 * <p>
 * Values are written as the symbolic name of the enum value, or as the number itself when the
 * enum declares no value with that number. Both names and numbers are read back; numbers are
 * accepted as they are, since an enum may gain values after the code was generated.
 */
@Immutable
public class EnumValueCodec {

    private final EnumDescriptor enumDescriptor;

    public EnumValueCodec(@Nonnull final EnumDescriptor enumDescriptor) {
        this.enumDescriptor = enumDescriptor;
    }

    /**
     * @return The fully qualified name of the enum, e.g. "hello_world.GreetingType".
     */
    @Nonnull
    public String getEnumName() {
        return enumDescriptor.getFullName();
    }

    /**
     * @param number A wire value.
     * @return The name of the value, if the enum declares it. The first declared name wins for
     *         aliases.
     */
    @Nonnull
    public Optional<String> toName(final int number) {
        return Optional.ofNullable(enumDescriptor.findValueByNumber(number))
                .map(EnumValueDescriptor::getName);
    }

    /**
     * @param name A symbolic name.
     * @return The wire value of the name, if the enum declares it.
     */
    @Nonnull
    public Optional<Integer> fromName(@Nonnull final String name) {
        return Optional.ofNullable(enumDescriptor.findValueByName(name))
                .map(EnumValueDescriptor::getNumber);
    }

    /**
     * Write a wire value as its name, or as a number if it has no name.
     *
     * @param number The wire value.
     * @param generator The generator to write to.
     * @throws IOException If writing fails.
     */
    public void write(final int number, @Nonnull final JsonGenerator generator) throws IOException {
        final Optional<String> name = toName(number);
        if (name.isPresent()) {
            generator.writeString(name.get());
        } else {
            generator.writeNumber(number);
        }
    }

    /**
     * Read a wire value from the current token of the parser, which must be a name of the enum
     * or an integer.
     *
     * @param parser The parser, positioned on the value.
     * @return The wire value.
     * @throws IOException If the token is not a known name or an integer.
     */
    public int read(@Nonnull final JsonParser parser) throws IOException {
        final JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_STRING) {
            final String text = parser.getText();
            return fromName(text).orElseThrow(() -> InvalidFormatException.from(parser,
                    "Unknown value \"" + text + "\" for enum " + getEnumName(), text, Integer.class));
        } else if (token == JsonToken.VALUE_NUMBER_INT) {
            return parser.getIntValue();
        }
        throw MismatchedInputException.from(parser, Integer.class,
                "Expected a name or number of enum " + getEnumName() + " but got " + token);
    }
}
