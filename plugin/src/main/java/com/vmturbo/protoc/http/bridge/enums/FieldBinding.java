package com.vmturbo.protoc.http.bridge.enums;

import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

import com.vmturbo.protoc.http.bridge.generator.EnumDescriptor;
import com.vmturbo.protoc.http.bridge.generator.FieldDescriptor;
import com.vmturbo.protoc.http.bridge.naming.IdentifierCase;

/**
 * Links an enum-typed field to the one enum type its JSON codecs are bound to.
 * <p>
 * The field id is the word-cased path of the enclosing messages followed by the word-cased
 * field name, e.g. "hello_request_greeting_type", and names the codec pair of the field.
 */
@Immutable
public class FieldBinding {

    private final String fieldId;

    private final String enumTypePath;

    private final Cardinality cardinality;

    private final FieldDescriptor field;

    private final EnumDescriptor enumDescriptor;

    public FieldBinding(@Nonnull final String fieldId,
                        @Nonnull final String enumTypePath,
                        @Nonnull final Cardinality cardinality,
                        @Nonnull final FieldDescriptor field,
                        @Nonnull final EnumDescriptor enumDescriptor) {
        this.fieldId = Objects.requireNonNull(fieldId);
        this.enumTypePath = Objects.requireNonNull(enumTypePath);
        this.cardinality = Objects.requireNonNull(cardinality);
        this.field = Objects.requireNonNull(field);
        this.enumDescriptor = Objects.requireNonNull(enumDescriptor);
    }

    @Nonnull
    public String getFieldId() {
        return fieldId;
    }

    /**
     * @return The resolved path of the enum relative to its package, e.g. "outer::Status".
     */
    @Nonnull
    public String getEnumTypePath() {
        return enumTypePath;
    }

    @Nonnull
    public Cardinality getCardinality() {
        return cardinality;
    }

    @Nonnull
    public FieldDescriptor getField() {
        return field;
    }

    @Nonnull
    public EnumDescriptor getEnumDescriptor() {
        return enumDescriptor;
    }

    /**
     * @return The fully qualified proto name of the field, e.g. "pkg.HelloRequest.greeting_type".
     */
    @Nonnull
    public String getQualifiedFieldName() {
        return field.getQualifiedProtoName();
    }

    /**
     * @return The fully qualified proto name of the bound enum, e.g. "pkg.GreetingType".
     */
    @Nonnull
    public String getQualifiedEnumName() {
        return enumDescriptor.getQualifiedProtoName();
    }

    /**
     * @return e.g. "serialize_option_hello_request_greeting_type_as_string".
     */
    @Nonnull
    public String getSerializerName() {
        return "serialize_" + cardinality.getNamePrefix() + fieldId + "_as_string";
    }

    /**
     * @return e.g. "deserialize_option_hello_request_greeting_type_from_string".
     */
    @Nonnull
    public String getDeserializerName() {
        return "deserialize_" + cardinality.getNamePrefix() + fieldId + "_from_string";
    }

    @Nonnull
    public String getSerializerClassName() {
        return IdentifierCase.toUpperCamel(getSerializerName());
    }

    @Nonnull
    public String getDeserializerClassName() {
        return IdentifierCase.toUpperCamel(getDeserializerName());
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FieldBinding)) {
            return false;
        }
        final FieldBinding that = (FieldBinding)other;
        return fieldId.equals(that.fieldId)
                && enumTypePath.equals(that.enumTypePath)
                && cardinality == that.cardinality;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldId, enumTypePath, cardinality);
    }

    @Override
    public String toString() {
        return fieldId + " -> " + enumTypePath + " (" + cardinality + ")";
    }
}
