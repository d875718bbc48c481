package com.vmturbo.protoc.http.bridge.generator;

import java.util.Optional;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

import com.google.protobuf.DescriptorProtos.FieldDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Label;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Type;

import org.apache.commons.lang3.StringUtils;

import com.vmturbo.protoc.http.bridge.naming.IdentifierCase;

/**
 * A field of a message.
 */
@Immutable
public class FieldDescriptor {

    private final FileDescriptorProcessingContext context;

    private final FieldDescriptorProto fieldDescriptorProto;

    private final String qualifiedMessageName;

    private final String comment;

    public FieldDescriptor(@Nonnull final FileDescriptorProcessingContext context,
                           @Nonnull final String qualifiedMessageName,
                           @Nonnull final FieldDescriptorProto fieldDescriptorProto) {
        this.context = context;
        this.qualifiedMessageName = qualifiedMessageName;
        this.fieldDescriptorProto = fieldDescriptorProto;
        this.comment = context.getCurrentComment();
    }

    @Nonnull
    public FieldDescriptorProto getProto() {
        return fieldDescriptorProto;
    }

    /**
     * @return The name of the field in the .proto file, which is also its JSON property name.
     */
    @Nonnull
    public String getName() {
        return fieldDescriptorProto.getName();
    }

    /**
     * @return The qualified name of the field, e.g. "hello_world.HelloRequest.greeting_type".
     */
    @Nonnull
    public String getQualifiedProtoName() {
        return qualifiedMessageName + "." + getName();
    }

    /**
     * @return The name of the field in the generated Java code.
     */
    @Nonnull
    public String getJavaName() {
        return IdentifierCase.toJavaFieldName(getName());
    }

    /**
     * @return The camel-cased name protoc uses in the accessors of this field, e.g.
     *         "GreetingType" for getGreetingType().
     */
    @Nonnull
    public String getAccessorSuffix() {
        return IdentifierCase.toProtoCamelCase(getName(), true);
    }

    @Nonnull
    public String getComment() {
        return comment;
    }

    @Nonnull
    public Type getType() {
        return fieldDescriptorProto.getType();
    }

    /**
     * @return The referenced enum or message type without the leading dot, or an empty string
     *         for scalar fields.
     */
    @Nonnull
    public String getTypeName() {
        return StringUtils.removeStart(fieldDescriptorProto.getTypeName(), ".");
    }

    public boolean isRepeated() {
        return fieldDescriptorProto.getLabel() == Label.LABEL_REPEATED;
    }

    /**
     * @return True for repeated fields that are not maps.
     */
    public boolean isList() {
        return isRepeated() && !isMapField();
    }

    public boolean isMapField() {
        return isRepeated() && getContentMessage()
                .map(MessageDescriptor::isMapEntry)
                .orElse(false);
    }

    /**
     * @return True if the field was declared with the proto3 "optional" keyword.
     */
    public boolean isProto3Optional() {
        return fieldDescriptorProto.getProto3Optional();
    }

    /**
     * @return True if the field is part of a real (non-synthetic) oneof.
     */
    public boolean isOneofMember() {
        return fieldDescriptorProto.hasOneofIndex() && !isProto3Optional();
    }

    /**
     * @return True if the generated transfer object tracks presence of this field as a
     *         nullable value: proto3 optional fields, oneof members and proto2 optional fields.
     */
    public boolean hasExplicitPresence() {
        if (isRepeated()) {
            return false;
        }
        return isProto3Optional() || isOneofMember()
                || (!isProto3Syntax() && fieldDescriptorProto.getLabel() == Label.LABEL_OPTIONAL);
    }

    /**
     * @return The index of the (non-synthetic) oneof the field belongs to.
     */
    @Nonnull
    public Optional<Integer> getOneofIndex() {
        return isOneofMember() ? Optional.of(fieldDescriptorProto.getOneofIndex()) : Optional.empty();
    }

    public boolean isProto3Syntax() {
        return context.isProto3Syntax();
    }

    /**
     * @return The message type of a message (or map) field.
     */
    @Nonnull
    public Optional<MessageDescriptor> getContentMessage() {
        if (getType() != Type.TYPE_MESSAGE && getType() != Type.TYPE_GROUP) {
            return Optional.empty();
        }
        return Optional.of(context.getRegistry().getMessageDescriptor(getTypeName()));
    }

    /**
     * @return The enum type of an enum field.
     */
    @Nonnull
    public Optional<EnumDescriptor> getContentEnum() {
        if (getType() != Type.TYPE_ENUM) {
            return Optional.empty();
        }
        return Optional.of(context.getRegistry().getEnumDescriptor(getTypeName()));
    }

    @Override
    public String toString() {
        return getQualifiedProtoName();
    }
}
