package com.vmturbo.protoc.http.bridge.generator;

import java.util.List;
import java.util.stream.Collectors;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

import com.google.common.collect.ImmutableList;
import com.google.protobuf.DescriptorProtos.DescriptorProto;

/**
 * A message declared in a .proto file, with its fields and nested types.
 */
@Immutable
public class MessageDescriptor extends AbstractDescriptor {

    private final DescriptorProto descriptorProto;

    /**
     * The nested messages and enums, in declaration order.
     */
    private final List<AbstractDescriptor> nestedDescriptors;

    private final List<FieldDescriptor> fieldDescriptors;

    public MessageDescriptor(@Nonnull final FileDescriptorProcessingContext context,
                             @Nonnull final DescriptorProto descriptorProto,
                             @Nonnull final List<AbstractDescriptor> nestedDescriptors) {
        super(context, descriptorProto.getName());
        this.descriptorProto = descriptorProto;
        this.nestedDescriptors = ImmutableList.copyOf(nestedDescriptors);

        final ImmutableList.Builder<FieldDescriptor> fieldsBuilder = ImmutableList.builder();
        context.startFieldList();
        for (int fieldIdx = 0; fieldIdx < descriptorProto.getFieldCount(); ++fieldIdx) {
            context.startListElement(fieldIdx);
            fieldsBuilder.add(new FieldDescriptor(context, getQualifiedProtoName(),
                    descriptorProto.getField(fieldIdx)));
            context.endListElement();
        }
        context.endFieldList();
        this.fieldDescriptors = fieldsBuilder.build();
    }

    @Nonnull
    public DescriptorProto getDescriptorProto() {
        return descriptorProto;
    }

    @Nonnull
    public List<FieldDescriptor> getFieldDescriptors() {
        return fieldDescriptors;
    }

    @Nonnull
    public List<MessageDescriptor> getNestedMessages() {
        return nestedDescriptors.stream()
                .filter(MessageDescriptor.class::isInstance)
                .map(MessageDescriptor.class::cast)
                .collect(Collectors.toList());
    }

    @Nonnull
    public List<EnumDescriptor> getNestedEnums() {
        return nestedDescriptors.stream()
                .filter(EnumDescriptor.class::isInstance)
                .map(EnumDescriptor.class::cast)
                .collect(Collectors.toList());
    }

    /**
     * @return True if this is the synthetic entry message protoc creates for a map field.
     */
    public boolean isMapEntry() {
        return descriptorProto.getOptions().getMapEntry();
    }

    /**
     * @return The key field of a map entry message.
     */
    @Nonnull
    public FieldDescriptor getMapKey() {
        return getMapEntryField("key");
    }

    /**
     * @return The value field of a map entry message.
     */
    @Nonnull
    public FieldDescriptor getMapValue() {
        return getMapEntryField("value");
    }

    @Nonnull
    private FieldDescriptor getMapEntryField(@Nonnull final String name) {
        if (!isMapEntry()) {
            throw new IllegalStateException(getQualifiedProtoName() + " is not a map entry.");
        }
        return fieldDescriptors.stream()
                .filter(field -> field.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "Map entry " + getQualifiedProtoName() + " has no " + name + " field."));
    }
}
