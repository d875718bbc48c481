package com.vmturbo.protoc.http.bridge.generator;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

import com.google.protobuf.DescriptorProtos.EnumDescriptorProto;

/**
 * An enum declared in a .proto file, at the top level or nested in a message.
 */
@Immutable
public class EnumDescriptor extends AbstractDescriptor {

    private final EnumDescriptorProto enumDescriptorProto;

    public EnumDescriptor(@Nonnull final FileDescriptorProcessingContext context,
                          @Nonnull final EnumDescriptorProto enumDescriptorProto) {
        super(context, enumDescriptorProto.getName());
        this.enumDescriptorProto = enumDescriptorProto;
    }

    @Nonnull
    public EnumDescriptorProto getProto() {
        return enumDescriptorProto;
    }

    /**
     * A closed (proto2) enum has no "Value" accessors in the Java code protoc generates, and
     * cannot hold numbers it does not declare.
     *
     * @return True if the enum is declared in a proto2 file.
     */
    public boolean isClosed() {
        return !context.isProto3Syntax();
    }
}
