package com.vmturbo.protoc.http.bridge.generator;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

import com.google.protobuf.DescriptorProtos.MethodDescriptorProto;

import com.vmturbo.protoc.http.bridge.naming.IdentifierCase;

/**
 * A method of a gRPC service.
 */
@Immutable
public class ServiceMethodDescriptor {

    /**
     * The streaming kinds of a gRPC method.
     */
    public enum MethodType {
        SIMPLE,
        CLIENT_STREAM,
        SERVER_STREAM,
        BI_STREAM
    }

    private final FileDescriptorProcessingContext context;

    private final MethodDescriptorProto methodDescriptor;

    private final String comment;

    public ServiceMethodDescriptor(@Nonnull final FileDescriptorProcessingContext context,
                                   @Nonnull final MethodDescriptorProto methodDescriptor) {
        this.context = context;
        this.methodDescriptor = methodDescriptor;
        this.comment = context.getCurrentComment();
    }

    @Nonnull
    public MethodDescriptorProto getProto() {
        return methodDescriptor;
    }

    @Nonnull
    public String getName() {
        return methodDescriptor.getName();
    }

    /**
     * @return The name of the method in the grpc-java service base class, e.g. "sayHello".
     */
    @Nonnull
    public String getJavaMethodName() {
        return IdentifierCase.toProtoCamelCase(getName(), false);
    }

    @Nonnull
    public String getComment() {
        return comment;
    }

    @Nonnull
    public MethodType getType() {
        if (methodDescriptor.getClientStreaming()) {
            return methodDescriptor.getServerStreaming() ? MethodType.BI_STREAM : MethodType.CLIENT_STREAM;
        } else {
            return methodDescriptor.getServerStreaming() ? MethodType.SERVER_STREAM : MethodType.SIMPLE;
        }
    }

    @Nonnull
    public MessageDescriptor getInputMessage() {
        return context.getRegistry().getMessageDescriptor(methodDescriptor.getInputType());
    }

    @Nonnull
    public MessageDescriptor getOutputMessage() {
        return context.getRegistry().getMessageDescriptor(methodDescriptor.getOutputType());
    }
}
