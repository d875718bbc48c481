package com.vmturbo.protoc.http.bridge.generator;

import java.util.List;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

import com.google.common.collect.ImmutableList;
import com.google.protobuf.DescriptorProtos.MethodDescriptorProto;
import com.google.protobuf.DescriptorProtos.ServiceDescriptorProto;

/**
 * A gRPC service declared in a .proto file.
 */
@Immutable
public class ServiceDescriptor extends AbstractDescriptor {

    /**
     * Methods in declaration order.
     */
    private final List<ServiceMethodDescriptor> methodDescriptors;

    private final ServiceDescriptorProto serviceDescriptor;

    public ServiceDescriptor(@Nonnull final FileDescriptorProcessingContext context,
                             @Nonnull final ServiceDescriptorProto serviceDescriptor) {
        super(context, serviceDescriptor.getName());
        this.serviceDescriptor = serviceDescriptor;

        final ImmutableList.Builder<ServiceMethodDescriptor> descriptorsBuilder =
                ImmutableList.builder();
        context.startServiceMethodList();
        for (int methodIdx = 0; methodIdx < serviceDescriptor.getMethodCount(); ++methodIdx) {
            context.startListElement(methodIdx);
            final MethodDescriptorProto methodDescriptor =
                    serviceDescriptor.getMethod(methodIdx);
            descriptorsBuilder.add(new ServiceMethodDescriptor(context, methodDescriptor));
            context.endListElement();
        }
        context.endServiceMethodList();
        methodDescriptors = descriptorsBuilder.build();
    }

    @Nonnull
    public ServiceDescriptorProto getProto() {
        return serviceDescriptor;
    }

    @Nonnull
    public List<ServiceMethodDescriptor> getMethodDescriptors() {
        return methodDescriptors;
    }

    /**
     * @return The name of the service class grpc-java generates, e.g. "hello_world.GreeterGrpc".
     */
    @Nonnull
    public String getGrpcClassName() {
        final String javaPackage = context.getJavaPackage();
        return (javaPackage.isEmpty() ? "" : javaPackage + ".") + getName() + "Grpc";
    }

    /**
     * @param method A method of this service.
     * @return The path gRPC uses for the method, e.g. "/hello_world.Greeter/SayHello".
     */
    @Nonnull
    public String getWirePath(@Nonnull final ServiceMethodDescriptor method) {
        return "/" + getQualifiedProtoName() + "/" + method.getName();
    }
}
