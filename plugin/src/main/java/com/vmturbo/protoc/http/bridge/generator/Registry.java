package com.vmturbo.protoc.http.bridge.generator;

import java.util.HashMap;
import java.util.Map;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableList;
import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.ServiceDescriptorProto;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The registry keeps track of already-processed descriptors.
 * Since there are links between the different descriptors (when they
 * reference other messages and/or packages) we need a central place to
 * index descriptor information. This is that place.
 */
public class Registry {

    private static final Logger logger = LogManager.getLogger();

    private final Map<String, AbstractDescriptor> descriptorMap = new HashMap<>();

    /**
     * Register the enums, messages and services of a file, adding the top-level ones to the
     * file's context.
     *
     * @param context The context of the file.
     */
    public void registerFile(@Nonnull final FileDescriptorProcessingContext context) {
        final FileDescriptorProto fileDescriptorProto = context.getFileDescriptorProto();
        logger.debug("Registering messages in file: {} in package: {}",
                fileDescriptorProto.getName(),
                fileDescriptorProto.getPackage());

        context.startEnumList();
        for (int enumIdx = 0; enumIdx < fileDescriptorProto.getEnumTypeCount(); ++enumIdx) {
            context.startListElement(enumIdx);
            context.addEnumDescriptor(registerEnum(context, fileDescriptorProto.getEnumType(enumIdx)));
            context.endListElement();
        }
        context.endEnumList();

        context.startMessageList();
        for (int msgIdx = 0; msgIdx < fileDescriptorProto.getMessageTypeCount(); ++msgIdx) {
            context.startListElement(msgIdx);
            context.addMessageDescriptor(registerMessage(context, fileDescriptorProto.getMessageType(msgIdx)));
            context.endListElement();
        }
        context.endMessageList();

        context.startServiceList();
        for (int svcIdx = 0; svcIdx < fileDescriptorProto.getServiceCount(); ++svcIdx) {
            context.startListElement(svcIdx);
            context.addServiceDescriptor(registerService(context, fileDescriptorProto.getService(svcIdx)));
            context.endListElement();
        }
        context.endServiceList();
    }

    @Nonnull
    ServiceDescriptor registerService(@Nonnull final FileDescriptorProcessingContext context,
                                      @Nonnull final ServiceDescriptorProto serviceDescriptor) {
        final ServiceDescriptor descriptor = new ServiceDescriptor(context, serviceDescriptor);
        descriptorMap.put(descriptor.getQualifiedProtoName(), descriptor);
        return descriptor;
    }

    @Nonnull
    EnumDescriptor registerEnum(@Nonnull final FileDescriptorProcessingContext context,
                                @Nonnull final EnumDescriptorProto enumDescriptor) {
        final EnumDescriptor descriptor = new EnumDescriptor(context, enumDescriptor);
        descriptorMap.put(descriptor.getQualifiedProtoName(), descriptor);
        return descriptor;
    }

    @Nonnull
    MessageDescriptor registerMessage(@Nonnull final FileDescriptorProcessingContext context,
                                      @Nonnull final DescriptorProto descriptorProto) {
        final ImmutableList.Builder<AbstractDescriptor> childrenBuilder = new ImmutableList.Builder<>();

        // Processing the messages, need to include that in the path.
        context.startNestedMessageList(descriptorProto.getName());
        for (int i = 0; i < descriptorProto.getNestedTypeCount(); ++i) {
            context.startListElement(i);
            childrenBuilder.add(registerMessage(context, descriptorProto.getNestedType(i)));
            context.endListElement();
        }
        context.endNestedMessageList();

        context.startNestedEnumList(descriptorProto.getName());
        for (int nestedEnumIdx = 0; nestedEnumIdx < descriptorProto.getEnumTypeCount(); ++nestedEnumIdx) {
            context.startListElement(nestedEnumIdx);
            childrenBuilder.add(registerEnum(context, descriptorProto.getEnumType(nestedEnumIdx)));
            context.endListElement();
        }
        context.endNestedEnumList();

        final MessageDescriptor typeDescriptor =
                new MessageDescriptor(context, descriptorProto, childrenBuilder.build());
        descriptorMap.put(typeDescriptor.getQualifiedProtoName(), typeDescriptor);
        return typeDescriptor;
    }

    /**
     * Gets a message descriptor in the registry by name.
     * Since we should never try to retrieve descriptors that we haven't processed
     * this method throws a runtime exception if the descriptor is not registered.
     *
     * @param name The fully qualified name of the message, with or without the leading "."
     *             protoc uses in type references (e.g. .testPkg.TestMessage).
     * @return The descriptor associated with the name.
     * @throws IllegalStateException If no message with that name is registered.
     */
    @Nonnull
    public MessageDescriptor getMessageDescriptor(@Nonnull final String name) {
        return getDescriptor(name, MessageDescriptor.class);
    }

    /**
     * Gets an enum descriptor in the registry by name.
     *
     * @param name The fully qualified name of the enum, with or without the leading ".".
     * @return The descriptor associated with the name.
     * @throws IllegalStateException If no enum with that name is registered.
     */
    @Nonnull
    public EnumDescriptor getEnumDescriptor(@Nonnull final String name) {
        return getDescriptor(name, EnumDescriptor.class);
    }

    @Nonnull
    private <T extends AbstractDescriptor> T getDescriptor(@Nonnull final String name,
                                                           @Nonnull final Class<T> type) {
        final AbstractDescriptor result = descriptorMap.get(StringUtils.removeStart(name, "."));
        if (result == null) {
            throw new IllegalStateException("Descriptor " + name
                    + " is not present in the registry.");
        }
        if (!type.isInstance(result)) {
            throw new IllegalStateException("Descriptor " + name + " is a "
                    + result.getClass().getSimpleName() + ", not a " + type.getSimpleName());
        }
        return type.cast(result);
    }
}
