package com.vmturbo.protoc.http.bridge.generator;

import java.util.List;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableList;

/**
 * Common information about a named descriptor (message, enum or service) in a .proto file.
 */
public abstract class AbstractDescriptor {

    protected final FileDescriptorProcessingContext context;

    private final String name;

    private final List<String> outerMessages;

    private final String comment;

    protected AbstractDescriptor(@Nonnull final FileDescriptorProcessingContext context,
                                 @Nonnull final String name) {
        this.context = context;
        this.name = name;
        this.outerMessages = context.getOuterMessages();
        this.comment = context.getCurrentComment();
    }

    /**
     * @return The name of the descriptor as it appears in the .proto file, e.g. "Status".
     */
    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public FileDescriptorProcessingContext getContext() {
        return context;
    }

    /**
     * @return The enclosing messages followed by the name, e.g. [Outer, Inner, Status].
     */
    @Nonnull
    public List<String> getNestedPath() {
        return ImmutableList.<String>builder().addAll(outerMessages).add(name).build();
    }

    /**
     * @return The name relative to the outer class (or package, with java_multiple_files),
     *         e.g. "Outer.Inner.Status".
     */
    @Nonnull
    public String getNameWithinOuterClass() {
        return String.join(".", getNestedPath());
    }

    /**
     * @return The fully qualified proto name without the leading dot, e.g. "pkg.Outer.Status".
     */
    @Nonnull
    public String getQualifiedProtoName() {
        final String protoPackage = context.getProtoPackage();
        return protoPackage.isEmpty()
                ? getNameWithinOuterClass() : protoPackage + "." + getNameWithinOuterClass();
    }

    /**
     * @return The fully qualified name of the Java class protoc generates for this descriptor.
     */
    @Nonnull
    public String getQualifiedOriginalName() {
        return context.getJavaClassPrefix() + getNameWithinOuterClass();
    }

    /**
     * @return The comment on the descriptor in the .proto file, or an empty string.
     */
    @Nonnull
    public String getComment() {
        return comment;
    }

    @Override
    public String toString() {
        return getQualifiedProtoName();
    }
}
