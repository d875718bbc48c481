package com.vmturbo.protoc.http.bridge.generator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableList;
import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileOptions;
import com.google.protobuf.DescriptorProtos.SourceCodeInfo.Location;

import org.apache.commons.lang3.StringUtils;

import com.vmturbo.protoc.http.bridge.naming.IdentifierCase;

/**
 * Holds the state of processing a single .proto file: the Java location protoc assigns to the
 * file's classes, the position of the descriptor currently being processed (to find its
 * comments in the source info), and the enclosing messages of that descriptor.
 * <p>
 * The path follows the field numbers of descriptor.proto, e.g. [4, 0, 2, 1] is the second field
 * of the first message in the file.
 */
public class FileDescriptorProcessingContext {

    private static final int FILE_MESSAGE_TYPE = 4;
    private static final int FILE_ENUM_TYPE = 5;
    private static final int FILE_SERVICE = 6;
    private static final int MESSAGE_FIELD = 2;
    private static final int MESSAGE_NESTED_TYPE = 3;
    private static final int MESSAGE_ENUM_TYPE = 4;
    private static final int SERVICE_METHOD = 2;

    private final Registry registry;

    private final FileDescriptorProto fileDescriptorProto;

    private final boolean generated;

    private final String javaPackage;

    private final String outerClassName;

    private final Map<List<Integer>, String> commentsByPath = new HashMap<>();

    private final Deque<Integer> path = new ArrayDeque<>();

    private final Deque<String> outerMessages = new ArrayDeque<>();

    private final List<MessageDescriptor> messageDescriptors = new ArrayList<>();

    private final List<EnumDescriptor> enumDescriptors = new ArrayList<>();

    private final List<ServiceDescriptor> serviceDescriptors = new ArrayList<>();

    public FileDescriptorProcessingContext(@Nonnull final Registry registry,
                                           @Nonnull final FileDescriptorProto fileDescriptorProto,
                                           final boolean generated) {
        this.registry = registry;
        this.fileDescriptorProto = fileDescriptorProto;
        this.generated = generated;

        final FileOptions options = fileDescriptorProto.getOptions();
        this.javaPackage = options.hasJavaPackage()
                ? options.getJavaPackage() : fileDescriptorProto.getPackage();
        this.outerClassName = options.hasJavaOuterClassname()
                ? options.getJavaOuterClassname() : deriveOuterClassName(fileDescriptorProto);

        for (Location location : fileDescriptorProto.getSourceCodeInfo().getLocationList()) {
            String comment = location.getLeadingComments().trim();
            if (comment.isEmpty()) {
                comment = location.getTrailingComments().trim();
            }
            if (!comment.isEmpty()) {
                commentsByPath.put(ImmutableList.copyOf(location.getPathList()), comment);
            }
        }
    }

    /**
     * The outer class name protoc uses when none is configured: the camel-cased base name of
     * the file, suffixed with "OuterClass" when a type in the file has the same name.
     */
    @Nonnull
    private static String deriveOuterClassName(@Nonnull final FileDescriptorProto file) {
        final String baseName = StringUtils.removeEnd(
                StringUtils.substringAfterLast("/" + file.getName(), "/"), ".proto");
        final String className = IdentifierCase.toProtoCamelCase(baseName, true);
        final boolean conflict = file.getEnumTypeList().stream()
                    .anyMatch(enumType -> enumType.getName().equals(className))
                || file.getServiceList().stream()
                    .anyMatch(service -> service.getName().equals(className))
                || file.getMessageTypeList().stream()
                    .anyMatch(message -> hasConflictingName(message, className));
        return conflict ? className + "OuterClass" : className;
    }

    private static boolean hasConflictingName(@Nonnull final DescriptorProto message,
                                              @Nonnull final String className) {
        return message.getName().equals(className)
                || message.getEnumTypeList().stream()
                    .anyMatch(enumType -> enumType.getName().equals(className))
                || message.getNestedTypeList().stream()
                    .anyMatch(nested -> hasConflictingName(nested, className));
    }

    @Nonnull
    public Registry getRegistry() {
        return registry;
    }

    @Nonnull
    public FileDescriptorProto getFileDescriptorProto() {
        return fileDescriptorProto;
    }

    /**
     * @return True if the file was listed in the request's files to generate, false if it is
     *         only present as a dependency.
     */
    public boolean isGenerated() {
        return generated;
    }

    @Nonnull
    public String getProtoPackage() {
        return fileDescriptorProto.getPackage();
    }

    @Nonnull
    public String getJavaPackage() {
        return javaPackage;
    }

    @Nonnull
    public String getOuterClassName() {
        return outerClassName;
    }

    /**
     * @return The prefix of the Java names of the classes protoc generates for this file, e.g.
     *         "hello_world.HelloWorld." or just "hello_world." with java_multiple_files.
     */
    @Nonnull
    public String getJavaClassPrefix() {
        final String packagePrefix = javaPackage.isEmpty() ? "" : javaPackage + ".";
        return fileDescriptorProto.getOptions().getJavaMultipleFiles()
                ? packagePrefix : packagePrefix + outerClassName + ".";
    }

    public boolean isProto3Syntax() {
        return !fileDescriptorProto.getSyntax().isEmpty()
                && !"proto2".equals(fileDescriptorProto.getSyntax());
    }

    /**
     * @param className A class name in the Java package of this file.
     * @return The path of the source file for the class, relative to the output directory.
     */
    @Nonnull
    public String getJavaFileName(@Nonnull final String className) {
        final String directory = javaPackage.isEmpty() ? "" : javaPackage.replace('.', '/') + "/";
        return directory + className + ".java";
    }

    /**
     * @return The names of the messages enclosing the descriptor being processed, outermost first.
     */
    @Nonnull
    public List<String> getOuterMessages() {
        return ImmutableList.copyOf(outerMessages);
    }

    /**
     * @return The comment attached to the descriptor being processed, or an empty string.
     */
    @Nonnull
    public String getCurrentComment() {
        return commentsByPath.getOrDefault(ImmutableList.copyOf(path), "");
    }

    /**
     * @return The top-level messages of the file, in declaration order.
     */
    @Nonnull
    public List<MessageDescriptor> getMessageDescriptors() {
        return Collections.unmodifiableList(messageDescriptors);
    }

    /**
     * @return The top-level enums of the file, in declaration order.
     */
    @Nonnull
    public List<EnumDescriptor> getEnumDescriptors() {
        return Collections.unmodifiableList(enumDescriptors);
    }

    @Nonnull
    public List<ServiceDescriptor> getServiceDescriptors() {
        return Collections.unmodifiableList(serviceDescriptors);
    }

    void addMessageDescriptor(@Nonnull final MessageDescriptor descriptor) {
        messageDescriptors.add(descriptor);
    }

    void addEnumDescriptor(@Nonnull final EnumDescriptor descriptor) {
        enumDescriptors.add(descriptor);
    }

    void addServiceDescriptor(@Nonnull final ServiceDescriptor descriptor) {
        serviceDescriptors.add(descriptor);
    }

    public void startMessageList() {
        path.addLast(FILE_MESSAGE_TYPE);
    }

    public void endMessageList() {
        path.removeLast();
    }

    public void startEnumList() {
        path.addLast(FILE_ENUM_TYPE);
    }

    public void endEnumList() {
        path.removeLast();
    }

    public void startServiceList() {
        path.addLast(FILE_SERVICE);
    }

    public void endServiceList() {
        path.removeLast();
    }

    public void startNestedMessageList(@Nonnull final String parentName) {
        outerMessages.addLast(parentName);
        path.addLast(MESSAGE_NESTED_TYPE);
    }

    public void endNestedMessageList() {
        path.removeLast();
        outerMessages.removeLast();
    }

    public void startNestedEnumList(@Nonnull final String parentName) {
        outerMessages.addLast(parentName);
        path.addLast(MESSAGE_ENUM_TYPE);
    }

    public void endNestedEnumList() {
        path.removeLast();
        outerMessages.removeLast();
    }

    public void startFieldList() {
        path.addLast(MESSAGE_FIELD);
    }

    public void endFieldList() {
        path.removeLast();
    }

    public void startServiceMethodList() {
        path.addLast(SERVICE_METHOD);
    }

    public void endServiceMethodList() {
        path.removeLast();
    }

    public void startListElement(final int index) {
        path.addLast(index);
    }

    public void endListElement() {
        path.removeLast();
    }

    @Override
    public String toString() {
        return fileDescriptorProto.getName();
    }
}
