package com.vmturbo.protoc.http.bridge.enums;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableList;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.vmturbo.protoc.http.bridge.generator.EnumDescriptor;
import com.vmturbo.protoc.http.bridge.generator.FieldDescriptor;
import com.vmturbo.protoc.http.bridge.generator.MessageDescriptor;
import com.vmturbo.protoc.http.bridge.generator.ProtocGenerationException;
import com.vmturbo.protoc.http.bridge.naming.EnumTypePathResolver;
import com.vmturbo.protoc.http.bridge.naming.EnumTypePathResolver.NestedPathStyle;
import com.vmturbo.protoc.http.bridge.naming.IdentifierCase;

/**
 * Finds every enum-typed field of a message tree and binds it to its declared enum type.
 * <p>
 * Messages are walked depth first: the fields of a message come before the contents of its
 * nested messages, and siblings keep their declaration order. Map entry messages are not
 * descended into.
 */
public class EnumFieldExtractor {

    private static final Logger logger = LogManager.getLogger();

    private final NestedPathStyle pathStyle;

    /**
     * @param pathStyle The style of the resolved enum type paths of the bindings.
     */
    public EnumFieldExtractor(@Nonnull final NestedPathStyle pathStyle) {
        this.pathStyle = pathStyle;
    }

    /**
     * Extract the bindings of several top-level messages, e.g. all the messages of the files
     * that share a Java package.
     *
     * @param messages The top-level messages, in order.
     * @return The bindings, in traversal order.
     * @throws ProtocGenerationException If two bindings have the same field id or codec
     *         class name.
     */
    @Nonnull
    public List<FieldBinding> extractAll(@Nonnull final List<MessageDescriptor> messages) {
        final List<FieldBinding> bindings = new ArrayList<>();
        messages.forEach(message -> bindings.addAll(extract(message)));

        final Map<String, FieldBinding> bindingsById = new HashMap<>();
        final Map<String, FieldBinding> bindingsByClassName = new HashMap<>();
        for (FieldBinding binding : bindings) {
            final FieldBinding existing = bindingsById.putIfAbsent(binding.getFieldId(), binding);
            if (existing != null) {
                throw new ProtocGenerationException("Enum fields " + existing.getQualifiedFieldName()
                        + " and " + binding.getQualifiedFieldName() + " both map to field id "
                        + binding.getFieldId());
            }
            // Ids differing only in underscores camel-case to the same class name.
            checkClassName(bindingsByClassName, binding.getSerializerClassName(), binding);
            checkClassName(bindingsByClassName, binding.getDeserializerClassName(), binding);
        }
        return ImmutableList.copyOf(bindings);
    }

    private static void checkClassName(@Nonnull final Map<String, FieldBinding> bindingsByClassName,
                                       @Nonnull final String className,
                                       @Nonnull final FieldBinding binding) {
        final FieldBinding existing = bindingsByClassName.putIfAbsent(className, binding);
        if (existing != null) {
            throw new ProtocGenerationException("Enum fields " + existing.getQualifiedFieldName()
                    + " and " + binding.getQualifiedFieldName() + " both map to codec class "
                    + className);
        }
    }

    /**
     * Extract the bindings of a top-level message and all the messages nested in it.
     *
     * @param message The root message.
     * @return The bindings, in traversal order.
     */
    @Nonnull
    public List<FieldBinding> extract(@Nonnull final MessageDescriptor message) {
        final ImmutableList.Builder<FieldBinding> bindings = ImmutableList.builder();
        visitMessage(message, Optional.empty(), bindings);
        return bindings.build();
    }

    private void visitMessage(@Nonnull final MessageDescriptor message,
                              @Nonnull final Optional<String> parentPath,
                              @Nonnull final ImmutableList.Builder<FieldBinding> bindings) {
        final String messageWords = IdentifierCase.toWordCase(message.getName());
        final String currentPath = parentPath
                .map(parent -> parent + "_" + messageWords)
                .orElse(messageWords);

        for (FieldDescriptor field : message.getFieldDescriptors()) {
            final Optional<EnumDescriptor> enumType = field.getContentEnum();
            if (enumType.isPresent()) {
                final FieldBinding binding = bind(currentPath, field, enumType.get());
                logger.debug("Bound field {} to enum {}", field.getQualifiedProtoName(), binding.getEnumTypePath());
                bindings.add(binding);
            }
        }

        for (MessageDescriptor nested : message.getNestedMessages()) {
            if (!nested.isMapEntry()) {
                visitMessage(nested, Optional.of(currentPath), bindings);
            }
        }
    }

    @Nonnull
    private FieldBinding bind(@Nonnull final String messagePath,
                              @Nonnull final FieldDescriptor field,
                              @Nonnull final EnumDescriptor enumDescriptor) {
        final String enumTypePath = EnumTypePathResolver.resolveEnumTypePath(
                field.getProto().getTypeName(), pathStyle);

        // The resolver only sees the dotted reference. Check it against where the enum is
        // actually declared, since upper case package components look like messages.
        final List<String> nestedPath = enumDescriptor.getNestedPath();
        final String expectedPath = pathStyle.format(nestedPath.subList(0, nestedPath.size() - 1),
                enumDescriptor.getName());
        if (!expectedPath.equals(enumTypePath)) {
            throw new ProtocGenerationException("Enum type " + field.getProto().getTypeName()
                    + " of field " + field.getQualifiedProtoName()
                    + " cannot be resolved to a known module path (resolved " + enumTypePath
                    + ", declared as " + expectedPath + ")");
        }

        final String fieldId = messagePath + "_" + IdentifierCase.toWordCase(field.getName());
        return new FieldBinding(fieldId, enumTypePath, Cardinality.of(field), field, enumDescriptor);
    }
}
