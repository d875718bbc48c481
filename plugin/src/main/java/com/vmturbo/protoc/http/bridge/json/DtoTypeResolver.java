package com.vmturbo.protoc.http.bridge.json;

import java.util.Optional;
import java.util.function.UnaryOperator;

import javax.annotation.Nonnull;

import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Type;

import com.vmturbo.protoc.http.bridge.generator.FieldDescriptor;
import com.vmturbo.protoc.http.bridge.generator.FileDescriptorProcessingContext;
import com.vmturbo.protoc.http.bridge.generator.MessageDescriptor;
import com.vmturbo.protoc.http.bridge.generator.ProtocGenerationException;

/**
 * Maps proto types to the Java types of the JSON transfer objects.
 * <p>
 * Scalars become primitives (boxed when the field tracks presence), enums stay wire integers,
 * messages become the transfer object generated for them, repeated fields become lists and
 * map fields become maps.
 */
public class DtoTypeResolver {

    /**
     * The runtime transfer object of {@code google.protobuf.Empty}.
     */
    public static final String EMPTY_BODY = "com.vmturbo.protoc.http.bridge.runtime.json.EmptyBody";

    private static final String EMPTY_MESSAGE = "google.protobuf.Empty";

    private final UnaryOperator<String> pluginClassNamer;

    /**
     * @param pluginClassNamer Maps the outer class protoc generates for a file to the class
     *                         holding the transfer objects of the file.
     */
    public DtoTypeResolver(@Nonnull final UnaryOperator<String> pluginClassNamer) {
        this.pluginClassNamer = pluginClassNamer;
    }

    /**
     * @param message A message.
     * @return The fully qualified name of the transfer object of the message.
     * @throws ProtocGenerationException If no transfer object is generated for the message.
     */
    @Nonnull
    public String getDtoClassName(@Nonnull final MessageDescriptor message) {
        if (EMPTY_MESSAGE.equals(message.getQualifiedProtoName())) {
            return EMPTY_BODY;
        }
        final FileDescriptorProcessingContext context = message.getContext();
        if (!context.isGenerated()) {
            throw new ProtocGenerationException("Message " + message.getQualifiedProtoName()
                    + " is declared in " + context + ", which is not in the files to generate.");
        }
        final String javaPackage = context.getJavaPackage();
        return (javaPackage.isEmpty() ? "" : javaPackage + ".")
                + pluginClassNamer.apply(context.getOuterClassName()) + "."
                + message.getNameWithinOuterClass();
    }

    /**
     * @param field A field of a message.
     * @return The Java type of the field in the transfer object.
     */
    @Nonnull
    public String getFieldType(@Nonnull final FieldDescriptor field) {
        if (field.isMapField()) {
            final MessageDescriptor entry = field.getContentMessage().get();
            return "Map<" + getElementType(entry.getMapKey()) + ", "
                    + getElementType(entry.getMapValue()) + ">";
        } else if (field.isRepeated()) {
            return "List<" + getElementType(field) + ">";
        } else if (field.hasExplicitPresence()) {
            return getElementType(field);
        } else {
            return getValueType(field, false);
        }
    }

    /**
     * @param field A field of a message.
     * @return The expression the field of a new transfer object is initialized with, if any.
     */
    @Nonnull
    public Optional<String> getInitializer(@Nonnull final FieldDescriptor field) {
        if (field.isMapField()) {
            return Optional.of("new LinkedHashMap<>()");
        } else if (field.isRepeated()) {
            return Optional.of("new ArrayList<>()");
        } else if (field.hasExplicitPresence()) {
            return Optional.empty();
        } else if (field.getType() == Type.TYPE_STRING) {
            return Optional.of("\"\"");
        } else if (field.getType() == Type.TYPE_BYTES) {
            return Optional.of("new byte[0]");
        }
        return Optional.empty();
    }

    /**
     * @param field A field of a message.
     * @return True if the Java field of the transfer object can hold null.
     */
    public boolean isNullable(@Nonnull final FieldDescriptor field) {
        if (field.isRepeated() || field.hasExplicitPresence()) {
            return true;
        }
        switch (field.getType()) {
            case TYPE_STRING:
            case TYPE_BYTES:
            case TYPE_MESSAGE:
            case TYPE_GROUP:
                return true;
            default:
                return false;
        }
    }

    @Nonnull
    private String getElementType(@Nonnull final FieldDescriptor field) {
        return getValueType(field, true);
    }

    @Nonnull
    private String getValueType(@Nonnull final FieldDescriptor field, final boolean boxed) {
        switch (field.getType()) {
            case TYPE_DOUBLE:
                return boxed ? "Double" : "double";
            case TYPE_FLOAT:
                return boxed ? "Float" : "float";
            case TYPE_INT64:
            case TYPE_UINT64:
            case TYPE_SINT64:
            case TYPE_FIXED64:
            case TYPE_SFIXED64:
                return boxed ? "Long" : "long";
            case TYPE_INT32:
            case TYPE_UINT32:
            case TYPE_SINT32:
            case TYPE_FIXED32:
            case TYPE_SFIXED32:
            case TYPE_ENUM:
                return boxed ? "Integer" : "int";
            case TYPE_BOOL:
                return boxed ? "Boolean" : "boolean";
            case TYPE_STRING:
                return "String";
            case TYPE_BYTES:
                return "byte[]";
            case TYPE_MESSAGE:
            case TYPE_GROUP:
                return getDtoClassName(field.getContentMessage().get());
            default:
                throw new IllegalStateException("Unhandled field type " + field.getType()
                        + " of field " + field.getQualifiedProtoName());
        }
    }
}
