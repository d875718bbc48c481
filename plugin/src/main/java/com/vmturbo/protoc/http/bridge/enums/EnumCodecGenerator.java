package com.vmturbo.protoc.http.bridge.enums;

import java.util.ArrayList;
import java.util.List;

import javax.annotation.Nonnull;

import com.google.protobuf.compiler.PluginProtos.CodeGeneratorResponse.File;

import org.stringtemplate.v4.ST;

import com.vmturbo.protoc.http.bridge.generator.FileDescriptorProcessingContext;

/**
 * Generates the JSON codecs of enum fields: one serializer class and one deserializer class
 * per {@link FieldBinding}, each bound to the enum type declared by the field. Wire values
 * of different enums overlap, so a codec never looks at any enum other than its own.
 * <p>
 * All the codecs of a Java package go into a single {@value #CLASS_NAME} class.
 */
public class EnumCodecGenerator {

    /**
     * The name of the generated class holding the codecs of a package.
     */
    public static final String CLASS_NAME = "JsonEnumCodecs";

    private static final String RUNTIME_PACKAGE = "com.vmturbo.protoc.http.bridge.runtime.json";

    private static final String FILE_TEMPLATE =
            "// Generated by $pluginName$. Do not edit!\n" +
            "$if(packageName)$\n" +
            "package $packageName$;\n" +
            "$endif$\n" +
            "\n" +
            "import $runtimePackage$.EnumValueDeserializer;\n" +
            "import $runtimePackage$.EnumValueSerializer;\n" +
            "import $runtimePackage$.OptionalEnumValueDeserializer;\n" +
            "import $runtimePackage$.RepeatedEnumValueDeserializer;\n" +
            "import $runtimePackage$.RepeatedEnumValueSerializer;\n" +
            "\n" +
            "/**\n" +
            " * JSON codecs of the enum fields in this package. Each codec converts between wire\n" +
            " * values and the names of exactly one enum type.\n" +
            " */\n" +
            "public final class $className$ {\n" +
            "\n" +
            "    private $className$() {}\n" +
            "\n" +
            "    $codecs; separator=\"\\n\\n\"$\n" +
            "}\n";

    private static final String CODEC_TEMPLATE =
            "/**\n" +
            " * $direction$ {@code $fieldName$} with the names of {@code $enumName$}.\n" +
            " */\n" +
            "public static final class $className$ extends $baseClass$ {\n" +
            "    public $className$() {\n" +
            "        super($enumType$.getDescriptor());\n" +
            "    }\n" +
            "}";

    private final String pluginName;

    public EnumCodecGenerator(@Nonnull final String pluginName) {
        this.pluginName = pluginName;
    }

    /**
     * @param binding A binding whose enum type path is in the Java style.
     * @return The Java class protoc generates for the bound enum.
     */
    @Nonnull
    public static String getJavaEnumType(@Nonnull final FieldBinding binding) {
        final FileDescriptorProcessingContext enumContext = binding.getEnumDescriptor().getContext();
        return enumContext.getJavaClassPrefix() + binding.getEnumTypePath();
    }

    /**
     * @param binding A binding in the package.
     * @return The name of the serializer class, relative to the package.
     */
    @Nonnull
    public static String getSerializerReference(@Nonnull final FieldBinding binding) {
        return CLASS_NAME + "." + binding.getSerializerClassName();
    }

    /**
     * @param binding A binding in the package.
     * @return The name of the deserializer class, relative to the package.
     */
    @Nonnull
    public static String getDeserializerReference(@Nonnull final FieldBinding binding) {
        return CLASS_NAME + "." + binding.getDeserializerClassName();
    }

    /**
     * Generate the codec class of a Java package.
     *
     * @param context Any of the generated files in the package, to locate the output.
     * @param bindings The bindings of all the messages in the package, with unique field ids.
     * @return The generated file.
     */
    @Nonnull
    public File generate(@Nonnull final FileDescriptorProcessingContext context,
                         @Nonnull final List<FieldBinding> bindings) {
        final List<String> codecs = new ArrayList<>(bindings.size() * 2);
        for (FieldBinding binding : bindings) {
            codecs.add(generateCodec(binding, binding.getSerializerClassName(),
                    serializerBaseClass(binding.getCardinality()), "Serializes"));
            codecs.add(generateCodec(binding, binding.getDeserializerClassName(),
                    deserializerBaseClass(binding.getCardinality()), "Deserializes"));
        }

        final ST template = new ST(FILE_TEMPLATE, '$', '$')
                .add("pluginName", pluginName)
                .add("runtimePackage", RUNTIME_PACKAGE)
                .add("className", CLASS_NAME)
                .add("codecs", codecs);
        if (!context.getJavaPackage().isEmpty()) {
            template.add("packageName", context.getJavaPackage());
        }
        return File.newBuilder()
                .setName(context.getJavaFileName(CLASS_NAME))
                .setContent(template.render())
                .build();
    }

    @Nonnull
    private String generateCodec(@Nonnull final FieldBinding binding,
                                 @Nonnull final String className,
                                 @Nonnull final String baseClass,
                                 @Nonnull final String direction) {
        return new ST(CODEC_TEMPLATE, '$', '$')
                .add("direction", direction)
                .add("fieldName", binding.getQualifiedFieldName())
                .add("enumName", binding.getQualifiedEnumName())
                .add("className", className)
                .add("baseClass", baseClass)
                .add("enumType", getJavaEnumType(binding))
                .render();
    }

    @Nonnull
    private static String serializerBaseClass(@Nonnull final Cardinality cardinality) {
        return cardinality == Cardinality.REPEATED ? "RepeatedEnumValueSerializer" : "EnumValueSerializer";
    }

    @Nonnull
    private static String deserializerBaseClass(@Nonnull final Cardinality cardinality) {
        switch (cardinality) {
            case OPTION:
                return "OptionalEnumValueDeserializer";
            case REPEATED:
                return "RepeatedEnumValueDeserializer";
            default:
                return "EnumValueDeserializer";
        }
    }
}
