package com.vmturbo.protoc.http.bridge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import javax.annotation.Nonnull;

import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Type;
import com.google.protobuf.compiler.PluginProtos.CodeGeneratorResponse.File;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.stringtemplate.v4.ST;

import com.vmturbo.protoc.http.bridge.enums.EnumCodecGenerator;
import com.vmturbo.protoc.http.bridge.enums.EnumFieldExtractor;
import com.vmturbo.protoc.http.bridge.enums.FieldBinding;
import com.vmturbo.protoc.http.bridge.generator.EnumDescriptor;
import com.vmturbo.protoc.http.bridge.generator.FieldDescriptor;
import com.vmturbo.protoc.http.bridge.generator.FileDescriptorProcessingContext;
import com.vmturbo.protoc.http.bridge.generator.GeneratorOptions;
import com.vmturbo.protoc.http.bridge.generator.MessageDescriptor;
import com.vmturbo.protoc.http.bridge.generator.ProtocPluginCodeGenerator;
import com.vmturbo.protoc.http.bridge.generator.ServiceDescriptor;
import com.vmturbo.protoc.http.bridge.json.DtoTypeResolver;
import com.vmturbo.protoc.http.bridge.json.Omission;
import com.vmturbo.protoc.http.bridge.json.OmissionAnnotator;
import com.vmturbo.protoc.http.bridge.naming.EnumTypePathResolver.NestedPathStyle;
import com.vmturbo.protoc.http.bridge.naming.IdentifierCase;
import com.vmturbo.protoc.http.bridge.route.ErrorEnvelopeGenerator;
import com.vmturbo.protoc.http.bridge.route.RouteGenerator;

/**
 * An implementation of {@link ProtocPluginCodeGenerator} that makes gRPC services reachable
 * over HTTP/JSON. For every .proto file it generates a class with a JSON transfer object per
 * message and a Spring WebMvc route function per service. Every Java package also gets the
 * error body of its routes and, with string enums enabled, the JSON codecs of its enum fields.
 */
class HttpBridgeCodeGenerator extends ProtocPluginCodeGenerator {

    private static final Logger logger = LogManager.getLogger();

    private final EnumFieldExtractor enumFieldExtractor = new EnumFieldExtractor(NestedPathStyle.JAVA);

    private final OmissionAnnotator omissionAnnotator = new OmissionAnnotator();

    private final DtoTypeResolver dtoTypeResolver = new DtoTypeResolver(this::generatePluginJavaClass);

    private final RouteGenerator routeGenerator = new RouteGenerator(dtoTypeResolver);

    private final EnumCodecGenerator enumCodecGenerator = new EnumCodecGenerator(getPluginName());

    private final ErrorEnvelopeGenerator errorEnvelopeGenerator = new ErrorEnvelopeGenerator(getPluginName());

    private boolean enableStringEnums = false;

    /**
     * Bindings of every generated enum field, by qualified proto field name.
     */
    private final Map<String, FieldBinding> bindingsByField = new HashMap<>();

    /**
     * Bindings of every Java package, in traversal order.
     */
    private final Map<String, List<FieldBinding>> bindingsByPackage = new HashMap<>();

    /**
     * {@inheritDoc}
     */
    @Override
    @Nonnull
    protected String getPluginName() {
        return "protoc-http-bridge";
    }

    /**
     * {@inheritDoc}
     */
    @Override
    @Nonnull
    protected String generatePluginJavaClass(@Nonnull final String protoJavaClass) {
        return protoJavaClass + "Http";
    }

    /**
     * {@inheritDoc}
     */
    @Override
    @Nonnull
    protected String generateImports() {
        return HttpBridgeTemplates.imports();
    }

    /**
     * Bind the enum fields of every Java package, so that codec names are known (and unique)
     * before any transfer object refers to them.
     */
    @Override
    protected void beforeGeneration(@Nonnull final GeneratorOptions options,
                                    @Nonnull final List<FileDescriptorProcessingContext> filesToGenerate) {
        enableStringEnums = options.isEnableStringEnums();
        bindingsByField.clear();
        bindingsByPackage.clear();
        if (!enableStringEnums) {
            return;
        }
        final Map<String, List<MessageDescriptor>> messagesByPackage = new HashMap<>();
        filesToGenerate.forEach(file -> messagesByPackage
                .computeIfAbsent(file.getJavaPackage(), pkg -> new ArrayList<>())
                .addAll(file.getMessageDescriptors()));
        messagesByPackage.forEach((javaPackage, messages) -> {
            final List<FieldBinding> bindings = enumFieldExtractor.extractAll(messages);
            logger.debug("Bound {} enum fields in package {}", bindings.size(), javaPackage);
            bindingsByPackage.put(javaPackage, bindings);
            bindings.forEach(binding -> bindingsByField.put(binding.getQualifiedFieldName(), binding));
        });
    }

    /**
     * {@inheritDoc}
     */
    @Override
    @Nonnull
    protected List<File> generatePackageFiles(@Nonnull final String javaPackage,
                                              @Nonnull final List<FileDescriptorProcessingContext> files) {
        final List<File> packageFiles = new ArrayList<>();
        files.stream()
                .filter(file -> file.getServiceDescriptors().stream()
                        .anyMatch(service -> !service.getMethodDescriptors().isEmpty()))
                .findFirst()
                .ifPresent(file -> packageFiles.add(errorEnvelopeGenerator.generate(file)));

        final List<FieldBinding> bindings =
                bindingsByPackage.getOrDefault(javaPackage, Collections.emptyList());
        if (enableStringEnums && !bindings.isEmpty()) {
            packageFiles.add(enumCodecGenerator.generate(files.get(0), bindings));
        }
        return packageFiles;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    @Nonnull
    protected Optional<String> generateServiceCode(@Nonnull final ServiceDescriptor serviceDescriptor) {
        return routeGenerator.generateRoutes(serviceDescriptor);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    @Nonnull
    protected Optional<String> generateMessageCode(@Nonnull final MessageDescriptor messageDescriptor) {
        logger.debug("Generating transfer object for {}", messageDescriptor.getQualifiedProtoName());
        final String className = messageDescriptor.getName();
        final ST template = HttpBridgeTemplates.message()
                .add("className", className)
                .add("originalProtoType", messageDescriptor.getQualifiedOriginalName())
                .add("fieldDeclarations", messageDescriptor.getFieldDescriptors().stream()
                        .map(this::generateFieldDeclaration)
                        .collect(Collectors.toList()))
                .add("nestedDefinitions", messageDescriptor.getNestedMessages().stream()
                        .filter(nested -> !nested.isMapEntry())
                        .map(this::generateMessageCode)
                        .filter(Optional::isPresent)
                        .map(Optional::get)
                        .collect(Collectors.toList()))
                .add("setBuilderFields", messageDescriptor.getFieldDescriptors().stream()
                        .map(this::addFieldToProtoBuilder)
                        .collect(Collectors.toList()))
                .add("setDtoFields", messageDescriptor.getFieldDescriptors().stream()
                        .map(field -> addFieldSetFromProto(messageDescriptor, field))
                        .collect(Collectors.toList()));
        final String javadoc = HttpBridgeTemplates.javadoc(messageDescriptor.getComment());
        if (!javadoc.isEmpty()) {
            template.add("javadoc", javadoc);
        }
        return Optional.of(template.render());
    }

    @Nonnull
    private String generateFieldDeclaration(@Nonnull final FieldDescriptor fieldDescriptor) {
        final List<String> annotations = new ArrayList<>();
        annotations.add("@JsonProperty(\"" + fieldDescriptor.getName() + "\")");
        if (enableStringEnums) {
            omissionAnnotator.getOmission(fieldDescriptor)
                    .map(Omission::getAnnotation)
                    .ifPresent(annotations::add);
            final FieldBinding binding = bindingsByField.get(fieldDescriptor.getQualifiedProtoName());
            if (binding != null) {
                annotations.add("@JsonSerialize(using = "
                        + EnumCodecGenerator.getSerializerReference(binding) + ".class)");
                annotations.add("@JsonDeserialize(using = "
                        + EnumCodecGenerator.getDeserializerReference(binding) + ".class)");
            }
        }

        final ST template = HttpBridgeTemplates.fieldDeclaration()
                .add("annotations", annotations)
                .add("type", dtoTypeResolver.getFieldType(fieldDescriptor))
                .add("name", fieldDescriptor.getJavaName());
        dtoTypeResolver.getInitializer(fieldDescriptor)
                .ifPresent(initializer -> template.add("initializer", initializer));
        final String javadoc = HttpBridgeTemplates.javadoc(fieldDescriptor.getComment());
        if (!javadoc.isEmpty()) {
            template.add("javadoc", javadoc);
        }
        return template.render();
    }

    /**
     * Generate code to add this field to the builder that creates
     * a protobuf object from the generated Java object.
     *
     * @return The generated code string.
     */
    @Nonnull
    private String addFieldToProtoBuilder(@Nonnull final FieldDescriptor fieldDescriptor) {
        final FieldDescriptor valueField = getValueField(fieldDescriptor);
        final boolean bulk = isIdentityConversion(valueField);
        final boolean element = fieldDescriptor.isRepeated();
        return HttpBridgeTemplates.addFieldToProtoBuilder()
                .add("name", fieldDescriptor.getJavaName())
                .add("accessor", getAccessor(fieldDescriptor, valueField, bulk || !element))
                .add("element", toProtoElement(valueField, element ? "v" : "this." + fieldDescriptor.getJavaName()))
                .add("isMap", fieldDescriptor.isMapField())
                .add("isList", fieldDescriptor.isList())
                .add("isNullable", dtoTypeResolver.isNullable(fieldDescriptor))
                .add("bulk", bulk)
                .render();
    }

    /**
     * Generate code to set this field in the generated Java
     * object from a protobuf object.
     *
     * @return The generated code string.
     */
    @Nonnull
    private String addFieldSetFromProto(@Nonnull final MessageDescriptor messageDescriptor,
                                        @Nonnull final FieldDescriptor fieldDescriptor) {
        final FieldDescriptor valueField = getValueField(fieldDescriptor);
        final boolean bulk = isIdentityConversion(valueField);
        final boolean element = fieldDescriptor.isRepeated();
        final String accessor = getAccessor(fieldDescriptor, valueField, bulk || !element);
        final ST template = HttpBridgeTemplates.setFieldFromProto()
                .add("name", fieldDescriptor.getJavaName())
                .add("accessor", accessor)
                .add("element", fromProtoElement(valueField, element ? "v" : "proto.get" + accessor + "()"))
                .add("isMap", fieldDescriptor.isMapField())
                .add("isList", fieldDescriptor.isList())
                .add("bulk", bulk);
        getPresenceCheck(messageDescriptor, fieldDescriptor)
                .ifPresent(presence -> template.add("presence", presence));
        return template.render();
    }

    /**
     * @return The field holding the values of a field: the value of a map entry, or the field
     *         itself.
     */
    @Nonnull
    private FieldDescriptor getValueField(@Nonnull final FieldDescriptor fieldDescriptor) {
        if (fieldDescriptor.isMapField()) {
            return fieldDescriptor.getContentMessage()
                    .map(MessageDescriptor::getMapValue)
                    .orElseThrow(() -> new IllegalStateException("Content message not present in map field."));
        }
        return fieldDescriptor;
    }

    /**
     * The accessor suffix of a field. Open enums are read and written by wire value, through
     * the "Value" accessors protoc generates for them.
     */
    @Nonnull
    private String getAccessor(@Nonnull final FieldDescriptor fieldDescriptor,
                               @Nonnull final FieldDescriptor valueField,
                               final boolean byWireValue) {
        final boolean openEnum = valueField.getContentEnum()
                .map(enumDescriptor -> !enumDescriptor.isClosed())
                .orElse(false);
        return fieldDescriptor.getAccessorSuffix() + (openEnum && byWireValue ? "Value" : "");
    }

    /**
     * @return True if values are stored in the transfer object as protoc's accessors take them,
     *         so that whole collections can be copied.
     */
    private boolean isIdentityConversion(@Nonnull final FieldDescriptor valueField) {
        switch (valueField.getType()) {
            case TYPE_BYTES:
            case TYPE_MESSAGE:
            case TYPE_GROUP:
                return false;
            case TYPE_ENUM:
                return valueField.getContentEnum()
                        .map(enumDescriptor -> !enumDescriptor.isClosed())
                        .orElse(false);
            default:
                return true;
        }
    }

    @Nonnull
    private String toProtoElement(@Nonnull final FieldDescriptor valueField, @Nonnull final String value) {
        switch (valueField.getType()) {
            case TYPE_BYTES:
                return "ByteString.copyFrom(" + value + ")";
            case TYPE_MESSAGE:
            case TYPE_GROUP:
                return value + ".toProto()";
            case TYPE_ENUM:
                final EnumDescriptor enumDescriptor = valueField.getContentEnum().get();
                if (enumDescriptor.isClosed()) {
                    return "ClosedEnumValues.forNumber(" + value + ", "
                            + enumDescriptor.getQualifiedOriginalName() + "::forNumber, \""
                            + enumDescriptor.getQualifiedProtoName() + "\")";
                }
                return value;
            default:
                return value;
        }
    }

    @Nonnull
    private String fromProtoElement(@Nonnull final FieldDescriptor valueField, @Nonnull final String value) {
        switch (valueField.getType()) {
            case TYPE_BYTES:
                return value + ".toByteArray()";
            case TYPE_MESSAGE:
            case TYPE_GROUP:
                return dtoTypeResolver.getDtoClassName(valueField.getContentMessage().get())
                        + ".fromProto(" + value + ")";
            case TYPE_ENUM:
                final boolean closed = valueField.getContentEnum().get().isClosed();
                return closed ? value + ".getNumber()" : value;
            default:
                return value;
        }
    }

    /**
     * @return The condition under which a singular field is copied from the protobuf message,
     *         for fields whose absence is kept as null in the transfer object.
     */
    @Nonnull
    private Optional<String> getPresenceCheck(@Nonnull final MessageDescriptor messageDescriptor,
                                              @Nonnull final FieldDescriptor fieldDescriptor) {
        if (fieldDescriptor.isRepeated()) {
            return Optional.empty();
        }
        final Optional<Integer> oneofIndex = fieldDescriptor.getOneofIndex();
        if (oneofIndex.isPresent()) {
            final String oneofCase = IdentifierCase.toProtoCamelCase(messageDescriptor.getDescriptorProto()
                    .getOneofDecl(oneofIndex.get()).getName(), true) + "Case";
            return Optional.of("proto.get" + oneofCase + "() == "
                    + messageDescriptor.getQualifiedOriginalName() + "." + oneofCase + "."
                    + fieldDescriptor.getName().toUpperCase(Locale.ROOT));
        }
        if (fieldDescriptor.hasExplicitPresence()
                || fieldDescriptor.getType() == Type.TYPE_MESSAGE
                || fieldDescriptor.getType() == Type.TYPE_GROUP) {
            return Optional.of("proto.has" + fieldDescriptor.getAccessorSuffix() + "()");
        }
        return Optional.empty();
    }
}
