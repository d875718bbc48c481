package com.vmturbo.protoc.http.bridge.generator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableSet;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.google.protobuf.compiler.PluginProtos.CodeGeneratorRequest;
import com.google.protobuf.compiler.PluginProtos.CodeGeneratorResponse;
import com.google.protobuf.compiler.PluginProtos.CodeGeneratorResponse.Feature;
import com.google.protobuf.compiler.PluginProtos.CodeGeneratorResponse.File;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.stringtemplate.v4.ST;

/**
 * Base class for protoc plugins that generate one Java class per .proto file, plus optional
 * files per Java package.
 * <p>
 * The protobuf compiler calls the plugin, passing a {@link CodeGeneratorRequest} message via
 * stdin, and expects the {@link CodeGeneratorResponse} message via stdout. Any failure is
 * reported through {@link CodeGeneratorResponse#getError()} so that protoc fails the build, and
 * no files are produced in that case.
 */
public abstract class ProtocPluginCodeGenerator {

    private static final Logger logger = LogManager.getLogger();

    private static final String FILE_TEMPLATE =
            "// Generated by $pluginName$ from $protoSourceName$. Do not edit!\n" +
            "$if(packageName)$\n" +
            "package $packageName$;\n" +
            "$endif$\n" +
            "\n" +
            "$imports$\n" +
            "\n" +
            "/**\n" +
            " * HTTP/JSON bindings for the messages and services in {@code $protoSourceName$}.\n" +
            " */\n" +
            "public final class $className$ {\n" +
            "\n" +
            "    private $className$() {}\n" +
            "\n" +
            "    $messageCode; separator=\"\\n\\n\"$\n" +
            "\n" +
            "    $serviceCode; separator=\"\\n\\n\"$\n" +
            "}\n";

    private final JavaSourceValidator validator = new JavaSourceValidator();

    /**
     * @return The name of the plugin, used in logs, errors and generated file headers.
     */
    @Nonnull
    protected abstract String getPluginName();

    /**
     * @param protoJavaClass The outer class protoc generates for a .proto file.
     * @return The name of the class this plugin generates for the same file.
     */
    @Nonnull
    protected abstract String generatePluginJavaClass(@Nonnull String protoJavaClass);

    /**
     * @return The import statements of every per-file class.
     */
    @Nonnull
    protected abstract String generateImports();

    /**
     * @param messageDescriptor A top-level message of a file being generated.
     * @return The code to put in the per-file class for the message, if any.
     */
    @Nonnull
    protected abstract Optional<String> generateMessageCode(@Nonnull MessageDescriptor messageDescriptor);

    /**
     * @param serviceDescriptor A service of a file being generated.
     * @return The code to put in the per-file class for the service, if any.
     */
    @Nonnull
    protected abstract Optional<String> generateServiceCode(@Nonnull ServiceDescriptor serviceDescriptor);

    /**
     * Called once every file of the request is registered, before any code is generated.
     *
     * @param options The options of the run.
     * @param filesToGenerate The files to generate code for, in request order.
     */
    protected void beforeGeneration(@Nonnull final GeneratorOptions options,
                                    @Nonnull final List<FileDescriptorProcessingContext> filesToGenerate) {
    }

    /**
     * Generate the files that exist once per Java package.
     *
     * @param javaPackage The Java package.
     * @param files The generated .proto files whose classes live in the package.
     * @return The files to add to the output.
     */
    @Nonnull
    protected List<File> generatePackageFiles(@Nonnull final String javaPackage,
                                              @Nonnull final List<FileDescriptorProcessingContext> files) {
        return Collections.emptyList();
    }

    /**
     * Read the request from stdin and write the response to stdout.
     *
     * @throws IOException If the streams cannot be read or written.
     */
    public void generate() throws IOException {
        final CodeGeneratorRequest request = CodeGeneratorRequest.parseFrom(System.in);
        generate(request).writeTo(System.out);
        System.out.flush();
    }

    /**
     * Generate the response for a request.
     *
     * @param request The request from protoc.
     * @return The generated files, or an error.
     */
    @Nonnull
    public CodeGeneratorResponse generate(@Nonnull final CodeGeneratorRequest request) {
        final CodeGeneratorResponse.Builder response = CodeGeneratorResponse.newBuilder()
                .setSupportedFeatures(Feature.FEATURE_PROTO3_OPTIONAL_VALUE);
        try {
            final List<File> files = generateFiles(request);
            logger.info("{} generated {} files for {} proto files.", getPluginName(),
                    files.size(), request.getFileToGenerateCount());
            return response.addAllFile(files).build();
        } catch (RuntimeException e) {
            logger.error(getPluginName() + " failed.", e);
            return response.setError(getPluginName() + ": " + e.getMessage()).build();
        }
    }

    @Nonnull
    private List<File> generateFiles(@Nonnull final CodeGeneratorRequest request) {
        final GeneratorOptions options = GeneratorOptions.parse(request.getParameter());
        final Set<String> toGenerate = ImmutableSet.copyOf(request.getFileToGenerateList());

        // The request presents the proto file descriptors in topological order
        // w.r.t. dependencies - i.e. the dependencies appear before the dependents.
        // Everything is registered before generating so that lookups never depend on order.
        final Registry registry = new Registry();
        final List<FileDescriptorProcessingContext> filesToGenerate = new ArrayList<>();
        for (FileDescriptorProto fileDescriptorProto : request.getProtoFileList()) {
            final FileDescriptorProcessingContext context = new FileDescriptorProcessingContext(
                    registry, fileDescriptorProto, toGenerate.contains(fileDescriptorProto.getName()));
            registry.registerFile(context);
            if (context.isGenerated()) {
                filesToGenerate.add(context);
            }
        }

        beforeGeneration(options, filesToGenerate);

        final List<File> files = new ArrayList<>();
        final Map<String, List<FileDescriptorProcessingContext>> filesByPackage = new LinkedHashMap<>();
        for (FileDescriptorProcessingContext context : filesToGenerate) {
            generateFile(context).ifPresent(files::add);
            filesByPackage.computeIfAbsent(context.getJavaPackage(), pkg -> new ArrayList<>())
                    .add(context);
        }
        filesByPackage.forEach((javaPackage, packageFiles) ->
                files.addAll(generatePackageFiles(javaPackage, packageFiles)));

        files.forEach(file -> validator.validate(file.getName(), file.getContent()));

        options.getDescriptorSetOutputPath().ifPresent(path -> writeDescriptorSet(request, path));
        return files;
    }

    @Nonnull
    private Optional<File> generateFile(@Nonnull final FileDescriptorProcessingContext context) {
        logger.debug("Generating code for file: {} in package: {}",
                context.getFileDescriptorProto().getName(), context.getProtoPackage());
        final List<String> messageCode = context.getMessageDescriptors().stream()
                .map(this::generateMessageCode)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect(Collectors.toList());
        final List<String> serviceCode = context.getServiceDescriptors().stream()
                .map(this::generateServiceCode)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect(Collectors.toList());
        if (messageCode.isEmpty() && serviceCode.isEmpty()) {
            logger.debug("Nothing to generate for file: {}", context.getFileDescriptorProto().getName());
            return Optional.empty();
        }

        final String className = generatePluginJavaClass(context.getOuterClassName());
        final ST template = new ST(FILE_TEMPLATE, '$', '$')
                .add("pluginName", getPluginName())
                .add("protoSourceName", context.getFileDescriptorProto().getName())
                .add("imports", generateImports())
                .add("className", className)
                .add("messageCode", messageCode)
                .add("serviceCode", serviceCode);
        if (!context.getJavaPackage().isEmpty()) {
            template.add("packageName", context.getJavaPackage());
        }
        return Optional.of(File.newBuilder()
                .setName(context.getJavaFileName(className))
                .setContent(template.render())
                .build());
    }

    private void writeDescriptorSet(@Nonnull final CodeGeneratorRequest request,
                                    @Nonnull final String outputPath) {
        final Path path = Paths.get(outputPath);
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.write(path, FileDescriptorSet.newBuilder()
                    .addAllFile(request.getProtoFileList())
                    .build()
                    .toByteArray());
            logger.info("Wrote descriptor set with {} files to {}",
                    request.getProtoFileCount(), path);
        } catch (IOException e) {
            throw new ProtocGenerationException("Failed to write descriptor set to " + outputPath, e);
        }
    }
}
