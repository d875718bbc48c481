package com.vmturbo.protoc.http.bridge.route;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import javax.annotation.Nonnull;

import com.google.protobuf.compiler.PluginProtos.CodeGeneratorResponse.File;

import io.grpc.Status;

import org.stringtemplate.v4.ST;

import com.vmturbo.protoc.http.bridge.generator.FileDescriptorProcessingContext;

/**
 * Generates the error body shared by all the routes of a Java package,
 * {@code {"error": {"code": "<STATUS_CODE>", "message": "<description>"}}}, together with the
 * translation of gRPC status codes to HTTP status codes.
 */
public class ErrorEnvelopeGenerator {

    /**
     * The name of the generated error class of a package.
     */
    public static final String CLASS_NAME = "HttpErrorEnvelope";

    private static final String FILE_TEMPLATE =
            "// Generated by $pluginName$. Do not edit!\n" +
            "$if(packageName)$\n" +
            "package $packageName$;\n" +
            "$endif$\n" +
            "\n" +
            "import com.fasterxml.jackson.annotation.JsonIgnore;\n" +
            "import com.fasterxml.jackson.annotation.JsonProperty;\n" +
            "\n" +
            "import io.grpc.Metadata;\n" +
            "import io.grpc.Status;\n" +
            "\n" +
            "import com.vmturbo.protoc.http.bridge.runtime.route.RpcError;\n" +
            "\n" +
            "/**\n" +
            " * The JSON body of a failed HTTP call to a service of this package.\n" +
            " */\n" +
            "public final class $className$ implements RpcError {\n" +
            "\n" +
            "    @JsonProperty(\"error\")\n" +
            "    public final ErrorBody error;\n" +
            "\n" +
            "    @JsonIgnore\n" +
            "    private final int httpStatus;\n" +
            "\n" +
            "    private $className$(final int httpStatus, final String code, final String message) {\n" +
            "        this.httpStatus = httpStatus;\n" +
            "        this.error = new ErrorBody(code, message);\n" +
            "    }\n" +
            "\n" +
            "    /**\n" +
            "     * Build the error body of a failed call.\n" +
            "     */\n" +
            "    public static $className$ render(final Status status, final Metadata trailers) {\n" +
            "        final String description = status.getDescription();\n" +
            "        return new $className$(httpStatus(status.getCode()), status.getCode().name(),\n" +
            "                description == null ? \"\" : description);\n" +
            "    }\n" +
            "\n" +
            "    /**\n" +
            "     * The HTTP status reported for a gRPC status code.\n" +
            "     */\n" +
            "    public static int httpStatus(final Status.Code code) {\n" +
            "        switch (code) {\n" +
            "            $cases; separator=\"\\n\"$\n" +
            "            default:\n" +
            "                return $defaultStatus$;\n" +
            "        }\n" +
            "    }\n" +
            "\n" +
            "    @Override\n" +
            "    @JsonIgnore\n" +
            "    public int getHttpStatus() {\n" +
            "        return httpStatus;\n" +
            "    }\n" +
            "\n" +
            "    /**\n" +
            "     * The code and message of the error.\n" +
            "     */\n" +
            "    public static final class ErrorBody {\n" +
            "\n" +
            "        @JsonProperty(\"code\")\n" +
            "        public final String code;\n" +
            "\n" +
            "        @JsonProperty(\"message\")\n" +
            "        public final String message;\n" +
            "\n" +
            "        private ErrorBody(final String code, final String message) {\n" +
            "            this.code = code;\n" +
            "            this.message = message;\n" +
            "        }\n" +
            "    }\n" +
            "}\n";

    private final String pluginName;

    public ErrorEnvelopeGenerator(@Nonnull final String pluginName) {
        this.pluginName = pluginName;
    }

    /**
     * Generate the error class of a Java package.
     *
     * @param context Any of the generated files in the package, to locate the output.
     * @return The generated file.
     */
    @Nonnull
    public File generate(@Nonnull final FileDescriptorProcessingContext context) {
        final ST template = new ST(FILE_TEMPLATE, '$', '$')
                .add("pluginName", pluginName)
                .add("className", CLASS_NAME)
                .add("cases", generateCases())
                .add("defaultStatus", HttpStatusTable.DEFAULT_HTTP_STATUS);
        if (!context.getJavaPackage().isEmpty()) {
            template.add("packageName", context.getJavaPackage());
        }
        return File.newBuilder()
                .setName(context.getJavaFileName(CLASS_NAME))
                .setContent(template.render())
                .build();
    }

    /**
     * One group of case labels per HTTP status, e.g. "case ALREADY_EXISTS:\ncase ABORTED:\n
     * return 409;".
     */
    @Nonnull
    private List<String> generateCases() {
        final Map<Integer, List<Status.Code>> codesByHttpStatus = new LinkedHashMap<>();
        HttpStatusTable.getExplicitMappings().forEach((code, httpStatus) ->
                codesByHttpStatus.computeIfAbsent(httpStatus, status -> new ArrayList<>()).add(code));
        return codesByHttpStatus.entrySet().stream()
                .map(entry -> entry.getValue().stream()
                        .map(code -> "case " + code.name() + ":\n")
                        .collect(Collectors.joining())
                        + "    return " + entry.getKey() + ";")
                .collect(Collectors.toList());
    }
}
