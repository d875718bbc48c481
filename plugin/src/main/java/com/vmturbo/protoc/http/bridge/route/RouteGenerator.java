package com.vmturbo.protoc.http.bridge.route;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import javax.annotation.Nonnull;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.stringtemplate.v4.ST;

import com.vmturbo.protoc.http.bridge.generator.ServiceDescriptor;
import com.vmturbo.protoc.http.bridge.generator.ServiceMethodDescriptor;
import com.vmturbo.protoc.http.bridge.generator.ServiceMethodDescriptor.MethodType;
import com.vmturbo.protoc.http.bridge.json.DtoTypeResolver;

/**
 * Generates the HTTP routes of a gRPC service: a static method that takes the service
 * implementation and returns one POST route per method, bound to the gRPC path of the
 * method, e.g. {@code /hello_world.Greeter/SayHello}.
 */
public class RouteGenerator {

    private static final Logger logger = LogManager.getLogger();

    private static final String SERVICE_TEMPLATE =
            "/**\n" +
            " * HTTP routes of {@code $serviceName$}. Every method of the service is reachable with\n" +
            " * a POST of its JSON request to its gRPC path.\n" +
            "$if(comment)$\n" +
            " * <p>\n" +
            " * $comment$\n" +
            "$endif$\n" +
            " *\n" +
            " * @param handler The service implementation, shared by all routes and calls.\n" +
            " * @return The routes.\n" +
            " */\n" +
            "public static RouterFunction<ServerResponse> $routesMethod$(final $implBase$ handler) {\n" +
            "    return RouterFunctions.route()\n" +
            "            $routes; separator=\"\\n\"$\n" +
            "            .build();\n" +
            "}";

    private static final String ROUTE_TEMPLATE =
            ".POST(\"$path$\", RpcRoute.<$requestDto$, $requestProto$, $responseProto$, $responseDto$>$factory$(\n" +
            "        $requestDto$.class, $requestDto$::toProto, $responseDto$::fromProto,\n" +
            "        handler::$javaMethod$, $errorClass$::render))";

    private final DtoTypeResolver dtoTypeResolver;

    public RouteGenerator(@Nonnull final DtoTypeResolver dtoTypeResolver) {
        this.dtoTypeResolver = dtoTypeResolver;
    }

    /**
     * @param serviceDescriptor A service.
     * @return The name of the generated routes method, e.g. "greeterRoutes".
     */
    @Nonnull
    public static String getRoutesMethodName(@Nonnull final ServiceDescriptor serviceDescriptor) {
        return StringUtils.uncapitalize(serviceDescriptor.getName()) + "Routes";
    }

    /**
     * Generate the routes method of a service.
     *
     * @param serviceDescriptor The service.
     * @return The code of the method, or empty if the service has no methods.
     */
    @Nonnull
    public Optional<String> generateRoutes(@Nonnull final ServiceDescriptor serviceDescriptor) {
        if (serviceDescriptor.getMethodDescriptors().isEmpty()) {
            logger.debug("Service {} has no methods, no routes generated.",
                    serviceDescriptor.getQualifiedProtoName());
            return Optional.empty();
        }

        final List<String> routes = serviceDescriptor.getMethodDescriptors().stream()
                .map(method -> generateRoute(serviceDescriptor, method))
                .collect(Collectors.toList());
        final ST template = new ST(SERVICE_TEMPLATE, '$', '$')
                .add("serviceName", serviceDescriptor.getQualifiedProtoName())
                .add("routesMethod", getRoutesMethodName(serviceDescriptor))
                .add("implBase", serviceDescriptor.getGrpcClassName() + "."
                        + serviceDescriptor.getName() + "ImplBase")
                .add("routes", routes);
        if (!serviceDescriptor.getComment().isEmpty()) {
            template.add("comment", serviceDescriptor.getComment().replace("*/", "*&#47;")
                    .replace("\n", "\n * "));
        }
        return Optional.of(template.render());
    }

    @Nonnull
    private String generateRoute(@Nonnull final ServiceDescriptor serviceDescriptor,
                                 @Nonnull final ServiceMethodDescriptor method) {
        final String path = serviceDescriptor.getWirePath(method);
        logger.debug("Route POST {} -> {}", path, method.getJavaMethodName());
        return new ST(ROUTE_TEMPLATE, '$', '$')
                .add("path", path)
                .add("requestDto", dtoTypeResolver.getDtoClassName(method.getInputMessage()))
                .add("requestProto", method.getInputMessage().getQualifiedOriginalName())
                .add("responseProto", method.getOutputMessage().getQualifiedOriginalName())
                .add("responseDto", dtoTypeResolver.getDtoClassName(method.getOutputMessage()))
                .add("factory", getRouteFactory(method.getType()))
                .add("javaMethod", method.getJavaMethodName())
                .add("errorClass", ErrorEnvelopeGenerator.CLASS_NAME)
                .render();
    }

    /**
     * @param type The streaming kind of a method.
     * @return The factory method of the runtime route for the kind.
     */
    @Nonnull
    static String getRouteFactory(@Nonnull final MethodType type) {
        switch (type) {
            case CLIENT_STREAM:
                return "clientStreaming";
            case SERVER_STREAM:
                return "serverStreaming";
            case BI_STREAM:
                return "bidiStreaming";
            default:
                return "unary";
        }
    }
}
