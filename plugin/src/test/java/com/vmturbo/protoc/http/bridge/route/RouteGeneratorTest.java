package com.vmturbo.protoc.http.bridge.route;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import org.junit.Before;
import org.junit.Test;

import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.ServiceDescriptorProto;

import com.vmturbo.protoc.http.bridge.generator.Registry;
import com.vmturbo.protoc.http.bridge.generator.ServiceDescriptor;
import com.vmturbo.protoc.http.bridge.generator.ServiceMethodDescriptor.MethodType;
import com.vmturbo.protoc.http.bridge.generator.TestProtos;
import com.vmturbo.protoc.http.bridge.json.DtoTypeResolver;

/**
 * Test {@link RouteGenerator}.
 */
public class RouteGeneratorTest {

    private final RouteGenerator routeGenerator =
            new RouteGenerator(new DtoTypeResolver(outerClass -> outerClass + "Http"));

    private ServiceDescriptor greeter;

    /**
     * Register the hello world fixture.
     */
    @Before
    public void setup() {
        greeter = TestProtos.register(new Registry(), TestProtos.helloWorld())
                .get(0).getServiceDescriptors().get(0);
    }

    /**
     * One POST route per method, at the gRPC path of the method.
     */
    @Test
    public void testRoutes() {
        final String code = routeGenerator.generateRoutes(greeter).get();

        assertThat(code, containsString("public static RouterFunction<ServerResponse> greeterRoutes("
                + "final hello_world.GreeterGrpc.GreeterImplBase handler) {"));
        assertThat(code, containsString("return RouterFunctions.route()"));
        assertThat(code, containsString(".POST(\"/hello_world.Greeter/SayHello\", RpcRoute.<"
                + "hello_world.HelloWorldHttp.HelloRequest, hello_world.HelloWorld.HelloRequest, "
                + "hello_world.HelloWorld.HelloReply, hello_world.HelloWorldHttp.HelloReply>unary("));
        assertThat(code, containsString("hello_world.HelloWorldHttp.HelloRequest.class, "
                + "hello_world.HelloWorldHttp.HelloRequest::toProto, "
                + "hello_world.HelloWorldHttp.HelloReply::fromProto,"));
        assertThat(code, containsString("handler::sayHello, HttpErrorEnvelope::render))"));
        assertThat(code, containsString(".POST(\"/hello_world.Greeter/StreamHellos\""));
        assertThat(code, containsString(">serverStreaming("));
        assertThat(code, containsString("handler::collectHellos"));
        assertThat(code, containsString(">clientStreaming("));
        assertThat(code, containsString(">bidiStreaming("));
        assertThat(code, containsString(".build();"));
    }

    /**
     * A service without methods has no routes.
     */
    @Test
    public void testServiceWithoutMethods() {
        final FileDescriptorProto file = FileDescriptorProto.newBuilder()
                .setName("idle.proto")
                .setPackage("idle")
                .setSyntax("proto3")
                .addService(ServiceDescriptorProto.newBuilder().setName("Idle"))
                .build();
        final ServiceDescriptor idle = TestProtos.register(new Registry(), file)
                .get(0).getServiceDescriptors().get(0);
        assertFalse(routeGenerator.generateRoutes(idle).isPresent());
    }

    /**
     * Names of the generated method and route factories.
     */
    @Test
    public void testNames() {
        assertEquals("greeterRoutes", RouteGenerator.getRoutesMethodName(greeter));
        assertEquals("unary", RouteGenerator.getRouteFactory(MethodType.SIMPLE));
        assertEquals("serverStreaming", RouteGenerator.getRouteFactory(MethodType.SERVER_STREAM));
        assertEquals("clientStreaming", RouteGenerator.getRouteFactory(MethodType.CLIENT_STREAM));
        assertEquals("bidiStreaming", RouteGenerator.getRouteFactory(MethodType.BI_STREAM));
    }
}
