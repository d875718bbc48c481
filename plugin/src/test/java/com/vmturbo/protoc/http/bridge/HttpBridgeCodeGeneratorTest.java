package com.vmturbo.protoc.http.bridge;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Label;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Type;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.google.protobuf.DescriptorProtos.OneofDescriptorProto;
import com.google.protobuf.compiler.PluginProtos.CodeGeneratorRequest;
import com.google.protobuf.compiler.PluginProtos.CodeGeneratorResponse;
import com.google.protobuf.compiler.PluginProtos.CodeGeneratorResponse.Feature;

import com.vmturbo.protoc.http.bridge.generator.TestProtos;

/**
 * Test {@link HttpBridgeCodeGenerator}.
 */
public class HttpBridgeCodeGeneratorTest {

    /**
     * Temporary folder for the descriptor set.
     */
    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    /**
     * With string enums, every package gets transfer objects, routes, the error envelope and
     * the enum codecs.
     */
    @Test
    public void testGenerateWithStringEnums() {
        final CodeGeneratorResponse response = generate("enable_string_enums", TestProtos.helloWorld());

        assertFalse(response.getError(), response.hasError());
        assertEquals(Feature.FEATURE_PROTO3_OPTIONAL_VALUE, response.getSupportedFeatures());
        assertThat(fileNames(response), contains("hello_world/HelloWorldHttp.java",
                "hello_world/HttpErrorEnvelope.java", "hello_world/JsonEnumCodecs.java"));

        final String content = response.getFile(0).getContent();
        assertThat(content, startsWith("// Generated by protoc-http-bridge from hello_world.proto. Do not edit!"));
        assertThat(content, containsString("package hello_world;"));
        assertThat(content, containsString("public final class HelloWorldHttp {"));
        assertThat(content, containsString("public static class HelloRequest {"));
        assertThat(content, containsString("public static class HelloReply {"));
        assertThat(content, containsString("A greeting request."));

        // Enum fields are bound to their own codecs.
        assertThat(content, containsString(
                "@JsonSerialize(using = JsonEnumCodecs.SerializeHelloRequestGreetingTypeAsString.class)"));
        assertThat(content, containsString(
                "@JsonDeserialize(using = JsonEnumCodecs.DeserializeOptionHelloRequestFallbackTypeFromString.class)"));
        assertThat(content, containsString(
                "@JsonSerialize(using = JsonEnumCodecs.SerializeRepeatedHelloRequestAcceptedTypesAsString.class)"));

        // Omission annotations.
        assertThat(content, containsString("@JsonInclude(Include.NON_EMPTY)"));
        assertThat(content, containsString("@JsonInclude(Include.NON_NULL)"));

        // Field types.
        assertThat(content, containsString("public String name = \"\";"));
        assertThat(content, containsString("public int greetingType;"));
        assertThat(content, containsString("public Integer fallbackType;"));
        assertThat(content, containsString("public List<Integer> acceptedTypes = new ArrayList<>();"));
        assertThat(content, containsString("public Map<String, Integer> counts = new LinkedHashMap<>();"));
        assertThat(content, containsString("public byte[] token = new byte[0];"));
        assertThat(content, containsString("public hello_world.HelloWorldHttp.HelloRequest request;"));
        assertThat(content, containsString("public Integer code;"));

        // Conversions.
        assertThat(content, containsString("builder.setGreetingTypeValue(this.greetingType);"));
        assertThat(content, containsString("builder.setFallbackTypeValue(this.fallbackType);"));
        assertThat(content, containsString("builder.addAllAcceptedTypesValue(this.acceptedTypes);"));
        assertThat(content, containsString("builder.putAllCounts(this.counts);"));
        assertThat(content, containsString("builder.setToken(ByteString.copyFrom(this.token));"));
        assertThat(content, containsString("builder.setRequest(this.request.toProto());"));
        assertThat(content, containsString("dto.greetingType = proto.getGreetingTypeValue();"));
        assertThat(content, containsString("if (proto.hasFallbackType()) {"));
        assertThat(content, containsString("dto.acceptedTypes = new ArrayList<>(proto.getAcceptedTypesValueList());"));
        assertThat(content, containsString("dto.token = proto.getToken().toByteArray();"));
        assertThat(content, containsString(
                "dto.request = hello_world.HelloWorldHttp.HelloRequest.fromProto(proto.getRequest());"));
        assertThat(content, containsString(
                "if (proto.getDetailCase() == hello_world.HelloWorld.HelloReply.DetailCase.CODE) {"));

        // Routes.
        assertThat(content, containsString("greeterRoutes(final hello_world.GreeterGrpc.GreeterImplBase handler)"));
        assertThat(content, containsString(".POST(\"/hello_world.Greeter/SayHello\""));
    }

    /**
     * Without string enums, enums are plain numbers and nothing is omitted.
     */
    @Test
    public void testGenerateWithoutStringEnums() {
        final CodeGeneratorResponse response = generate("", TestProtos.helloWorld());

        assertFalse(response.getError(), response.hasError());
        assertThat(fileNames(response), contains("hello_world/HelloWorldHttp.java",
                "hello_world/HttpErrorEnvelope.java"));
        final String content = response.getFile(0).getContent();
        assertThat(content, containsString("@JsonProperty(\"greeting_type\")"));
        assertThat(content, not(containsString("@JsonSerialize(")));
        assertThat(content, not(containsString("@JsonInclude(")));
    }

    /**
     * Files in the same package share the package files, and dependencies are not generated.
     */
    @Test
    public void testFilesToGenerate() {
        final FileDescriptorProto shop = TestProtos.shop();
        final CodeGeneratorRequest request = CodeGeneratorRequest.newBuilder()
                .setParameter("enable_string_enums")
                .addProtoFile(TestProtos.helloWorld())
                .addProtoFile(shop)
                .addFileToGenerate(shop.getName())
                .build();
        final CodeGeneratorResponse response = new HttpBridgeCodeGenerator().generate(request);

        assertFalse(response.getError(), response.hasError());
        assertThat(fileNames(response), contains("com/example/shop/OrderOuterClassHttp.java",
                "com/example/shop/JsonEnumCodecs.java"));
        final String content = response.getFile(0).getContent();
        assertThat(content, containsString("public static class Line {"));
        assertThat(content, containsString(
                "public List<com.example.shop.OrderOuterClassHttp.Order.Line> lines = new ArrayList<>();"));
        assertThat(content, containsString("this.lines.forEach(v -> builder.addLines(v.toProto()));"));
        assertThat(content, containsString("@JsonDeserialize(using = JsonEnumCodecs.DeserializeOrderLineStateFromString.class)"));
    }

    /**
     * Closed (proto2) enums are converted by number and checked against the declared values.
     */
    @Test
    public void testClosedEnums() {
        final FileDescriptorProto legacy = FileDescriptorProto.newBuilder()
                .setName("legacy/colors.proto")
                .setPackage("legacy")
                .setSyntax("proto2")
                .addEnumType(TestProtos.enumType("Color", "WHITE", "RED", "BLUE"))
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("Paint")
                        .addField(TestProtos.enumField("color", 1, ".legacy.Color"))
                        .addField(TestProtos.enumField("palette", 2, ".legacy.Color").toBuilder()
                                .setLabel(Label.LABEL_REPEATED)))
                .build();
        final CodeGeneratorResponse response = generate("enable_string_enums", legacy);

        assertFalse(response.getError(), response.hasError());
        final String content = response.getFile(0).getContent();
        assertEquals("legacy/ColorsHttp.java", response.getFile(0).getName());
        assertThat(content, containsString("public Integer color;"));
        assertThat(content, containsString(
                "builder.setColor(ClosedEnumValues.forNumber(this.color, legacy.Colors.Color::forNumber, \"legacy.Color\"));"));
        assertThat(content, containsString(
                "this.palette.forEach(v -> builder.addPalette(ClosedEnumValues.forNumber(v, legacy.Colors.Color::forNumber, \"legacy.Color\")));"));
        assertThat(content, containsString("dto.color = proto.getColor().getNumber();"));
        assertThat(content, containsString(".map(v -> v.getNumber())"));
        assertThat(content, containsString(
                "@JsonDeserialize(using = JsonEnumCodecs.DeserializeOptionPaintColorFromString.class)"));
    }

    /**
     * Oneof case constants are upper-cased the same way whatever the default locale.
     */
    @Test
    public void testOneofCaseIndependentOfLocale() {
        final FileDescriptorProto file = FileDescriptorProto.newBuilder()
                .setName("lookup.proto")
                .setPackage("lookup")
                .setSyntax("proto3")
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("Key")
                        .addField(TestProtos.field("id", 1, Type.TYPE_STRING).toBuilder().setOneofIndex(0))
                        .addField(TestProtos.field("index", 2, Type.TYPE_INT64).toBuilder().setOneofIndex(0))
                        .addOneofDecl(OneofDescriptorProto.newBuilder().setName("value")))
                .build();
        final Locale defaultLocale = Locale.getDefault();
        final CodeGeneratorResponse response;
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            response = generate("enable_string_enums", file);
        } finally {
            Locale.setDefault(defaultLocale);
        }

        assertFalse(response.getError(), response.hasError());
        final String content = response.getFile(0).getContent();
        assertThat(content, containsString("proto.getValueCase() == lookup.Lookup.Key.ValueCase.ID"));
        assertThat(content, containsString("proto.getValueCase() == lookup.Lookup.Key.ValueCase.INDEX"));
    }

    /**
     * Enum fields whose codecs would share a class name fail the run.
     */
    @Test
    public void testCodecClassNameCollision() {
        final FileDescriptorProto file = FileDescriptorProto.newBuilder()
                .setName("collide.proto")
                .setPackage("collide")
                .setSyntax("proto3")
                .addEnumType(TestProtos.enumType("Mode", "MODE_UNSPECIFIED", "ON"))
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("M")
                        .addField(TestProtos.enumField("ab_1", 1, ".collide.Mode"))
                        .addField(TestProtos.enumField("ab1", 2, ".collide.Mode")))
                .build();
        final CodeGeneratorResponse response = generate("enable_string_enums", file);

        assertTrue(response.hasError());
        assertThat(response.getError(), containsString("SerializeMAb1AsString"));
        assertEquals(0, response.getFileCount());
    }

    /**
     * A file with only enums produces no class of its own.
     */
    @Test
    public void testNothingToGenerate() {
        final FileDescriptorProto enums = FileDescriptorProto.newBuilder()
                .setName("codes.proto")
                .setPackage("codes")
                .setSyntax("proto3")
                .addEnumType(TestProtos.enumType("Code", "CODE_UNSPECIFIED", "ONE"))
                .build();
        final CodeGeneratorResponse response = generate("enable_string_enums", enums);

        assertFalse(response.getError(), response.hasError());
        assertEquals(0, response.getFileCount());
    }

    /**
     * Invalid options fail the whole run.
     */
    @Test
    public void testInvalidOption() {
        final CodeGeneratorResponse response = generate("emit_openapi", TestProtos.helloWorld());

        assertTrue(response.hasError());
        assertThat(response.getError(), containsString("protoc-http-bridge"));
        assertThat(response.getError(), containsString("emit_openapi"));
        assertEquals(0, response.getFileCount());
    }

    /**
     * The descriptor set of the request is written when requested.
     *
     * @throws IOException If the descriptor set cannot be read.
     */
    @Test
    public void testDescriptorSetOutput() throws IOException {
        final File output = new File(tempFolder.getRoot(), "descriptors/hello.pb");
        final CodeGeneratorResponse response = generate(
                "descriptor_set_output_path=" + output.getAbsolutePath(), TestProtos.helloWorld());

        assertFalse(response.getError(), response.hasError());
        final FileDescriptorSet descriptorSet = FileDescriptorSet.parseFrom(Files.readAllBytes(output.toPath()));
        assertEquals(1, descriptorSet.getFileCount());
        assertEquals(TestProtos.helloWorld(), descriptorSet.getFile(0));
    }

    private static CodeGeneratorResponse generate(final String parameter, final FileDescriptorProto file) {
        return new HttpBridgeCodeGenerator().generate(CodeGeneratorRequest.newBuilder()
                .setParameter(parameter)
                .addProtoFile(file)
                .addFileToGenerate(file.getName())
                .build());
    }

    private static List<String> fileNames(final CodeGeneratorResponse response) {
        return response.getFileList().stream()
                .map(CodeGeneratorResponse.File::getName)
                .collect(Collectors.toList());
    }
}
