package com.vmturbo.protoc.http.bridge.generator;

import java.util.ArrayList;
import java.util.List;

import javax.annotation.Nonnull;

import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumDescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumValueDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Label;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Type;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileOptions;
import com.google.protobuf.DescriptorProtos.MessageOptions;
import com.google.protobuf.DescriptorProtos.MethodDescriptorProto;
import com.google.protobuf.DescriptorProtos.OneofDescriptorProto;
import com.google.protobuf.DescriptorProtos.ServiceDescriptorProto;
import com.google.protobuf.DescriptorProtos.SourceCodeInfo;
import com.google.protobuf.DescriptorProtos.SourceCodeInfo.Location;

/**
 * Descriptor fixtures for tests, built the way protoc would describe the equivalent .proto
 * files.
 */
public class TestProtos {

    private TestProtos() {}

    /**
     * <pre>
     * syntax = "proto3";
     * package hello_world;
     *
     * enum GreetingType { GREETING_TYPE_UNSPECIFIED = 0; CASUAL = 1; FORMAL = 2; }
     *
     * // A greeting request.
     * message HelloRequest {
     *     string name = 1;
     *     GreetingType greeting_type = 2;
     *     optional GreetingType fallback_type = 3;
     *     repeated GreetingType accepted_types = 4;
     *     map&lt;string, int32&gt; counts = 5;
     *     bytes token = 6;
     * }
     *
     * message HelloReply {
     *     string message = 1;
     *     HelloRequest request = 2;
     *     oneof detail { int32 code = 3; string text = 4; }
     * }
     *
     * service Greeter {
     *     rpc SayHello(HelloRequest) returns (HelloReply);
     *     rpc StreamHellos(HelloRequest) returns (stream HelloReply);
     *     rpc CollectHellos(stream HelloRequest) returns (HelloReply);
     *     rpc ChatHellos(stream HelloRequest) returns (stream HelloReply);
     * }
     * </pre>
     *
     * @return The file descriptor.
     */
    @Nonnull
    public static FileDescriptorProto helloWorld() {
        return FileDescriptorProto.newBuilder()
                .setName("hello_world.proto")
                .setPackage("hello_world")
                .setSyntax("proto3")
                .addEnumType(enumType("GreetingType", "GREETING_TYPE_UNSPECIFIED", "CASUAL", "FORMAL"))
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("HelloRequest")
                        .addField(field("name", 1, Type.TYPE_STRING))
                        .addField(enumField("greeting_type", 2, ".hello_world.GreetingType"))
                        .addField(enumField("fallback_type", 3, ".hello_world.GreetingType").toBuilder()
                                .setProto3Optional(true)
                                .setOneofIndex(0))
                        .addField(enumField("accepted_types", 4, ".hello_world.GreetingType").toBuilder()
                                .setLabel(Label.LABEL_REPEATED))
                        .addField(messageField("counts", 5, ".hello_world.HelloRequest.CountsEntry").toBuilder()
                                .setLabel(Label.LABEL_REPEATED))
                        .addField(field("token", 6, Type.TYPE_BYTES))
                        .addNestedType(mapEntry("CountsEntry", Type.TYPE_STRING, Type.TYPE_INT32))
                        .addOneofDecl(OneofDescriptorProto.newBuilder().setName("_fallback_type")))
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("HelloReply")
                        .addField(field("message", 1, Type.TYPE_STRING))
                        .addField(messageField("request", 2, ".hello_world.HelloRequest"))
                        .addField(field("code", 3, Type.TYPE_INT32).toBuilder().setOneofIndex(0))
                        .addField(field("text", 4, Type.TYPE_STRING).toBuilder().setOneofIndex(0))
                        .addOneofDecl(OneofDescriptorProto.newBuilder().setName("detail")))
                .addService(ServiceDescriptorProto.newBuilder()
                        .setName("Greeter")
                        .addMethod(method("SayHello", ".hello_world.HelloRequest", ".hello_world.HelloReply", false, false))
                        .addMethod(method("StreamHellos", ".hello_world.HelloRequest", ".hello_world.HelloReply", false, true))
                        .addMethod(method("CollectHellos", ".hello_world.HelloRequest", ".hello_world.HelloReply", true, false))
                        .addMethod(method("ChatHellos", ".hello_world.HelloRequest", ".hello_world.HelloReply", true, true)))
                .setSourceCodeInfo(SourceCodeInfo.newBuilder()
                        .addLocation(Location.newBuilder()
                                .addPath(4).addPath(0)
                                .setLeadingComments(" A greeting request.\n")))
                .build();
    }

    /**
     * <pre>
     * syntax = "proto3";
     * package shop.v1;
     * option java_package = "com.example.shop";
     * option java_multiple_files = true;
     *
     * message Order {
     *     message Line {
     *         enum State { STATE_UNSPECIFIED = 0; OPEN = 1; SHIPPED = 2; }
     *         State state = 1;
     *     }
     *     Line.State first_state = 1;
     *     repeated Line lines = 2;
     * }
     * </pre>
     *
     * @return The file descriptor.
     */
    @Nonnull
    public static FileDescriptorProto shop() {
        return FileDescriptorProto.newBuilder()
                .setName("shop/v1/order.proto")
                .setPackage("shop.v1")
                .setSyntax("proto3")
                .setOptions(FileOptions.newBuilder()
                        .setJavaPackage("com.example.shop")
                        .setJavaMultipleFiles(true))
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("Order")
                        .addField(enumField("first_state", 1, ".shop.v1.Order.Line.State"))
                        .addField(messageField("lines", 2, ".shop.v1.Order.Line").toBuilder()
                                .setLabel(Label.LABEL_REPEATED))
                        .addNestedType(DescriptorProto.newBuilder()
                                .setName("Line")
                                .addField(enumField("state", 1, ".shop.v1.Order.Line.State"))
                                .addEnumType(enumType("State", "STATE_UNSPECIFIED", "OPEN", "SHIPPED"))))
                .build();
    }

    @Nonnull
    public static EnumDescriptorProto enumType(@Nonnull final String name, @Nonnull final String... values) {
        final EnumDescriptorProto.Builder builder = EnumDescriptorProto.newBuilder().setName(name);
        for (int i = 0; i < values.length; ++i) {
            builder.addValue(EnumValueDescriptorProto.newBuilder().setName(values[i]).setNumber(i));
        }
        return builder.build();
    }

    @Nonnull
    public static FieldDescriptorProto field(@Nonnull final String name, final int number,
                                             @Nonnull final Type type) {
        return FieldDescriptorProto.newBuilder()
                .setName(name)
                .setNumber(number)
                .setLabel(Label.LABEL_OPTIONAL)
                .setType(type)
                .setJsonName(name)
                .build();
    }

    @Nonnull
    public static FieldDescriptorProto enumField(@Nonnull final String name, final int number,
                                                 @Nonnull final String typeName) {
        return field(name, number, Type.TYPE_ENUM).toBuilder().setTypeName(typeName).build();
    }

    @Nonnull
    public static FieldDescriptorProto messageField(@Nonnull final String name, final int number,
                                                    @Nonnull final String typeName) {
        return field(name, number, Type.TYPE_MESSAGE).toBuilder().setTypeName(typeName).build();
    }

    @Nonnull
    public static DescriptorProto mapEntry(@Nonnull final String name,
                                           @Nonnull final Type keyType,
                                           @Nonnull final Type valueType) {
        return DescriptorProto.newBuilder()
                .setName(name)
                .addField(field("key", 1, keyType))
                .addField(field("value", 2, valueType))
                .setOptions(MessageOptions.newBuilder().setMapEntry(true))
                .build();
    }

    @Nonnull
    public static MethodDescriptorProto method(@Nonnull final String name,
                                               @Nonnull final String inputType,
                                               @Nonnull final String outputType,
                                               final boolean clientStreaming,
                                               final boolean serverStreaming) {
        return MethodDescriptorProto.newBuilder()
                .setName(name)
                .setInputType(inputType)
                .setOutputType(outputType)
                .setClientStreaming(clientStreaming)
                .setServerStreaming(serverStreaming)
                .build();
    }

    /**
     * Register files as the plugin driver does.
     *
     * @param registry The registry to register in.
     * @param files The files, dependencies first. All of them are marked as generated.
     * @return The contexts of the files, in order.
     */
    @Nonnull
    public static List<FileDescriptorProcessingContext> register(@Nonnull final Registry registry,
                                                                 @Nonnull final FileDescriptorProto... files) {
        final List<FileDescriptorProcessingContext> contexts = new ArrayList<>();
        for (FileDescriptorProto file : files) {
            final FileDescriptorProcessingContext context =
                    new FileDescriptorProcessingContext(registry, file, true);
            registry.registerFile(context);
            contexts.add(context);
        }
        return contexts;
    }
}
