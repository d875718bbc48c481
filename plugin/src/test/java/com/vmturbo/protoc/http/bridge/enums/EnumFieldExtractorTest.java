package com.vmturbo.protoc.http.bridge.enums;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Label;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Type;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.OneofDescriptorProto;

import com.vmturbo.protoc.http.bridge.generator.ProtocGenerationException;
import com.vmturbo.protoc.http.bridge.generator.Registry;
import com.vmturbo.protoc.http.bridge.generator.TestProtos;
import com.vmturbo.protoc.http.bridge.naming.EnumTypePathResolver.NestedPathStyle;

/**
 * Test {@link EnumFieldExtractor}.
 */
public class EnumFieldExtractorTest {

    private final Registry registry = new Registry();

    private final EnumFieldExtractor extractor = new EnumFieldExtractor(NestedPathStyle.MODULE);

    /**
     * Every enum field gets a binding, in declaration order, with its cardinality.
     */
    @Test
    public void testTopLevelMessage() {
        TestProtos.register(registry, TestProtos.helloWorld());
        final List<FieldBinding> bindings =
                extractor.extract(registry.getMessageDescriptor("hello_world.HelloRequest"));

        assertEquals(3, bindings.size());
        assertBinding(bindings.get(0), "hello_request_greeting_type", "GreetingType", Cardinality.SINGLE);
        assertBinding(bindings.get(1), "hello_request_fallback_type", "GreetingType", Cardinality.OPTION);
        assertBinding(bindings.get(2), "hello_request_accepted_types", "GreetingType", Cardinality.REPEATED);
        assertEquals("hello_world.GreetingType", bindings.get(0).getQualifiedEnumName());
        assertEquals("hello_world.HelloRequest.greeting_type", bindings.get(0).getQualifiedFieldName());
    }

    /**
     * A message without enum fields has no bindings.
     */
    @Test
    public void testNoEnumFields() {
        TestProtos.register(registry, TestProtos.helloWorld());
        assertTrue(extractor.extract(registry.getMessageDescriptor("hello_world.HelloReply")).isEmpty());
    }

    /**
     * The fields of a message come before the fields of its nested messages, whose ids carry
     * the path of enclosing messages.
     */
    @Test
    public void testNestedMessages() {
        TestProtos.register(registry, TestProtos.shop());
        final List<FieldBinding> bindings = extractor.extract(registry.getMessageDescriptor("shop.v1.Order"));

        assertEquals(2, bindings.size());
        assertBinding(bindings.get(0), "order_first_state", "order::line::State", Cardinality.SINGLE);
        assertBinding(bindings.get(1), "order_line_state", "order::line::State", Cardinality.SINGLE);
    }

    /**
     * The Java style nests enum paths like protoc's classes.
     */
    @Test
    public void testJavaStyle() {
        TestProtos.register(registry, TestProtos.shop());
        final List<FieldBinding> bindings = new EnumFieldExtractor(NestedPathStyle.JAVA)
                .extract(registry.getMessageDescriptor("shop.v1.Order"));
        assertEquals("Order.Line.State", bindings.get(0).getEnumTypePath());
    }

    /**
     * Enum values of map fields are not bound.
     */
    @Test
    public void testMapEntriesSkipped() {
        final FileDescriptorProto file = FileDescriptorProto.newBuilder()
                .setName("inventory.proto")
                .setPackage("inventory")
                .setSyntax("proto3")
                .addEnumType(TestProtos.enumType("Level", "LEVEL_UNSPECIFIED", "LOW", "HIGH"))
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("Stock")
                        .addField(TestProtos.messageField("levels", 1, ".inventory.Stock.LevelsEntry").toBuilder()
                                .setLabel(Label.LABEL_REPEATED))
                        .addField(TestProtos.enumField("level", 2, ".inventory.Level"))
                        .addNestedType(TestProtos.mapEntry("LevelsEntry", Type.TYPE_STRING, Type.TYPE_ENUM).toBuilder()
                                .setField(1, TestProtos.enumField("value", 2, ".inventory.Level"))))
                .build();
        TestProtos.register(registry, file);

        final List<FieldBinding> bindings = extractor.extract(registry.getMessageDescriptor("inventory.Stock"));
        assertEquals(1, bindings.size());
        assertBinding(bindings.get(0), "stock_level", "Level", Cardinality.SINGLE);
    }

    /**
     * Two fields with the same id in one package cannot both get codecs.
     */
    @Test
    public void testDuplicateFieldIds() {
        final FileDescriptorProto file = FileDescriptorProto.newBuilder()
                .setName("clash.proto")
                .setPackage("clash")
                .setSyntax("proto3")
                .addEnumType(TestProtos.enumType("GreetingType", "GREETING_TYPE_UNSPECIFIED", "CASUAL"))
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("HelloRequest")
                        .addField(TestProtos.enumField("greeting_type", 1, ".clash.GreetingType")))
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("Hello")
                        .addNestedType(DescriptorProto.newBuilder()
                                .setName("Request")
                                .addField(TestProtos.enumField("greeting_type", 1, ".clash.GreetingType"))))
                .build();
        TestProtos.register(registry, file);

        try {
            extractor.extractAll(Arrays.asList(registry.getMessageDescriptor("clash.HelloRequest"),
                    registry.getMessageDescriptor("clash.Hello")));
            fail("Expected duplicate field ids to be rejected.");
        } catch (ProtocGenerationException e) {
            assertThat(e.getMessage(), containsString("hello_request_greeting_type"));
        }
    }

    /**
     * Ids that differ only in underscores name the same codec classes.
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
        TestProtos.register(registry, file);

        try {
            extractor.extractAll(Arrays.asList(registry.getMessageDescriptor("collide.M")));
            fail("Expected the codec class name collision to be rejected.");
        } catch (ProtocGenerationException e) {
            assertThat(e.getMessage(), containsString("collide.M.ab_1"));
            assertThat(e.getMessage(), containsString("collide.M.ab1"));
            assertThat(e.getMessage(), containsString("SerializeMAb1AsString"));
        }
    }

    /**
     * An enum member of a oneof may be absent, like a proto3 optional field.
     */
    @Test
    public void testOneofMember() {
        final FileDescriptorProto file = FileDescriptorProto.newBuilder()
                .setName("signal.proto")
                .setPackage("signal")
                .setSyntax("proto3")
                .addEnumType(TestProtos.enumType("Color", "COLOR_UNSPECIFIED", "RED", "GREEN"))
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("Light")
                        .addField(TestProtos.enumField("color", 1, ".signal.Color").toBuilder()
                                .setOneofIndex(0))
                        .addField(TestProtos.field("blink_ms", 2, Type.TYPE_INT32).toBuilder()
                                .setOneofIndex(0))
                        .addOneofDecl(OneofDescriptorProto.newBuilder().setName("state")))
                .build();
        TestProtos.register(registry, file);

        final List<FieldBinding> bindings = extractor.extract(registry.getMessageDescriptor("signal.Light"));
        assertEquals(1, bindings.size());
        assertBinding(bindings.get(0), "light_color", "Color", Cardinality.OPTION);
        assertEquals("serialize_option_light_color_as_string", bindings.get(0).getSerializerName());
    }

    /**
     * An upper case package component looks like a message, and the resolved path would not
     * name the enum.
     */
    @Test
    public void testUnresolvablePath() {
        final FileDescriptorProto file = FileDescriptorProto.newBuilder()
                .setName("billing.proto")
                .setPackage("acme.Billing")
                .setSyntax("proto3")
                .addEnumType(TestProtos.enumType("Currency", "CURRENCY_UNSPECIFIED", "EUR"))
                .addMessageType(DescriptorProto.newBuilder()
                        .setName("Invoice")
                        .addField(TestProtos.enumField("currency", 1, ".acme.Billing.Currency")))
                .build();
        TestProtos.register(registry, file);

        try {
            extractor.extract(registry.getMessageDescriptor("acme.Billing.Invoice"));
            fail("Expected the enum path to be rejected.");
        } catch (ProtocGenerationException e) {
            assertThat(e.getMessage(), containsString("acme.Billing.Currency"));
        }
    }

    private static void assertBinding(final FieldBinding binding, final String fieldId,
                                      final String enumTypePath, final Cardinality cardinality) {
        assertEquals(fieldId, binding.getFieldId());
        assertEquals(enumTypePath, binding.getEnumTypePath());
        assertEquals(cardinality, binding.getCardinality());
    }
}
