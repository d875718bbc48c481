package com.vmturbo.protoc.http.bridge.runtime.json;

import javax.annotation.Nonnull;

import com.google.protobuf.DescriptorProtos.EnumDescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumValueDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.Descriptors.DescriptorValidationException;
import com.google.protobuf.Descriptors.EnumDescriptor;
import com.google.protobuf.Descriptors.FileDescriptor;

/**
 * Enums whose wire values overlap: 1 is PENDING, AUTHENTICATION_PENDING or PROCESSING
 * depending on the enum.
 */
public class TestEnums {

    private static final FileDescriptor FILE;

    static {
        final FileDescriptorProto proto = FileDescriptorProto.newBuilder()
                .setName("billing.proto")
                .setPackage("billing")
                .setSyntax("proto3")
                .addEnumType(enumType("PaymentStatus", "PAYMENT_STATUS_UNSPECIFIED", "PENDING", "SETTLED"))
                .addEnumType(enumType("AuthStatus", "AUTH_STATUS_UNSPECIFIED", "AUTHENTICATION_PENDING"))
                .addEnumType(enumType("JobStatus", "JOB_STATUS_UNSPECIFIED", "PROCESSING", "DONE"))
                .addEnumType(enumType("GreetingType", "GREETING_TYPE_UNSPECIFIED", "CASUAL", "FORMAL"))
                .build();
        try {
            FILE = FileDescriptor.buildFrom(proto, new FileDescriptor[0]);
        } catch (DescriptorValidationException e) {
            throw new IllegalStateException(e);
        }
    }

    public static final EnumDescriptor PAYMENT_STATUS = FILE.findEnumTypeByName("PaymentStatus");

    public static final EnumDescriptor AUTH_STATUS = FILE.findEnumTypeByName("AuthStatus");

    public static final EnumDescriptor JOB_STATUS = FILE.findEnumTypeByName("JobStatus");

    public static final EnumDescriptor GREETING_TYPE = FILE.findEnumTypeByName("GreetingType");

    private TestEnums() {}

    @Nonnull
    private static EnumDescriptorProto enumType(@Nonnull final String name, @Nonnull final String... values) {
        final EnumDescriptorProto.Builder builder = EnumDescriptorProto.newBuilder().setName(name);
        for (int i = 0; i < values.length; ++i) {
            builder.addValue(EnumValueDescriptorProto.newBuilder().setName(values[i]).setNumber(i));
        }
        return builder.build();
    }
}
