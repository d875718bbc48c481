package com.vmturbo.protoc.http.bridge.json;

import java.util.Optional;

import javax.annotation.Nonnull;

import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Type;

import com.vmturbo.protoc.http.bridge.generator.FieldDescriptor;

/**
 * Decides which fields are left out of the JSON output when they carry no value.
 * <ol>
 *     <li>Singular string fields are omitted when absent or empty, including strings with
 *     explicit presence.</li>
 *     <li>Other fields with explicit presence (proto3 "optional", oneof members, proto2
 *     optional fields) are omitted when absent.</li>
 *     <li>Singular message fields are omitted when absent.</li>
 * </ol>
 * No other field is annotated.
 */
public class OmissionAnnotator {

    /**
     * @param field A field of a message.
     * @return How the field is omitted, or empty if it is always written.
     */
    @Nonnull
    public Optional<Omission> getOmission(@Nonnull final FieldDescriptor field) {
        if (field.isRepeated()) {
            return Optional.empty();
        }
        if (field.getType() == Type.TYPE_STRING) {
            return Optional.of(Omission.WHEN_EMPTY);
        }
        if (field.hasExplicitPresence()) {
            return Optional.of(Omission.WHEN_ABSENT);
        }
        if (field.getType() == Type.TYPE_MESSAGE || field.getType() == Type.TYPE_GROUP) {
            return Optional.of(Omission.WHEN_ABSENT);
        }
        return Optional.empty();
    }
}
