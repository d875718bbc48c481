package com.vmturbo.protoc.http.bridge.runtime.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.google.protobuf.Empty;

/**
 * The JSON transfer object of {@code google.protobuf.Empty}, written as {@code {}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EmptyBody {

    public Empty toProto() {
        return Empty.getDefaultInstance();
    }

    public static EmptyBody fromProto(final Empty proto) {
        return new EmptyBody();
    }
}
