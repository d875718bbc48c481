package com.vmturbo.protoc.http.bridge.runtime.json;

import javax.annotation.Nonnull;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The JSON mapper of the generated routes. Unknown properties in requests are ignored.
 */
public class HttpBridgeJson {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private HttpBridgeJson() {}

    /**
     * @return The shared mapper. It is thread-safe once configured and must not be
     *         reconfigured.
     */
    @Nonnull
    public static ObjectMapper objectMapper() {
        return OBJECT_MAPPER;
    }
}
