package com.vmturbo.protoc.http.bridge.runtime.route;

import java.util.Map;

import javax.annotation.Nullable;

import io.grpc.Context;
import io.grpc.Metadata;

/**
 * The gRPC {@link Context} keys through which a service implementation sees the HTTP request
 * it is called for. The values are only set while the implementation is invoked by an HTTP
 * route, not when it is called over gRPC.
 */
public class HttpRpcContext {

    /**
     * The request headers, as metadata.
     */
    public static final Context.Key<Metadata> REQUEST_METADATA =
            Context.key("http-bridge-request-metadata");

    /**
     * Metadata added here is returned as response headers, on success and on failure.
     */
    public static final Context.Key<Metadata> RESPONSE_METADATA =
            Context.key("http-bridge-response-metadata");

    /**
     * The attributes of the servlet request.
     */
    public static final Context.Key<Map<String, Object>> REQUEST_ATTRIBUTES =
            Context.key("http-bridge-request-attributes");

    private HttpRpcContext() {}

    @Nullable
    public static Metadata requestMetadata() {
        return REQUEST_METADATA.get();
    }

    @Nullable
    public static Metadata responseMetadata() {
        return RESPONSE_METADATA.get();
    }

    @Nullable
    public static Map<String, Object> requestAttributes() {
        return REQUEST_ATTRIBUTES.get();
    }
}
