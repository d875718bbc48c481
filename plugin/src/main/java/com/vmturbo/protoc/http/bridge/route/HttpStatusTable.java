package com.vmturbo.protoc.http.bridge.route;

import java.util.Map;

import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import io.grpc.Status;

/**
 * The fixed translation of gRPC status codes to HTTP status codes. Codes not listed map to
 * {@value #DEFAULT_HTTP_STATUS}.
 */
public class HttpStatusTable {

    /**
     * The HTTP status of every code without an explicit mapping.
     */
    public static final int DEFAULT_HTTP_STATUS = 500;

    private static final Map<Status.Code, Integer> HTTP_STATUS_BY_CODE = Maps.immutableEnumMap(
            ImmutableMap.<Status.Code, Integer>builder()
                .put(Status.Code.OK, 200)
                .put(Status.Code.INVALID_ARGUMENT, 400)
                .put(Status.Code.NOT_FOUND, 404)
                .put(Status.Code.ALREADY_EXISTS, 409)
                .put(Status.Code.ABORTED, 409)
                .put(Status.Code.PERMISSION_DENIED, 403)
                .put(Status.Code.UNAUTHENTICATED, 401)
                .put(Status.Code.RESOURCE_EXHAUSTED, 429)
                .put(Status.Code.FAILED_PRECONDITION, 412)
                .put(Status.Code.UNIMPLEMENTED, 501)
                .put(Status.Code.UNAVAILABLE, 503)
                .put(Status.Code.DEADLINE_EXCEEDED, 408)
                .put(Status.Code.CANCELLED, 408)
                .put(Status.Code.OUT_OF_RANGE, 416)
                .build());

    private HttpStatusTable() {}

    /**
     * @param code A gRPC status code.
     * @return The HTTP status reported for the code.
     */
    public static int getHttpStatus(@Nonnull final Status.Code code) {
        return HTTP_STATUS_BY_CODE.getOrDefault(code, DEFAULT_HTTP_STATUS);
    }

    /**
     * @return The codes with an explicit HTTP status, in the order of {@link Status.Code}.
     */
    @Nonnull
    public static Map<Status.Code, Integer> getExplicitMappings() {
        return HTTP_STATUS_BY_CODE;
    }
}
