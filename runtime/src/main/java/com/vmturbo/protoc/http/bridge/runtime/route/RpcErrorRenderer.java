package com.vmturbo.protoc.http.bridge.runtime.route;

import javax.annotation.Nonnull;

import io.grpc.Metadata;
import io.grpc.Status;

/**
 * Turns the status a call failed with into the JSON error body of the package.
 */
@FunctionalInterface
public interface RpcErrorRenderer {

    /**
     * @param status The status of the failed call.
     * @param trailers The trailers the call failed with. Empty if there are none.
     * @return The error body.
     */
    @Nonnull
    RpcError render(@Nonnull Status status, @Nonnull Metadata trailers);
}
