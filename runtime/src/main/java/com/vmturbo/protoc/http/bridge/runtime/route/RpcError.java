package com.vmturbo.protoc.http.bridge.runtime.route;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * The JSON body of a failed call, generated once per package.
 */
public interface RpcError {

    /**
     * @return The HTTP status of the response carrying this body.
     */
    @JsonIgnore
    int getHttpStatus();
}
