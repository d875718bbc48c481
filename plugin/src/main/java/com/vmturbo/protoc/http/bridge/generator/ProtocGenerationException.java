package com.vmturbo.protoc.http.bridge.generator;

import javax.annotation.Nonnull;

/**
 * Thrown when the input descriptors cannot be turned into correct code. Generation is aborted
 * and the error is reported to protoc, which fails the build.
 */
public class ProtocGenerationException extends RuntimeException {

    public ProtocGenerationException(@Nonnull final String message) {
        super(message);
    }

    public ProtocGenerationException(@Nonnull final String message, @Nonnull final Throwable cause) {
        super(message, cause);
    }
}
