package com.vmturbo.protoc.http.bridge.runtime.route;

import java.util.Locale;
import java.util.regex.Pattern;

import javax.annotation.Nonnull;

import com.google.common.io.BaseEncoding;

import io.grpc.Metadata;
import io.grpc.Metadata.Key;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;

/**
 * Maps HTTP headers to gRPC metadata and back. Headers ending in "-bin" carry base64-encoded
 * binary values, as in gRPC over HTTP/2.
 */
public class RpcMetadataHeaders {

    private static final Logger logger = LogManager.getLogger();

    private static final Pattern VALID_KEY = Pattern.compile("[0-9a-z_.\\-]+");

    private static final BaseEncoding BASE64 = BaseEncoding.base64();

    private RpcMetadataHeaders() {}

    /**
     * @param headers The headers of an HTTP request.
     * @return The metadata. Headers whose names are not legal metadata keys are left out.
     * @throws IllegalArgumentException If a binary header is not valid base64.
     */
    @Nonnull
    public static Metadata toMetadata(@Nonnull final HttpHeaders headers) {
        final Metadata metadata = new Metadata();
        headers.forEach((name, values) -> {
            final String key = name.toLowerCase(Locale.ROOT);
            if (!VALID_KEY.matcher(key).matches()) {
                logger.debug("Header {} is not a valid metadata key, skipped.", name);
            } else if (key.endsWith(Metadata.BINARY_HEADER_SUFFIX)) {
                final Key<byte[]> binaryKey = Key.of(key, Metadata.BINARY_BYTE_MARSHALLER);
                values.forEach(value -> metadata.put(binaryKey, BASE64.decode(value.trim())));
            } else {
                final Key<String> asciiKey = Key.of(key, Metadata.ASCII_STRING_MARSHALLER);
                values.forEach(value -> metadata.put(asciiKey, value));
            }
        });
        return metadata;
    }

    /**
     * Add metadata to HTTP response headers.
     *
     * @param metadata The metadata.
     * @param headers The headers to add to.
     */
    public static void addHeaders(@Nonnull final Metadata metadata, @Nonnull final HttpHeaders headers) {
        for (String key : metadata.keys()) {
            if (key.endsWith(Metadata.BINARY_HEADER_SUFFIX)) {
                final Iterable<byte[]> values = metadata.getAll(Key.of(key, Metadata.BINARY_BYTE_MARSHALLER));
                if (values != null) {
                    values.forEach(value -> headers.add(key, BASE64.encode(value)));
                }
            } else {
                final Iterable<String> values = metadata.getAll(Key.of(key, Metadata.ASCII_STRING_MARSHALLER));
                if (values != null) {
                    values.forEach(value -> headers.add(key, value));
                }
            }
        }
    }
}
