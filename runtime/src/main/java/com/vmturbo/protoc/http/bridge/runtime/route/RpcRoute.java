package com.vmturbo.protoc.http.bridge.runtime.route;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteStreams;

import io.grpc.Context;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.ServerCalls.BidiStreamingMethod;
import io.grpc.stub.ServerCalls.ClientStreamingMethod;
import io.grpc.stub.ServerCalls.ServerStreamingMethod;
import io.grpc.stub.ServerCalls.UnaryMethod;
import io.grpc.stub.StreamObserver;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.function.HandlerFunction;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import com.vmturbo.protoc.http.bridge.runtime.json.HttpBridgeJson;

/**
 * Executes one gRPC method per HTTP request: the JSON body is read into the request transfer
 * object(s), converted to protobuf and passed to the service implementation, and the responses
 * are written back as JSON. Requests of client-streaming methods and responses of
 * server-streaming methods are JSON arrays.
 * <p>
 * The route waits for the implementation to complete the call. A failed call is answered with
 * the HTTP status and error body of its gRPC status.
 *
 * @param <ReqDtoT> The request transfer object.
 * @param <ReqT> The request message.
 * @param <RespT> The response message.
 * @param <RespDtoT> The response transfer object.
 */
public class RpcRoute<ReqDtoT, ReqT, RespT, RespDtoT> implements HandlerFunction<ServerResponse> {

    private static final Logger logger = LogManager.getLogger();

    /**
     * Invokes the service implementation with all the requests of one call.
     */
    @FunctionalInterface
    private interface CallInvoker<ReqT, RespT> {
        void invoke(@Nonnull List<ReqT> requests, @Nonnull StreamObserver<RespT> responseObserver);
    }

    private final Class<ReqDtoT> requestType;

    private final boolean streamingRequest;

    private final boolean streamingResponse;

    private final Function<ReqDtoT, ReqT> requestConverter;

    private final Function<RespT, RespDtoT> responseConverter;

    private final CallInvoker<ReqT, RespT> invoker;

    private final RpcErrorRenderer errorRenderer;

    private final ObjectMapper objectMapper;

    private RpcRoute(@Nonnull final Class<ReqDtoT> requestType,
                     final boolean streamingRequest,
                     final boolean streamingResponse,
                     @Nonnull final Function<ReqDtoT, ReqT> requestConverter,
                     @Nonnull final Function<RespT, RespDtoT> responseConverter,
                     @Nonnull final CallInvoker<ReqT, RespT> invoker,
                     @Nonnull final RpcErrorRenderer errorRenderer,
                     @Nonnull final ObjectMapper objectMapper) {
        this.requestType = requestType;
        this.streamingRequest = streamingRequest;
        this.streamingResponse = streamingResponse;
        this.requestConverter = requestConverter;
        this.responseConverter = responseConverter;
        this.invoker = invoker;
        this.errorRenderer = errorRenderer;
        this.objectMapper = objectMapper;
    }

    /**
     * A route for a method with a single request and a single response.
     *
     * @param requestType The request transfer object class.
     * @param requestConverter Converts the request transfer object to the request message.
     * @param responseConverter Converts the response message to its transfer object.
     * @param method The method of the service implementation.
     * @param errorRenderer Renders failures.
     * @param <ReqDtoT> The request transfer object.
     * @param <ReqT> The request message.
     * @param <RespT> The response message.
     * @param <RespDtoT> The response transfer object.
     * @return The route.
     */
    @Nonnull
    public static <ReqDtoT, ReqT, RespT, RespDtoT> RpcRoute<ReqDtoT, ReqT, RespT, RespDtoT> unary(
            @Nonnull final Class<ReqDtoT> requestType,
            @Nonnull final Function<ReqDtoT, ReqT> requestConverter,
            @Nonnull final Function<RespT, RespDtoT> responseConverter,
            @Nonnull final UnaryMethod<ReqT, RespT> method,
            @Nonnull final RpcErrorRenderer errorRenderer) {
        return new RpcRoute<>(requestType, false, false, requestConverter, responseConverter,
                (requests, responseObserver) -> method.invoke(requests.get(0), responseObserver),
                errorRenderer, HttpBridgeJson.objectMapper());
    }

    /**
     * A route for a method with a single request and a stream of responses, answered with a
     * JSON array.
     */
    @Nonnull
    public static <ReqDtoT, ReqT, RespT, RespDtoT> RpcRoute<ReqDtoT, ReqT, RespT, RespDtoT> serverStreaming(
            @Nonnull final Class<ReqDtoT> requestType,
            @Nonnull final Function<ReqDtoT, ReqT> requestConverter,
            @Nonnull final Function<RespT, RespDtoT> responseConverter,
            @Nonnull final ServerStreamingMethod<ReqT, RespT> method,
            @Nonnull final RpcErrorRenderer errorRenderer) {
        return new RpcRoute<>(requestType, false, true, requestConverter, responseConverter,
                (requests, responseObserver) -> method.invoke(requests.get(0), responseObserver),
                errorRenderer, HttpBridgeJson.objectMapper());
    }

    /**
     * A route for a method with a stream of requests, read from a JSON array, and a single
     * response.
     */
    @Nonnull
    public static <ReqDtoT, ReqT, RespT, RespDtoT> RpcRoute<ReqDtoT, ReqT, RespT, RespDtoT> clientStreaming(
            @Nonnull final Class<ReqDtoT> requestType,
            @Nonnull final Function<ReqDtoT, ReqT> requestConverter,
            @Nonnull final Function<RespT, RespDtoT> responseConverter,
            @Nonnull final ClientStreamingMethod<ReqT, RespT> method,
            @Nonnull final RpcErrorRenderer errorRenderer) {
        return new RpcRoute<>(requestType, true, false, requestConverter, responseConverter,
                (requests, responseObserver) -> sendAll(method.invoke(responseObserver), requests),
                errorRenderer, HttpBridgeJson.objectMapper());
    }

    /**
     * A route for a method with streams of requests and responses, both JSON arrays.
     */
    @Nonnull
    public static <ReqDtoT, ReqT, RespT, RespDtoT> RpcRoute<ReqDtoT, ReqT, RespT, RespDtoT> bidiStreaming(
            @Nonnull final Class<ReqDtoT> requestType,
            @Nonnull final Function<ReqDtoT, ReqT> requestConverter,
            @Nonnull final Function<RespT, RespDtoT> responseConverter,
            @Nonnull final BidiStreamingMethod<ReqT, RespT> method,
            @Nonnull final RpcErrorRenderer errorRenderer) {
        return new RpcRoute<>(requestType, true, true, requestConverter, responseConverter,
                (requests, responseObserver) -> sendAll(method.invoke(responseObserver), requests),
                errorRenderer, HttpBridgeJson.objectMapper());
    }

    private static <ReqT> void sendAll(@Nonnull final StreamObserver<ReqT> requestObserver,
                                       @Nonnull final List<ReqT> requests) {
        requests.forEach(requestObserver::onNext);
        requestObserver.onCompleted();
    }

    @Override
    public ServerResponse handle(@Nonnull final ServerRequest request) throws IOException {
        final Metadata responseMetadata = new Metadata();
        try {
            final List<ReqT> requests = readRequests(request);
            final List<RespT> responses = call(request, requests, responseMetadata);
            return ServerResponse.ok()
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> RpcMetadataHeaders.addHeaders(responseMetadata, headers))
                    .body(writeResponses(responses));
        } catch (StatusException e) {
            logger.debug("Call to {} failed with {}", request.path(), e.getStatus());
            return writeError(e.getStatus(), e.getTrailers(), responseMetadata);
        }
    }

    @Nonnull
    private List<ReqT> readRequests(@Nonnull final ServerRequest request) throws StatusException {
        final Optional<MediaType> contentType;
        try {
            contentType = request.headers().contentType();
        } catch (InvalidMediaTypeException e) {
            throw invalidArgument(e.getMessage(), e);
        }
        if (contentType.isPresent() && !MediaType.APPLICATION_JSON.isCompatibleWith(contentType.get())) {
            throw invalidArgument("Unsupported content type " + contentType.get()
                    + ", expected " + MediaType.APPLICATION_JSON_VALUE, null);
        }

        final byte[] body;
        try {
            body = ByteStreams.toByteArray(request.servletRequest().getInputStream());
        } catch (IOException e) {
            throw Status.CANCELLED.withDescription("Failed to read the request body: " + e.getMessage())
                    .withCause(e)
                    .asException();
        }
        final boolean emptyBody = new String(body, StandardCharsets.UTF_8).trim().isEmpty();

        final List<ReqDtoT> requestObjects;
        try {
            if (streamingRequest) {
                final JavaType listType = objectMapper.getTypeFactory()
                        .constructCollectionType(List.class, requestType);
                requestObjects = emptyBody ? ImmutableList.of() : objectMapper.readValue(body, listType);
            } else {
                final ReqDtoT requestObject = emptyBody
                        ? objectMapper.readValue("{}", requestType)
                        : objectMapper.readValue(body, requestType);
                requestObjects = requestObject == null ? null : ImmutableList.of(requestObject);
            }
        } catch (JsonProcessingException e) {
            throw invalidArgument("Malformed request body: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw Status.CANCELLED.withDescription("Failed to read the request body: " + e.getMessage())
                    .withCause(e)
                    .asException();
        }
        if (requestObjects == null || requestObjects.contains(null)) {
            throw invalidArgument("The request body must be a JSON "
                    + (streamingRequest ? "array of objects." : "object."), null);
        }

        try {
            return requestObjects.stream()
                    .map(requestConverter)
                    .collect(Collectors.toList());
        } catch (IllegalArgumentException e) {
            throw invalidArgument(e.getMessage(), e);
        }
    }

    @Nonnull
    private List<RespT> call(@Nonnull final ServerRequest request,
                             @Nonnull final List<ReqT> requests,
                             @Nonnull final Metadata responseMetadata) throws StatusException {
        final Metadata requestMetadata;
        try {
            requestMetadata = RpcMetadataHeaders.toMetadata(request.headers().asHttpHeaders());
        } catch (IllegalArgumentException e) {
            throw invalidArgument("Invalid request header: " + e.getMessage(), e);
        }
        final Map<String, Object> attributes = request.attributes();
        final Context context = Context.current().withValues(
                HttpRpcContext.REQUEST_METADATA, requestMetadata,
                HttpRpcContext.RESPONSE_METADATA, responseMetadata,
                HttpRpcContext.REQUEST_ATTRIBUTES, attributes);

        final CollectingStreamObserver<RespT> responseObserver = new CollectingStreamObserver<>();
        final Context previous = context.attach();
        try {
            invoker.invoke(requests, responseObserver);
        } catch (StatusRuntimeException e) {
            logger.debug("Implementation of {} failed with {}", request.path(), e.getStatus());
            responseObserver.onError(e);
        } catch (RuntimeException e) {
            logger.error("Unexpected failure in the implementation of " + request.path(), e);
            responseObserver.onError(e);
        } finally {
            context.detach(previous);
        }

        final List<RespT> responses = responseObserver.awaitValues();
        if (!streamingResponse && responses.size() != 1) {
            throw Status.INTERNAL.withDescription(responses.isEmpty()
                    ? "The call completed without a response."
                    : "The call completed with " + responses.size() + " responses.")
                    .asException();
        }
        return responses;
    }

    @Nonnull
    private byte[] writeResponses(@Nonnull final List<RespT> responses) throws JsonProcessingException {
        final List<RespDtoT> responseObjects = responses.stream()
                .map(responseConverter)
                .collect(Collectors.toList());
        return objectMapper.writeValueAsBytes(streamingResponse ? responseObjects : responseObjects.get(0));
    }

    @Nonnull
    private ServerResponse writeError(@Nonnull final Status status,
                                      @Nullable final Metadata trailers,
                                      @Nonnull final Metadata responseMetadata) throws JsonProcessingException {
        final Metadata errorTrailers = trailers == null ? new Metadata() : trailers;
        final RpcError error = errorRenderer.render(status, errorTrailers);
        return ServerResponse.status(error.getHttpStatus())
                .contentType(MediaType.APPLICATION_JSON)
                .headers(headers -> {
                    RpcMetadataHeaders.addHeaders(responseMetadata, headers);
                    RpcMetadataHeaders.addHeaders(errorTrailers, headers);
                })
                .body(objectMapper.writeValueAsBytes(error));
    }

    @Nonnull
    private static StatusException invalidArgument(@Nullable final String description,
                                                   @Nullable final Throwable cause) {
        return Status.INVALID_ARGUMENT.withDescription(description).withCause(cause).asException();
    }
}
