package com.vmturbo.protoc.http.bridge.runtime.route;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import javax.annotation.Nonnull;

import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.stub.StreamObserver;

/**
 * Collects the responses of a call, so that the HTTP route can wait for the call to finish.
 * The service implementation may complete the call from any thread.
 *
 * @param <T> The response type.
 */
public class CollectingStreamObserver<T> implements StreamObserver<T> {

    private final List<T> values = new ArrayList<>();

    private final CompletableFuture<List<T>> result = new CompletableFuture<>();

    @Override
    public void onNext(final T value) {
        synchronized (values) {
            if (result.isDone()) {
                throw new IllegalStateException("Call already closed.");
            }
            values.add(value);
        }
    }

    @Override
    public void onError(final Throwable t) {
        result.completeExceptionally(t);
    }

    @Override
    public void onCompleted() {
        synchronized (values) {
            result.complete(Collections.unmodifiableList(new ArrayList<>(values)));
        }
    }

    /**
     * Block until the call completes.
     *
     * @return The responses, in order.
     * @throws StatusException The status the call failed with.
     */
    @Nonnull
    public List<T> awaitValues() throws StatusException {
        try {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw Status.CANCELLED.withDescription("Interrupted while waiting for the call to complete.")
                    .withCause(e)
                    .asException();
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            throw Status.fromThrowable(cause).asException(Status.trailersFromThrowable(cause));
        }
    }
}
