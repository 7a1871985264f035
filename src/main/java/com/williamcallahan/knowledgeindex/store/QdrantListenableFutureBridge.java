package com.williamcallahan.knowledgeindex.store;

import com.google.common.util.concurrent.ListenableFuture;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Waits on Qdrant's Guava futures with a bounded timeout, unwrapping failures.
 */
final class QdrantListenableFutureBridge {

    private QdrantListenableFutureBridge() {}

    static <T> T await(ListenableFuture<T> future, Duration timeout, String operation) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new IllegalStateException("Qdrant " + operation + " interrupted", interrupted);
        } catch (ExecutionException executionException) {
            Throwable cause = executionException.getCause();
            throw new IllegalStateException(
                    "Qdrant " + operation + " failed", cause == null ? executionException : cause);
        } catch (TimeoutException timeoutException) {
            future.cancel(true);
            throw new IllegalStateException(
                    "Qdrant " + operation + " timed out after " + timeout.toMillis() + "ms", timeoutException);
        }
    }
}
