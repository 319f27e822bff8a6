package io.github.distinctid.core.backend;

import io.github.distinctid.core.BackendUnavailableException;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Non-blocking view of a counter backend. Futures complete exceptionally with
 * {@link BackendUnavailableException} when the increment fails.
 */
public interface AsyncCounterBackend {

    default CompletableFuture<Long> incrementAsync(String key) {
        return incrementByAsync(key, 1);
    }

    CompletableFuture<Long> incrementByAsync(String key, long delta);

    /**
     * Runs the blocking calls of {@code backend} on {@code executor}.
     */
    static AsyncCounterBackend of(CounterBackend backend, Executor executor) {
        Objects.requireNonNull(backend);
        Objects.requireNonNull(executor);
        return new AsyncCounterBackend() {
            @Override
            public CompletableFuture<Long> incrementAsync(String key) {
                return CompletableFuture.supplyAsync(() -> backend.increment(key), executor);
            }

            @Override
            public CompletableFuture<Long> incrementByAsync(String key, long delta) {
                return CompletableFuture.supplyAsync(() -> backend.incrementBy(key, delta), executor);
            }
        };
    }

    /**
     * Unwraps the {@link CompletionException} layer added by {@link CompletableFuture}.
     */
    static Throwable unwrap(Throwable throwable) {
        Throwable cause = throwable;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

}
