package io.github.distinctid.core.backend;

/**
 * Atomic, durable counter keyed by name. Both operations return the new total and must be
 * linearizable across every thread and process sharing the backend.
 * <p>
 * Implementations report failures as {@link io.github.distinctid.core.BackendUnavailableException}
 * and do not retry.
 */
public interface CounterBackend {

    default long increment(String key) {
        return incrementBy(key, 1);
    }

    long incrementBy(String key, long delta);

    static void requirePositive(long delta) {
        if (delta <= 0) {
            throw new IllegalArgumentException("delta must be positive, got " + delta);
        }
    }

}
