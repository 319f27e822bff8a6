package io.github.distinctid.core.support;

import io.github.distinctid.core.backend.AsyncCounterBackend;
import io.github.distinctid.core.backend.CounterBackend;
import io.github.distinctid.core.log.Log;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serves counter values from a range reserved on the backend in one call, reserving the
 * next range once the current one is used up.
 * <p>
 * {@code current <= highWater + 1} holds at all times. While this buffer is the only
 * consumer of its key the values it returns are strictly increasing with no gaps.
 */
public class LocalIdBuffer {

    private final Log log = Log.get(LocalIdBuffer.class);

    private final Lock lock = new ReentrantLock();
    private final int bufferSize;

    private long current = 1;
    private long highWater = 0;
    private long refills;

    public LocalIdBuffer(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive, got " + bufferSize);
        }
        this.bufferSize = bufferSize;
    }

    public long next(CounterBackend backend, String key) {
        lock.lock();
        try {
            if (current > highWater) {
                install(backend.incrementBy(key, bufferSize));
            }
            return current++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Asynchronous {@link #next}. The lock is never held while the backend is awaited, so
     * callers arriving at an empty buffer each reserve a range. A range older than the
     * installed one only yields its first value; the rest of it is skipped.
     */
    public CompletableFuture<Long> nextAsync(AsyncCounterBackend backend, String key) {
        lock.lock();
        try {
            if (current <= highWater) {
                return CompletableFuture.completedFuture(current++);
            }
        } finally {
            lock.unlock();
        }
        return backend.incrementByAsync(key, bufferSize).thenApply(this::accept);
    }

    private long accept(long total) {
        lock.lock();
        try {
            if (total > highWater) {
                install(total);
                return current++;
            }
            return total - bufferSize + 1;
        } finally {
            lock.unlock();
        }
    }

    private void install(long total) {
        highWater = total;
        current = total - bufferSize + 1;
        refills++;
        log.debug(() -> "reserved [" + (total - bufferSize + 1) + ", " + total + "]");
    }

    public int getBufferSize() {
        return bufferSize;
    }

    public long current() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }

    public long highWater() {
        lock.lock();
        try {
            return highWater;
        } finally {
            lock.unlock();
        }
    }

    public long refills() {
        lock.lock();
        try {
            return refills;
        } finally {
            lock.unlock();
        }
    }
}
