package io.github.distinctid.core.support;

import io.github.distinctid.core.BackendUnavailableException;
import io.github.distinctid.core.backend.AsyncCounterBackend;
import io.github.distinctid.core.backend.CounterBackend;
import io.github.distinctid.core.backend.MemoryCounterBackend;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class LocalIdBufferTest {

    private static final String KEY = "buffer";

    @Test
    void refillsWhenExhausted() {
        MemoryCounterBackend backend = new MemoryCounterBackend();
        LocalIdBuffer buffer = new LocalIdBuffer(10);

        for (long expected = 1; expected <= 15; expected++) {
            assertEquals(expected, buffer.next(backend, KEY));
            assertTrue(buffer.current() <= buffer.highWater() + 1);
        }
        assertEquals(2, backend.getIncrementByCalls());
        assertEquals(0, backend.getIncrementCalls());
        assertEquals(2, buffer.refills());
        assertEquals(20, buffer.highWater());
        assertEquals(16, buffer.current());
    }

    @Test
    void reservesAfterOtherConsumers() {
        MemoryCounterBackend backend = new MemoryCounterBackend();
        backend.set(KEY, 500);
        LocalIdBuffer buffer = new LocalIdBuffer(100);

        assertEquals(501, buffer.next(backend, KEY));
        backend.increment(KEY);
        for (int i = 0; i < 99; i++) {
            buffer.next(backend, KEY);
        }
        assertEquals(602, buffer.next(backend, KEY));
        assertEquals(701, buffer.highWater());
    }

    @Test
    void failedRefillLeavesBufferEmpty() {
        CounterBackend backend = mock(CounterBackend.class);
        when(backend.incrementBy(anyString(), anyLong()))
                .thenThrow(new BackendUnavailableException("down", new RuntimeException("down")))
                .thenReturn(10L);
        LocalIdBuffer buffer = new LocalIdBuffer(10);

        assertThrows(BackendUnavailableException.class, () -> buffer.next(backend, KEY));
        assertEquals(0, buffer.refills());
        assertEquals(1, buffer.next(backend, KEY));
        verify(backend, times(2)).incrementBy(KEY, 10);
    }

    @Test
    void concurrentConsumersGetContiguousValues() throws Exception {
        MemoryCounterBackend backend = new MemoryCounterBackend();
        LocalIdBuffer buffer = new LocalIdBuffer(64);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        Set<Long> values = ConcurrentHashMap.newKeySet();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        values.add(buffer.next(backend, KEY));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(4000, values.size());
        for (long v = 1; v <= 4000; v++) {
            assertTrue(values.contains(v), "missing " + v);
        }
        assertEquals(63, backend.getIncrementByCalls());
    }

    @Test
    void asyncServesFromMemoryAndRefills() {
        MemoryCounterBackend backend = new MemoryCounterBackend();
        AsyncCounterBackend async = AsyncCounterBackend.of(backend, Runnable::run);
        LocalIdBuffer buffer = new LocalIdBuffer(3);

        List<Long> values = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            values.add(buffer.nextAsync(async, KEY).join());
        }
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L, 6L, 7L), values);
        assertEquals(3, backend.getIncrementByCalls());
    }

    @Test
    void asyncStaleRangeYieldsItsOwnFirstValue() {
        MemoryCounterBackend backend = new MemoryCounterBackend();
        CompletableFuture<Long> slow = new CompletableFuture<>();
        AsyncCounterBackend async = (key, delta) -> slow;
        LocalIdBuffer buffer = new LocalIdBuffer(5);

        CompletableFuture<Long> pending = buffer.nextAsync(async, KEY);
        backend.incrementBy(KEY, 5);
        assertEquals(6, buffer.next(backend, KEY));
        assertEquals(7, buffer.next(backend, KEY));

        slow.complete(5L);
        assertEquals(1, pending.join());
        assertEquals(8, buffer.next(backend, KEY));
        assertEquals(10, buffer.highWater());
    }

    @Test
    void rejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new LocalIdBuffer(0));
    }
}
