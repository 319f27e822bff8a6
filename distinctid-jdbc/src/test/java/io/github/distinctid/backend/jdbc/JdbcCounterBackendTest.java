package io.github.distinctid.backend.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.github.distinctid.core.BackendUnavailableException;
import io.github.distinctid.core.support.DistinctIdGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class JdbcCounterBackendTest {

    private static final String KEY = "distinctid:test";

    private HikariDataSource dataSource;
    private JdbcCounterBackend backend;

    @BeforeEach
    void setUp() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        config.setMaximumPoolSize(8);
        config.setConnectionTimeout(2000);
        dataSource = new HikariDataSource(config);
        backend = new JdbcCounterBackend(dataSource::getConnection, new H2Database());
    }

    @AfterEach
    void tearDown() {
        backend.close();
        dataSource.close();
    }

    @Test
    void createsCounterOnFirstIncrement() {
        assertEquals(1, backend.increment(KEY));
        assertEquals(2, backend.increment(KEY));
        assertEquals(12, backend.incrementBy(KEY, 10));
        assertEquals(12, backend.get(KEY));
        assertEquals(5, backend.incrementBy("other", 5));
    }

    @Test
    void presetCounter() {
        backend.set(KEY, 1023);
        assertEquals(1024, backend.increment(KEY));
        backend.set(KEY, 7);
        assertEquals(8, backend.increment(KEY));
    }

    @Test
    void rejectsNonPositiveDelta() {
        assertThrows(IllegalArgumentException.class, () -> backend.incrementBy(KEY, 0));
        assertThrows(IllegalArgumentException.class, () -> backend.incrementBy(KEY, -1));
    }

    @Test
    void tableCreationIsIdempotent() {
        backend.incrementBy(KEY, 3);
        JdbcCounterBackend second = new JdbcCounterBackend(dataSource::getConnection, new H2Database());
        try {
            assertEquals(4, second.increment(KEY));
        } finally {
            second.close();
        }
    }

    @Test
    void concurrentIncrementsAreAtomic() throws Exception {
        backend.increment(KEY);
        Set<Long> totals = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 100; i++) {
                        totals.add(backend.increment(KEY));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(800, totals.size());
        assertEquals(801, backend.get(KEY));
    }

    @Test
    void asyncIncrements() {
        List<CompletableFuture<Long>> futures = new ArrayList<>();
        backend.increment(KEY);
        for (int i = 0; i < 20; i++) {
            futures.add(backend.incrementAsync(KEY));
        }
        Set<Long> totals = new HashSet<>();
        for (CompletableFuture<Long> future : futures) {
            totals.add(future.join());
        }
        assertEquals(20, totals.size());
        assertEquals(26, backend.incrementByAsync(KEY, 5).join());
    }

    @Test
    void unreachableDatabaseIsUnavailable() {
        AtomicBoolean down = new AtomicBoolean();
        JdbcCounterBackend flaky = new JdbcCounterBackend(() -> {
            if (down.get()) {
                throw new SQLTransientConnectionException("Connection refused");
            }
            return dataSource.getConnection();
        }, new H2Database());
        try {
            assertEquals(1, flaky.increment(KEY));
            down.set(true);
            BackendUnavailableException e = assertThrows(BackendUnavailableException.class, () -> flaky.increment(KEY));
            assertTrue(e.getMessage().contains("Connection refused"));
            assertInstanceOf(SQLTransientConnectionException.class, e.getCause());

            CompletionException async = assertThrows(CompletionException.class, () -> flaky.incrementAsync(KEY).join());
            assertInstanceOf(BackendUnavailableException.class, async.getCause());
        } finally {
            flaky.close();
        }
    }

    @Test
    void timeoutIsUnavailable() {
        AtomicBoolean slow = new AtomicBoolean();
        JdbcCounterBackend timingOut = new JdbcCounterBackend(() -> {
            if (slow.get()) {
                throw new SQLTimeoutException("Timeout");
            }
            return dataSource.getConnection();
        }, new H2Database());
        try {
            slow.set(true);
            BackendUnavailableException e = assertThrows(BackendUnavailableException.class, () -> timingOut.incrementBy(KEY, 10));
            assertTrue(e.getMessage().contains("Timeout"));
        } finally {
            timingOut.close();
        }
    }

    @Test
    void unreachableAtStartup() {
        assertThrows(BackendUnavailableException.class, () -> new JdbcCounterBackend(() -> {
            throw new SQLTransientConnectionException("Connection refused");
        }, new H2Database()));
    }

    @Test
    void drivesGenerator() {
        DistinctIdGenerator generator = new DistinctIdGenerator(backend);
        backend.set(KEY, 1023);
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            ids.add(generator.nextId(1, KEY));
        }
        assertEquals(5, new HashSet<>(ids).size());
        for (int i = 0; i < 5; i++) {
            assertEquals(i, generator.getComposer().sequence(ids.get(i)));
        }

        long[] batch = generator.nextIdsAsync(100, 2, KEY).join();
        assertEquals(100, Arrays.stream(batch).distinct().count());
        assertEquals(1128, backend.get(KEY));

        generator.enableBuffering(10);
        for (int i = 0; i < 15; i++) {
            generator.nextId(3, KEY);
        }
        assertEquals(1148, backend.get(KEY));
    }
}
