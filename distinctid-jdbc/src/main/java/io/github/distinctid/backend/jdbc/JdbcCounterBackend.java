package io.github.distinctid.backend.jdbc;

import io.github.distinctid.core.BackendUnavailableException;
import io.github.distinctid.core.backend.AsyncCounterBackend;
import io.github.distinctid.core.backend.CounterBackend;
import io.github.distinctid.core.log.Log;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters shared by every process that can reach the same database. An increment updates
 * the counter row and reads it back in one transaction; the row lock taken by the update
 * makes the pair atomic.
 * <p>
 * Asynchronous increments run the same transaction on a dedicated executor.
 */
public class JdbcCounterBackend implements CounterBackend, AsyncCounterBackend, AutoCloseable {

    public static final int DEFAULT_POOL_SIZE = 4;

    private final Log log = Log.get(JdbcCounterBackend.class);

    private final ConnectionProvider connectionProvider;
    private final JdbcDatabase database;
    private final ExecutorService executorService;
    private boolean shutdownServiceOnClose;

    public JdbcCounterBackend(ConnectionProvider connectionProvider) {
        this(connectionProvider, new MysqlDatabase());
    }

    public JdbcCounterBackend(ConnectionProvider connectionProvider, JdbcDatabase database) {
        this(connectionProvider, database, Executors.newFixedThreadPool(DEFAULT_POOL_SIZE, new CounterThreadFactory()));
        shutdownServiceOnClose = true;
    }

    public JdbcCounterBackend(ConnectionProvider connectionProvider,
                              JdbcDatabase database,
                              ExecutorService executorService) {
        this.connectionProvider = connectionProvider;
        this.database = database;
        this.executorService = executorService;
        try {
            executeDDL();
        } catch (RuntimeSqlException e) {
            throw new BackendUnavailableException("cannot create table " + JdbcDatabase.TABLE, e.getCause());
        }
    }

    private void executeDDL() {
        doInConnection(database::executeTableDDL);
    }

    @Override
    public long incrementBy(@NotNull String key, long delta) {
        CounterBackend.requirePositive(delta);
        long start = System.currentTimeMillis();
        AtomicLong total = new AtomicLong();
        try {
            doInTransaction(connection -> total.set(addAndGet(connection, key, delta)));
        } catch (RuntimeSqlException e) {
            throw BackendUnavailableException.of(key, e.getCause());
        }
        log.trace(() -> "counter '" + key + "' +" + delta + " = " + total.get()
                        + " in " + (System.currentTimeMillis() - start) + "ms");
        return total.get();
    }

    private long addAndGet(Connection connection, String key, long delta) throws SQLException {
        if (database.addToCounter(connection, key, delta) == 1) {
            return database.queryCounter(connection, key);
        }
        if (database.insertCounter(connection, key, delta)) {
            log.debug(() -> "counter '" + key + "' created");
            return delta;
        }
        if (database.addToCounter(connection, key, delta) != 1) {
            throw new IllegalStateException("counter '" + key + "' can not be updated");
        }
        return database.queryCounter(connection, key);
    }

    @Override
    public CompletableFuture<Long> incrementByAsync(@NotNull String key, long delta) {
        return CompletableFuture.supplyAsync(() -> incrementBy(key, delta), executorService);
    }

    /**
     * Overwrites the total of {@code key}, creating the counter if needed.
     */
    public void set(@NotNull String key, long value) {
        try {
            doInTransaction(connection -> {
                if (database.updateCounter(connection, key, value) == 0) {
                    database.insertCounter(connection, key, value);
                }
            });
        } catch (RuntimeSqlException e) {
            throw BackendUnavailableException.of(key, e.getCause());
        }
        log.info(() -> "counter '" + key + "' set to " + value);
    }

    public long get(@NotNull String key) {
        AtomicLong value = new AtomicLong();
        try {
            doInConnection(connection -> value.set(database.queryCounter(connection, key)));
        } catch (RuntimeSqlException e) {
            throw BackendUnavailableException.of(key, e.getCause());
        }
        return value.get();
    }

    private void doInConnection(ConnectionConsumer connectionConsumer) {
        try (Connection connection = connectionProvider.getConnection()) {
            connectionConsumer.doInConnection(connection);
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        }
    }

    private void doInTransaction(ConnectionConsumer connectionConsumer) {
        doInConnection(connection -> database.doInTransaction(connection, connectionConsumer));
    }

    @Override
    public void close() {
        if (shutdownServiceOnClose) {
            executorService.shutdown();
        }
    }

    private static final class CounterThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(@NotNull Runnable runnable) {
            Thread thread = new Thread(runnable, "jdbc-counter-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

}
