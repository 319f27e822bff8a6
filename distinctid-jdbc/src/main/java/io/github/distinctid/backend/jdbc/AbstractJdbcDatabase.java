package io.github.distinctid.backend.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;

public abstract class AbstractJdbcDatabase implements JdbcDatabase {

    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(5);

    private final int queryTimeoutSeconds;

    protected AbstractJdbcDatabase(Duration queryTimeout) {
        this.queryTimeoutSeconds = toSeconds(queryTimeout);
    }

    /**
     * Whole seconds, rounded up; zero or negative durations mean no timeout.
     */
    static int toSeconds(Duration timeout) {
        if (timeout.isZero() || timeout.isNegative()) {
            return 0;
        }
        long millis = timeout.toMillis();
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, (millis + 999) / 1000));
    }

    protected PreparedStatement prepare(Connection connection, String sql) throws SQLException {
        PreparedStatement statement = connection.prepareStatement(sql);
        statement.setQueryTimeout(queryTimeoutSeconds);
        return statement;
    }

    int getQueryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    @Override
    public int addToCounter(Connection connection, String key, long delta) throws SQLException {
        String sql = "update " + TABLE + " set counter_value=counter_value+? where counter_key=?";
        try (PreparedStatement statement = prepare(connection, sql)) {
            statement.setLong(1, delta);
            statement.setString(2, key);
            return statement.executeUpdate();
        }
    }

    @Override
    public int updateCounter(Connection connection, String key, long value) throws SQLException {
        String sql = "update " + TABLE + " set counter_value=? where counter_key=?";
        try (PreparedStatement statement = prepare(connection, sql)) {
            statement.setLong(1, value);
            statement.setString(2, key);
            return statement.executeUpdate();
        }
    }

    @Override
    public long queryCounter(Connection connection, String key) throws SQLException {
        String sql = "select counter_value from " + TABLE + " where counter_key=?";
        try (PreparedStatement statement = prepare(connection, sql)) {
            statement.setString(1, key);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (resultSet.next()) {
                    return resultSet.getLong(1);
                }
            }
        }
        throw new IllegalStateException("counter '" + key + "' not found");
    }
}
