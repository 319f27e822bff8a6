package io.github.distinctid.backend.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * SQL dialect of the counter table {@code id_generator_counter(counter_key, counter_value)}.
 */
public interface JdbcDatabase {

    String TABLE = "id_generator_counter";

    void executeTableDDL(Connection connection) throws SQLException;

    /**
     * Creates the counter row with {@code value} unless it already exists.
     *
     * @return whether the row was created by this call
     */
    boolean insertCounter(Connection connection, String key, long value) throws SQLException;

    /**
     * Adds {@code delta} to the counter, locking its row until the transaction ends.
     *
     * @return number of rows updated, 0 if the counter does not exist
     */
    int addToCounter(Connection connection, String key, long delta) throws SQLException;

    int updateCounter(Connection connection, String key, long value) throws SQLException;

    long queryCounter(Connection connection, String key) throws SQLException;

    default void doInTransaction(Connection connection, ConnectionConsumer consumer) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        if (autoCommit) {
            connection.setAutoCommit(false);
        }
        try {
            consumer.doInConnection(connection);
            connection.commit();
        } catch (Exception e) {
            connection.rollback();
            throw e;
        } finally {
            if (autoCommit) {
                connection.setAutoCommit(true);
            }
        }
    }

}
