package io.github.distinctid.backend.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Statement;
import java.time.Duration;

public class H2Database extends AbstractJdbcDatabase {

    public H2Database() {
        this(DEFAULT_QUERY_TIMEOUT);
    }

    public H2Database(Duration queryTimeout) {
        super(queryTimeout);
    }

    @Override
    public void executeTableDDL(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("create table if not exists " + TABLE + " (" +
                              "counter_key varchar(191) not null primary key," +
                              "counter_value bigint not null)");
        }
    }

    @Override
    public boolean insertCounter(Connection connection, String key, long value) throws SQLException {
        String sql = "merge into " + TABLE + " t " +
                     "using (select cast(? as varchar(191)) k, cast(? as bigint) v) s " +
                     "on t.counter_key=s.k " +
                     "when not matched then insert (counter_key,counter_value) values (s.k,s.v)";
        try (PreparedStatement statement = prepare(connection, sql)) {
            statement.setString(1, key);
            statement.setLong(2, value);
            return statement.executeUpdate() == 1;
        } catch (SQLIntegrityConstraintViolationException e) {
            // created by a concurrent transaction
            return false;
        }
    }

}
