package io.github.distinctid.backend.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;

public class MysqlDatabase extends AbstractJdbcDatabase {

    public MysqlDatabase() {
        this(DEFAULT_QUERY_TIMEOUT);
    }

    public MysqlDatabase(Duration queryTimeout) {
        super(queryTimeout);
    }

    @Override
    public void executeTableDDL(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("create table if not exists `" + TABLE + "` (" +
                              "`counter_key` varchar(191) not null," +
                              "`counter_value` bigint not null," +
                              "primary key (`counter_key`)) " +
                              "engine=innodb default charset=utf8mb4 collate=utf8mb4_bin");
        }
    }

    @Override
    public boolean insertCounter(Connection connection, String key, long value) throws SQLException {
        String sql = "insert ignore into `" + TABLE + "` (`counter_key`,`counter_value`) values (?,?)";
        try (PreparedStatement statement = prepare(connection, sql)) {
            statement.setString(1, key);
            statement.setLong(2, value);
            return statement.executeUpdate() == 1;
        }
    }

}
