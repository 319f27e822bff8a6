package io.github.distinctid.backend.jdbc;

import java.sql.SQLException;

public class RuntimeSqlException extends RuntimeException {

    public RuntimeSqlException(SQLException cause) {
        super(cause.getMessage(), cause);
    }

    @Override
    public synchronized SQLException getCause() {
        return (SQLException) super.getCause();
    }
}
