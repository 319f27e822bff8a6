package io.github.distinctid.backend.jdbc;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AbstractJdbcDatabaseTest {

    @Test
    void subSecondTimeoutRoundsUp() {
        assertEquals(1, new H2Database(Duration.ofMillis(1)).getQueryTimeoutSeconds());
        assertEquals(1, new H2Database(Duration.ofMillis(999)).getQueryTimeoutSeconds());
        assertEquals(2, new MysqlDatabase(Duration.ofMillis(1001)).getQueryTimeoutSeconds());
        assertEquals(5, new MysqlDatabase().getQueryTimeoutSeconds());
    }

    @Test
    void zeroOrNegativeMeansNoTimeout() {
        assertEquals(0, new H2Database(Duration.ZERO).getQueryTimeoutSeconds());
        assertEquals(0, new H2Database(Duration.ofSeconds(-3)).getQueryTimeoutSeconds());
    }
}
