package com.text2sql.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.text2sql.config.Text2SqlProperties;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryExecutorTest {

    private QueryExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:executor_" + System.nanoTime() + ";DB_CLOSE_DELAY=-1");
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE orders (id INT PRIMARY KEY, amount DECIMAL(10,2), created_at TIMESTAMP, "
                    + "shipped_on DATE, note VARCHAR(20))");
            stmt.execute("INSERT INTO orders VALUES "
                    + "(1, 12.50, TIMESTAMP '2024-01-02 03:04:05', DATE '2024-01-03', NULL), "
                    + "(2, 100.00, TIMESTAMP '2024-02-01 00:00:00', NULL, 'gift')");
        }
        executor = new QueryExecutor(dataSource, new Text2SqlProperties());
    }

    @Test
    void execute_shouldReturnOrderedJsonSafeRows() {
        List<Map<String, Object>> rows = executor.execute(
                "SELECT id, amount, created_at, shipped_on, note FROM orders ORDER BY id");

        assertEquals(2, rows.size());
        Map<String, Object> first = rows.get(0);
        assertEquals(List.of("ID", "AMOUNT", "CREATED_AT", "SHIPPED_ON", "NOTE"), List.copyOf(first.keySet()));
        assertEquals(1, first.get("ID"));
        assertEquals(0, new BigDecimal("12.50").compareTo((BigDecimal) first.get("AMOUNT")));
        assertEquals("2024-01-02T03:04:05", first.get("CREATED_AT"));
        assertEquals("2024-01-03", first.get("SHIPPED_ON"));
        assertTrue(first.containsKey("NOTE"));
        assertEquals("gift", rows.get(1).get("NOTE"));
    }

    @Test
    void execute_shouldKeepEveryColumnWhenLabelsRepeat() {
        List<Map<String, Object>> rows = executor.execute(
                "SELECT o.id, p.id, o.note FROM orders o JOIN orders p ON p.id = o.id + 1");

        assertEquals(List.of("ID", "ID_2", "NOTE"), List.copyOf(rows.get(0).keySet()));
        assertEquals(1, rows.get(0).get("ID"));
        assertEquals(2, rows.get(0).get("ID_2"));
    }

    @Test
    void execute_shouldUseColumnLabels() {
        List<Map<String, Object>> rows = executor.execute("SELECT count(*) AS order_count FROM orders");

        assertEquals(List.of("ORDER_COUNT"), List.copyOf(rows.get(0).keySet()));
    }

    @Test
    void execute_shouldReturnEmptyListWhenNoRowsMatch() {
        assertTrue(executor.execute("SELECT * FROM orders WHERE id = 99").isEmpty());
    }

    @Test
    void execute_shouldWrapDatabaseErrors() {
        QueryExecutionException ex = assertThrows(QueryExecutionException.class,
                () -> executor.execute("SELECT missing_column FROM orders"));

        assertTrue(ex.getMessage().toUpperCase().contains("MISSING_COLUMN"));
    }

    @Test
    void execute_shouldReportUnavailableDatabaseSeparately() throws Exception {
        DataSource broken = mock(DataSource.class);
        when(broken.getConnection()).thenThrow(new SQLException("Connection refused"));
        QueryExecutor brokenExecutor = new QueryExecutor(broken, new Text2SqlProperties());

        DatabaseConnectionException ex = assertThrows(DatabaseConnectionException.class,
                () -> brokenExecutor.execute("SELECT 1"));

        assertEquals("Connection refused", ex.getMessage());
    }
}
