package com.text2sql.pipeline;

import com.text2sql.config.Text2SqlProperties;
import com.text2sql.util.JdbcJsonSafe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

/**
 * Runs one validated statement on a pooled connection and materializes the rows.
 */
@Slf4j
@Component
public class QueryExecutor {

    private final DataSource dataSource;
    private final boolean readOnly;
    private final int queryTimeoutSeconds;

    public QueryExecutor(DataSource dataSource, Text2SqlProperties properties) {
        this.dataSource = dataSource;
        this.readOnly = properties.getDatasource().isReadOnly();
        this.queryTimeoutSeconds = properties.getDatasource().getQueryTimeoutSeconds();
    }

    /**
     * Execute a statement.
     *
     * @param statement validated statement
     * @return rows in result order, columns in select order
     * @throws DatabaseConnectionException when no connection is available
     * @throws QueryExecutionException when the database reports an error for the statement
     */
    public List<Map<String, Object>> execute(String statement) {
        Connection conn = borrowConnection();
        long startTime = System.currentTimeMillis();
        try (conn) {
            if (readOnly) {
                conn.setReadOnly(true);
            }
            try (Statement stmt = conn.createStatement()) {
                if (queryTimeoutSeconds > 0) {
                    stmt.setQueryTimeout(queryTimeoutSeconds);
                }
                try (ResultSet rs = stmt.executeQuery(statement)) {
                    List<Map<String, Object>> rows = JdbcJsonSafe.readRows(rs);
                    log.info("Query executed (rows={}, duration_ms={})", rows.size(),
                            System.currentTimeMillis() - startTime);
                    return rows;
                }
            }
        } catch (SQLException e) {
            log.warn("Query execution failed (sql_state={}): {}", e.getSQLState(), e.getMessage());
            throw new QueryExecutionException(messageOf(e), e);
        }
    }

    private Connection borrowConnection() {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            log.error("Could not obtain a database connection: {}", e.getMessage());
            throw new DatabaseConnectionException(messageOf(e), e);
        }
    }

    private static String messageOf(SQLException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
