package com.text2sql.util;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Set;

/**
 * Keeps a pooled connection when a generated query fails for a reason that says nothing about the
 * connection itself.
 *
 * <p>Generated SQL fails routinely (unknown column, bad cast, syntax, statement timeout) and every
 * such failure is handed to the debug repairer; none of them may cost a pooled connection.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    // 0A feature not supported, 22 data exception, 42 syntax error or access rule violation
    private static final Set<String> STATEMENT_LEVEL_CLASSES = Set.of("0A", "22", "42");

    // query_canceled, raised when the statement timeout fires
    private static final String QUERY_CANCELED = "57014";

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }
        String sqlState = sqlException != null ? sqlException.getSQLState() : null;
        if (sqlState == null || sqlState.length() < 2) {
            return Override.CONTINUE_EVICT;
        }
        if (QUERY_CANCELED.equals(sqlState) || STATEMENT_LEVEL_CLASSES.contains(sqlState.substring(0, 2))) {
            return Override.DO_NOT_EVICT;
        }
        return Override.CONTINUE_EVICT;
    }
}
