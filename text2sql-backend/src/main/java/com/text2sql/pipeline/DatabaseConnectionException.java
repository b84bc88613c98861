package com.text2sql.pipeline;

/**
 * Thrown when no connection could be borrowed from the pool. Unlike {@link QueryExecutionException}
 * this says nothing about the query, so it is never handed to debug repair.
 */
public class DatabaseConnectionException extends RuntimeException {

    public DatabaseConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
