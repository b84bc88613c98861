package com.text2sql.pipeline;

/**
 * Thrown when the database rejects or fails a validated query. The message is the driver's message.
 */
public class QueryExecutionException extends RuntimeException {

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
