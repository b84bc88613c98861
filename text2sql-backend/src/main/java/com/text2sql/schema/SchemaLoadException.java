package com.text2sql.schema;

/**
 * Thrown when the schema snapshot cannot be built from the relational store.
 */
public class SchemaLoadException extends Exception {
    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause underlying error
     */
    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
