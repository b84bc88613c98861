package com.text2sql.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Failure categories of a pipeline run, each with the message used when no specific one is known.
 */
public enum ErrorKind {
    SQL_GENERATION_FAILED("sql_generation_failed",
            "I couldn't generate a valid SQL query for your question. Please try rephrasing or providing more context."),
    SQL_VALIDATION_FAILED("sql_validation_failed",
            "The generated SQL query doesn't meet security requirements. Only read-only queries are allowed."),
    DATABASE_CONNECTION_ERROR("database_connection_error",
            "There was an issue connecting to the database. Please try again later."),
    EXECUTION_ERROR("execution_error",
            "An error occurred while executing the query. Please check your question for clarity."),
    INSUFFICIENT_PERMISSIONS("insufficient_permissions",
            "You don't have permission to access this information."),
    CONFIGURATION_ERROR("configuration_error",
            "The service is not configured to answer questions. Please contact the administrator."),
    EMPTY_RESULTS("empty_results",
            "The query executed successfully but returned no results."),
    SUMMARIZATION_FAILED("summarization_failed",
            "I couldn't generate a summary for the query results."),
    GENERAL_ERROR("general_error",
            "An unexpected error occurred. Please try again later.");

    private final String code;
    private final String defaultMessage;

    ErrorKind(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
