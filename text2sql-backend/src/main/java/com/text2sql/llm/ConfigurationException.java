package com.text2sql.llm;

/**
 * Thrown when no usable upstream credential is available for a request. Not retried.
 */
public class ConfigurationException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public ConfigurationException(String message) {
        super(message);
    }
}
