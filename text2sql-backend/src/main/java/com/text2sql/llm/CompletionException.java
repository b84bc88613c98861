package com.text2sql.llm;

/**
 * Thrown when a completion call cannot be completed: transport error, timeout, or an error status
 * from the gateway.
 */
public class CompletionException extends Exception {

    public CompletionException(String message) {
        super(message);
    }

    public CompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
