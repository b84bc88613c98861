package com.text2sql.llm;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Chat completion capability used by the pipeline.
 */
public interface CompletionClient {

    /**
     * Structured call: the model is forced to answer through {@code function}.
     *
     * @param request messages and credentials
     * @param function output shape
     * @param model model identifier
     * @return the populated arguments object, or empty when the response carries no call to
     *         {@code function}
     * @throws CompletionException when the call itself fails
     */
    Optional<JsonNode> callFunction(CompletionRequest request, FunctionSpec function, String model)
            throws CompletionException;

    /**
     * Unconstrained call.
     *
     * @param request messages and credentials
     * @param model model identifier
     * @return trimmed message content
     * @throws CompletionException when the call fails or returns no content
     */
    String complete(CompletionRequest request, String model) throws CompletionException;
}
