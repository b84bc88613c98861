package com.text2sql.llm;

/**
 * A single system + user message exchange.
 *
 * @param apiKey API key of the request scope
 * @param systemMessage system instruction
 * @param userMessage user message
 */
public record CompletionRequest(String apiKey, String systemMessage, String userMessage) {

    @Override
    public String toString() {
        return "CompletionRequest[systemMessageLength=" + (systemMessage != null ? systemMessage.length() : 0)
                + ", userMessageLength=" + (userMessage != null ? userMessage.length() : 0) + "]";
    }
}
