package com.text2sql.model;

/**
 * Immutable per-request scope threaded through every pipeline call.
 *
 * <p>Pipeline components are shared singletons and must not keep customer state in fields; whatever
 * depends on the caller (prompt overrides, upstream API key) is read from here.
 *
 * @param customerId optional customer scope
 * @param apiKey resolved upstream completion API key
 */
public record RequestContext(String customerId, String apiKey) {

    @Override
    public String toString() {
        return "RequestContext[customerId=" + customerId + "]";
    }
}
