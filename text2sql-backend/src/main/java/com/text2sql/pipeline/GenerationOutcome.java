package com.text2sql.pipeline;

/**
 * Result of SQL generation: a query or an error, never both.
 */
public final class GenerationOutcome {

    private final String query;
    private final String error;

    private GenerationOutcome(String query, String error) {
        this.query = query;
        this.error = error;
    }

    /**
     * Create a successful outcome.
     *
     * @param query generated SQL
     * @return outcome
     */
    public static GenerationOutcome success(String query) {
        return new GenerationOutcome(query, null);
    }

    /**
     * Create a failed outcome.
     *
     * @param error error message
     * @return outcome
     */
    public static GenerationOutcome failure(String error) {
        return new GenerationOutcome(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public String getQuery() {
        return query;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "GenerationOutcome[query]" : "GenerationOutcome[error=" + error + "]";
    }
}
