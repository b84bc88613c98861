package com.text2sql.pipeline;

/**
 * Result of the safety gate.
 *
 * @param valid whether the query may be executed
 * @param reason rejection reason when invalid
 * @param statement the first statement of the query; the only text that may be executed
 */
public record ValidationOutcome(boolean valid, String reason, String statement) {

    public static ValidationOutcome valid(String statement) {
        return new ValidationOutcome(true, null, statement);
    }

    public static ValidationOutcome invalid(String reason) {
        return new ValidationOutcome(false, reason, null);
    }
}
