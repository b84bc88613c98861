package com.text2sql.pipeline;

/**
 * Result of a debug repair.
 *
 * @param fixedQuery repaired query, already re-validated
 * @param explanation model's explanation of the fix
 * @param validation validation of the repaired query
 * @param error failure reason when the repair did not produce a safe query
 */
public record DebugOutcome(String fixedQuery, String explanation, ValidationOutcome validation, String error) {

    public static DebugOutcome fixed(String fixedQuery, String explanation, ValidationOutcome validation) {
        return new DebugOutcome(fixedQuery, explanation, validation, null);
    }

    public static DebugOutcome failure(String error) {
        return new DebugOutcome(null, null, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Statement to execute after a successful repair.
     */
    public String statement() {
        return validation != null ? validation.statement() : null;
    }
}
