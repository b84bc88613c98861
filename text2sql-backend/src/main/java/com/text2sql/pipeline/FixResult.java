package com.text2sql.pipeline;

/**
 * Output of {@link HeuristicFixer}.
 *
 * @param query possibly rewritten query
 * @param changed whether any rewrite was applied
 */
public record FixResult(String query, boolean changed) {
}
