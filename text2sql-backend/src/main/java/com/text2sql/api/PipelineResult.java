package com.text2sql.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.text2sql.pipeline.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response envelope of {@code POST /v1/query}.
 *
 * JSON fields (snake_case, nulls omitted):
 * - success: whether rows were returned to the caller
 * - query: the statement that was executed
 * - original_query: the statement before a debug repair, only when was_debugged
 * - was_debugged: whether a debug repair was used
 * - data: result rows, absent on failure
 * - summary: natural-language answer
 * - record_count: number of rows
 * - error: {type, message} on failure
 * - mock: true on failure envelopes
 * - message: informational message for empty results
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PipelineResult {

    static final String EMPTY_RESULTS_SUMMARY = "No data was found for your query.";
    static final String EMPTY_RESULTS_MESSAGE = "Query executed successfully but returned no results.";

    private boolean success;
    private String query;
    private String originalQuery;
    private Boolean wasDebugged;
    private List<Map<String, Object>> data;
    private String summary;
    private Integer recordCount;
    private ErrorDetail error;
    private Boolean mock;
    private String message;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorDetail {
        private ErrorKind type;
        private String message;
    }

    /**
     * Failure envelope.
     *
     * @param kind failure category
     * @param message specific message; the category default is used when blank
     * @return result
     */
    public static PipelineResult failure(ErrorKind kind, String message) {
        String effective = message != null && !message.isBlank() ? message : kind.getDefaultMessage();
        return PipelineResult.builder()
                .success(false)
                .error(new ErrorDetail(kind, effective))
                .mock(true)
                .build();
    }

    /**
     * Success envelope for a query that returned no rows.
     *
     * @param query executed statement
     * @return result
     */
    public static PipelineResult emptyResults(String query) {
        return PipelineResult.builder()
                .success(true)
                .query(query)
                .data(List.of())
                .recordCount(0)
                .summary(EMPTY_RESULTS_SUMMARY)
                .message(EMPTY_RESULTS_MESSAGE)
                .build();
    }

    /**
     * Success envelope with rows.
     *
     * @param query executed statement
     * @param rows result rows
     * @param summary summary text
     * @return result
     */
    public static PipelineResult success(String query, List<Map<String, Object>> rows, String summary) {
        return PipelineResult.builder()
                .success(true)
                .query(query)
                .data(rows)
                .recordCount(rows.size())
                .summary(summary)
                .build();
    }

    /**
     * Mark this result as produced by a repaired query.
     *
     * @param originalQuery statement before the first repair
     * @return this result
     */
    public PipelineResult debugged(String originalQuery) {
        this.wasDebugged = true;
        this.originalQuery = originalQuery;
        return this;
    }
}
