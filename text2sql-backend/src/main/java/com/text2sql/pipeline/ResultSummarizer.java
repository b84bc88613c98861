package com.text2sql.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.text2sql.config.Text2SqlProperties;
import com.text2sql.llm.CompletionClient;
import com.text2sql.llm.CompletionRequest;
import com.text2sql.llm.CompletionSettings;
import com.text2sql.model.RequestContext;
import com.text2sql.prompt.PromptResolver;
import com.text2sql.prompt.PromptRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Writes the natural-language answer for a result set, followed by a markdown preview table.
 *
 * <p>Summarization never fails the request: any error yields {@link #FALLBACK_SUMMARY}.
 */
@Slf4j
@Component
public class ResultSummarizer {

    static final String NO_RESULTS_SUMMARY = "The query returned no results.";
    static final String FALLBACK_SUMMARY = "I couldn't generate a summary for the query results.";

    private final CompletionClient completionClient;
    private final CompletionSettings settings;
    private final PromptResolver promptResolver;
    private final PromptContextFormatter formatter;
    private final int previewRows;
    private final int contextRows;

    public ResultSummarizer(
            CompletionClient completionClient,
            CompletionSettings settings,
            PromptResolver promptResolver,
            PromptContextFormatter formatter,
            Text2SqlProperties properties
    ) {
        this.completionClient = completionClient;
        this.settings = settings;
        this.promptResolver = promptResolver;
        this.formatter = formatter;
        this.previewRows = properties.getSummary().getPreviewRows();
        this.contextRows = properties.getSummary().getContextRows();
    }

    /**
     * Summarize query results.
     *
     * @param question original question
     * @param query executed statement
     * @param rows result rows
     * @param request request scope
     * @return summary text, with the preview table appended when there are rows
     */
    public String summarize(String question, String query, List<Map<String, Object>> rows, RequestContext request) {
        if (rows == null || rows.isEmpty()) {
            return NO_RESULTS_SUMMARY;
        }

        try {
            String userMessage = "Original question: " + question + "\n"
                    + "SQL query executed: " + query + "\n"
                    + "Query results: " + resultContext(rows) + "\n\n"
                    + "Please summarize these results to answer the original question.";
            CompletionRequest completionRequest = new CompletionRequest(
                    request.apiKey(),
                    promptResolver.resolve(PromptRole.SUMMARY, request.customerId()),
                    userMessage
            );

            String summary = settings.primaryOnly()
                    .execute(model -> completionClient.complete(completionRequest, model));
            return summary + disclosure(rows);
        } catch (Exception e) {
            log.error("Error generating result summary: {}", e.getMessage());
            return FALLBACK_SUMMARY;
        }
    }

    private String resultContext(List<Map<String, Object>> rows) throws JsonProcessingException {
        int shown = Math.min(contextRows, rows.size());
        String json = formatter.rowsJson(rows.subList(0, shown));
        if (rows.size() > shown) {
            json += "\n... and " + (rows.size() - shown) + " more rows";
        }
        return json;
    }

    private String disclosure(List<Map<String, Object>> rows) {
        String table = MarkdownTableRenderer.render(rows, previewRows);
        int total = rows.size();
        if (total > previewRows) {
            return "\n\nHere are the top " + Math.min(previewRows, total) + " results out of " + total
                    + " total rows:\n\n" + table;
        }
        return "\n\nHere are all " + total + " results:\n\n" + table;
    }
}
