package com.text2sql.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.text2sql.llm.CompletionClient;
import com.text2sql.llm.CompletionException;
import com.text2sql.llm.CompletionRequest;
import com.text2sql.llm.CompletionSettings;
import com.text2sql.llm.FunctionSpec;
import com.text2sql.model.RequestContext;
import com.text2sql.model.SchemaSnapshot;
import com.text2sql.prompt.PromptResolver;
import com.text2sql.prompt.PromptRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Asks the model to repair a query that failed validation or execution. A repaired query is always
 * sent through {@link SafetyValidator} again before it is handed back.
 */
@Slf4j
@Component
public class DebugRepairer {

    static final FunctionSpec FIX_SQL_QUERY = new FunctionSpec(
            "fix_sql_query",
            "Fix a PostgreSQL query that failed validation or execution",
            CandidateGenerator.orderedProperties(
                    "fixed_query", "The corrected SQL query",
                    "explanation", "What was wrong and how it was fixed",
                    "error", "Set only when the query cannot be fixed; explains why"
            ),
            List.of("fixed_query", "explanation")
    );

    private final CompletionClient completionClient;
    private final CompletionSettings settings;
    private final PromptResolver promptResolver;
    private final PromptContextFormatter formatter;
    private final SafetyValidator validator;

    public DebugRepairer(
            CompletionClient completionClient,
            CompletionSettings settings,
            PromptResolver promptResolver,
            PromptContextFormatter formatter,
            SafetyValidator validator
    ) {
        this.completionClient = completionClient;
        this.settings = settings;
        this.promptResolver = promptResolver;
        this.formatter = formatter;
        this.validator = validator;
    }

    /**
     * Repair a query.
     *
     * @param query query that failed
     * @param errorMessage validation reason or database error message
     * @param snapshot schema snapshot
     * @param request request scope
     * @return repaired and re-validated query, or failure
     */
    public DebugOutcome repair(String query, String errorMessage, SchemaSnapshot snapshot, RequestContext request) {
        try {
            String systemMessage = PromptRole.format(
                    promptResolver.resolve(PromptRole.DEBUG, request.customerId()),
                    Map.of(
                            "schema", formatter.schemaJson(snapshot),
                            "error", errorMessage != null ? errorMessage : ""
                    )
            );
            CompletionRequest completionRequest =
                    new CompletionRequest(request.apiKey(), systemMessage, "Fix this SQL query: " + query);

            Optional<JsonNode> arguments = settings.debugPolicy()
                    .execute(model -> completionClient.callFunction(completionRequest, FIX_SQL_QUERY, model));
            if (arguments.isEmpty()) {
                log.warn("Completion response carried no fix_sql_query call");
                return DebugOutcome.failure("Failed to debug query");
            }

            JsonNode args = arguments.get();
            String error = CandidateGenerator.text(args, "error");
            if (!error.isBlank()) {
                log.warn("Model could not fix the query: {}", error);
                return DebugOutcome.failure(error);
            }

            String fixedQuery = CandidateGenerator.text(args, "fixed_query").trim();
            if (fixedQuery.isEmpty()) {
                return DebugOutcome.failure("Failed to generate a fixed query");
            }
            String explanation = CandidateGenerator.text(args, "explanation");

            ValidationOutcome validation = validator.validate(fixedQuery);
            if (!validation.valid()) {
                log.warn("Repaired query rejected by validation: {}", validation.reason());
                return DebugOutcome.failure(validation.reason());
            }

            log.info("Query repaired: {} (explanation: {})", SqlLogging.abbreviate(fixedQuery), explanation);
            return DebugOutcome.fixed(fixedQuery, explanation, validation);
        } catch (CompletionException e) {
            log.error("Debug repair failed: {}", e.getMessage());
            return DebugOutcome.failure("Debugging error: " + e.getMessage());
        } catch (JsonProcessingException e) {
            log.error("Failed to render schema context for debug repair", e);
            return DebugOutcome.failure("Debugging error: " + e.getOriginalMessage());
        }
    }
}
