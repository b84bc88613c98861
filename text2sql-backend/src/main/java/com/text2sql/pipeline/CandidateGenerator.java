package com.text2sql.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.text2sql.llm.CompletionClient;
import com.text2sql.llm.CompletionException;
import com.text2sql.llm.CompletionRequest;
import com.text2sql.llm.CompletionSettings;
import com.text2sql.llm.FunctionSpec;
import com.text2sql.model.RequestContext;
import com.text2sql.model.SchemaContext;
import com.text2sql.prompt.PromptResolver;
import com.text2sql.prompt.PromptRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a natural-language question into one SQL query with a single structured completion call.
 */
@Slf4j
@Component
public class CandidateGenerator {

    static final FunctionSpec GENERATE_SQL_QUERY = new FunctionSpec(
            "generate_sql_query",
            "Generate a PostgreSQL query that answers the user's question",
            orderedProperties(
                    "query", "The SQL query that answers the question",
                    "error", "Set only when no query can answer the question; explains why"
            ),
            List.of("query")
    );

    private final CompletionClient completionClient;
    private final CompletionSettings settings;
    private final PromptResolver promptResolver;
    private final PromptContextFormatter formatter;

    public CandidateGenerator(
            CompletionClient completionClient,
            CompletionSettings settings,
            PromptResolver promptResolver,
            PromptContextFormatter formatter
    ) {
        this.completionClient = completionClient;
        this.settings = settings;
        this.promptResolver = promptResolver;
        this.formatter = formatter;
    }

    /**
     * Generate SQL for a question.
     *
     * @param question natural-language question
     * @param schema schema context used as prompt context
     * @param request request scope
     * @return generated query or error
     */
    public GenerationOutcome generate(String question, SchemaContext schema, RequestContext request) {
        String systemMessage;
        try {
            systemMessage = PromptRole.format(
                    promptResolver.resolve(PromptRole.GENERATION, request.customerId()),
                    Map.of(
                            "schema", formatter.schemaJson(schema.snapshot()),
                            "samples", formatter.samplesText(schema.samples())
                    )
            );
        } catch (JsonProcessingException e) {
            log.error("Failed to render schema context for generation", e);
            return GenerationOutcome.failure("Error: " + e.getOriginalMessage());
        }

        CompletionRequest completionRequest = new CompletionRequest(request.apiKey(), systemMessage, question);
        Optional<JsonNode> arguments;
        try {
            arguments = settings.generationPolicy()
                    .execute(model -> completionClient.callFunction(completionRequest, GENERATE_SQL_QUERY, model));
        } catch (CompletionException e) {
            log.error("SQL generation failed on every model: {}", e.getMessage());
            return GenerationOutcome.failure("Error: " + e.getMessage());
        }

        if (arguments.isEmpty()) {
            log.warn("Completion response carried no generate_sql_query call");
            return GenerationOutcome.failure("Failed to generate SQL query");
        }

        JsonNode args = arguments.get();
        String error = text(args, "error");
        if (!error.isBlank()) {
            log.warn("Model declined to generate SQL: {}", error);
            return GenerationOutcome.failure(error);
        }

        String query = text(args, "query").trim();
        if (query.isEmpty()) {
            return GenerationOutcome.failure("Generated SQL query is empty");
        }

        log.info("Generated SQL query: {}", SqlLogging.abbreviate(query));
        return GenerationOutcome.success(query);
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : "";
    }

    static Map<String, String> orderedProperties(String... namesAndDescriptions) {
        Map<String, String> properties = new LinkedHashMap<>();
        for (int i = 0; i + 1 < namesAndDescriptions.length; i += 2) {
            properties.put(namesAndDescriptions[i], namesAndDescriptions[i + 1]);
        }
        return properties;
    }
}
