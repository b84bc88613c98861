package com.text2sql.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.text2sql.config.Text2SqlProperties;
import com.text2sql.llm.CompletionClient;
import com.text2sql.llm.CompletionException;
import com.text2sql.llm.CompletionRequest;
import com.text2sql.llm.CompletionSettings;
import com.text2sql.model.RequestContext;
import com.text2sql.model.SchemaContext;
import com.text2sql.prompt.InMemoryPromptStore;
import com.text2sql.prompt.PromptResolver;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CandidateGeneratorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final RequestContext REQUEST = new RequestContext(null, "sk-test");

    @Mock
    private CompletionClient completionClient;

    private CandidateGenerator generator;
    private SchemaContext schema;

    @BeforeEach
    void setUp() {
        Text2SqlProperties properties = new Text2SqlProperties();
        CompletionSettings settings = new CompletionSettings(
                "http://localhost", "sk-test", "gpt-4o", "gpt-4", "gpt-3.5-turbo", 1000);
        generator = new CandidateGenerator(
                completionClient,
                settings,
                new PromptResolver(new InMemoryPromptStore(properties)),
                new PromptContextFormatter(MAPPER, properties)
        );
        schema = new SchemaContext(
                HeuristicFixerTest.snapshot("users"),
                Map.of("users", List.of(Map.of("id", 1))),
                OffsetDateTime.now()
        );
    }

    @Test
    void generate_shouldReturnQueryFromFunctionCall() throws Exception {
        when(completionClient.callFunction(any(), eq(CandidateGenerator.GENERATE_SQL_QUERY), eq("gpt-4o")))
                .thenReturn(args("{\"query\": \"  SELECT * FROM users  \"}"));

        GenerationOutcome outcome = generator.generate("list all users", schema, REQUEST);

        assertTrue(outcome.isSuccess());
        assertEquals("SELECT * FROM users", outcome.getQuery());
        assertNull(outcome.getError());
    }

    @Test
    void generate_shouldEmbedSchemaAndSamplesInSystemMessage() throws Exception {
        when(completionClient.callFunction(any(), any(), any())).thenReturn(args("{\"query\": \"SELECT 1\"}"));

        generator.generate("list all users", schema, REQUEST);

        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(completionClient).callFunction(captor.capture(), any(), eq("gpt-4o"));
        CompletionRequest request = captor.getValue();
        assertEquals("sk-test", request.apiKey());
        assertEquals("list all users", request.userMessage());
        assertTrue(request.systemMessage().contains("\"users\""));
        assertTrue(request.systemMessage().contains("Here are some examples of the data:\n\nTable: users\n"));
        assertFalse(request.systemMessage().contains("{schema}"));
        assertFalse(request.systemMessage().contains("{samples}"));
    }

    @Test
    void generate_shouldPreferErrorFieldOverQuery() throws Exception {
        when(completionClient.callFunction(any(), any(), any()))
                .thenReturn(args("{\"query\": \"SELECT 1\", \"error\": \"The schema has no salary data\"}"));

        GenerationOutcome outcome = generator.generate("average salary", schema, REQUEST);

        assertFalse(outcome.isSuccess());
        assertEquals("The schema has no salary data", outcome.getError());
        assertNull(outcome.getQuery());
    }

    @Test
    void generate_shouldFailOnBlankQuery() throws Exception {
        when(completionClient.callFunction(any(), any(), any())).thenReturn(args("{\"query\": \"  \"}"));

        assertEquals("Generated SQL query is empty", generator.generate("q", schema, REQUEST).getError());
    }

    @Test
    void generate_shouldFailWhenResponseHasNoFunctionCall() throws Exception {
        when(completionClient.callFunction(any(), any(), any())).thenReturn(Optional.empty());

        assertEquals("Failed to generate SQL query", generator.generate("q", schema, REQUEST).getError());
    }

    @Test
    void generate_shouldRetryWithFallbackModel() throws Exception {
        when(completionClient.callFunction(any(), any(), eq("gpt-4o"))).thenThrow(new CompletionException("HTTP 503"));
        when(completionClient.callFunction(any(), any(), eq("gpt-4"))).thenReturn(args("{\"query\": \"SELECT 2\"}"));

        GenerationOutcome outcome = generator.generate("q", schema, REQUEST);

        assertEquals("SELECT 2", outcome.getQuery());
    }

    @Test
    void generate_shouldReportLastErrorWhenAllModelsFail() throws Exception {
        when(completionClient.callFunction(any(), any(), eq("gpt-4o"))).thenThrow(new CompletionException("HTTP 503"));
        when(completionClient.callFunction(any(), any(), eq("gpt-4"))).thenThrow(new CompletionException("HTTP 429"));

        GenerationOutcome outcome = generator.generate("q", schema, REQUEST);

        assertEquals("Error: HTTP 429", outcome.getError());
        verify(completionClient, never()).callFunction(any(), any(), eq("gpt-3.5-turbo"));
    }

    static Optional<JsonNode> args(String json) throws Exception {
        return Optional.of(MAPPER.readTree(json));
    }
}
