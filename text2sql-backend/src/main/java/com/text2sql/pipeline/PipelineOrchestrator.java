package com.text2sql.pipeline;

import com.text2sql.api.PipelineResult;
import com.text2sql.llm.ConfigurationException;
import com.text2sql.llm.CredentialResolver;
import com.text2sql.model.RequestContext;
import com.text2sql.model.SchemaContext;
import com.text2sql.schema.SchemaRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Runs a question through generation, fixing, validation, execution and summarization.
 *
 * <p>Every outcome is returned as a {@link PipelineResult}; no exception leaves {@link #process}.
 * At most one repair is attempted after a validation failure and at most one after an execution
 * failure. Only statements that passed {@link SafetyValidator} are ever executed.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    private final CredentialResolver credentialResolver;
    private final SchemaRegistry schemaRegistry;
    private final CandidateGenerator generator;
    private final HeuristicFixer fixer;
    private final SafetyValidator validator;
    private final DebugRepairer repairer;
    private final QueryExecutor executor;
    private final ResultSummarizer summarizer;

    public PipelineOrchestrator(
            CredentialResolver credentialResolver,
            SchemaRegistry schemaRegistry,
            CandidateGenerator generator,
            HeuristicFixer fixer,
            SafetyValidator validator,
            DebugRepairer repairer,
            QueryExecutor executor,
            ResultSummarizer summarizer
    ) {
        this.credentialResolver = credentialResolver;
        this.schemaRegistry = schemaRegistry;
        this.generator = generator;
        this.fixer = fixer;
        this.validator = validator;
        this.repairer = repairer;
        this.executor = executor;
        this.summarizer = summarizer;
    }

    /**
     * Answer a question.
     *
     * @param question natural-language question
     * @param customerId optional customer scope
     * @return result envelope
     */
    public PipelineResult process(String question, String customerId) {
        try {
            return run(question, credentialResolver.resolve(customerId));
        } catch (ConfigurationException e) {
            return PipelineResult.failure(ErrorKind.CONFIGURATION_ERROR, e.getMessage());
        } catch (DatabaseConnectionException e) {
            return PipelineResult.failure(ErrorKind.DATABASE_CONNECTION_ERROR, null);
        } catch (RuntimeException e) {
            log.error("Unexpected error processing question (customer_id={})", customerId, e);
            return PipelineResult.failure(ErrorKind.GENERAL_ERROR, e.getMessage());
        }
    }

    private PipelineResult run(String question, RequestContext request) {
        SchemaContext schema = schemaRegistry.current();
        log.info("Processing question (customer_id={}, tables={})", request.customerId(), schema.snapshot().size());

        GenerationOutcome generated = generator.generate(question, schema, request);
        if (!generated.isSuccess()) {
            return PipelineResult.failure(ErrorKind.SQL_GENERATION_FAILED, generated.getError());
        }

        FixResult fix = fixer.fix(generated.getQuery(), schema.snapshot());
        String candidate = fix.query();
        if (fix.changed()) {
            log.info("Heuristic fixes applied: {} -> {}",
                    SqlLogging.abbreviate(generated.getQuery()), SqlLogging.abbreviate(candidate));
        }

        String originalQuery = null;
        String statement;
        ValidationOutcome validation = validator.validate(candidate);
        if (validation.valid()) {
            statement = validation.statement();
        } else {
            log.info("Validation failed: {}. Attempting to debug.", validation.reason());
            DebugOutcome repaired = repairer.repair(candidate, validation.reason(), schema.snapshot(), request);
            if (!repaired.isSuccess()) {
                return PipelineResult.failure(ErrorKind.SQL_VALIDATION_FAILED, validation.reason());
            }
            originalQuery = candidate;
            statement = repaired.statement();
        }

        List<Map<String, Object>> rows;
        try {
            rows = executor.execute(statement);
        } catch (QueryExecutionException first) {
            log.info("Execution failed: {}. Attempting to debug.", first.getMessage());
            DebugOutcome repaired = repairer.repair(statement, first.getMessage(), schema.snapshot(), request);
            if (!repaired.isSuccess()) {
                return PipelineResult.failure(ErrorKind.EXECUTION_ERROR, first.getMessage());
            }
            if (originalQuery == null) {
                originalQuery = statement;
            }
            statement = repaired.statement();
            try {
                rows = executor.execute(statement);
            } catch (QueryExecutionException second) {
                log.warn("Repaired query failed as well: {}", second.getMessage());
                return PipelineResult.failure(ErrorKind.EXECUTION_ERROR, first.getMessage());
            }
        }

        PipelineResult result;
        if (rows.isEmpty()) {
            result = PipelineResult.emptyResults(statement);
        } else {
            String summary = summarizer.summarize(question, statement, rows, request);
            result = PipelineResult.success(statement, rows, summary);
        }
        return originalQuery != null ? result.debugged(originalQuery) : result;
    }
}
