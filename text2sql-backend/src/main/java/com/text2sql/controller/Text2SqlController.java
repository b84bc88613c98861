package com.text2sql.controller;

import com.text2sql.api.PipelineResult;
import com.text2sql.api.PromptUpsertRequest;
import com.text2sql.api.QueryRequest;
import com.text2sql.model.SchemaContext;
import com.text2sql.pipeline.PipelineOrchestrator;
import com.text2sql.prompt.PromptStore;
import com.text2sql.schema.SchemaRegistry;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class Text2SqlController {

    private static final Logger log = LoggerFactory.getLogger(Text2SqlController.class);

    static final String CUSTOMER_HEADER = "X-Customer-Id";

    private final PipelineOrchestrator orchestrator;
    private final SchemaRegistry schemaRegistry;
    private final PromptStore promptStore;

    public Text2SqlController(
            PipelineOrchestrator orchestrator,
            SchemaRegistry schemaRegistry,
            PromptStore promptStore
    ) {
        this.orchestrator = orchestrator;
        this.schemaRegistry = schemaRegistry;
        this.promptStore = promptStore;
    }

    /**
     * Answer a natural-language question.
     *
     * POST /v1/query
     *
     * Pipeline failures are reported inside the envelope, so this endpoint answers 200 unless the
     * request itself is invalid.
     *
     * @param request question and optional customer id
     * @param headerCustomerId customer id from the {@code X-Customer-Id} header
     * @return pipeline result
     */
    @PostMapping("/query")
    public ResponseEntity<PipelineResult> query(
            @Valid @RequestBody QueryRequest request,
            @RequestHeader(value = CUSTOMER_HEADER, required = false) String headerCustomerId) {
        String customerId = request.getCustomerId() != null && !request.getCustomerId().isBlank()
                ? request.getCustomerId()
                : headerCustomerId;
        log.info("Received question (customer_id={}, trace_id={})", customerId, MDC.get("trace_id"));
        return ResponseEntity.ok(orchestrator.process(request.getQuestion(), customerId));
    }

    /**
     * Current schema snapshot.
     *
     * GET /v1/schema
     */
    @GetMapping("/schema")
    public ResponseEntity<Map<String, Object>> getSchema() {
        return ResponseEntity.ok(describeSchema(schemaRegistry.current()));
    }

    /**
     * Reload schema and samples from the database.
     *
     * POST /v1/schema/refresh
     */
    @PostMapping("/schema/refresh")
    public ResponseEntity<Map<String, Object>> refreshSchema() {
        SchemaContext refreshed = schemaRegistry.refresh();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("table_count", refreshed.snapshot().size());
        body.put("sampled_tables", refreshed.samples().size());
        body.put("loaded_at", refreshed.loadedAt().toString());
        return ResponseEntity.ok(body);
    }

    /**
     * Prompts visible to a customer, or the global defaults.
     *
     * GET /v1/prompts
     */
    @GetMapping("/prompts")
    public ResponseEntity<Map<String, String>> listPrompts(
            @RequestParam(value = "customer_id", required = false) String customerId) {
        return ResponseEntity.ok(promptStore.listForCustomer(customerId));
    }

    /**
     * Create or replace a prompt document.
     *
     * POST /v1/prompts
     */
    @PostMapping("/prompts")
    public ResponseEntity<Map<String, Object>> upsertPrompt(@Valid @RequestBody PromptUpsertRequest request) {
        boolean changed = promptStore.upsert(request.getPromptId(), request.getPromptText(), request.getCustomerId());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt_id", request.getPromptId());
        if (request.getCustomerId() != null) {
            body.put("customer_id", request.getCustomerId());
        }
        body.put("changed", changed);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/prompts/info")
    public ResponseEntity<Map<String, Object>> promptInfo() {
        return ResponseEntity.ok(promptStore.describe());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("schema_tables", schemaRegistry.current().snapshot().size());
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> describeSchema(SchemaContext context) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tables", context.snapshot());
        body.put("table_count", context.snapshot().size());
        body.put("loaded_at", context.loadedAt().toString());
        return body;
    }
}
