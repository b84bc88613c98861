package com.text2sql.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.text2sql.pipeline.ErrorKind;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PipelineResultTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void failure_shouldUseDefaultMessageWhenNoneGiven() {
        PipelineResult result = PipelineResult.failure(ErrorKind.EXECUTION_ERROR, " ");

        assertEquals(ErrorKind.EXECUTION_ERROR.getDefaultMessage(), result.getError().getMessage());
    }

    @Test
    void failure_shouldSerializeWithoutDataField() throws Exception {
        JsonNode json = mapper.valueToTree(PipelineResult.failure(ErrorKind.SQL_GENERATION_FAILED, "no query"));

        assertFalse(json.get("success").asBoolean());
        assertEquals("sql_generation_failed", json.at("/error/type").asText());
        assertEquals("no query", json.at("/error/message").asText());
        assertTrue(json.get("mock").asBoolean());
        assertFalse(json.has("data"));
        assertFalse(json.has("query"));
    }

    @Test
    void debugged_shouldAddDebugMarkersInSnakeCase() throws Exception {
        PipelineResult result = PipelineResult.success("SELECT name FROM users", List.of(Map.of("name", "Ann")), "ok")
                .debugged("SELECT nme FROM users");

        JsonNode json = mapper.valueToTree(result);

        assertTrue(json.get("was_debugged").asBoolean());
        assertEquals("SELECT nme FROM users", json.get("original_query").asText());
        assertEquals(1, json.get("record_count").asInt());
        assertFalse(json.has("error"));
        assertFalse(json.has("mock"));
    }
}
