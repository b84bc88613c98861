package com.text2sql.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.text2sql.config.Text2SqlProperties;
import com.text2sql.model.SchemaSnapshot;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Renders schema, samples and result rows as the JSON text embedded in prompts.
 */
@Component
public class PromptContextFormatter {

    static final String SAMPLES_HEADER = "Here are some examples of the data:\n";

    private final ObjectWriter prettyWriter;
    private final int sampleCharLimit;

    public PromptContextFormatter(ObjectMapper objectMapper, Text2SqlProperties properties) {
        this.prettyWriter = objectMapper.writerWithDefaultPrettyPrinter();
        this.sampleCharLimit = properties.getSchema().getSampleCharLimit();
    }

    public String schemaJson(SchemaSnapshot snapshot) throws JsonProcessingException {
        return prettyWriter.writeValueAsString(snapshot != null ? snapshot : SchemaSnapshot.empty());
    }

    /**
     * Sample section of the generation prompt; empty when there are no samples.
     */
    public String samplesText(Map<String, List<Map<String, Object>>> samples) throws JsonProcessingException {
        if (samples == null || samples.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(SAMPLES_HEADER);
        for (Map.Entry<String, List<Map<String, Object>>> entry : samples.entrySet()) {
            String json = prettyWriter.writeValueAsString(entry.getValue());
            if (json.length() > sampleCharLimit) {
                json = json.substring(0, sampleCharLimit);
            }
            sb.append("\nTable: ").append(entry.getKey()).append('\n')
                    .append(json)
                    .append("...\n");
        }
        return sb.toString();
    }

    public String rowsJson(List<Map<String, Object>> rows) throws JsonProcessingException {
        return prettyWriter.writeValueAsString(rows);
    }
}
