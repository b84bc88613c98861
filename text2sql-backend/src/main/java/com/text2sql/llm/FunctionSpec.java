package com.text2sql.llm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named output shape for structured completion calls. All properties are strings.
 *
 * @param name function name the model is forced to call
 * @param description function description
 * @param properties property name to description, in declaration order
 * @param required names of required properties
 */
public record FunctionSpec(String name, String description, Map<String, String> properties, List<String> required) {

    public FunctionSpec {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        required = List.copyOf(required);
    }

    /**
     * JSON-schema {@code parameters} object of the function.
     *
     * @return parameters schema
     */
    public Map<String, Object> parametersSchema() {
        Map<String, Object> props = new LinkedHashMap<>();
        properties.forEach((prop, desc) -> props.put(prop, Map.of("type", "string", "description", desc)));

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", props);
        schema.put("required", required);
        return schema;
    }
}
