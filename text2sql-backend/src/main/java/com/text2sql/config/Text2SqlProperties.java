package com.text2sql.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Application settings bound from {@code text2sql.*}.
 *
 * <p>LLM gateway settings are not part of this class; they are resolved from the environment by
 * {@link com.text2sql.llm.CompletionSettings}.
 */
@Data
@ConfigurationProperties(prefix = "text2sql")
public class Text2SqlProperties {

    private Datasource datasource = new Datasource();

    private Schema schema = new Schema();

    private Summary summary = new Summary();

    /**
     * Global prompt texts keyed by prompt id (for example {@code sql_system_message}).
     */
    private Map<String, String> prompts = new LinkedHashMap<>();

    /**
     * Per-customer settings keyed by customer id.
     */
    private Map<String, Customer> customers = new LinkedHashMap<>();

    @Data
    public static class Datasource {
        private String url;
        private String username;
        private String password;

        /**
         * Mark borrowed connections read-only before executing generated SQL.
         */
        private boolean readOnly = true;

        private int maximumPoolSize = 10;
        private int minimumIdle = 1;
        private long connectionTimeoutMs = 5000;

        /**
         * JDBC statement timeout for generated queries. Zero disables it.
         */
        private int queryTimeoutSeconds = 30;
    }

    @Data
    public static class Schema {
        /**
         * Schema to introspect. Defaults to the connection's current schema.
         */
        private String name;

        private int sampleRows = 3;

        /**
         * Maximum characters of sample JSON per table in the generation prompt.
         */
        private int sampleCharLimit = 500;
    }

    @Data
    public static class Summary {
        /**
         * Rows rendered in the markdown preview table.
         */
        private int previewRows = 10;

        /**
         * Rows sent to the model as summarization context.
         */
        private int contextRows = 10;
    }

    @Data
    public static class Customer {
        private String apiKey;

        /**
         * Customer prompt settings keyed by prompt id; these win over every other prompt source.
         */
        private Map<String, String> prompts = new LinkedHashMap<>();
    }
}
