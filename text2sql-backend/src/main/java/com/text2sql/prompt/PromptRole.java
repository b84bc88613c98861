package com.text2sql.prompt;

import java.util.Map;

/**
 * Pipeline roles that need an instruction text, with the built-in text used when no store has one.
 */
public enum PromptRole {

    GENERATION("sql_system_message",
            "System message for SQL generation from natural language",
            """
            You are an expert SQL assistant that converts natural language queries into PostgreSQL queries.
            Given the database schema and examples of data, generate a valid PostgreSQL SELECT query.
            Follow these rules strictly:
            1. ONLY generate SELECT queries - never write, update or delete operations
            2. Use proper PostgreSQL syntax and table/column names exactly as shown in the schema
            3. Include appropriate JOINs when needed based on the schema relationships
            4. If you cannot generate a valid query, provide a clear error message
            5. Never make assumptions about the schema, only use what is provided

            The database schema is as follows:
            {schema}

            {samples}"""),

    DEBUG("sql_debug_system_message",
            "System message for SQL debugging and fixing",
            """
            You are an expert SQL debugging agent. Your task is to analyze a broken SQL query
            and fix any issues while ensuring it remains a read-only SELECT query.

            The database schema is:
            {schema}

            When fixing queries, follow these rules:
            1. Only fix the query if you're confident in the solution
            2. ONLY generate SELECT queries - never modify to include writes/updates/deletes
            3. Maintain the original intent of the query
            4. Fix syntax errors, type casting issues, and schema compliance problems
            5. Use proper PostgreSQL syntax
            6. If you can't fix the query, provide a clear error message explaining why

            The original query failed with this error: {error}"""),

    SUMMARY("result_summary_system_message",
            "System message for summarizing SQL query results",
            """
            You are an expert data analyst that summarizes SQL query results.
            Your task is to provide a clear, concise summary of the query results in natural language.
            Focus on key findings, patterns, and the most relevant information that answers the user's original question.
            Keep the summary simple, direct, and to the point.""");

    private final String promptId;
    private final String description;
    private final String defaultText;

    PromptRole(String promptId, String description, String defaultText) {
        this.promptId = promptId;
        this.description = description;
        this.defaultText = defaultText;
    }

    public String getPromptId() {
        return promptId;
    }

    public String getDescription() {
        return description;
    }

    public String getDefaultText() {
        return defaultText;
    }

    /**
     * Fill {@code {name}} placeholders. Replacement is literal, so other braces in customer-provided
     * templates are left alone.
     *
     * @param template prompt template
     * @param values placeholder name to value
     * @return formatted prompt
     */
    public static String format(String template, Map<String, String> values) {
        String out = template;
        for (var entry : values.entrySet()) {
            out = out.replace("{" + entry.getKey() + "}", entry.getValue() != null ? entry.getValue() : "");
        }
        return out;
    }
}
