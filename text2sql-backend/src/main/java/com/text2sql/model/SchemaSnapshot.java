package com.text2sql.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable description of the tables available to the pipeline.
 *
 * <p>Instances are never patched; a schema refresh builds a new snapshot and replaces the old one.
 * Serializes as a plain {@code table -> TableInfo} JSON object, which is the shape interpolated into
 * prompts.
 */
public final class SchemaSnapshot {

    private static final SchemaSnapshot EMPTY = new SchemaSnapshot(Map.of());

    private final Map<String, TableInfo> tables;

    private SchemaSnapshot(Map<String, TableInfo> tables) {
        this.tables = tables;
    }

    /**
     * Create a snapshot. Table order is preserved.
     *
     * @param tables table name to table info
     * @return snapshot
     */
    public static SchemaSnapshot of(Map<String, TableInfo> tables) {
        if (tables == null || tables.isEmpty()) {
            return EMPTY;
        }
        return new SchemaSnapshot(Collections.unmodifiableMap(new LinkedHashMap<>(tables)));
    }

    public static SchemaSnapshot empty() {
        return EMPTY;
    }

    @JsonValue
    public Map<String, TableInfo> getTables() {
        return tables;
    }

    public Set<String> tableNames() {
        return tables.keySet();
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }

    public int size() {
        return tables.size();
    }

    @Override
    public String toString() {
        return "SchemaSnapshot" + tables.keySet();
    }
}
