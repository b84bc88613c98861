package com.text2sql.schema;

import com.text2sql.model.SchemaSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Source of schema metadata and sample rows for the generation context.
 */
public interface SchemaIntrospector {

    /**
     * Read tables, columns and keys.
     *
     * @return schema snapshot
     * @throws SchemaLoadException when the metadata cannot be read
     */
    SchemaSnapshot load() throws SchemaLoadException;

    /**
     * Read up to {@code limit} rows of a table. Best effort: returns an empty list on any failure.
     *
     * @param table table name as it appears in the snapshot
     * @param limit maximum rows
     * @return sample rows
     */
    List<Map<String, Object>> sample(String table, int limit);
}
