package com.text2sql.model;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema snapshot together with the table samples collected alongside it.
 *
 * <p>This is the unit swapped by a schema refresh, so readers always see a snapshot and the samples
 * that belong to it.
 *
 * @param snapshot schema snapshot
 * @param samples table name to sample rows, used as generation context only
 * @param loadedAt load time
 */
public record SchemaContext(
        SchemaSnapshot snapshot,
        Map<String, List<Map<String, Object>>> samples,
        OffsetDateTime loadedAt
) {

    public SchemaContext {
        snapshot = snapshot != null ? snapshot : SchemaSnapshot.empty();
        samples = samples != null ? Collections.unmodifiableMap(new LinkedHashMap<>(samples)) : Map.of();
    }

    public static SchemaContext empty() {
        return new SchemaContext(SchemaSnapshot.empty(), Map.of(), OffsetDateTime.now());
    }
}
