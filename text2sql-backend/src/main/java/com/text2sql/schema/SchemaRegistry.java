package com.text2sql.schema;

import com.text2sql.config.Text2SqlProperties;
import com.text2sql.model.SchemaContext;
import com.text2sql.model.SchemaSnapshot;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the process-wide schema context shared by all requests.
 *
 * <p>Readers get an immutable {@link SchemaContext}; {@link #refresh()} builds a complete replacement
 * before swapping it in, so a concurrent reader sees either the old or the new context, never a
 * partially built one.
 */
@Slf4j
@Service
public class SchemaRegistry {

    private final SchemaIntrospector introspector;
    private final int sampleRows;
    private final AtomicReference<SchemaContext> current = new AtomicReference<>(SchemaContext.empty());

    /**
     * Create a registry.
     *
     * @param introspector schema source
     * @param properties application settings
     */
    public SchemaRegistry(SchemaIntrospector introspector, Text2SqlProperties properties) {
        this.introspector = introspector;
        this.sampleRows = properties.getSchema().getSampleRows();
    }

    @PostConstruct
    public void initialize() {
        refresh();
    }

    /**
     * Current schema context.
     *
     * @return context, empty when the schema could not be loaded
     */
    public SchemaContext current() {
        return current.get();
    }

    /**
     * Rebuild the schema context and swap it in.
     *
     * <p>A load failure does not stop the service: the pipeline runs against an empty snapshot.
     *
     * @return the context now in effect
     */
    public SchemaContext refresh() {
        SchemaContext next;
        try {
            SchemaSnapshot snapshot = introspector.load();
            next = new SchemaContext(snapshot, loadSamples(snapshot), OffsetDateTime.now());
            log.info("Schema information loaded (tables={}, sampled_tables={})",
                    snapshot.size(), next.samples().size());
        } catch (SchemaLoadException e) {
            log.error("Error loading schema information, continuing with an empty schema", e);
            next = SchemaContext.empty();
        }
        current.set(next);
        return next;
    }

    private Map<String, List<Map<String, Object>>> loadSamples(SchemaSnapshot snapshot) {
        Map<String, List<Map<String, Object>>> samples = new LinkedHashMap<>();
        if (sampleRows <= 0) {
            return samples;
        }
        for (String table : snapshot.tableNames()) {
            List<Map<String, Object>> rows = introspector.sample(table, sampleRows);
            if (rows != null && !rows.isEmpty()) {
                samples.put(table, List.copyOf(rows));
            }
        }
        return samples;
    }
}
