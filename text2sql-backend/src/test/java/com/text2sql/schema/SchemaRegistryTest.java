package com.text2sql.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.text2sql.config.Text2SqlProperties;
import com.text2sql.model.SchemaContext;
import com.text2sql.model.SchemaSnapshot;
import com.text2sql.model.TableInfo;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SchemaRegistryTest {

    @Mock
    private SchemaIntrospector introspector;

    private SchemaRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SchemaRegistry(introspector, new Text2SqlProperties());
    }

    @Test
    void refresh_shouldSwapInSnapshotWithNonEmptySamples() throws Exception {
        Map<String, TableInfo> tables = new LinkedHashMap<>();
        tables.put("users", TableInfo.builder().build());
        tables.put("audit", TableInfo.builder().build());
        SchemaSnapshot snapshot = SchemaSnapshot.of(tables);
        when(introspector.load()).thenReturn(snapshot);
        when(introspector.sample("users", 3)).thenReturn(List.of(Map.of("id", 1)));
        when(introspector.sample("audit", 3)).thenReturn(List.of());

        SchemaContext context = registry.refresh();

        assertSame(context, registry.current());
        assertSame(snapshot, context.snapshot());
        assertEquals(List.of("users"), List.copyOf(context.samples().keySet()));
    }

    @Test
    void refresh_shouldFallBackToEmptySchemaWhenLoadFails() throws Exception {
        when(introspector.load()).thenThrow(new SchemaLoadException("connection refused", null));

        SchemaContext context = registry.refresh();

        assertTrue(context.snapshot().isEmpty());
        assertTrue(context.samples().isEmpty());
        verify(introspector, never()).sample(anyString(), anyInt());
    }

    @Test
    void current_shouldBeEmptyBeforeFirstLoad() {
        assertTrue(registry.current().snapshot().isEmpty());
    }
}
