package com.text2sql.schema;

import com.text2sql.config.Text2SqlProperties;
import com.text2sql.model.ColumnInfo;
import com.text2sql.model.ForeignKeyInfo;
import com.text2sql.model.SchemaSnapshot;
import com.text2sql.model.TableInfo;
import com.text2sql.util.JdbcJsonSafe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds schema snapshots from JDBC {@link DatabaseMetaData}.
 */
@Slf4j
@Component
public class JdbcSchemaIntrospector implements SchemaIntrospector {

    private static final String[] TABLE_TYPES = {"TABLE"};

    private final DataSource dataSource;
    private final String schemaName;

    /**
     * Create an introspector.
     *
     * @param dataSource data source of the queried store
     * @param properties application settings
     */
    public JdbcSchemaIntrospector(DataSource dataSource, Text2SqlProperties properties) {
        this.dataSource = dataSource;
        this.schemaName = properties.getSchema().getName();
    }

    @Override
    public SchemaSnapshot load() throws SchemaLoadException {
        try (Connection conn = dataSource.getConnection()) {
            DatabaseMetaData meta = conn.getMetaData();
            String schema = resolveSchema(conn);

            Map<String, TableInfo> tables = new LinkedHashMap<>();
            for (String table : listTables(meta, conn.getCatalog(), schema)) {
                TableInfo.TableInfoBuilder builder = TableInfo.builder();
                readColumns(meta, conn.getCatalog(), schema, table, builder);
                readPrimaryKeys(meta, conn.getCatalog(), schema, table, builder);
                readForeignKeys(meta, conn.getCatalog(), schema, table, builder);
                tables.put(table, builder.build());
            }

            log.info("Schema introspection completed (schema={}, tables={})", schema, tables.size());
            return SchemaSnapshot.of(tables);
        } catch (SQLException e) {
            throw new SchemaLoadException("Failed to read schema metadata: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Map<String, Object>> sample(String table, int limit) {
        if (table == null || table.isBlank() || limit <= 0) {
            return List.of();
        }

        try (Connection conn = dataSource.getConnection()) {
            String sql = "SELECT * FROM " + quoteIdentifier(table, conn.getMetaData().getIdentifierQuoteString())
                    + " LIMIT " + limit;

            try (Statement stmt = conn.createStatement()) {
                stmt.setMaxRows(limit);
                try (ResultSet rs = stmt.executeQuery(sql)) {
                    return JdbcJsonSafe.readRows(rs);
                }
            }
        } catch (Exception e) {
            log.warn("Failed to sample table (table={}): {}", table, e.getMessage());
            return List.of();
        }
    }

    static String quoteIdentifier(String identifier, String quote) {
        if (quote == null || quote.isBlank()) {
            return identifier;
        }
        return quote + identifier.replace(quote, quote + quote) + quote;
    }

    private String resolveSchema(Connection conn) throws SQLException {
        if (schemaName != null && !schemaName.isBlank()) {
            return schemaName.trim();
        }
        return conn.getSchema();
    }

    private List<String> listTables(DatabaseMetaData meta, String catalog, String schema) throws SQLException {
        List<String> tables = new ArrayList<>();
        try (ResultSet rs = meta.getTables(catalog, schema, "%", TABLE_TYPES)) {
            while (rs.next()) {
                tables.add(rs.getString("TABLE_NAME"));
            }
        }
        return tables;
    }

    private void readColumns(DatabaseMetaData meta, String catalog, String schema, String table,
                             TableInfo.TableInfoBuilder builder) throws SQLException {
        try (ResultSet rs = meta.getColumns(catalog, schema, table, "%")) {
            while (rs.next()) {
                builder.column(ColumnInfo.builder()
                        .name(rs.getString("COLUMN_NAME"))
                        .type(rs.getString("TYPE_NAME"))
                        .nullable(rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls)
                        .build());
            }
        }
    }

    private void readPrimaryKeys(DatabaseMetaData meta, String catalog, String schema, String table,
                                 TableInfo.TableInfoBuilder builder) throws SQLException {
        Map<Short, String> bySequence = new TreeMap<>();
        try (ResultSet rs = meta.getPrimaryKeys(catalog, schema, table)) {
            while (rs.next()) {
                bySequence.put(rs.getShort("KEY_SEQ"), rs.getString("COLUMN_NAME"));
            }
        }
        bySequence.values().forEach(builder::primaryKey);
    }

    private void readForeignKeys(DatabaseMetaData meta, String catalog, String schema, String table,
                                 TableInfo.TableInfoBuilder builder) throws SQLException {
        // Composite keys arrive as one row per column; group them by constraint.
        Map<String, ForeignKeyInfo.ForeignKeyInfoBuilder> byName = new LinkedHashMap<>();
        try (ResultSet rs = meta.getImportedKeys(catalog, schema, table)) {
            while (rs.next()) {
                String referredTable = rs.getString("PKTABLE_NAME");
                String fkName = rs.getString("FK_NAME");
                String key = fkName != null ? fkName : referredTable;
                byName.computeIfAbsent(key, k -> ForeignKeyInfo.builder().referredTable(referredTable))
                        .constrainedColumn(rs.getString("FKCOLUMN_NAME"))
                        .referredColumn(rs.getString("PKCOLUMN_NAME"));
            }
        }
        byName.values().forEach(fk -> builder.foreignKey(fk.build()));
    }
}
