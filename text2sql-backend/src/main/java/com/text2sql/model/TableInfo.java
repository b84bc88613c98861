package com.text2sql.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Columns and keys of a single table.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TableInfo {
    @Singular
    List<ColumnInfo> columns;
    @Singular
    Set<String> primaryKeys;
    @Singular
    List<ForeignKeyInfo> foreignKeys;
}
