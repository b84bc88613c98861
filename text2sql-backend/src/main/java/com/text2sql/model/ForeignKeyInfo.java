package com.text2sql.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Foreign-key edge from a table to {@code referredTable}. Column lists are aligned by position.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ForeignKeyInfo {
    @Singular
    List<String> constrainedColumns;
    String referredTable;
    @Singular
    List<String> referredColumns;
}
