package com.text2sql.model;

import lombok.Builder;
import lombok.Value;

/**
 * Column description inside a {@link TableInfo}.
 */
@Value
@Builder
public class ColumnInfo {
    String name;
    String type;
    boolean nullable;
}
