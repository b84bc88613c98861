package com.text2sql.pipeline;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders result rows as a markdown table.
 *
 * <p>The header is the union of the keys of the rendered rows in first-seen order. Missing and null
 * cells are empty; values containing {@code |} or a line break are wrapped in backticks.
 */
public final class MarkdownTableRenderer {

    private MarkdownTableRenderer() {
    }

    /**
     * Render at most {@code maxRows} rows.
     *
     * @param rows result rows
     * @param maxRows row cap
     * @return markdown table, empty when there is nothing to render
     */
    public static String render(List<Map<String, Object>> rows, int maxRows) {
        if (rows == null || rows.isEmpty() || maxRows <= 0) {
            return "";
        }
        List<Map<String, Object>> displayed = rows.subList(0, Math.min(maxRows, rows.size()));

        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, Object> row : displayed) {
            columns.addAll(row.keySet());
        }
        if (columns.isEmpty()) {
            return "";
        }

        StringBuilder sb = new StringBuilder();
        sb.append("| ").append(String.join(" | ", columns)).append(" |\n");
        sb.append("|");
        for (int i = 0; i < columns.size(); i++) {
            sb.append(" --- |");
        }
        sb.append('\n');

        for (Map<String, Object> row : displayed) {
            sb.append('|');
            for (String column : columns) {
                sb.append(' ').append(cell(row.get(column))).append(" |");
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static String cell(Object value) {
        if (value == null) {
            return "";
        }
        String text = value instanceof BigDecimal decimal ? decimal.toPlainString() : String.valueOf(value);
        if (text.contains("|") || text.contains("\n") || text.contains("\r")) {
            return "`" + text.replace("\r", " ").replace("\n", " ") + "`";
        }
        return text;
    }
}
