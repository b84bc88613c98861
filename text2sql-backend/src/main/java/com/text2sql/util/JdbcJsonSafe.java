package com.text2sql.util;

import java.io.IOException;
import java.io.Reader;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.sql.Struct;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Turns JDBC rows into plain maps that Jackson can serialize without driver classes on hand.
 *
 * <p>Rows are returned to API callers and pretty-printed into completion prompts. Numbers and
 * booleans pass through (decimals are printed plain by the object mapper), temporal values become
 * ISO-8601 strings, LOBs and binary values become text or base64, arrays and structs become lists.
 * A value that cannot be read becomes {@code "[unsupported]"} instead of failing the whole row.
 */
public final class JdbcJsonSafe {

    static final String UNSUPPORTED = "[unsupported]";

    private static final int MAX_TEXT_CHARS = 100_000;
    private static final int MAX_BINARY_BYTES = 100_000;
    private static final int MAX_DEPTH = 3;
    private static final String PG_OBJECT_CLASS = "org.postgresql.util.PGobject";

    private JdbcJsonSafe() {
    }

    /**
     * Reads every remaining row of a result set.
     *
     * @param rs open result set positioned before the first row
     * @return rows keyed by column label, in column order; a repeated label gets a numeric suffix
     *         ({@code id}, {@code id_2}) so that no column is dropped
     * @throws SQLException when the cursor itself fails
     */
    public static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columns = meta.getColumnCount();
        String[] labels = new String[columns];
        Set<String> used = new HashSet<>();
        for (int i = 0; i < columns; i++) {
            labels[i] = uniqueLabel(meta.getColumnLabel(i + 1), used);
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>(columns * 2);
            for (int i = 0; i < columns; i++) {
                row.put(labels[i], readColumn(rs, i + 1));
            }
            rows.add(row);
        }
        return rows;
    }

    /**
     * Converts a single driver value.
     *
     * @param value value returned by {@code ResultSet.getObject}
     * @return json-safe value
     */
    public static Object toJsonSafe(Object value) {
        try {
            return convert(value, 0);
        } catch (SQLException | IOException | ReflectiveOperationException e) {
            return UNSUPPORTED;
        }
    }

    static String uniqueLabel(String label, Set<String> used) {
        String candidate = label;
        for (int n = 2; !used.add(candidate); n++) {
            candidate = label + "_" + n;
        }
        return candidate;
    }

    private static Object readColumn(ResultSet rs, int column) {
        Object raw;
        try {
            raw = rs.getObject(column);
        } catch (SQLException e) {
            return UNSUPPORTED;
        }
        return toJsonSafe(raw);
    }

    private static Object convert(Object value, int depth)
            throws SQLException, IOException, ReflectiveOperationException {
        if (value == null) {
            return null;
        }
        if (depth > MAX_DEPTH) {
            return UNSUPPORTED;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof String s) {
            return cap(s);
        }
        if (value instanceof java.sql.Timestamp ts) {
            return ts.toLocalDateTime().toString();
        }
        if (value instanceof java.sql.Date d) {
            return d.toLocalDate().toString();
        }
        if (value instanceof java.sql.Time t) {
            return t.toLocalTime().toString();
        }
        if (value instanceof TemporalAccessor || value instanceof UUID) {
            return value.toString();
        }
        if (value instanceof byte[] bytes) {
            return base64(bytes, bytes.length);
        }
        if (value instanceof Clob clob) {
            return readText(clob.getCharacterStream());
        }
        if (value instanceof SQLXML xml) {
            return readText(xml.getCharacterStream());
        }
        if (value instanceof Blob blob) {
            int length = (int) Math.min(blob.length(), MAX_BINARY_BYTES);
            return length <= 0 ? "" : base64(blob.getBytes(1, length), length);
        }
        if (value instanceof java.sql.Array array) {
            return convert(array.getArray(), depth);
        }
        if (value instanceof Struct struct) {
            return convert(struct.getAttributes(), depth);
        }
        if (value instanceof Object[] elements) {
            List<Object> out = new ArrayList<>(elements.length);
            for (Object element : elements) {
                out.add(convert(element, depth + 1));
            }
            return out;
        }
        if (PG_OBJECT_CLASS.equals(value.getClass().getName())) {
            // json, jsonb, interval and enum columns; the driver is only on the runtime classpath
            Object text = value.getClass().getMethod("getValue").invoke(value);
            return text != null ? cap(text.toString()) : "";
        }
        return cap(String.valueOf(value));
    }

    private static String readText(Reader reader) throws IOException {
        if (reader == null) {
            return "";
        }
        try (reader) {
            StringBuilder sb = new StringBuilder();
            char[] buf = new char[8192];
            int n;
            while (sb.length() < MAX_TEXT_CHARS
                    && (n = reader.read(buf, 0, Math.min(buf.length, MAX_TEXT_CHARS - sb.length()))) > 0) {
                sb.append(buf, 0, n);
            }
            return sb.toString();
        }
    }

    private static String base64(byte[] bytes, int length) {
        int n = Math.min(length, MAX_BINARY_BYTES);
        byte[] data = n == bytes.length ? bytes : Arrays.copyOf(bytes, n);
        return Base64.getEncoder().encodeToString(data);
    }

    private static String cap(String s) {
        return s.length() <= MAX_TEXT_CHARS ? s : s.substring(0, MAX_TEXT_CHARS);
    }
}
