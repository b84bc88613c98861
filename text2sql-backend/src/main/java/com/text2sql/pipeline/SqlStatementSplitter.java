package com.text2sql.pipeline;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits SQL text into statements on {@code ;} separators that are outside quotes and comments.
 *
 * <p>Understands the PostgreSQL lexical forms that can hide a separator: single-quoted strings with
 * doubled quotes, {@code E'...'} strings with backslash escapes, dollar-quoted strings
 * ({@code $$...$$}, {@code $tag$...$tag$}), double-quoted and backtick identifiers, line comments and
 * nested block comments.
 */
public final class SqlStatementSplitter {

    private SqlStatementSplitter() {
    }

    /**
     * Result of scanning SQL text.
     *
     * @param statements trimmed, non-empty statements in input order
     * @param terminated false when a quoted string, identifier or block comment is never closed
     */
    public record Scan(List<String> statements, boolean terminated) {
    }

    /**
     * Split SQL text into statements.
     *
     * @param sql SQL text
     * @return trimmed, non-empty statements in input order
     */
    public static List<String> split(String sql) {
        return scan(sql).statements();
    }

    /**
     * Split SQL text and report whether every quoted region and comment was closed.
     *
     * @param sql SQL text
     * @return scan result
     */
    public static Scan scan(String sql) {
        List<String> statements = new ArrayList<>();
        if (sql == null || sql.isBlank()) {
            return new Scan(statements, true);
        }

        StringBuilder current = new StringBuilder();
        boolean terminated = true;
        int i = 0;
        int n = sql.length();
        while (i < n) {
            int end = regionEnd(sql, i);
            if (end > n) {
                terminated = false;
                end = n;
            }
            if (end > i) {
                current.append(sql, i, end);
                i = end;
                continue;
            }
            char c = sql.charAt(i);
            if (c == ';') {
                addIfPresent(statements, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
            i++;
        }
        addIfPresent(statements, current);
        return new Scan(statements, terminated);
    }

    /**
     * Blank out quoted strings, quoted identifiers and comments, keeping the text length.
     *
     * @param sql SQL text
     * @return text in which only unquoted SQL remains readable
     */
    public static String maskQuoted(String sql) {
        if (sql == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(sql.length());
        int i = 0;
        int n = sql.length();
        while (i < n) {
            int end = Math.min(regionEnd(sql, i), n);
            if (end > i) {
                out.append(" ".repeat(end - i));
                i = end;
            } else {
                out.append(sql.charAt(i++));
            }
        }
        return out.toString();
    }

    // Index just past the quoted region or comment starting at i, i when none starts there,
    // n + 1 when the region is never closed.
    private static int regionEnd(String sql, int i) {
        int n = sql.length();
        char c = sql.charAt(i);
        char next = i + 1 < n ? sql.charAt(i + 1) : '\0';

        if ((c == 'E' || c == 'e') && next == '\'' && !isIdentifierChar(charBefore(sql, i))) {
            return closeQuote(sql, i + 1, '\'', true);
        }
        if (c == '\'' || c == '"' || c == '`') {
            return closeQuote(sql, i, c, false);
        }
        if (c == '-' && next == '-') {
            int nl = sql.indexOf('\n', i);
            return nl < 0 ? n : nl;
        }
        if (c == '/' && next == '*') {
            return closeBlockComment(sql, i);
        }
        if (c == '$' && !isIdentifierChar(charBefore(sql, i))) {
            String tag = dollarTag(sql, i);
            if (tag != null) {
                int close = sql.indexOf(tag, i + tag.length());
                return close < 0 ? n + 1 : close + tag.length();
            }
        }
        return i;
    }

    // A doubled quote is an escaped quote; in E'' strings a backslash escapes the next character.
    private static int closeQuote(String sql, int start, char quote, boolean backslashEscapes) {
        int i = start + 1;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            if (backslashEscapes && c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                if (i + 1 < n && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return n + 1;
    }

    private static int closeBlockComment(String sql, int start) {
        int depth = 0;
        int i = start;
        int n = sql.length();
        while (i + 1 < n) {
            if (sql.charAt(i) == '/' && sql.charAt(i + 1) == '*') {
                depth++;
                i += 2;
            } else if (sql.charAt(i) == '*' && sql.charAt(i + 1) == '/') {
                depth--;
                i += 2;
                if (depth == 0) {
                    return i;
                }
            } else {
                i++;
            }
        }
        return n + 1;
    }

    // "$$" or "$tag$"; "$1" is a positional parameter, not a quote.
    private static String dollarTag(String sql, int start) {
        int j = start + 1;
        int n = sql.length();
        while (j < n) {
            char c = sql.charAt(j);
            if (c == '$') {
                return sql.substring(start, j + 1);
            }
            boolean valid = j == start + 1
                    ? Character.isLetter(c) || c == '_'
                    : Character.isLetterOrDigit(c) || c == '_';
            if (!valid) {
                return null;
            }
            j++;
        }
        return null;
    }

    private static char charBefore(String sql, int i) {
        return i > 0 ? sql.charAt(i - 1) : ' ';
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static void addIfPresent(List<String> statements, StringBuilder current) {
        String statement = current.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
    }
}
