package com.text2sql.pipeline;

import com.text2sql.model.SchemaSnapshot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cheap rewrites of frequent generation mistakes, applied before validation. No model call.
 *
 * <p>Two passes run in order:
 * <ol>
 *   <li>literal quoting: {@code status = active} becomes {@code status = 'active'};</li>
 *   <li>table names: a table referenced with the wrong case, in singular/plural form, or with a
 *   one-character typo right after {@code FROM}/{@code JOIN}, is replaced with the schema name.</li>
 * </ol>
 * Both passes leave single-quoted literals alone and are idempotent.
 *
 * <p>Known limitations: an unqualified identifier on the right side of {@code =} gets quoted, and a
 * column whose name resembles a table name can be rewritten.
 */
@Component
public class HeuristicFixer {

    private static final Pattern BAREWORD_AFTER_EQUALS = Pattern.compile(
            "(?<![<>!=:])(=\\s*)([A-Za-z_][A-Za-z0-9_]*+)(?!\\s*\\()(?!\\s*['\"])(?!\\s*::)(?!\\.)"
    );

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*+");

    private static final Set<String> UNQUOTED_VALUES = Set.of(
            "NULL", "TRUE", "FALSE", "CURRENT_DATE", "CURRENT_TIME", "CURRENT_TIMESTAMP",
            "CURRENT_USER", "LOCALTIME", "LOCALTIMESTAMP", "ANY", "ALL", "SOME"
    );

    private static final Set<String> SQL_KEYWORDS = Set.of(
            "SELECT", "FROM", "WHERE", "AND", "OR", "NOT", "IN", "IS", "NULL", "AS", "ON", "JOIN",
            "INNER", "LEFT", "RIGHT", "FULL", "OUTER", "CROSS", "NATURAL", "USING", "GROUP", "ORDER",
            "BY", "HAVING", "LIMIT", "OFFSET", "FETCH", "FIRST", "NEXT", "ROWS", "ROW", "ONLY", "UNION",
            "INTERSECT", "EXCEPT", "ALL", "DISTINCT", "CASE", "WHEN", "THEN", "ELSE", "END", "ASC",
            "DESC", "NULLS", "LAST", "BETWEEN", "LIKE", "ILIKE", "EXISTS", "ANY", "SOME", "WITH",
            "RECURSIVE", "OVER", "PARTITION", "WINDOW", "CAST", "TRUE", "FALSE", "INTERVAL", "DATE",
            "TIME", "TIMESTAMP", "VALUES", "LATERAL", "FILTER", "WITHIN", "USER", "COUNT", "SUM",
            "AVG", "MIN", "MAX"
    );

    private static final int MIN_FUZZY_LENGTH = 4;

    /**
     * Apply both passes.
     *
     * @param query generated query
     * @param snapshot schema snapshot providing the canonical table names
     * @return rewritten query and whether anything changed
     */
    public FixResult fix(String query, SchemaSnapshot snapshot) {
        if (query == null || query.isEmpty()) {
            return new FixResult(query, false);
        }
        String quoted = quoteBarewordLiterals(query);
        List<String> tables = snapshot != null ? List.copyOf(snapshot.tableNames()) : List.of();
        String normalized = tables.isEmpty() ? quoted : normalizeTableNames(quoted, tables);
        return new FixResult(normalized, !normalized.equals(query));
    }

    String quoteBarewordLiterals(String query) {
        boolean[] inLiteral = literalMask(query);
        Matcher m = BAREWORD_AFTER_EQUALS.matcher(query);
        StringBuilder out = new StringBuilder(query.length() + 8);
        while (m.find()) {
            String word = m.group(2);
            if (inLiteral[m.start()] || UNQUOTED_VALUES.contains(word.toUpperCase(Locale.ROOT))) {
                m.appendReplacement(out, Matcher.quoteReplacement(m.group()));
                continue;
            }
            m.appendReplacement(out, Matcher.quoteReplacement(m.group(1) + "'" + word + "'"));
        }
        m.appendTail(out);
        return out.toString();
    }

    String normalizeTableNames(String query, List<String> tables) {
        boolean[] inLiteral = literalMask(query);
        Matcher m = IDENTIFIER.matcher(query);
        StringBuilder out = new StringBuilder(query.length());
        int last = 0;
        String previousWord = null;
        while (m.find()) {
            if (inLiteral[m.start()] || isAfterDot(query, m.start()) || isWordContinuation(query, m.start())) {
                continue;
            }
            String token = m.group();
            String replacement = canonicalTable(token, tables, isTableReferencePosition(previousWord));
            if (replacement != null) {
                out.append(query, last, m.start()).append(replacement);
                last = m.end();
            }
            previousWord = token;
        }
        out.append(query, last, query.length());
        return out.toString();
    }

    private static String canonicalTable(String token, List<String> tables, boolean tablePosition) {
        if (tables.contains(token) || SQL_KEYWORDS.contains(token.toUpperCase(Locale.ROOT))) {
            return null;
        }
        for (String table : tables) {
            if (table.equalsIgnoreCase(token)) {
                return table;
            }
        }
        for (String table : tables) {
            if (isPluralVariant(token, table)) {
                return table;
            }
        }
        if (!tablePosition || token.length() < MIN_FUZZY_LENGTH) {
            return null;
        }
        for (String table : tables) {
            if (table.length() >= MIN_FUZZY_LENGTH && withinOneEdit(token.toLowerCase(Locale.ROOT),
                    table.toLowerCase(Locale.ROOT))) {
                return table;
            }
        }
        return null;
    }

    private static boolean isPluralVariant(String token, String table) {
        String t = token.toLowerCase(Locale.ROOT);
        String name = table.toLowerCase(Locale.ROOT);
        return t.equals(name + "s") || (name.endsWith("s") && t.equals(name.substring(0, name.length() - 1)));
    }

    static boolean withinOneEdit(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        int la = a.length();
        int lb = b.length();
        if (Math.abs(la - lb) > 1) {
            return false;
        }
        if (la > lb) {
            return withinOneEdit(b, a);
        }
        int i = 0;
        while (i < la && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        if (la == lb) {
            return a.substring(i + 1).equals(b.substring(i + 1));
        }
        return a.substring(i).equals(b.substring(i + 1));
    }

    private static boolean isTableReferencePosition(String previousWord) {
        return previousWord != null
                && ("FROM".equalsIgnoreCase(previousWord) || "JOIN".equalsIgnoreCase(previousWord));
    }

    private static boolean isAfterDot(String query, int start) {
        int i = start - 1;
        while (i >= 0 && Character.isWhitespace(query.charAt(i))) {
            i--;
        }
        return i >= 0 && query.charAt(i) == '.';
    }

    // Identifier regex can start in the middle of "1abc" or "x$y"; those are not separate tokens.
    private static boolean isWordContinuation(String query, int start) {
        if (start == 0) {
            return false;
        }
        char prev = query.charAt(start - 1);
        return Character.isLetterOrDigit(prev) || prev == '_' || prev == '$';
    }

    /**
     * Marks every character that belongs to a single-quoted literal or a double-quoted identifier.
     */
    static boolean[] literalMask(String query) {
        boolean[] mask = new boolean[query.length()];
        List<int[]> ranges = new ArrayList<>();
        int i = 0;
        int n = query.length();
        while (i < n) {
            char c = query.charAt(i);
            if (c == '\'' || c == '"') {
                int end = i + 1;
                while (end < n) {
                    if (query.charAt(end) == c) {
                        if (end + 1 < n && query.charAt(end + 1) == c) {
                            end += 2;
                            continue;
                        }
                        break;
                    }
                    end++;
                }
                int stop = Math.min(end + 1, n);
                ranges.add(new int[]{i, stop});
                i = stop;
                continue;
            }
            i++;
        }
        for (int[] range : ranges) {
            for (int k = range[0]; k < range[1]; k++) {
                mask[k] = true;
            }
        }
        return mask;
    }
}
