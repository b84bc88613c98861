package com.text2sql.pipeline;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SetOperationList;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Gate between generated SQL and the database: only a single read-only SELECT gets through.
 *
 * <p>Rules are applied in order and the first failure wins: blank input, an unclosed quote or comment,
 * no statement, a disallowed keyword anywhere in the input, a first statement that is not a plain
 * SELECT. Only the first
 * statement of the input is ever executed.
 */
@Slf4j
@Component
public class SafetyValidator {

    static final List<String> DISALLOWED_KEYWORDS = List.of(
            "INSERT", "UPDATE", "DELETE", "DROP", "CREATE", "ALTER",
            "TRUNCATE", "GRANT", "REVOKE", "COMMIT", "ROLLBACK"
    );

    private static final List<Pattern> KEYWORD_PATTERNS = DISALLOWED_KEYWORDS.stream()
            .map(kw -> Pattern.compile("\\b" + kw + "\\b", Pattern.CASE_INSENSITIVE))
            .toList();

    private static final Pattern INTO_WORD = Pattern.compile("\\bINTO\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern LEADING_WORD = Pattern.compile("^\\s*\\(*\\s*([A-Za-z]+)");

    /**
     * Validate a query.
     *
     * @param query SQL text
     * @return outcome carrying the first statement when valid
     */
    public ValidationOutcome validate(String query) {
        try {
            if (query == null || query.isBlank()) {
                return ValidationOutcome.invalid("Empty query");
            }

            SqlStatementSplitter.Scan scan = SqlStatementSplitter.scan(query);
            if (!scan.terminated()) {
                return ValidationOutcome.invalid("Unterminated quoted string or comment");
            }

            List<String> statements = scan.statements();
            if (statements.isEmpty()) {
                return ValidationOutcome.invalid("Empty or invalid SQL query");
            }
            if (statements.size() > 1) {
                log.warn("Query contains {} statements, only the first one is considered", statements.size());
            }

            for (int i = 0; i < KEYWORD_PATTERNS.size(); i++) {
                if (KEYWORD_PATTERNS.get(i).matcher(query).find()) {
                    return ValidationOutcome.invalid("Disallowed SQL keyword found: " + DISALLOWED_KEYWORDS.get(i));
                }
            }

            String first = statements.get(0);
            if (!isSelect(first)) {
                return ValidationOutcome.invalid("Only SELECT queries are allowed");
            }

            return ValidationOutcome.valid(first);
        } catch (RuntimeException e) {
            log.error("Unexpected error while validating query", e);
            return ValidationOutcome.invalid("Validation error: " + e.getMessage());
        }
    }

    private boolean isSelect(String statement) {
        Statement parsed;
        try {
            parsed = CCJSqlParserUtil.parse(statement);
        } catch (JSQLParserException e) {
            log.debug("Parser rejected statement, falling back to its leading keyword: {}", e.getMessage());
            return isPlainSelectText(statement);
        }
        if (!(parsed instanceof Select select)) {
            return false;
        }
        return !hasIntoClause(select);
    }

    private static boolean hasIntoClause(Select select) {
        if (select instanceof PlainSelect plain) {
            return plain.getIntoTables() != null && !plain.getIntoTables().isEmpty();
        }
        if (select instanceof ParenthesedSelect parenthesed) {
            return parenthesed.getSelect() != null && hasIntoClause(parenthesed.getSelect());
        }
        if (select instanceof SetOperationList setOperations && setOperations.getSelects() != null) {
            for (Select member : setOperations.getSelects()) {
                if (hasIntoClause(member)) {
                    return true;
                }
            }
        }
        return false;
    }

    // Text-level check for statements the parser cannot read. A separator anywhere in the text, even
    // inside what looks like a literal, or an INTO outside literals, disqualifies the statement.
    static boolean isPlainSelectText(String statement) {
        if (statement.indexOf(';') >= 0) {
            return false;
        }
        if (INTO_WORD.matcher(SqlStatementSplitter.maskQuoted(statement)).find()) {
            return false;
        }
        return "SELECT".equals(leadingKeyword(statement));
    }

    static String leadingKeyword(String statement) {
        var m = LEADING_WORD.matcher(stripLeadingComments(statement));
        return m.find() ? m.group(1).toUpperCase(Locale.ROOT) : "";
    }

    private static String stripLeadingComments(String sql) {
        String s = sql.stripLeading();
        while (true) {
            if (s.startsWith("--")) {
                int nl = s.indexOf('\n');
                s = nl < 0 ? "" : s.substring(nl + 1).stripLeading();
            } else if (s.startsWith("/*")) {
                int end = s.indexOf("*/");
                s = end < 0 ? "" : s.substring(end + 2).stripLeading();
            } else {
                return s;
            }
        }
    }
}
