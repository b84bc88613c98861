package com.text2sql.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class SqlStatementSplitterTest {

    @Test
    void split_shouldSeparateStatementsOnSemicolons() {
        assertEquals(List.of("SELECT 1", "SELECT 2"), SqlStatementSplitter.split("SELECT 1; SELECT 2;"));
    }

    @Test
    void split_shouldIgnoreSemicolonsInsideLiteralsAndComments() {
        String sql = "SELECT 'a;b' AS x, \"c;d\" FROM t -- trailing; comment\nWHERE y = 1 /* ; */";

        List<String> statements = SqlStatementSplitter.split(sql);

        assertEquals(1, statements.size());
        assertEquals(sql, statements.get(0));
    }

    @Test
    void split_shouldHandleEscapedQuotes() {
        List<String> statements = SqlStatementSplitter.split("SELECT 'it''s; fine'; DROP TABLE t");

        assertEquals(List.of("SELECT 'it''s; fine'", "DROP TABLE t"), statements);
    }

    @Test
    void split_shouldReturnEmptyListForBlankOrSeparatorOnlyInput() {
        assertTrue(SqlStatementSplitter.split("   ").isEmpty());
        assertTrue(SqlStatementSplitter.split(" ; ;; ").isEmpty());
        assertTrue(SqlStatementSplitter.split(null).isEmpty());
    }

    @Test
    void split_shouldKeepSeparatorsInsideDollarQuotes() {
        String sql = "SELECT $$a;b$$, $fn$ ' ; $fn$ AS body; SELECT 2";

        assertEquals(List.of("SELECT $$a;b$$, $fn$ ' ; $fn$ AS body", "SELECT 2"), SqlStatementSplitter.split(sql));
    }

    @Test
    void split_shouldHonourBackslashEscapesInEscapeStrings() {
        String sql = "SELECT E'it\\'s; fine'; SELECT 'x\\'; SELECT 3";

        assertEquals(List.of("SELECT E'it\\'s; fine'", "SELECT 'x\\'", "SELECT 3"), SqlStatementSplitter.split(sql));
    }

    @Test
    void split_shouldTreatPositionalParametersAsPlainText() {
        assertEquals(List.of("SELECT * FROM t WHERE id = $1", "SELECT 2"),
                SqlStatementSplitter.split("SELECT * FROM t WHERE id = $1; SELECT 2"));
    }

    @Test
    void split_shouldHandleNestedBlockComments() {
        assertEquals(List.of("SELECT 1 /* a /* ; */ ; */", "SELECT 2"),
                SqlStatementSplitter.split("SELECT 1 /* a /* ; */ ; */; SELECT 2"));
    }

    @Test
    void scan_shouldReportUnclosedRegions() {
        assertFalse(SqlStatementSplitter.scan("SELECT '").terminated());
        assertFalse(SqlStatementSplitter.scan("SELECT $$x").terminated());
        assertFalse(SqlStatementSplitter.scan("SELECT 1 /* open").terminated());
        assertTrue(SqlStatementSplitter.scan("SELECT 'closed' -- trailing comment").terminated());
    }

    @Test
    void maskQuoted_shouldBlankLiteralsAndCommentsKeepingLength() {
        String sql = "SELECT 'into' /* into */ FROM t";

        String masked = SqlStatementSplitter.maskQuoted(sql);

        assertEquals(sql.length(), masked.length());
        assertEquals("SELECT        " + " ".repeat(10) + " FROM t", masked);
    }
}
