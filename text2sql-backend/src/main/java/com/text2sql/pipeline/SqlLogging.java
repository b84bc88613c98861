package com.text2sql.pipeline;

/**
 * Keeps SQL in log lines short.
 */
final class SqlLogging {

    private static final int MAX_LOGGED_CHARS = 100;

    private SqlLogging() {
    }

    static String abbreviate(String sql) {
        if (sql == null) {
            return "";
        }
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        return oneLine.length() <= MAX_LOGGED_CHARS ? oneLine : oneLine.substring(0, MAX_LOGGED_CHARS) + "...";
    }
}
