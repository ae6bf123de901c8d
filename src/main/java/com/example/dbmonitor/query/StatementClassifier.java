package com.example.dbmonitor.query;

import com.example.dbmonitor.domain.QueryRecord.StatementType;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort classification of query text: statement type by prefix,
 * first referenced table by the identifier following FROM (or INTO / UPDATE).
 */
public final class StatementClassifier {

    private static final Pattern LEADING_COMMENTS = Pattern.compile("^(\\s*(--[^\\n]*\\n|/\\*.*?\\*/))*\\s*", Pattern.DOTALL);
    private static final String IDENTIFIER = "((?:\"[^\"]+\"|[\\w$]+)(?:\\.(?:\"[^\"]+\"|[\\w$]+))?)";
    private static final Pattern FROM_TABLE = Pattern.compile("\\bFROM\\s+" + IDENTIFIER, Pattern.CASE_INSENSITIVE);
    private static final Pattern INTO_TABLE = Pattern.compile("^INSERT\\s+INTO\\s+" + IDENTIFIER, Pattern.CASE_INSENSITIVE);
    private static final Pattern UPDATE_TABLE = Pattern.compile("^UPDATE\\s+(?:ONLY\\s+)?" + IDENTIFIER, Pattern.CASE_INSENSITIVE);

    private StatementClassifier() {}

    public static StatementType statementType(String query) {
        String head = stripLeadingComments(query).toUpperCase(Locale.ROOT);
        if (head.startsWith("SELECT") || head.startsWith("WITH")) return StatementType.SELECT;
        if (head.startsWith("INSERT")) return StatementType.INSERT;
        if (head.startsWith("UPDATE")) return StatementType.UPDATE;
        if (head.startsWith("DELETE")) return StatementType.DELETE;
        return StatementType.OTHER;
    }

    /**
     * @return the first referenced table without quotes, or null when none can be found
     */
    public static String firstTable(String query) {
        String text = stripLeadingComments(query);
        Matcher matcher = switch (statementType(text)) {
            case INSERT -> INTO_TABLE.matcher(text);
            case UPDATE -> UPDATE_TABLE.matcher(text);
            default -> FROM_TABLE.matcher(text);
        };
        if (!matcher.find()) {
            return null;
        }
        String table = matcher.group(1).replace("\"", "");
        // "FROM (subquery)" and set-returning functions do not name a table
        if (table.isEmpty() || table.startsWith("$")) {
            return null;
        }
        return table;
    }

    public static StatementStatistics annotate(String query, long calls, double totalTimeMs, double meanTimeMs,
                                               double minTimeMs, double maxTimeMs, long rows) {
        return new StatementStatistics(query, calls, totalTimeMs, meanTimeMs, minTimeMs, maxTimeMs, rows,
                statementType(query), firstTable(query));
    }

    private static String stripLeadingComments(String query) {
        if (query == null) return "";
        return LEADING_COMMENTS.matcher(query).replaceFirst("");
    }
}
