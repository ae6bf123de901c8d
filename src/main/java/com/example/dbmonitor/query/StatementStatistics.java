package com.example.dbmonitor.query;

import com.example.dbmonitor.domain.QueryRecord.StatementType;

/**
 * One row of pg_stat_statements, annotated with the inferred statement type and first table.
 */
public record StatementStatistics(
        String query,
        long calls,
        double totalTimeMs,
        double meanTimeMs,
        double minTimeMs,
        double maxTimeMs,
        long rows,
        StatementType statementType,
        String firstTable
) {

    public QueryIdentity identity() {
        return QueryIdentity.of(query);
    }
}
