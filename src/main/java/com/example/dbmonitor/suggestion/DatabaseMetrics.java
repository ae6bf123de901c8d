package com.example.dbmonitor.suggestion;

import com.example.dbmonitor.domain.CriticalQueryEvent;
import com.example.dbmonitor.domain.QueryRecord;
import com.example.dbmonitor.domain.TableSnapshot;

import java.util.List;

/**
 * Everything the suggestion engine knows about one target. Serialized as JSON into the prompt.
 */
public record DatabaseMetrics(
        String targetId,
        List<QueryRecord> significantQueries,
        List<QueryRecord> topQueries,
        List<TableSnapshot> tableStructures,
        List<TableUsage> tableUsage,
        List<TableUsage> mostUsedTables,
        List<String> unusedTables,
        List<CriticalQueryEvent> recentCriticalEvents,
        PerformanceStats performanceStats,
        int totalTables,
        int totalQueries) {

    /** Slow queries or recent critical events; without either there is nothing to suggest. */
    public boolean hasSignificantData() {
        return !significantQueries.isEmpty() || !recentCriticalEvents.isEmpty();
    }

    public record TableUsage(String tableName, long callCount) {}

    /**
     * @param avgQueryTimeMs total time divided by total calls, rounded
     */
    public record PerformanceStats(long avgQueryTimeMs, long totalCalls, long totalTimeMs,
                                   String slowestQuery, double slowestQueryMeanMs) {

        static PerformanceStats empty() {
            return new PerformanceStats(0, 0, 0, null, 0);
        }
    }
}
