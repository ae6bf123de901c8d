package com.example.dbmonitor.suggestion;

import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.domain.Suggestion;
import com.example.dbmonitor.domain.Suggestion.Priority;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Derives three suggestions from the metrics alone, used whenever the model
 * answer cannot be used. Same metrics, same suggestions.
 */
@Component
@RequiredArgsConstructor
public class FallbackSuggestionGenerator {

    private final MonitorProperties properties;

    public List<Suggestion> generate(DatabaseMetrics metrics) {
        return List.of(queryPerformance(metrics), tableUsage(metrics), databaseHealth(metrics));
    }

    private Suggestion queryPerformance(DatabaseMetrics metrics) {
        long avg = metrics.performanceStats().avgQueryTimeMs();
        if (avg > properties.getSuggestions().getFallbackAvgQueryTimeMs()) {
            return new Suggestion("Optimize Query Performance",
                    "Average query time is " + avg + "ms. Consider adding indexes and optimizing query structure.",
                    Priority.HIGH, "query_optimization");
        }
        return new Suggestion("Monitor Query Performance",
                "Set up comprehensive monitoring to track query performance and identify bottlenecks early.",
                Priority.MEDIUM, "monitoring");
    }

    private Suggestion tableUsage(DatabaseMetrics metrics) {
        if (!metrics.unusedTables().isEmpty()) {
            return new Suggestion("Clean Up Unused Tables",
                    "Found " + metrics.unusedTables().size()
                            + " unused tables that can be removed to reduce storage overhead.",
                    Priority.LOW, "maintenance");
        }
        if (!metrics.mostUsedTables().isEmpty()) {
            String busiest = metrics.mostUsedTables().stream()
                    .limit(3)
                    .map(DatabaseMetrics.TableUsage::tableName)
                    .collect(Collectors.joining(", "));
            return new Suggestion("Optimize Table Access Patterns",
                    "Focus on optimizing the most frequently accessed tables: " + busiest + ".",
                    Priority.MEDIUM, "table_optimization");
        }
        return new Suggestion("Review Database Schema",
                "Analyze table structures and relationships to identify optimization opportunities.",
                Priority.MEDIUM, "schema_design");
    }

    private Suggestion databaseHealth(DatabaseMetrics metrics) {
        if (metrics.totalTables() > properties.getSuggestions().getPartitioningTableCount()) {
            return new Suggestion("Consider Table Partitioning",
                    "With " + metrics.totalTables()
                            + " tables, consider partitioning large tables to improve performance and maintenance.",
                    Priority.LOW, "partitioning");
        }
        return new Suggestion("Review Database Configuration",
                "Review and optimize database configuration settings for better performance.",
                Priority.LOW, "configuration");
    }
}
