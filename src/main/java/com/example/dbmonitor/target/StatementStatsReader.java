package com.example.dbmonitor.target;

import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.exception.StatisticsQueryException;
import com.example.dbmonitor.query.StatementClassifier;
import com.example.dbmonitor.query.StatementStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the top statements from pg_stat_statements on an open target connection.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatementStatsReader {

    private final MonitorProperties properties;

    /**
     * @param limit maximum number of statements, ranked by total execution time
     * @throws StatisticsQueryException when the statistics query itself fails
     */
    public List<StatementStatistics> readTopStatements(Connection connection, int limit) {
        List<StatementStatistics> result = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(PostgresCatalogQueries.TOP_STATEMENTS)) {
            statement.setQueryTimeout(properties.getTarget().getStatementTimeoutSeconds());
            statement.setInt(1, limit);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    String query = rs.getString("query");
                    if (query == null || query.isBlank()) {
                        continue;
                    }
                    result.add(StatementClassifier.annotate(
                            query,
                            rs.getLong("calls"),
                            rs.getDouble("total_exec_time"),
                            rs.getDouble("mean_exec_time"),
                            rs.getDouble("min_exec_time"),
                            rs.getDouble("max_exec_time"),
                            rs.getLong("rows")));
                }
            }
        } catch (SQLException e) {
            throw new StatisticsQueryException("pg_stat_statements query failed: " + e.getMessage(), e);
        }
        log.debug("Read {} statements from pg_stat_statements", result.size());
        return result;
    }
}
