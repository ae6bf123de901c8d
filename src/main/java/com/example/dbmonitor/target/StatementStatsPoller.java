package com.example.dbmonitor.target;

import com.example.dbmonitor.domain.MonitoredTarget;
import com.example.dbmonitor.exception.TargetConnectionException;
import com.example.dbmonitor.query.StatementStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Opens a short-lived connection to a target, reads its top statements and closes it again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatementStatsPoller {

    private final TargetConnectionProvider connectionProvider;
    private final StatementStatsReader statsReader;

    /**
     * @throws TargetConnectionException when the target cannot be reached
     * @throws com.example.dbmonitor.exception.StatisticsQueryException when the statistics query fails
     */
    public List<StatementStatistics> poll(MonitoredTarget target, int limit) {
        Connection connection = connectionProvider.open(target);
        try {
            return statsReader.readTopStatements(connection, limit);
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("Failed to close connection to {}: {}", target.describe(), e.getMessage());
            }
        }
    }
}
