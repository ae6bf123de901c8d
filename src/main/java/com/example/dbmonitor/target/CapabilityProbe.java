package com.example.dbmonitor.target;

import com.example.dbmonitor.domain.MonitoredTarget;
import com.example.dbmonitor.exception.TargetConnectionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * One-shot check that a target exposes pg_stat_statements.
 * Only targets that pass take part in scheduled collection.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CapabilityProbe {

    private final TargetConnectionProvider connectionProvider;

    public boolean hasStatisticsExtension(MonitoredTarget target) {
        try (Connection connection = connectionProvider.open(target);
             PreparedStatement statement = connection.prepareStatement(PostgresCatalogQueries.STATISTICS_EXTENSION_PRESENT);
             ResultSet rs = statement.executeQuery()) {
            boolean present = rs.next();
            if (!present) {
                log.warn("pg_stat_statements is not installed on {}", target.describe());
            }
            return present;
        } catch (TargetConnectionException e) {
            log.warn("Capability probe could not connect to {}: {}", target.describe(), e.getMessage());
            return false;
        } catch (SQLException e) {
            log.warn("Capability probe failed on {}: {}", target.describe(), e.getMessage());
            return false;
        }
    }
}
