package com.example.dbmonitor.target;

import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.domain.MonitoredTarget;
import com.example.dbmonitor.exception.CredentialException;
import com.example.dbmonitor.exception.TargetConnectionException;
import com.example.dbmonitor.security.CredentialCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.ds.PGSimpleDataSource;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Non-pooling PostgreSQL connections with explicit connect, login, socket and statement timeouts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PostgresConnectionProvider implements TargetConnectionProvider {

    private final CredentialCodec credentialCodec;
    private final MonitorProperties properties;

    @Override
    public Connection open(MonitoredTarget target) {
        String password;
        try {
            password = credentialCodec.decrypt(target.getPasswordEncrypted());
        } catch (CredentialException e) {
            throw new TargetConnectionException(target.getId(),
                    "Cannot decrypt credential for " + target.describe(), e);
        }

        MonitorProperties.TargetConfig cfg = properties.getTarget();
        PGSimpleDataSource dataSource = new PGSimpleDataSource();
        dataSource.setServerNames(new String[]{target.getHost()});
        dataSource.setPortNumbers(new int[]{target.getPort()});
        dataSource.setDatabaseName(target.getDatabaseName());
        dataSource.setUser(target.getUsername());
        dataSource.setPassword(password);
        dataSource.setApplicationName(cfg.getApplicationName());
        dataSource.setSslMode(target.getSslMode() != null ? target.getSslMode() : cfg.getSslMode());
        dataSource.setOptions("-c statement_timeout=" + cfg.getStatementTimeoutSeconds() * 1000L);
        dataSource.setReadOnly(true);

        try {
            dataSource.setConnectTimeout(cfg.getConnectTimeoutSeconds());
            dataSource.setLoginTimeout(cfg.getConnectTimeoutSeconds());
            dataSource.setSocketTimeout(cfg.getSocketTimeoutSeconds());
            Connection connection = dataSource.getConnection();
            log.debug("Connected to {}", target.describe());
            return connection;
        } catch (SQLException e) {
            throw new TargetConnectionException(target.getId(),
                    "Cannot connect to " + target.describe() + ": " + e.getMessage(), e);
        }
    }
}
