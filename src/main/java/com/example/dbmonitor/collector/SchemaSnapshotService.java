package com.example.dbmonitor.collector;

import com.example.dbmonitor.cache.ContextCacheService;
import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.domain.ColumnDescriptor;
import com.example.dbmonitor.domain.ForeignKeyDescriptor;
import com.example.dbmonitor.domain.IndexDescriptor;
import com.example.dbmonitor.domain.MonitoredTarget;
import com.example.dbmonitor.domain.TableSnapshot;
import com.example.dbmonitor.exception.TargetConnectionException;
import com.example.dbmonitor.repository.MonitoredTargetRepository;
import com.example.dbmonitor.repository.TableSnapshotRepository;
import com.example.dbmonitor.target.SchemaMetadataReader;
import com.example.dbmonitor.target.TargetConnectionProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Schema Snapshot Collector.
 *
 * For each monitored target, lists the base tables of the default schema and
 * captures columns, keys, indexes and an approximate row count per table.
 * The five metadata reads of one table run concurrently on the schema
 * executor against the same connection.
 */
@Slf4j
@Service
public class SchemaSnapshotService {

    private final MonitoredTargetRepository targetRepository;
    private final TableSnapshotRepository snapshotRepository;
    private final TargetConnectionProvider connectionProvider;
    private final SchemaMetadataReader metadataReader;
    private final ContextCacheService cacheService;
    private final MonitorProperties properties;
    private final Executor schemaExecutor;

    public SchemaSnapshotService(MonitoredTargetRepository targetRepository,
                                 TableSnapshotRepository snapshotRepository,
                                 TargetConnectionProvider connectionProvider,
                                 SchemaMetadataReader metadataReader,
                                 ContextCacheService cacheService,
                                 MonitorProperties properties,
                                 @Qualifier("schemaExecutor") Executor schemaExecutor) {
        this.targetRepository = targetRepository;
        this.snapshotRepository = snapshotRepository;
        this.connectionProvider = connectionProvider;
        this.metadataReader = metadataReader;
        this.cacheService = cacheService;
        this.properties = properties;
        this.schemaExecutor = schemaExecutor;
    }

    public List<SchemaCollectionResult> snapshotAll() {
        List<MonitoredTarget> targets = targetRepository.findByMonitoringEnabled(true);
        log.info("Collecting schema metadata from {} monitored targets", targets.size());

        List<SchemaCollectionResult> results = new ArrayList<>();
        for (MonitoredTarget target : targets) {
            try {
                results.add(snapshotTarget(target));
            } catch (TargetConnectionException e) {
                log.error("Skipping schema collection for {}: {}", target.describe(), e.getMessage());
            } catch (Exception e) {
                log.error("Schema collection failed for {}: {}", target.describe(), e.getMessage());
            }
        }
        return results;
    }

    public SchemaCollectionResult snapshotTarget(MonitoredTarget target) {
        String schema = properties.getTarget().getDefaultSchema();
        List<String> errors = new ArrayList<>();
        int processed = 0;

        Connection connection = connectionProvider.open(target);
        try {
            List<String> tables = metadataReader.listBaseTables(connection, schema);
            log.debug("Found {} tables in {}.{}", tables.size(), target.getDatabaseName(), schema);

            for (String table : tables) {
                try {
                    snapshotTable(target.getId(), connection, schema, table);
                    processed++;
                } catch (Exception e) {
                    String message = rootMessage(e);
                    errors.add(table + ": " + message);
                    log.error("Failed to snapshot table {} on {}: {}", table, target.describe(), message);
                }
            }
        } finally {
            close(connection, target);
            if (processed > 0) {
                cacheService.invalidate(target.getId());
            }
        }

        log.info("Schema snapshot of {}: {} tables stored, {} failed", target.describe(), processed, errors.size());
        return new SchemaCollectionResult(target.getId(), target.getDatabaseName(), processed, errors);
    }

    private void snapshotTable(String targetId, Connection connection, String schema, String table) {
        CompletableFuture<List<ColumnDescriptor>> columns = CompletableFuture.supplyAsync(
                () -> metadataReader.readColumns(connection, schema, table), schemaExecutor);
        CompletableFuture<List<String>> primaryKeys = CompletableFuture.supplyAsync(
                () -> metadataReader.readPrimaryKeys(connection, schema, table), schemaExecutor);
        CompletableFuture<List<ForeignKeyDescriptor>> foreignKeys = CompletableFuture.supplyAsync(
                () -> metadataReader.readForeignKeys(connection, schema, table), schemaExecutor);
        CompletableFuture<List<IndexDescriptor>> indexes = CompletableFuture.supplyAsync(
                () -> metadataReader.readIndexes(connection, schema, table), schemaExecutor);
        CompletableFuture<Long> rowCount = CompletableFuture
                .supplyAsync(() -> Long.valueOf(metadataReader.estimateRowCount(connection, schema, table)), schemaExecutor)
                .exceptionally(e -> {
                    log.warn("Row count unavailable for {}.{}: {}", schema, table, rootMessage(e));
                    return null;
                });

        CompletableFuture.allOf(columns, primaryKeys, foreignKeys, indexes, rowCount).join();

        Instant now = Instant.now();
        TableSnapshot snapshot = snapshotRepository.findByTargetIdAndSchemaNameAndTableName(targetId, schema, table)
                .orElseGet(() -> TableSnapshot.builder()
                        .targetId(targetId)
                        .schemaName(schema)
                        .tableName(table)
                        .build());
        snapshot.setColumns(columns.join());
        snapshot.setPrimaryKeys(primaryKeys.join());
        snapshot.setForeignKeys(foreignKeys.join());
        snapshot.setIndexes(indexes.join());
        snapshot.setRowCount(rowCount.join());
        snapshot.setUpdatedAt(now);
        snapshotRepository.save(snapshot);
    }

    private void close(Connection connection, MonitoredTarget target) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close connection to {}: {}", target.describe(), e.getMessage());
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage();
    }

    public record SchemaCollectionResult(String targetId, String database, int tablesProcessed,
                                         List<String> errors) {}
}
