package com.example.dbmonitor.target;

import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.domain.ColumnDescriptor;
import com.example.dbmonitor.domain.ForeignKeyDescriptor;
import com.example.dbmonitor.domain.IndexDescriptor;
import com.example.dbmonitor.exception.StatisticsQueryException;
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
 * Catalog reads for schema snapshots. Each method is a single independent read-only
 * statement, so the snapshot collector may run them concurrently on one connection.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaMetadataReader {

    private final MonitorProperties properties;

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    public List<String> listBaseTables(Connection connection, String schema) {
        return query(connection, PostgresCatalogQueries.BASE_TABLES, rs -> rs.getString("table_name"), schema);
    }

    public List<ColumnDescriptor> readColumns(Connection connection, String schema, String table) {
        return query(connection, PostgresCatalogQueries.COLUMNS, rs -> new ColumnDescriptor(
                rs.getString("column_name"),
                rs.getString("data_type"),
                "YES".equalsIgnoreCase(rs.getString("is_nullable")),
                rs.getString("column_default"),
                intOrNull(rs, "character_maximum_length"),
                intOrNull(rs, "numeric_precision"),
                intOrNull(rs, "numeric_scale")), schema, table);
    }

    public List<String> readPrimaryKeys(Connection connection, String schema, String table) {
        return query(connection, PostgresCatalogQueries.PRIMARY_KEYS, rs -> rs.getString("column_name"), schema, table);
    }

    public List<ForeignKeyDescriptor> readForeignKeys(Connection connection, String schema, String table) {
        return query(connection, PostgresCatalogQueries.FOREIGN_KEYS, rs -> new ForeignKeyDescriptor(
                rs.getString("column_name"),
                rs.getString("foreign_table_name"),
                rs.getString("foreign_column_name"),
                rs.getString("constraint_name")), schema, table);
    }

    public List<IndexDescriptor> readIndexes(Connection connection, String schema, String table) {
        return query(connection, PostgresCatalogQueries.INDEXES, rs -> new IndexDescriptor(
                rs.getString("indexname"),
                rs.getString("indexdef")), schema, table);
    }

    /**
     * Planner estimate from pg_class; exact COUNT(*) when the table was never analysed.
     *
     * @throws StatisticsQueryException when neither count can be read
     */
    public long estimateRowCount(Connection connection, String schema, String table) {
        List<Long> estimate = query(connection, PostgresCatalogQueries.ESTIMATED_ROW_COUNT,
                rs -> rs.getLong(1), schema, table);
        if (!estimate.isEmpty() && estimate.get(0) >= 0) {
            return estimate.get(0);
        }
        String sql = "SELECT COUNT(*) FROM " + quoteIdentifier(schema) + "." + quoteIdentifier(table);
        List<Long> exact = query(connection, sql, rs -> rs.getLong(1));
        if (exact.isEmpty()) {
            throw new StatisticsQueryException("No row count returned for " + schema + "." + table, null);
        }
        return exact.get(0);
    }

    private static Integer intOrNull(ResultSet rs, String column) throws SQLException {
        Object value = rs.getObject(column);
        return value instanceof Number number ? number.intValue() : null;
    }

    static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private <T> List<T> query(Connection connection, String sql, RowMapper<T> mapper, String... params) {
        List<T> rows = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setQueryTimeout(properties.getSchema().getMetadataQueryTimeoutSeconds());
            for (int i = 0; i < params.length; i++) {
                statement.setString(i + 1, params[i]);
            }
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
            }
        } catch (SQLException e) {
            throw new StatisticsQueryException("Catalog query failed: " + e.getMessage(), e);
        }
        return rows;
    }
}
