package com.example.dbmonitor.cache;

import com.example.dbmonitor.config.MonitorProperties;
import com.example.dbmonitor.domain.ColumnDescriptor;
import com.example.dbmonitor.domain.IndexDescriptor;
import com.example.dbmonitor.domain.QueryRecord;
import com.example.dbmonitor.domain.TableSnapshot;
import com.example.dbmonitor.repository.QueryRecordRepository;
import com.example.dbmonitor.repository.TableSnapshotRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds a {@link DatabaseContext} from the persisted query records and table snapshots.
 */
@Component
@RequiredArgsConstructor
public class DatabaseContextBuilder {

    private static final int QUERY_PREVIEW_LENGTH = 100;

    private final QueryRecordRepository queryRecordRepository;
    private final TableSnapshotRepository tableSnapshotRepository;
    private final MonitorProperties properties;

    public DatabaseContext build(String targetId) {
        List<QueryRecord> queries = queryRecordRepository.findByTargetIdOrderByMeanTimeMsDesc(
                targetId, PageRequest.of(0, properties.getCache().getRecentQueries()));
        List<TableSnapshot> tables = tableSnapshotRepository.findByTargetIdOrderByTableNameAsc(targetId);
        return new DatabaseContext(targetId, queries, tables, narrative(queries, tables), Instant.now());
    }

    /**
     * Renders queries and tables as a block of text for inclusion in a prompt.
     * Empty when there is nothing to describe.
     */
    static String narrative(List<QueryRecord> queries, List<TableSnapshot> tables) {
        if (queries.isEmpty() && tables.isEmpty()) {
            return "";
        }

        StringBuilder sb = new StringBuilder("\n\n=== DATABASE CONTEXT ===\n");

        if (!queries.isEmpty()) {
            sb.append("\n**Recent Query Performance:**\n");
            for (int i = 0; i < queries.size(); i++) {
                QueryRecord query = queries.get(i);
                sb.append(i + 1).append(". Query: ").append(preview(query.getQueryText())).append('\n');
                sb.append("   - Calls: ").append(query.getCalls())
                        .append(", Mean Time: ").append(Math.round(query.getMeanTimeMs())).append("ms")
                        .append(", Total Time: ").append(Math.round(query.getTotalTimeMs())).append("ms\n");
            }
        }

        if (!tables.isEmpty()) {
            sb.append("\n**Table Structures:**\n");
            for (TableSnapshot table : tables) {
                sb.append("\nTable: ").append(table.getTableName())
                        .append(" (").append(table.getRowCount() != null ? table.getRowCount() : "unknown")
                        .append(" rows)\n");
                sb.append("Columns: ").append(table.getColumns().stream()
                        .map(ColumnDescriptor::describe)
                        .collect(Collectors.joining(", "))).append('\n');
                if (!table.getPrimaryKeys().isEmpty()) {
                    sb.append("Primary Keys: ").append(String.join(", ", table.getPrimaryKeys())).append('\n');
                }
                if (!table.getIndexes().isEmpty()) {
                    sb.append("Indexes: ").append(table.getIndexes().stream()
                            .map(IndexDescriptor::name)
                            .collect(Collectors.joining(", "))).append('\n');
                }
            }
        }

        sb.append("\n=== END DATABASE CONTEXT ===\n\n");
        return sb.toString();
    }

    private static String preview(String queryText) {
        if (queryText == null) {
            return "";
        }
        return queryText.length() > QUERY_PREVIEW_LENGTH
                ? queryText.substring(0, QUERY_PREVIEW_LENGTH) + "..."
                : queryText;
    }
}
