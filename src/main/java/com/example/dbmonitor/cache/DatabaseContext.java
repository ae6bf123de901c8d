package com.example.dbmonitor.cache;

import com.example.dbmonitor.domain.QueryRecord;
import com.example.dbmonitor.domain.TableSnapshot;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

/**
 * Denormalized view of one target handed to the text-generation collaborator:
 * the slowest recent queries, every table snapshot and a prose rendering of both.
 */
public record DatabaseContext(
        String targetId,
        List<QueryRecord> recentQueries,
        List<TableSnapshot> tables,
        String narrative,
        Instant cachedAt) {

    public static DatabaseContext empty(String targetId) {
        return new DatabaseContext(targetId, List.of(), List.of(), "", Instant.now());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return recentQueries.isEmpty() && tables.isEmpty();
    }
}
