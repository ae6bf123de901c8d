package com.example.dbmonitor.target;

/**
 * SQL run against monitored targets.
 */
final class PostgresCatalogQueries {

    private PostgresCatalogQueries() {}

    static final String STATISTICS_EXTENSION_PRESENT = """
            SELECT 1 FROM pg_extension WHERE extname = 'pg_stat_statements'
            """;

    /**
     * Top statements of the current database by total execution time.
     * Catalog lookups, the extension's own queries and transaction control are filtered out.
     */
    static final String TOP_STATEMENTS = """
            SELECT query,
                   calls,
                   total_exec_time,
                   mean_exec_time,
                   min_exec_time,
                   max_exec_time,
                   rows
            FROM pg_stat_statements
            WHERE dbid = (SELECT oid FROM pg_database WHERE datname = current_database())
              AND query NOT ILIKE '%pg_stat_statements%'
              AND query NOT ILIKE '%pg_catalog.%'
              AND query NOT ILIKE '%information_schema.%'
              AND query NOT ILIKE '%pg_extension%'
              AND query !~* '^\\s*(BEGIN|COMMIT|ROLLBACK|END|START TRANSACTION|SAVEPOINT|RELEASE|SET|SHOW|RESET|DISCARD|DEALLOCATE|LISTEN|UNLISTEN|VACUUM|ANALYZE|CHECKPOINT)\\y'
            ORDER BY total_exec_time DESC
            LIMIT ?
            """;

    static final String BASE_TABLES = """
            SELECT table_name
            FROM information_schema.tables
            WHERE table_schema = ?
              AND table_type = 'BASE TABLE'
            ORDER BY table_name
            """;

    static final String COLUMNS = """
            SELECT column_name,
                   data_type,
                   is_nullable,
                   column_default,
                   character_maximum_length,
                   numeric_precision,
                   numeric_scale
            FROM information_schema.columns
            WHERE table_schema = ?
              AND table_name = ?
            ORDER BY ordinal_position
            """;

    static final String PRIMARY_KEYS = """
            SELECT kcu.column_name
            FROM information_schema.table_constraints tc
            JOIN information_schema.key_column_usage kcu
              ON tc.constraint_name = kcu.constraint_name
             AND tc.table_schema = kcu.table_schema
            WHERE tc.table_schema = ?
              AND tc.table_name = ?
              AND tc.constraint_type = 'PRIMARY KEY'
            ORDER BY kcu.ordinal_position
            """;

    static final String FOREIGN_KEYS = """
            SELECT kcu.column_name,
                   ccu.table_name AS foreign_table_name,
                   ccu.column_name AS foreign_column_name,
                   tc.constraint_name
            FROM information_schema.table_constraints tc
            JOIN information_schema.key_column_usage kcu
              ON tc.constraint_name = kcu.constraint_name
             AND tc.table_schema = kcu.table_schema
            JOIN information_schema.constraint_column_usage ccu
              ON ccu.constraint_name = tc.constraint_name
             AND ccu.constraint_schema = tc.table_schema
            WHERE tc.table_schema = ?
              AND tc.table_name = ?
              AND tc.constraint_type = 'FOREIGN KEY'
            ORDER BY tc.constraint_name, kcu.ordinal_position
            """;

    static final String INDEXES = """
            SELECT indexname, indexdef
            FROM pg_indexes
            WHERE schemaname = ?
              AND tablename = ?
            ORDER BY indexname
            """;

    static final String ESTIMATED_ROW_COUNT = """
            SELECT c.reltuples::bigint
            FROM pg_class c
            JOIN pg_namespace n ON n.oid = c.relnamespace
            WHERE n.nspname = ?
              AND c.relname = ?
            """;
}
