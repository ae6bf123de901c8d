package com.example.dbmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * DB Monitor - background observation pipeline for externally hosted PostgreSQL instances.
 *
 * Architecture:
 * - Query Collection → mirrors pg_stat_statements into per-query records
 * - Alert Detection → watches opted-in queries, records critical events, notifies
 * - Schema Snapshots → columns, keys, indexes and row counts per table
 * - Context Cache → denormalized database context, invalidated by every collector
 * - Suggestion Synthesis → LLM-generated top 3 recommendations with deterministic fallback
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
public class DbMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DbMonitorApplication.class, args);
    }
}
