package com.example.dbmonitor.domain;

/**
 * The part of a target that notification channels are allowed to see.
 */
public record TargetInfo(String targetId, String host, String databaseName) {}
