package com.example.dbmonitor.domain;

public record ForeignKeyDescriptor(
        String columnName,
        String foreignTable,
        String foreignColumn,
        String constraintName
) {}
