package com.example.dbmonitor.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One column of a table, as reported by information_schema.columns.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ColumnDescriptor(
        String name,
        String dataType,
        boolean nullable,
        String defaultValue,
        Integer maxLength,
        Integer numericPrecision,
        Integer numericScale
) {

    /** {@code name (type)}, as shown in prompts. */
    public String describe() {
        return name + " (" + dataType + ")";
    }
}
