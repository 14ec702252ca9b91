package com.lucidata.model;

import java.util.List;
import java.util.Map;

/**
 * Rows returned by one executed statement.
 *
 * @param rows column name to JSON-safe value, one map per row, in column order
 * @param columnNames result column names in select-list order
 * @param rowCount number of rows returned, or the update count for statements without a result set
 * @param durationMs execution wall-clock time
 */
public record ExecutionResult(List<Map<String, Object>> rows, List<String> columnNames, long rowCount, long durationMs) {

    public ExecutionResult {
        rows = rows != null ? List.copyOf(rows) : List.of();
        columnNames = columnNames != null ? List.copyOf(columnNames) : List.of();
    }
}
