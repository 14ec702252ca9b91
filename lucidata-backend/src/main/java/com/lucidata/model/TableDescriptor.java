package com.lucidata.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Columns of a single table in declaration order.
 *
 * @param columns ordered column list, names unique within the table
 */
public record TableDescriptor(List<ColumnDescriptor> columns) {

    public TableDescriptor {
        columns = columns != null ? List.copyOf(columns) : List.of();
        Set<String> seen = new HashSet<>();
        for (ColumnDescriptor column : columns) {
            if (!seen.add(column.name())) {
                throw new IllegalArgumentException("Duplicate column name: " + column.name());
            }
        }
    }
}
