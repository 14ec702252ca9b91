package com.lucidata.model;

import java.util.Objects;

/**
 * One column of a table as seen by the translation prompt.
 *
 * @param name column name
 * @param type free-form type label, e.g. {@code integer} or {@code numeric(5,1)}
 * @param nullable whether the column accepts nulls
 */
public record ColumnDescriptor(String name, String type, boolean nullable) {

    public ColumnDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }
}
