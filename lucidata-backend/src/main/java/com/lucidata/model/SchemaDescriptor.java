package com.lucidata.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered mapping from table name to its columns, used to ground model translation.
 *
 * <p>Insertion order is preserved and reflects the order in which tables were enumerated.
 */
@ToString
public final class SchemaDescriptor {

    private static final SchemaDescriptor EMPTY = new SchemaDescriptor(Map.of());

    /**
     * Tables in enumeration order, unmodifiable.
     */
    @Getter
    private final Map<String, TableDescriptor> tables;

    private SchemaDescriptor(Map<String, TableDescriptor> tables) {
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }

    public static SchemaDescriptor empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SchemaDescriptor other)) {
            return false;
        }
        // order is part of identity
        return List.copyOf(tables.entrySet()).equals(List.copyOf(other.tables.entrySet()));
    }

    @Override
    public int hashCode() {
        return tables.hashCode();
    }

    /**
     * Accumulates tables in order and rejects duplicate table names.
     */
    public static final class Builder {
        private final Map<String, TableDescriptor> tables = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder table(String name, List<ColumnDescriptor> columns) {
            return table(name, new TableDescriptor(columns));
        }

        public Builder table(String name, TableDescriptor table) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Table name is required");
            }
            if (tables.putIfAbsent(name, table) != null) {
                throw new IllegalArgumentException("Duplicate table name: " + name);
            }
            return this;
        }

        public SchemaDescriptor build() {
            return tables.isEmpty() ? EMPTY : new SchemaDescriptor(tables);
        }
    }
}
