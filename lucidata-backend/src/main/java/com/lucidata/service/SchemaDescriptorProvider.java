package com.lucidata.service;

import com.lucidata.model.ColumnDescriptor;
import com.lucidata.model.Outcome;
import com.lucidata.model.SchemaDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Describes the tables of the public schema for prompt grounding.
 *
 * <p>Never fails: when the database is unconfigured or unreachable, or introspection fails, the
 * built-in description of the {@code cars} table is returned as a fallback outcome.
 */
@Slf4j
@Service
public class SchemaDescriptorProvider {

    public static final String FALLBACK_TABLE = "cars";

    private static final SchemaDescriptor FALLBACK_SCHEMA = SchemaDescriptor.builder()
            .table(FALLBACK_TABLE, List.of(
                    new ColumnDescriptor("id", "integer", false),
                    new ColumnDescriptor("model", "varchar(50)", false),
                    new ColumnDescriptor("mpg", "numeric(5,1)", true),
                    new ColumnDescriptor("cyl", "integer", true),
                    new ColumnDescriptor("disp", "numeric(6,1)", true),
                    new ColumnDescriptor("hp", "integer", true),
                    new ColumnDescriptor("drat", "numeric(4,2)", true),
                    new ColumnDescriptor("wt", "numeric(5,3)", true),
                    new ColumnDescriptor("qsec", "numeric(5,2)", true),
                    new ColumnDescriptor("vs", "integer", true),
                    new ColumnDescriptor("am", "integer", true),
                    new ColumnDescriptor("gear", "integer", true),
                    new ColumnDescriptor("carb", "integer", true)
            ))
            .build();

    private static final String LIST_TABLES_SQL =
            "SELECT tablename FROM pg_catalog.pg_tables WHERE schemaname = 'public' ORDER BY tablename";

    private static final String LIST_COLUMNS_SQL = "SELECT column_name, data_type, is_nullable "
            + "FROM information_schema.columns "
            + "WHERE table_schema = 'public' AND table_name = ? "
            + "ORDER BY ordinal_position";

    private final DatabaseConnector databaseConnector;

    public SchemaDescriptorProvider(DatabaseConnector databaseConnector) {
        this.databaseConnector = databaseConnector;
    }

    /**
     * The fixed schema used whenever live introspection is unavailable.
     *
     * @return fallback schema
     */
    public static SchemaDescriptor fallbackSchema() {
        return FALLBACK_SCHEMA;
    }

    /**
     * Fetch the live schema, or the fallback schema if that is not possible.
     *
     * @return schema outcome, either SUCCEEDED or FALLBACK_APPLIED
     */
    public Outcome<SchemaDescriptor> fetch() {
        if (!databaseConnector.isConfigured()) {
            log.warn("Database connection not configured, using built-in schema for table '{}'", FALLBACK_TABLE);
            return Outcome.fallback(FALLBACK_SCHEMA, List.of("Database not configured; using built-in schema"));
        }

        try {
            SchemaDescriptor schema = databaseConnector.withConnection("lucidata-schema", this::introspect);
            log.debug("Fetched schema with {} table(s)", schema.getTables().size());
            return Outcome.success(schema);
        } catch (SQLException | RuntimeException e) {
            log.warn("Error fetching database schema, using built-in schema: {}", e.getMessage());
            return Outcome.fallback(FALLBACK_SCHEMA, List.of("Schema introspection failed; using built-in schema"));
        }
    }

    private SchemaDescriptor introspect(Connection conn) throws SQLException {
        List<String> tableNames = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(LIST_TABLES_SQL)) {
            while (rs.next()) {
                tableNames.add(rs.getString(1));
            }
        }

        SchemaDescriptor.Builder builder = SchemaDescriptor.builder();
        try (PreparedStatement ps = conn.prepareStatement(LIST_COLUMNS_SQL)) {
            for (String tableName : tableNames) {
                ps.setString(1, tableName);
                List<ColumnDescriptor> columns = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        columns.add(new ColumnDescriptor(
                                rs.getString("column_name"),
                                rs.getString("data_type"),
                                "YES".equalsIgnoreCase(rs.getString("is_nullable"))
                        ));
                    }
                }
                builder.table(tableName, columns);
            }
        }
        return builder.build();
    }
}
