package com.lucidata.service;

import com.lucidata.config.LucidataConfig;
import com.lucidata.model.ExecutionResult;
import com.lucidata.model.QueryError;
import com.lucidata.util.JdbcJsonSafe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterUtils;
import org.springframework.jdbc.core.namedparam.ParsedSql;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes a single SQL statement and returns its rows.
 *
 * <p>Values are bound through {@code :name} placeholders and the {@code params} map, never by string
 * interpolation. Failures are classified into a {@link QueryError}.
 */
@Slf4j
@Service
public class QueryExecutionGateway {

    private static final List<String> CONNECTION_SQLSTATE_PREFIXES = List.of("08", "28", "3D", "53", "57P");

    private final DatabaseConnector databaseConnector;
    private final LucidataConfig.Database config;

    public QueryExecutionGateway(DatabaseConnector databaseConnector, LucidataConfig config) {
        this.databaseConnector = databaseConnector;
        this.config = config.database();
    }

    /**
     * Statement text with positional placeholders and the values to bind, in order.
     */
    record BoundStatement(String sql, List<Object> values) {
    }

    /**
     * Execute one statement.
     *
     * @param sql statement text, optionally with {@code :name} placeholders
     * @param params values for the placeholders, may be null
     * @return rows and column metadata
     * @throws QueryExecutionException when binding, connecting or executing fails
     */
    public ExecutionResult execute(String sql, Map<String, Object> params) throws QueryExecutionException {
        if (sql == null || sql.isBlank()) {
            throw new QueryExecutionException(new QueryError(QueryError.Kind.SYNTAX_ERROR, "SQL query is required"), null);
        }
        BoundStatement bound = bind(sql, params);

        log.info("Executing query: {}", sql);
        try {
            ExecutionResult result = databaseConnector.withConnection("lucidata-query", conn -> run(conn, bound));
            log.info("Query returned {} row(s) in {} ms", result.rowCount(), result.durationMs());
            return result;
        } catch (SQLException e) {
            QueryError error = classify(e);
            log.warn("Database query error (kind={}, sqlstate={}): {}", error.kind(), e.getSQLState(), e.getMessage());
            throw new QueryExecutionException(error, e);
        }
    }

    static BoundStatement bind(String sql, Map<String, Object> params) throws QueryExecutionException {
        if (params == null || params.isEmpty()) {
            return new BoundStatement(sql, List.of());
        }
        ParsedSql parsed = NamedParameterUtils.parseSqlStatement(sql);
        MapSqlParameterSource source = new MapSqlParameterSource(params);
        try {
            String jdbcSql = NamedParameterUtils.substituteNamedParameters(parsed, source);
            Object[] values = NamedParameterUtils.buildValueArray(parsed, source, null);
            List<Object> flattened = new ArrayList<>(values.length);
            for (Object value : values) {
                // collections were expanded to "?, ?, ..." by substituteNamedParameters
                if (value instanceof Collection<?> collection) {
                    flattened.addAll(collection);
                } else {
                    flattened.add(value);
                }
            }
            return new BoundStatement(jdbcSql, flattened);
        } catch (InvalidDataAccessApiUsageException e) {
            throw new QueryExecutionException(
                    new QueryError(QueryError.Kind.SYNTAX_ERROR, "Query parameter error: " + e.getMessage()), e);
        }
    }

    private ExecutionResult run(Connection conn, BoundStatement bound) throws SQLException {
        long startTime = System.currentTimeMillis();
        if (config.readOnly()) {
            conn.setReadOnly(true);
        }

        // Parameter-less statements go through a plain Statement; nothing to bind.
        if (bound.values().isEmpty()) {
            try (Statement stmt = conn.createStatement()) {
                applyTimeout(stmt);
                boolean hasResultSet = stmt.execute(bound.sql());
                return collect(stmt, hasResultSet, startTime);
            }
        }

        try (PreparedStatement ps = conn.prepareStatement(bound.sql())) {
            applyTimeout(ps);
            for (int i = 0; i < bound.values().size(); i++) {
                ps.setObject(i + 1, bound.values().get(i));
            }
            boolean hasResultSet = ps.execute();
            return collect(ps, hasResultSet, startTime);
        }
    }

    private void applyTimeout(Statement stmt) throws SQLException {
        if (config.queryTimeoutMs() > 0) {
            stmt.setQueryTimeout(Math.max(1, config.queryTimeoutMs() / 1000));
        }
    }

    private ExecutionResult collect(Statement stmt, boolean hasResultSet, long startTime) throws SQLException {
        if (!hasResultSet) {
            int updateCount = Math.max(stmt.getUpdateCount(), 0);
            return new ExecutionResult(List.of(), List.of(), updateCount, System.currentTimeMillis() - startTime);
        }

        try (ResultSet rs = stmt.getResultSet()) {
            ResultSetMetaData metaData = rs.getMetaData();
            int columnCount = metaData.getColumnCount();
            List<String> columnNames = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                columnNames.add(metaData.getColumnLabel(i));
            }

            List<Map<String, Object>> rows = new ArrayList<>();
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= columnCount; i++) {
                    row.put(columnNames.get(i - 1), JdbcJsonSafe.readJsonSafeValue(rs, i));
                }
                rows.add(row);
            }
            return new ExecutionResult(rows, columnNames, rows.size(), System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Map a JDBC failure onto the execution error taxonomy, by exception type and then SQLSTATE class.
     *
     * @param e jdbc failure
     * @return classified error carrying the driver message
     */
    static QueryError classify(SQLException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (e instanceof SQLSyntaxErrorException) {
            return new QueryError(QueryError.Kind.SYNTAX_ERROR, message);
        }
        if (e instanceof SQLIntegrityConstraintViolationException) {
            return new QueryError(QueryError.Kind.CONSTRAINT_VIOLATION, message);
        }
        if (e instanceof SQLTransientConnectionException || e instanceof SQLNonTransientConnectionException) {
            return new QueryError(QueryError.Kind.CONNECTION_ERROR, message);
        }

        String sqlState = e.getSQLState();
        if (sqlState != null) {
            if (sqlState.startsWith("42")) {
                return new QueryError(QueryError.Kind.SYNTAX_ERROR, message);
            }
            if (sqlState.startsWith("23")) {
                return new QueryError(QueryError.Kind.CONSTRAINT_VIOLATION, message);
            }
            for (String prefix : CONNECTION_SQLSTATE_PREFIXES) {
                if (sqlState.startsWith(prefix)) {
                    return new QueryError(QueryError.Kind.CONNECTION_ERROR, message);
                }
            }
        }
        return new QueryError(QueryError.Kind.OTHER, message);
    }
}
