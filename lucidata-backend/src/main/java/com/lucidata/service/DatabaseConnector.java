package com.lucidata.service;

import com.lucidata.config.LucidataConfig;
import com.lucidata.util.DsnParser;
import com.lucidata.util.JdbcConnectionInfo;
import com.lucidata.util.JdbcConnectionInfoResolver;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.util.Map;

/**
 * Opens one database connection per call and releases it before returning.
 *
 * <p>Every call builds a single-connection HikariCP data source and closes it together with the
 * connection, so nothing is pooled or shared across requests.
 */
@Slf4j
@Component
public class DatabaseConnector {

    private static final String SQLSTATE_UNABLE_TO_CONNECT = "08001";

    private final LucidataConfig.Database config;
    private final JdbcConnectionInfoResolver connectionInfoResolver;

    public DatabaseConnector(LucidataConfig config, JdbcConnectionInfoResolver connectionInfoResolver) {
        this.config = config.database();
        this.connectionInfoResolver = connectionInfoResolver;
    }

    /**
     * Work to run against an open connection.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    public interface ConnectionWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    public boolean isConfigured() {
        return config.isConfigured();
    }

    /**
     * Run work on a freshly opened connection.
     *
     * @param poolName name used in driver and pool logs
     * @param work work to run
     * @param <T> result type
     * @return work result
     * @throws SQLException if no database is configured, the connection fails, or the work fails
     */
    public <T> T withConnection(String poolName, ConnectionWork<T> work) throws SQLException {
        if (!config.isConfigured()) {
            throw new SQLNonTransientConnectionException("Database connection not configured", SQLSTATE_UNABLE_TO_CONNECT);
        }

        JdbcConnectionInfo info = resolveConnectionInfo();
        HikariDataSource ds;
        try {
            ds = createDataSource(buildHikariConfig(info, poolName));
        } catch (HikariPool.PoolInitializationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new SQLNonTransientConnectionException(
                    "Failed to connect to database: " + cause.getMessage(), SQLSTATE_UNABLE_TO_CONNECT, cause);
        } catch (RuntimeException e) {
            // Hikari rejects invalid settings (e.g. a connection timeout below 250 ms) with unchecked exceptions
            log.warn("Invalid database pool settings: {}", e.getMessage());
            throw new SQLNonTransientConnectionException(
                    "Invalid database configuration: " + e.getMessage(), SQLSTATE_UNABLE_TO_CONNECT, e);
        }

        try (ds; Connection conn = ds.getConnection()) {
            return work.apply(conn);
        }
    }

    HikariDataSource createDataSource(HikariConfig hikariConfig) {
        return new HikariDataSource(hikariConfig);
    }

    private JdbcConnectionInfo resolveConnectionInfo() throws SQLException {
        try {
            return connectionInfoResolver.resolve(config.url());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid database connection string {}: {}", DsnParser.mask(config.url()), e.getMessage());
            throw new SQLNonTransientConnectionException(
                    "Invalid database connection string: " + e.getMessage(), SQLSTATE_UNABLE_TO_CONNECT, e);
        }
    }

    private HikariConfig buildHikariConfig(JdbcConnectionInfo info, String poolName) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(info.getUrl());
        hikariConfig.setUsername(info.getUsername());
        hikariConfig.setPassword(info.getPassword());
        hikariConfig.setDriverClassName("org.postgresql.Driver");
        // Shows up as pg_stat_activity.application_name.
        hikariConfig.addDataSourceProperty("ApplicationName", "lucidata");
        Map<String, String> properties = info.getProperties();
        if (properties != null) {
            properties.forEach(hikariConfig::addDataSourceProperty);
        }
        hikariConfig.setConnectionTimeout(config.connectionTimeoutMs());
        hikariConfig.setMaximumPoolSize(1);
        hikariConfig.setMinimumIdle(0);
        hikariConfig.setPoolName(poolName);
        return hikariConfig;
    }
}
