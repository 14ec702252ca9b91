package com.lucidata.util;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Turns the configured database connection string into JDBC connection settings.
 *
 * <p>Accepts {@code postgres://} and {@code postgresql://} DSNs as well as ready-made
 * {@code jdbc:postgresql://} URLs, which are passed through untouched.
 */
@Component
public class JdbcConnectionInfoResolver {

    /**
     * Resolve a DSN into JDBC connection info.
     *
     * @param dsn connection string
     * @return jdbc connection info
     * @throws IllegalArgumentException if the DSN is malformed or not PostgreSQL
     */
    public JdbcConnectionInfo resolve(String dsn) {
        if (dsn == null || dsn.isBlank()) {
            throw new IllegalArgumentException("Database connection string is empty");
        }
        String trimmed = dsn.trim();
        if (trimmed.toLowerCase(Locale.ROOT).startsWith("jdbc:")) {
            if (!trimmed.toLowerCase(Locale.ROOT).startsWith("jdbc:postgresql:")) {
                throw new IllegalArgumentException("Unsupported JDBC URL, expected jdbc:postgresql: " + DsnParser.mask(trimmed));
            }
            return JdbcConnectionInfo.builder()
                    .url(trimmed)
                    .properties(Map.of())
                    .build();
        }

        DsnParser.ParsedDsn parsed = DsnParser.parseComponents(trimmed);
        if (!"postgres".equals(parsed.scheme()) && !"postgresql".equals(parsed.scheme())) {
            throw new IllegalArgumentException("Unsupported database type: " + parsed.scheme());
        }

        return JdbcConnectionInfo.builder()
                .url(DsnParser.buildPostgresJdbcUrl(parsed.host(), parsed.port(), parsed.database()))
                .username(parsed.username().isEmpty() ? null : parsed.username())
                .password(parsed.password().isEmpty() ? null : parsed.password())
                .properties(DsnParser.parseQuery(parsed.rawQuery()))
                .build();
    }
}
