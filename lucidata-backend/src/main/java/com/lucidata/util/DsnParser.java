package com.lucidata.util;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parses libpq-style connection strings such as {@code postgresql://user:secret@db:5432/lucidata}.
 */
public final class DsnParser {

    static final int DEFAULT_POSTGRES_PORT = 5432;

    private DsnParser() {
    }

    /**
     * Parsed DSN components.
     *
     * @param scheme scheme as written, e.g. {@code postgres}
     * @param username decoded user name, empty when absent
     * @param password decoded password, empty when absent
     * @param host host name or bracketed IPv6 literal
     * @param port port, or -1 when absent
     * @param database database name, empty when absent
     * @param rawQuery query string without the leading '?', or null
     */
    public record ParsedDsn(
            String scheme,
            String username,
            String password,
            String host,
            int port,
            String database,
            String rawQuery
    ) {
    }

    /**
     * Split a DSN into its components.
     *
     * @param dsn connection string
     * @return parsed DSN
     * @throws IllegalArgumentException if the DSN has no scheme or host
     */
    public static ParsedDsn parseComponents(String dsn) {
        if (dsn == null || dsn.isBlank()) {
            throw new IllegalArgumentException("DSN is empty");
        }
        String base = dsn.trim();
        String query = null;
        int queryIdx = base.indexOf('?');
        if (queryIdx != -1) {
            query = base.substring(queryIdx + 1);
            base = base.substring(0, queryIdx);
        }

        int schemeIdx = base.indexOf("://");
        if (schemeIdx <= 0) {
            throw new IllegalArgumentException("Invalid DSN format: missing scheme");
        }
        String scheme = base.substring(0, schemeIdx);
        String authorityAndPath = base.substring(schemeIdx + 3);

        String authority = authorityAndPath;
        String database = "";
        int pathIdx = authorityAndPath.indexOf('/');
        if (pathIdx != -1) {
            authority = authorityAndPath.substring(0, pathIdx);
            database = URLDecoder.decode(authorityAndPath.substring(pathIdx + 1), StandardCharsets.UTF_8);
        }

        // lastIndexOf: passwords may contain '@'
        String userInfo = null;
        String hostPort = authority;
        int atIdx = authority.lastIndexOf('@');
        if (atIdx != -1) {
            userInfo = authority.substring(0, atIdx);
            hostPort = authority.substring(atIdx + 1);
        }

        String host = hostPort;
        int port = -1;
        int colonIdx = hostPort.lastIndexOf(':');
        if (colonIdx != -1 && colonIdx > hostPort.lastIndexOf(']')) {
            try {
                port = Integer.parseInt(hostPort.substring(colonIdx + 1));
                host = hostPort.substring(0, colonIdx);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid DSN format: bad port", e);
            }
        }
        if (host.isBlank()) {
            throw new IllegalArgumentException("Invalid DSN format: missing host");
        }

        String username = "";
        String password = "";
        if (userInfo != null) {
            String[] parts = userInfo.split(":", 2);
            username = URLDecoder.decode(parts[0], StandardCharsets.UTF_8);
            if (parts.length > 1) {
                password = URLDecoder.decode(parts[1], StandardCharsets.UTF_8);
            }
        }

        return new ParsedDsn(scheme.toLowerCase(Locale.ROOT), username, password, host, port, database, query);
    }

    /**
     * Build a PostgreSQL JDBC URL.
     *
     * @param host host
     * @param port port, -1 for the default
     * @param database database name
     * @return jdbc url
     */
    public static String buildPostgresJdbcUrl(String host, int port, String database) {
        if (port == -1) {
            port = DEFAULT_POSTGRES_PORT;
        }
        return String.format("jdbc:postgresql://%s:%d/%s", host, port, database);
    }

    public static Map<String, String> parseQuery(String query) {
        Map<String, String> params = new LinkedHashMap<>();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            int idx = pair.indexOf('=');
            if (idx > 0) {
                String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
                String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
                params.put(key, value);
            }
        }
        return params;
    }

    /**
     * Replace the password in a DSN with asterisks for logging.
     *
     * @param dsn dsn
     * @return masked dsn
     */
    public static String mask(String dsn) {
        if (dsn == null) {
            return null;
        }
        return dsn.replaceAll(":[^@:/]+@", ":****@")
                .replaceAll("(?i)(password=)[^&]*", "$1****");
    }
}
