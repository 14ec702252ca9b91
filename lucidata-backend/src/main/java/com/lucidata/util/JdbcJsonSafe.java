package com.lucidata.util;

import java.io.Reader;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

/**
 * Converts JDBC column values into values Jackson can serialize and the presenter can render.
 */
public final class JdbcJsonSafe {
    static final int MAX_STRING_CHARS = 100_000;
    private static final int MAX_LOB_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;
    private static final int MAX_NESTED_DEPTH = 3;
    static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";

    private static final String PG_OBJECT_CLASS = "org.postgresql.util.PGobject";

    private JdbcJsonSafe() {
    }

    /**
     * Read one column of the current row as a JSON-safe value.
     *
     * @param rs result set positioned on a row
     * @param columnIndex 1-based column index
     * @return json-safe value, or a placeholder when the driver value cannot be read
     */
    public static Object readJsonSafeValue(ResultSet rs, int columnIndex) {
        try {
            return toJsonSafe(rs.getObject(columnIndex), 0);
        } catch (SQLException | RuntimeException e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    static Object toJsonSafe(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }
        if (depth > MAX_NESTED_DEPTH) {
            return UNSUPPORTED_PLACEHOLDER;
        }
        if (v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return truncate(s);
        }
        if (v instanceof Character c) {
            return String.valueOf(c);
        }
        if (PG_OBJECT_CLASS.equals(v.getClass().getName())) {
            // json, jsonb, interval, enums and other server types arrive as PGobject
            return truncate(readPgObjectValue(v));
        }
        if (v instanceof java.sql.Date || v instanceof java.sql.Time || v instanceof java.sql.Timestamp) {
            return v.toString();
        }
        if (v instanceof TemporalAccessor || v instanceof UUID) {
            return v.toString();
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof Blob blob) {
            return readBlobBase64(blob);
        }
        if (v instanceof SQLXML xml) {
            return truncate(xml.getString());
        }
        if (v instanceof java.sql.Array arr) {
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] elements) {
                List<Object> out = new ArrayList<>(elements.length);
                for (Object element : elements) {
                    out.add(toJsonSafe(element, depth + 1));
                }
                return out;
            }
            return truncate(String.valueOf(arrayValue));
        }
        return truncate(String.valueOf(v));
    }

    private static String readPgObjectValue(Object pgObject) {
        try {
            Object value = pgObject.getClass().getMethod("getValue").invoke(pgObject);
            return value != null ? value.toString() : "";
        } catch (ReflectiveOperationException e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    static String truncate(String s) {
        if (s == null || s.length() <= MAX_STRING_CHARS) {
            return s;
        }
        return s.substring(0, MAX_STRING_CHARS);
    }

    private static String readClob(Clob clob) throws SQLException {
        int toRead = (int) Math.min(clob.length(), MAX_LOB_CHARS);
        if (toRead <= 0) {
            return "";
        }
        try (Reader reader = clob.getCharacterStream()) {
            char[] buf = new char[Math.min(toRead, 8192)];
            StringBuilder sb = new StringBuilder(toRead);
            int n;
            while (sb.length() < toRead && (n = reader.read(buf, 0, Math.min(buf.length, toRead - sb.length()))) > 0) {
                sb.append(buf, 0, n);
            }
            return sb.toString();
        } catch (java.io.IOException e) {
            throw new SQLException("Failed to read CLOB value", e);
        }
    }

    private static String readBlobBase64(Blob blob) throws SQLException {
        int toRead = (int) Math.min(blob.length(), MAX_BLOB_BYTES);
        if (toRead <= 0) {
            return "";
        }
        return Base64.getEncoder().encodeToString(blob.getBytes(1, toRead));
    }
}
