package com.naturalsql.util;

import lombok.extern.slf4j.Slf4j;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Converts JDBC driver values into JSON-safe primitives so that driver-specific objects never reach the
 * serializer or the query cache.
 */
@Slf4j
public final class JdbcJsonSafe {
    private static final int MAX_LOB_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;
    private static final int MAX_STRING_CHARS = 100_000;
    private static final int MAX_NESTED_DEPTH = 3;
    static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";

    private JdbcJsonSafe() {
    }

    /**
     * Reads a JDBC column value and returns a JSON-safe equivalent.
     *
     * @param rs result set
     * @param columnIndex 1-based column index
     * @return json-safe value
     * @throws SQLException when the value cannot be read from the result set
     */
    public static Object readJsonSafeValue(ResultSet rs, int columnIndex) throws SQLException {
        Object v = rs.getObject(columnIndex);
        try {
            return toJsonSafe(v, 0);
        } catch (SQLException | RuntimeException e) {
            log.debug("Unsupported column value (column_index={}, value_class={}): {}",
                    columnIndex, v != null ? v.getClass().getName() : null, e.getMessage());
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
        // PostgreSQL json/jsonb/enum come back as PGobject
        if ("org.postgresql.util.PGobject".equals(v.getClass().getName())) {
            return truncate(readPgObject(v));
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
        if (v instanceof java.util.Date || v instanceof TemporalAccessor || v instanceof java.util.UUID) {
            return v.toString();
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof java.sql.Array arr) {
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] objectArray) {
                List<Object> out = new ArrayList<>(objectArray.length);
                for (Object elem : objectArray) {
                    out.add(toJsonSafe(elem, depth + 1));
                }
                return out;
            }
            return truncate(String.valueOf(arrayValue));
        }
        return truncate(String.valueOf(v));
    }

    private static String readPgObject(Object v) {
        try {
            Object value = v.getClass().getMethod("getValue").invoke(v);
            return value != null ? value.toString() : "";
        } catch (ReflectiveOperationException e) {
            return String.valueOf(v);
        }
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_STRING_CHARS) {
            return s;
        }
        return s.substring(0, MAX_STRING_CHARS);
    }

    private static String readClob(Clob clob) throws SQLException {
        int toRead = (int) Math.min(clob.length(), MAX_LOB_CHARS);
        return toRead <= 0 ? "" : clob.getSubString(1, toRead);
    }

    private static String readBlobBase64(Blob blob) throws SQLException {
        long length = blob.length();
        int toRead = (int) Math.min(length, MAX_BLOB_BYTES);
        if (toRead <= 0) {
            return "";
        }
        return Base64.getEncoder().encodeToString(blob.getBytes(1, toRead));
    }
}
