package com.jobscheduler.db;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;

import java.lang.reflect.Type;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Column conversions shared by the repositories: nullable timestamps and the
 * JSON text columns ({@code parameters}, {@code result}, {@code parameters_used}).
 */
public final class Columns {
    // Shared Gson instance - thread-safe. Whole numbers stay Long instead of Double.
    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .create();
    private static final Type MAP_TYPE = new TypeToken<LinkedHashMap<String, Object>>() { }.getType();

    private Columns() {
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    static String toJson(Map<String, Object> map) {
        return map == null ? null : GSON.toJson(map, MAP_TYPE);
    }

    /**
     * Serialize a handler result. Null stays SQL NULL.
     */
    public static String resultToJson(Object value) {
        return value == null ? null : GSON.toJson(value);
    }

    static Map<String, Object> fromJson(String json) throws SQLException {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            Map<String, Object> map = GSON.fromJson(json, MAP_TYPE);
            return map != null ? map : Collections.emptyMap();
        } catch (JsonParseException e) {
            throw new SQLException("Corrupt JSON column: " + e.getMessage(), e);
        }
    }
}
