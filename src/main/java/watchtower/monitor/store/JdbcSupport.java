package watchtower.monitor.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import watchtower.monitor.model.AlertCondition;
import watchtower.monitor.model.Severity;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;

/**
 * Column helpers shared by the JDBC repositories.
 */
final class JdbcSupport {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<AlertCondition, Severity>> SEVERITY_MAP = new TypeReference<>() {
    };

    private JdbcSupport() {
    }

    static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setObject(index, instant.atOffset(ZoneOffset.UTC));
        } else {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        }
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    static void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    static Integer getIntOrNull(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    static void setEnum(PreparedStatement ps, int index, Enum<?> value) throws SQLException {
        if (value != null) {
            ps.setString(index, value.name());
        } else {
            ps.setNull(index, Types.VARCHAR);
        }
    }

    static <E extends Enum<E>> E getEnum(ResultSet rs, String column, Class<E> type) throws SQLException {
        String value = rs.getString(column);
        return value != null ? Enum.valueOf(type, value) : null;
    }

    static String writeSeverities(Map<AlertCondition, Severity> severities) {
        try {
            return MAPPER.writeValueAsString(severities);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize severities", e);
        }
    }

    static Map<AlertCondition, Severity> readSeverities(String json) {
        Map<AlertCondition, Severity> result = new EnumMap<>(AlertCondition.class);
        if (json == null || json.isBlank()) {
            return result;
        }
        try {
            result.putAll(MAPPER.readValue(json, SEVERITY_MAP));
            return result;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse severities: " + json, e);
        }
    }
}
