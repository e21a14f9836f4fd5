package watchtower.monitor.store;

import watchtower.monitor.exception.StoreException;
import watchtower.monitor.model.DelayedStartDetails;
import watchtower.monitor.model.Detection;
import watchtower.monitor.model.DetectionDetails;
import watchtower.monitor.model.DetectionKind;
import watchtower.monitor.model.ExecutionStatus;
import watchtower.monitor.model.InsufficientInstancesDetails;
import watchtower.monitor.model.MissingExecutionDetails;
import watchtower.monitor.model.MissingHeartbeatDetails;
import watchtower.monitor.model.SchedulableKind;
import watchtower.monitor.model.Severity;
import watchtower.monitor.model.StatusChangeDetails;
import watchtower.monitor.repository.DetectionRepository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static watchtower.monitor.store.JdbcSupport.*;

/**
 * JDBC implementation of DetectionRepository.
 * All kinds share one table; the kind column selects which payload columns are populated.
 */
public class JdbcDetectionRepository implements DetectionRepository {

    private static final String UNRESOLVED = "resolved_at IS NULL AND resolves_id IS NULL";

    private final Database db;

    public JdbcDetectionRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Detection detection) {
        String sql = """
                    INSERT INTO detections (id, kind, schedulable_kind, schedulable_id, execution_id, severity,
                                            detected_at, resolved_at, resolved_by_id, resolves_id,
                                            schedule, expected_at, missing_execution_count, last_heartbeat_at,
                                            interval_start, interval_end, detected_concurrency, required_concurrency,
                                            status, postponed_until, triggered_at, same_status_count, success_count)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try {
            db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, detection.id());
                    ps.setString(2, detection.kind().name());
                    ps.setString(3, detection.schedulableKind().name());
                    ps.setString(4, detection.schedulableId());
                    ps.setString(5, detection.executionId());
                    ps.setString(6, detection.severity().name());
                    setTimestamp(ps, 7, detection.detectedAt());
                    setTimestamp(ps, 8, detection.resolvedAt());
                    ps.setString(9, detection.resolvedById());
                    ps.setString(10, detection.resolvesId());
                    bindDetails(ps, detection.details());
                    return ps.executeUpdate();
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to save detection: " + detection.id(), e);
        }
    }

    @Override
    public Optional<Detection> findById(String id) {
        return findOne("SELECT * FROM detections WHERE id = ?", id);
    }

    @Override
    public List<Detection> findBySchedulable(String schedulableId) {
        return findMany("SELECT * FROM detections WHERE schedulable_id = ? ORDER BY detected_at, id", schedulableId);
    }

    @Override
    public Optional<Detection> findUnresolvedMissingExecution(String schedulableId, Instant expectedAt) {
        String sql = """
                    SELECT * FROM detections
                    WHERE schedulable_id = ? AND kind = 'MISSING_SCHEDULED_EXECUTION' AND expected_at = ? AND
                """ + UNRESOLVED + " ORDER BY detected_at LIMIT 1";

        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, schedulableId);
                    setTimestamp(ps, 2, expectedAt);
                    return first(ps);
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to find missing execution detection for " + schedulableId, e);
        }
    }

    @Override
    public Optional<Detection> findLatestMissingExecution(String schedulableId) {
        String sql = """
                    SELECT * FROM detections
                    WHERE schedulable_id = ? AND kind = 'MISSING_SCHEDULED_EXECUTION' AND resolves_id IS NULL
                    ORDER BY expected_at DESC
                    LIMIT 1
                """;

        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, schedulableId);
                    return first(ps);
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to find latest missing execution detection for " + schedulableId, e);
        }
    }

    @Override
    public List<Detection> findUnresolvedMissingExecutionsBetween(String schedulableId, Instant from, Instant to) {
        String sql = """
                    SELECT * FROM detections
                    WHERE schedulable_id = ? AND kind = 'MISSING_SCHEDULED_EXECUTION'
                      AND expected_at >= ? AND expected_at <= ? AND
                """ + UNRESOLVED + " ORDER BY expected_at";

        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, schedulableId);
                    setTimestamp(ps, 2, from);
                    setTimestamp(ps, 3, to);
                    return executeQuery(ps);
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to find missing execution detections for " + schedulableId, e);
        }
    }

    @Override
    public Optional<Detection> findUnresolved(DetectionKind kind, String schedulableId, String executionId) {
        String executionFilter = executionId != null ? "execution_id = ?" : "execution_id IS NULL";
        String sql = "SELECT * FROM detections WHERE kind = ? AND schedulable_id = ? AND " + executionFilter
                + " AND " + UNRESOLVED + " ORDER BY detected_at LIMIT 1";

        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, kind.name());
                    ps.setString(2, schedulableId);
                    if (executionId != null) {
                        ps.setString(3, executionId);
                    }
                    return first(ps);
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to find unresolved " + kind + " detection for " + schedulableId, e);
        }
    }

    @Override
    public List<Detection> findOutstandingStatusChanges(String schedulableId) {
        String sql = """
                    SELECT * FROM detections
                    WHERE schedulable_id = ? AND kind = 'STATUS_CHANGE'
                      AND postponed_until IS NOT NULL AND triggered_at IS NULL AND
                """ + UNRESOLVED + " ORDER BY detected_at, id";

        return findMany(sql, schedulableId);
    }

    @Override
    public List<Detection> findDuePostponed(Instant now) {
        String sql = """
                    SELECT * FROM detections
                    WHERE kind = 'STATUS_CHANGE' AND postponed_until <= ? AND triggered_at IS NULL AND
                """ + UNRESOLVED + " ORDER BY postponed_until, id";

        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    setTimestamp(ps, 1, now);
                    return executeQuery(ps);
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to find due postponed detections", e);
        }
    }

    @Override
    public boolean markResolved(String id, Instant resolvedAt, String resolvedById) {
        String sql = "UPDATE detections SET resolved_at = ?, resolved_by_id = ? WHERE id = ? AND resolved_at IS NULL";

        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    setTimestamp(ps, 1, resolvedAt);
                    ps.setString(2, resolvedById);
                    ps.setString(3, id);
                    return ps.executeUpdate() > 0;
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to resolve detection: " + id, e);
        }
    }

    @Override
    public void updateStatusChange(String id, StatusChangeDetails details) {
        String sql = """
                    UPDATE detections
                    SET postponed_until = ?, triggered_at = ?, same_status_count = ?, success_count = ?
                    WHERE id = ? AND kind = 'STATUS_CHANGE'
                """;

        try {
            db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    setTimestamp(ps, 1, details.postponedUntil());
                    setTimestamp(ps, 2, details.triggeredAt());
                    ps.setInt(3, details.sameStatusCount());
                    ps.setInt(4, details.successCount());
                    ps.setString(5, id);
                    return ps.executeUpdate();
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to update status change detection: " + id, e);
        }
    }

    // ==================== Helpers ====================

    /** Binds parameters 11..23, leaving the columns of other kinds null. */
    private static void bindDetails(PreparedStatement ps, DetectionDetails details) throws SQLException {
        String schedule = null;
        Instant expectedAt = null;
        Integer missingCount = null;
        Instant lastHeartbeatAt = null;
        Instant intervalStart = null;
        Instant intervalEnd = null;
        Integer detectedConcurrency = null;
        Integer requiredConcurrency = null;
        ExecutionStatus status = null;
        Instant postponedUntil = null;
        Instant triggeredAt = null;
        Integer sameStatusCount = null;
        Integer successCount = null;

        switch (details.kind()) {
            case MISSING_SCHEDULED_EXECUTION -> {
                MissingExecutionDetails d = (MissingExecutionDetails) details;
                schedule = d.schedule();
                expectedAt = d.expectedExecutionAt();
                missingCount = d.missingExecutionCount();
            }
            case DELAYED_START -> expectedAt = ((DelayedStartDetails) details).expectedStartBy();
            case MISSING_HEARTBEAT -> {
                MissingHeartbeatDetails d = (MissingHeartbeatDetails) details;
                lastHeartbeatAt = d.lastHeartbeatAt();
                expectedAt = d.expectedHeartbeatAt();
            }
            case INSUFFICIENT_INSTANCES -> {
                InsufficientInstancesDetails d = (InsufficientInstancesDetails) details;
                intervalStart = d.intervalStart();
                intervalEnd = d.intervalEnd();
                detectedConcurrency = d.detectedConcurrency();
                requiredConcurrency = d.requiredConcurrency();
            }
            case STATUS_CHANGE -> {
                StatusChangeDetails d = (StatusChangeDetails) details;
                status = d.status();
                postponedUntil = d.postponedUntil();
                triggeredAt = d.triggeredAt();
                sameStatusCount = d.sameStatusCount();
                successCount = d.successCount();
            }
        }

        ps.setString(11, schedule);
        setTimestamp(ps, 12, expectedAt);
        setIntOrNull(ps, 13, missingCount);
        setTimestamp(ps, 14, lastHeartbeatAt);
        setTimestamp(ps, 15, intervalStart);
        setTimestamp(ps, 16, intervalEnd);
        setIntOrNull(ps, 17, detectedConcurrency);
        setIntOrNull(ps, 18, requiredConcurrency);
        setEnum(ps, 19, status);
        setTimestamp(ps, 20, postponedUntil);
        setTimestamp(ps, 21, triggeredAt);
        setIntOrNull(ps, 22, sameStatusCount);
        setIntOrNull(ps, 23, successCount);
    }

    private static DetectionDetails mapDetails(ResultSet rs, DetectionKind kind) throws SQLException {
        return switch (kind) {
            case MISSING_SCHEDULED_EXECUTION -> new MissingExecutionDetails(
                    rs.getString("schedule"),
                    getInstant(rs, "expected_at"),
                    rs.getInt("missing_execution_count"));
            case DELAYED_START -> new DelayedStartDetails(getInstant(rs, "expected_at"));
            case MISSING_HEARTBEAT -> new MissingHeartbeatDetails(
                    getInstant(rs, "last_heartbeat_at"),
                    getInstant(rs, "expected_at"));
            case INSUFFICIENT_INSTANCES -> new InsufficientInstancesDetails(
                    getInstant(rs, "interval_start"),
                    getInstant(rs, "interval_end"),
                    rs.getInt("detected_concurrency"),
                    rs.getInt("required_concurrency"));
            case STATUS_CHANGE -> new StatusChangeDetails(
                    ExecutionStatus.valueOf(rs.getString("status")),
                    getInstant(rs, "postponed_until"),
                    getInstant(rs, "triggered_at"),
                    rs.getInt("same_status_count"),
                    rs.getInt("success_count"));
        };
    }

    private Optional<Detection> findOne(String sql, String id) {
        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, id);
                    return first(ps);
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to find detection: " + id, e);
        }
    }

    private List<Detection> findMany(String sql, String schedulableId) {
        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, schedulableId);
                    return executeQuery(ps);
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to find detections for " + schedulableId, e);
        }
    }

    private Optional<Detection> first(PreparedStatement ps) throws SQLException {
        List<Detection> found = executeQuery(ps);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    private List<Detection> executeQuery(PreparedStatement ps) throws SQLException {
        List<Detection> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Detection mapRow(ResultSet rs) throws SQLException {
        DetectionKind kind = DetectionKind.valueOf(rs.getString("kind"));
        return Detection.builder()
                .id(rs.getString("id"))
                .schedulableKind(SchedulableKind.valueOf(rs.getString("schedulable_kind")))
                .schedulableId(rs.getString("schedulable_id"))
                .executionId(rs.getString("execution_id"))
                .severity(Severity.valueOf(rs.getString("severity")))
                .detectedAt(getInstant(rs, "detected_at"))
                .resolvedAt(getInstant(rs, "resolved_at"))
                .resolvedById(rs.getString("resolved_by_id"))
                .resolvesId(rs.getString("resolves_id"))
                .details(mapDetails(rs, kind))
                .build();
    }
}
