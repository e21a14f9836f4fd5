package watchtower.monitor.store;

import watchtower.monitor.exception.StoreException;
import watchtower.monitor.model.Execution;
import watchtower.monitor.model.ExecutionStatus;
import watchtower.monitor.model.SchedulableKind;
import watchtower.monitor.model.StopReason;
import watchtower.monitor.repository.ExecutionRepository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static watchtower.monitor.store.JdbcSupport.*;

/**
 * JDBC implementation of ExecutionRepository.
 */
public class JdbcExecutionRepository implements ExecutionRepository {

    private static final String IN_PROGRESS = "('MANUALLY_STARTED', 'RUNNING', 'STOPPING')";

    private final Database db;

    public JdbcExecutionRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Execution execution) {
        String sql = """
                    INSERT INTO executions (id, kind, schedulable_id, status, created_at, started_at, finished_at,
                                            marked_done_at, last_heartbeat_at, heartbeat_interval_seconds,
                                            stop_reason, skip_event_generation)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try {
            db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, execution.id());
                    ps.setString(2, execution.kind().name());
                    ps.setString(3, execution.schedulableId());
                    ps.setString(4, execution.status().name());
                    setTimestamp(ps, 5, execution.createdAt());
                    setTimestamp(ps, 6, execution.startedAt());
                    setTimestamp(ps, 7, execution.finishedAt());
                    setTimestamp(ps, 8, execution.markedDoneAt());
                    setTimestamp(ps, 9, execution.lastHeartbeatAt());
                    setIntOrNull(ps, 10, execution.heartbeatIntervalSeconds());
                    setEnum(ps, 11, execution.stopReason());
                    ps.setBoolean(12, execution.skipEventGeneration());
                    return ps.executeUpdate();
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to save execution: " + execution.id(), e);
        }
    }

    @Override
    public void update(Execution execution) {
        String sql = """
                    UPDATE executions
                    SET status = ?, started_at = ?, finished_at = ?, marked_done_at = ?, last_heartbeat_at = ?,
                        stop_reason = ?, skip_event_generation = ?
                    WHERE id = ?
                """;

        try {
            db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, execution.status().name());
                    setTimestamp(ps, 2, execution.startedAt());
                    setTimestamp(ps, 3, execution.finishedAt());
                    setTimestamp(ps, 4, execution.markedDoneAt());
                    setTimestamp(ps, 5, execution.lastHeartbeatAt());
                    setEnum(ps, 6, execution.stopReason());
                    ps.setBoolean(7, execution.skipEventGeneration());
                    ps.setString(8, execution.id());
                    return ps.executeUpdate();
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to update execution: " + execution.id(), e);
        }
    }

    @Override
    public Optional<Execution> findById(String id) {
        return findOne("SELECT * FROM executions WHERE id = ?", id);
    }

    @Override
    public Optional<Execution> lockForUpdate(String id) {
        return findOne("SELECT * FROM executions WHERE id = ? FOR UPDATE", id);
    }

    @Override
    public List<Execution> findInProgress() {
        String sql = "SELECT * FROM executions WHERE status IN " + IN_PROGRESS + " ORDER BY created_at, id";

        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    return executeQuery(ps);
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to find in-progress executions", e);
        }
    }

    @Override
    public int countStartedBetween(String schedulableId, Instant from, Instant to) {
        String sql = """
                    SELECT COUNT(*) FROM executions
                    WHERE schedulable_id = ? AND started_at >= ? AND started_at <= ?
                """;

        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, schedulableId);
                    setTimestamp(ps, 2, from);
                    setTimestamp(ps, 3, to);
                    return count(ps);
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to count executions of " + schedulableId, e);
        }
    }

    @Override
    public int countConcurrentAt(String schedulableId, Instant at, boolean includeUnstarted) {
        String started = includeUnstarted
                ? "(started_at <= ? OR (started_at IS NULL AND created_at <= ?))"
                : "started_at <= ?";
        String sql = """
                    SELECT COUNT(*) FROM executions
                    WHERE schedulable_id = ?
                      AND %s
                      AND (finished_at IS NULL OR finished_at >= ?)
                      AND (marked_done_at IS NULL OR marked_done_at >= ?)
                """.formatted(started);

        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    int i = 1;
                    ps.setString(i++, schedulableId);
                    setTimestamp(ps, i++, at);
                    if (includeUnstarted) {
                        setTimestamp(ps, i++, at);
                    }
                    setTimestamp(ps, i++, at);
                    setTimestamp(ps, i, at);
                    return count(ps);
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to count concurrent executions of " + schedulableId, e);
        }
    }

    @Override
    public List<Execution> findOverlapping(String schedulableId, Instant from, Instant to) {
        String sql = """
                    SELECT * FROM executions
                    WHERE schedulable_id = ? AND started_at IS NOT NULL AND started_at <= ?
                      AND (finished_at IS NULL OR finished_at > ?)
                      AND (marked_done_at IS NULL OR marked_done_at > ?)
                      AND (finished_at IS NOT NULL OR marked_done_at IS NOT NULL OR status IN %s)
                    ORDER BY started_at, id
                """.formatted(IN_PROGRESS);

        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, schedulableId);
                    setTimestamp(ps, 2, to);
                    setTimestamp(ps, 3, from);
                    setTimestamp(ps, 4, from);
                    return executeQuery(ps);
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to find overlapping executions of " + schedulableId, e);
        }
    }

    @Override
    public boolean claimEventHandling(String id, ExecutionStatus status) {
        String sql = """
                    UPDATE executions SET event_handled_status = ?
                    WHERE id = ? AND (event_handled_status IS NULL OR event_handled_status <> ?)
                """;

        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, status.name());
                    ps.setString(2, id);
                    ps.setString(3, status.name());
                    return ps.executeUpdate() > 0;
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to claim event handling for execution: " + id, e);
        }
    }

    @Override
    public boolean recordHeartbeat(String id, Instant at) {
        String sql = "UPDATE executions SET last_heartbeat_at = ? WHERE id = ?";

        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    setTimestamp(ps, 1, at);
                    ps.setString(2, id);
                    return ps.executeUpdate() > 0;
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to record heartbeat for execution: " + id, e);
        }
    }

    // ==================== Helpers ====================

    private Optional<Execution> findOne(String sql, String id) {
        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, id);
                    List<Execution> found = executeQuery(ps);
                    return found.isEmpty() ? Optional.<Execution>empty() : Optional.of(found.get(0));
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to find execution: " + id, e);
        }
    }

    private static int count(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private List<Execution> executeQuery(PreparedStatement ps) throws SQLException {
        List<Execution> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Execution mapRow(ResultSet rs) throws SQLException {
        return Execution.builder()
                .id(rs.getString("id"))
                .kind(SchedulableKind.valueOf(rs.getString("kind")))
                .schedulableId(rs.getString("schedulable_id"))
                .status(ExecutionStatus.valueOf(rs.getString("status")))
                .createdAt(getInstant(rs, "created_at"))
                .startedAt(getInstant(rs, "started_at"))
                .finishedAt(getInstant(rs, "finished_at"))
                .markedDoneAt(getInstant(rs, "marked_done_at"))
                .lastHeartbeatAt(getInstant(rs, "last_heartbeat_at"))
                .heartbeatIntervalSeconds(getIntOrNull(rs, "heartbeat_interval_seconds"))
                .stopReason(getEnum(rs, "stop_reason", StopReason.class))
                .skipEventGeneration(rs.getBoolean("skip_event_generation"))
                .build();
    }
}
