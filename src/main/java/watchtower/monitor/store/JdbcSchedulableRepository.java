package watchtower.monitor.store;

import watchtower.monitor.exception.StoreException;
import watchtower.monitor.model.AlertTargetLink;
import watchtower.monitor.model.PostponementPolicy;
import watchtower.monitor.model.Schedulable;
import watchtower.monitor.model.SchedulableKind;
import watchtower.monitor.repository.SchedulableRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static watchtower.monitor.store.JdbcSupport.*;

/**
 * JDBC implementation of SchedulableRepository.
 * Alert target links live in their own table, ordered by position.
 */
public class JdbcSchedulableRepository implements SchedulableRepository {

    private static final String COLUMNS = """
            id, kind, name, schedule, schedule_updated_at, enabled, created_at, scheduled_instance_count,
            max_concurrency, max_age_seconds, min_service_instance_count, service_updated_at,
            service_startup_grace_seconds, manual_start_alert_seconds, manual_start_abandon_seconds,
            heartbeat_alert_seconds, heartbeat_abandon_seconds,
            failure_postpone_seconds, failure_max_postponed_count, failure_required_success_count,
            timeout_postpone_seconds, timeout_max_postponed_count, timeout_required_success_count,
            event_severities
            """;

    private final Database db;

    public JdbcSchedulableRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Schedulable schedulable) {
        String sql = "INSERT INTO schedulables (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        try {
            db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    bind(ps, schedulable);
                    ps.executeUpdate();
                }
                writeLinks(conn, schedulable);
                return null;
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to save schedulable: " + schedulable.id(), e);
        }
    }

    @Override
    public void update(Schedulable schedulable) {
        String sql = """
                    UPDATE schedulables SET
                        id = ?, kind = ?, name = ?, schedule = ?, schedule_updated_at = ?, enabled = ?, created_at = ?,
                        scheduled_instance_count = ?, max_concurrency = ?, max_age_seconds = ?,
                        min_service_instance_count = ?, service_updated_at = ?, service_startup_grace_seconds = ?,
                        manual_start_alert_seconds = ?, manual_start_abandon_seconds = ?,
                        heartbeat_alert_seconds = ?, heartbeat_abandon_seconds = ?,
                        failure_postpone_seconds = ?, failure_max_postponed_count = ?, failure_required_success_count = ?,
                        timeout_postpone_seconds = ?, timeout_max_postponed_count = ?, timeout_required_success_count = ?,
                        event_severities = ?
                    WHERE id = ?
                """;

        try {
            db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    bind(ps, schedulable);
                    ps.setString(25, schedulable.id());
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(
                        "DELETE FROM schedulable_alert_targets WHERE schedulable_id = ?")) {
                    ps.setString(1, schedulable.id());
                    ps.executeUpdate();
                }
                writeLinks(conn, schedulable);
                return null;
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to update schedulable: " + schedulable.id(), e);
        }
    }

    @Override
    public Optional<Schedulable> findById(String id) {
        return findOne("SELECT * FROM schedulables WHERE id = ?", id);
    }

    @Override
    public Optional<Schedulable> lockForUpdate(String id) {
        return findOne("SELECT * FROM schedulables WHERE id = ? FOR UPDATE", id);
    }

    @Override
    public List<Schedulable> findEnabledScheduled(SchedulableKind kind) {
        String sql = """
                    SELECT * FROM schedulables
                    WHERE enabled = TRUE AND kind = ? AND schedule IS NOT NULL AND TRIM(schedule) <> ''
                    ORDER BY id
                """;

        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, kind.name());
                    return executeQuery(conn, ps);
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to find scheduled " + kind, e);
        }
    }

    @Override
    public List<Schedulable> findEnabledServices() {
        String sql = """
                    SELECT * FROM schedulables
                    WHERE enabled = TRUE AND kind = 'TASK' AND min_service_instance_count IS NOT NULL
                    ORDER BY id
                """;

        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    return executeQuery(conn, ps);
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to find service tasks", e);
        }
    }

    // ==================== Helpers ====================

    private Optional<Schedulable> findOne(String sql, String id) {
        try {
            return db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, id);
                    List<Schedulable> found = executeQuery(conn, ps);
                    return found.isEmpty() ? Optional.<Schedulable>empty() : Optional.of(found.get(0));
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to find schedulable: " + id, e);
        }
    }

    private static void bind(PreparedStatement ps, Schedulable s) throws SQLException {
        ps.setString(1, s.id());
        ps.setString(2, s.kind().name());
        ps.setString(3, s.name());
        ps.setString(4, s.schedule());
        setTimestamp(ps, 5, s.scheduleUpdatedAt());
        ps.setBoolean(6, s.enabled());
        setTimestamp(ps, 7, s.createdAt());
        setIntOrNull(ps, 8, s.scheduledInstanceCount());
        setIntOrNull(ps, 9, s.maxConcurrency());
        setIntOrNull(ps, 10, s.maxAgeSeconds());
        setIntOrNull(ps, 11, s.minServiceInstanceCount());
        setTimestamp(ps, 12, s.serviceUpdatedAt());
        setIntOrNull(ps, 13, s.serviceStartupGraceSeconds());
        setIntOrNull(ps, 14, s.manualStartAlertSeconds());
        setIntOrNull(ps, 15, s.manualStartAbandonSeconds());
        setIntOrNull(ps, 16, s.heartbeatAlertSeconds());
        setIntOrNull(ps, 17, s.heartbeatAbandonSeconds());
        setIntOrNull(ps, 18, s.failurePostponement().windowSeconds());
        setIntOrNull(ps, 19, s.failurePostponement().maxPostponedCount());
        setIntOrNull(ps, 20, s.failurePostponement().requiredSuccessCount());
        setIntOrNull(ps, 21, s.timeoutPostponement().windowSeconds());
        setIntOrNull(ps, 22, s.timeoutPostponement().maxPostponedCount());
        setIntOrNull(ps, 23, s.timeoutPostponement().requiredSuccessCount());
        ps.setString(24, writeSeverities(s.eventSeverities()));
    }

    private static void writeLinks(Connection conn, Schedulable s) throws SQLException {
        if (s.alertTargets().isEmpty())
            return;

        String sql = "INSERT INTO schedulable_alert_targets (schedulable_id, position, target_id, severities) VALUES (?, ?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int position = 0;
            for (AlertTargetLink link : s.alertTargets()) {
                ps.setString(1, s.id());
                ps.setInt(2, position++);
                ps.setString(3, link.targetId());
                ps.setString(4, writeSeverities(link.severities()));
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static List<AlertTargetLink> readLinks(Connection conn, String schedulableId) throws SQLException {
        String sql = "SELECT target_id, severities FROM schedulable_alert_targets WHERE schedulable_id = ? ORDER BY position";
        List<AlertTargetLink> links = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, schedulableId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    links.add(new AlertTargetLink(rs.getString("target_id"), readSeverities(rs.getString("severities"))));
                }
            }
        }
        return links;
    }

    private List<Schedulable> executeQuery(Connection conn, PreparedStatement ps) throws SQLException {
        List<Schedulable.Builder> builders = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString("id"));
                builders.add(mapRow(rs));
            }
        }

        List<Schedulable> results = new ArrayList<>(builders.size());
        for (int i = 0; i < builders.size(); i++) {
            results.add(builders.get(i).alertTargets(readLinks(conn, ids.get(i))).build());
        }
        return results;
    }

    private Schedulable.Builder mapRow(ResultSet rs) throws SQLException {
        return Schedulable.builder()
                .id(rs.getString("id"))
                .kind(SchedulableKind.valueOf(rs.getString("kind")))
                .name(rs.getString("name"))
                .schedule(rs.getString("schedule"))
                .scheduleUpdatedAt(getInstant(rs, "schedule_updated_at"))
                .enabled(rs.getBoolean("enabled"))
                .createdAt(getInstant(rs, "created_at"))
                .scheduledInstanceCount(getIntOrNull(rs, "scheduled_instance_count"))
                .maxConcurrency(getIntOrNull(rs, "max_concurrency"))
                .maxAgeSeconds(getIntOrNull(rs, "max_age_seconds"))
                .minServiceInstanceCount(getIntOrNull(rs, "min_service_instance_count"))
                .serviceUpdatedAt(getInstant(rs, "service_updated_at"))
                .serviceStartupGraceSeconds(getIntOrNull(rs, "service_startup_grace_seconds"))
                .manualStartAlertSeconds(getIntOrNull(rs, "manual_start_alert_seconds"))
                .manualStartAbandonSeconds(getIntOrNull(rs, "manual_start_abandon_seconds"))
                .heartbeatAlertSeconds(getIntOrNull(rs, "heartbeat_alert_seconds"))
                .heartbeatAbandonSeconds(getIntOrNull(rs, "heartbeat_abandon_seconds"))
                .failurePostponement(new PostponementPolicy(
                        getIntOrNull(rs, "failure_postpone_seconds"),
                        getIntOrNull(rs, "failure_max_postponed_count"),
                        getIntOrNull(rs, "failure_required_success_count")))
                .timeoutPostponement(new PostponementPolicy(
                        getIntOrNull(rs, "timeout_postpone_seconds"),
                        getIntOrNull(rs, "timeout_max_postponed_count"),
                        getIntOrNull(rs, "timeout_required_success_count")))
                .eventSeverities(readSeverities(rs.getString("event_severities")));
    }
}
