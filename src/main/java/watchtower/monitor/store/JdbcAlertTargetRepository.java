package watchtower.monitor.store;

import watchtower.monitor.exception.StoreException;
import watchtower.monitor.model.AlertTarget;
import watchtower.monitor.model.RateLimitTier;
import watchtower.monitor.model.Severity;
import watchtower.monitor.repository.AlertTargetRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static watchtower.monitor.store.JdbcSupport.*;

/**
 * JDBC implementation of AlertTargetRepository.
 * Tier counters are only written under the target's row lock.
 */
public class JdbcAlertTargetRepository implements AlertTargetRepository {

    private final Database db;

    public JdbcAlertTargetRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(AlertTarget target) {
        String targetSql = "INSERT INTO alert_targets (id, name, enabled, transport) VALUES (?, ?, ?, ?)";
        String tierSql = """
                    INSERT INTO rate_limit_tiers (target_id, tier_index, max_requests_per_period, request_period_seconds,
                                                  max_severity, request_period_started_at, request_count_in_period)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try {
            db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(targetSql)) {
                    ps.setString(1, target.id());
                    ps.setString(2, target.name());
                    ps.setBoolean(3, target.enabled());
                    ps.setString(4, target.transport());
                    ps.executeUpdate();
                }

                if (!target.tiers().isEmpty()) {
                    try (PreparedStatement ps = conn.prepareStatement(tierSql)) {
                        for (RateLimitTier tier : target.tiers()) {
                            ps.setString(1, target.id());
                            ps.setInt(2, tier.index());
                            setIntOrNull(ps, 3, tier.maxRequestsPerPeriod());
                            setIntOrNull(ps, 4, tier.requestPeriodSeconds());
                            setEnum(ps, 5, tier.maxSeverity());
                            setTimestamp(ps, 6, tier.requestPeriodStartedAt());
                            ps.setInt(7, tier.requestCountInPeriod());
                            ps.addBatch();
                        }
                        ps.executeBatch();
                    }
                }
                return null;
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to save alert target: " + target.id(), e);
        }
    }

    @Override
    public Optional<AlertTarget> findById(String id) {
        return findOne("SELECT * FROM alert_targets WHERE id = ?", id);
    }

    @Override
    public Optional<AlertTarget> lockForUpdate(String id) {
        return findOne("SELECT * FROM alert_targets WHERE id = ? FOR UPDATE", id);
    }

    @Override
    public void updateTiers(String targetId, List<RateLimitTier> tiers) {
        String sql = """
                    UPDATE rate_limit_tiers
                    SET request_period_started_at = ?, request_count_in_period = ?
                    WHERE target_id = ? AND tier_index = ?
                """;

        try {
            db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    for (RateLimitTier tier : tiers) {
                        setTimestamp(ps, 1, tier.requestPeriodStartedAt());
                        ps.setInt(2, tier.requestCountInPeriod());
                        ps.setString(3, targetId);
                        ps.setInt(4, tier.index());
                        ps.addBatch();
                    }
                    return ps.executeBatch();
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to update rate limit tiers of target: " + targetId, e);
        }
    }

    private Optional<AlertTarget> findOne(String sql, String id) {
        try {
            return db.withConnection(conn -> {
                String name;
                boolean enabled;
                String transport;
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, id);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            return Optional.<AlertTarget>empty();
                        }
                        name = rs.getString("name");
                        enabled = rs.getBoolean("enabled");
                        transport = rs.getString("transport");
                    }
                }
                return Optional.of(new AlertTarget(id, name, enabled, transport, readTiers(conn, id)));
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to find alert target: " + id, e);
        }
    }

    private static List<RateLimitTier> readTiers(Connection conn, String targetId) throws SQLException {
        String sql = "SELECT * FROM rate_limit_tiers WHERE target_id = ? ORDER BY tier_index";
        List<RateLimitTier> tiers = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, targetId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tiers.add(new RateLimitTier(
                            rs.getInt("tier_index"),
                            getIntOrNull(rs, "max_requests_per_period"),
                            getIntOrNull(rs, "request_period_seconds"),
                            getEnum(rs, "max_severity", Severity.class),
                            getInstant(rs, "request_period_started_at"),
                            rs.getInt("request_count_in_period")));
                }
            }
        }
        return tiers;
    }
}
