package watchtower.monitor.store;

import watchtower.monitor.exception.StoreException;
import watchtower.monitor.model.AlertRecord;
import watchtower.monitor.model.AlertSendStatus;
import watchtower.monitor.model.Severity;
import watchtower.monitor.repository.AlertRecordRepository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static watchtower.monitor.store.JdbcSupport.*;

/**
 * JDBC implementation of AlertRecordRepository.
 */
public class JdbcAlertRecordRepository implements AlertRecordRepository {

    private final Database db;

    public JdbcAlertRecordRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(AlertRecord record) {
        String sql = """
                    INSERT INTO alert_records (id, detection_id, target_id, severity, grouping_key, created_at,
                                               send_status, send_result, error_message, rate_limit_tier_index,
                                               completed_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try {
            db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, record.id());
                    ps.setString(2, record.detectionId());
                    ps.setString(3, record.targetId());
                    setEnum(ps, 4, record.severity());
                    ps.setString(5, record.groupingKey());
                    setTimestamp(ps, 6, record.createdAt());
                    ps.setString(7, record.sendStatus().name());
                    ps.setString(8, record.sendResult());
                    ps.setString(9, record.errorMessage());
                    setIntOrNull(ps, 10, record.rateLimitTierIndex());
                    setTimestamp(ps, 11, record.completedAt());
                    return ps.executeUpdate();
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to save alert record: " + record.id(), e);
        }
    }

    @Override
    public void updateOutcome(AlertRecord record) {
        String sql = """
                    UPDATE alert_records
                    SET send_status = ?, send_result = ?, error_message = ?, rate_limit_tier_index = ?, completed_at = ?
                    WHERE id = ?
                """;

        try {
            db.withConnection(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, record.sendStatus().name());
                    ps.setString(2, record.sendResult());
                    ps.setString(3, record.errorMessage());
                    setIntOrNull(ps, 4, record.rateLimitTierIndex());
                    setTimestamp(ps, 5, record.completedAt());
                    ps.setString(6, record.id());
                    return ps.executeUpdate();
                }
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to update alert record: " + record.id(), e);
        }
    }

    @Override
    public List<AlertRecord> findByDetectionId(String detectionId) {
        String sql = "SELECT * FROM alert_records WHERE detection_id = ? ORDER BY created_at, id";

        try {
            return db.withConnection(conn -> {
                List<AlertRecord> results = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, detectionId);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            results.add(mapRow(rs));
                        }
                    }
                }
                return results;
            });
        } catch (SQLException e) {
            throw new StoreException("Failed to find alert records of detection: " + detectionId, e);
        }
    }

    private AlertRecord mapRow(ResultSet rs) throws SQLException {
        return AlertRecord.builder()
                .id(rs.getString("id"))
                .detectionId(rs.getString("detection_id"))
                .targetId(rs.getString("target_id"))
                .severity(getEnum(rs, "severity", Severity.class))
                .groupingKey(rs.getString("grouping_key"))
                .createdAt(getInstant(rs, "created_at"))
                .sendStatus(AlertSendStatus.valueOf(rs.getString("send_status")))
                .sendResult(rs.getString("send_result"))
                .errorMessage(rs.getString("error_message"))
                .rateLimitTierIndex(getIntOrNull(rs, "rate_limit_tier_index"))
                .completedAt(getInstant(rs, "completed_at"))
                .build();
    }
}
