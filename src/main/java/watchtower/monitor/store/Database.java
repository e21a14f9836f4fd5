package watchtower.monitor.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import watchtower.monitor.config.MonitorConfig;
import watchtower.monitor.exception.StoreException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.function.Supplier;

/**
 * Connection pool, schema management and thread-bound transactions.
 * Uses HikariCP for connection pooling.
 *
 * <p>Repository calls made inside {@link #inTransaction(Supplier)} share one connection and commit
 * together. Calls made outside run in their own short transaction.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;
    private final ThreadLocal<Connection> transaction = new ThreadLocal<>();

    /**
     * Unit of JDBC work run against a connection.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    public Database(MonitorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("watchtower-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a fresh connection from the pool, ignoring any bound transaction.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Run JDBC work on the current thread's transaction, or in a new transaction committed
     * before returning when none is bound.
     */
    public <T> T withConnection(SqlWork<T> work) throws SQLException {
        Connection bound = transaction.get();
        if (bound != null) {
            return work.run(bound);
        }

        try (Connection conn = getConnection()) {
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            }
        }
    }

    /**
     * Run {@code work} in one transaction. Joins the current transaction if one is already bound
     * to this thread. Any exception rolls the transaction back and propagates.
     */
    public <T> T inTransaction(Supplier<T> work) {
        if (transaction.get() != null) {
            return work.get();
        }

        Connection conn;
        try {
            conn = getConnection();
        } catch (SQLException e) {
            throw new StoreException("Failed to open transaction", e);
        }

        transaction.set(conn);
        try {
            T result = work.get();
            conn.commit();
            return result;
        } catch (SQLException e) {
            rollback(conn, e);
            throw new StoreException("Failed to commit transaction", e);
        } catch (RuntimeException e) {
            rollback(conn, e);
            throw e;
        } finally {
            transaction.remove();
            close(conn);
        }
    }

    public void runInTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }

    public boolean isInTransaction() {
        return transaction.get() != null;
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private static void close(Connection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Failed to return connection to pool: {}", e.getMessage());
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- SCHEDULABLES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS schedulables (
                            id                              VARCHAR(64) PRIMARY KEY,
                            kind                            VARCHAR(16) NOT NULL,
                            name                            VARCHAR(256),
                            schedule                        VARCHAR(256),
                            schedule_updated_at             TIMESTAMP WITH TIME ZONE,
                            enabled                         BOOLEAN DEFAULT TRUE NOT NULL,
                            created_at                      TIMESTAMP WITH TIME ZONE,
                            scheduled_instance_count        INT,
                            max_concurrency                 INT,
                            max_age_seconds                 INT,
                            min_service_instance_count      INT,
                            service_updated_at              TIMESTAMP WITH TIME ZONE,
                            service_startup_grace_seconds   INT,
                            manual_start_alert_seconds      INT,
                            manual_start_abandon_seconds    INT,
                            heartbeat_alert_seconds         INT,
                            heartbeat_abandon_seconds       INT,
                            failure_postpone_seconds        INT,
                            failure_max_postponed_count     INT,
                            failure_required_success_count  INT,
                            timeout_postpone_seconds        INT,
                            timeout_max_postponed_count     INT,
                            timeout_required_success_count  INT,
                            event_severities                CLOB
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS schedulable_alert_targets (
                            schedulable_id  VARCHAR(64) NOT NULL,
                            position        INT NOT NULL,
                            target_id       VARCHAR(64) NOT NULL,
                            severities      CLOB,
                            PRIMARY KEY (schedulable_id, position)
                        );
                    """);

            // ---------- ALERT TARGETS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS alert_targets (
                            id          VARCHAR(64) PRIMARY KEY,
                            name        VARCHAR(256),
                            enabled     BOOLEAN DEFAULT TRUE NOT NULL,
                            transport   VARCHAR(64) NOT NULL
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS rate_limit_tiers (
                            target_id                   VARCHAR(64) NOT NULL,
                            tier_index                  INT NOT NULL,
                            max_requests_per_period     INT,
                            request_period_seconds      INT,
                            max_severity                VARCHAR(16),
                            request_period_started_at   TIMESTAMP WITH TIME ZONE,
                            request_count_in_period     INT DEFAULT 0 NOT NULL,
                            PRIMARY KEY (target_id, tier_index)
                        );
                    """);

            // ---------- EXECUTIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS executions (
                            id                          VARCHAR(64) PRIMARY KEY,
                            kind                        VARCHAR(16) NOT NULL,
                            schedulable_id              VARCHAR(64) NOT NULL,
                            status                      VARCHAR(20) NOT NULL,
                            created_at                  TIMESTAMP WITH TIME ZONE,
                            started_at                  TIMESTAMP WITH TIME ZONE,
                            finished_at                 TIMESTAMP WITH TIME ZONE,
                            marked_done_at              TIMESTAMP WITH TIME ZONE,
                            last_heartbeat_at           TIMESTAMP WITH TIME ZONE,
                            heartbeat_interval_seconds  INT,
                            stop_reason                 VARCHAR(40),
                            skip_event_generation       BOOLEAN DEFAULT FALSE NOT NULL,
                            event_handled_status        VARCHAR(20)
                        );
                    """);

            // ---------- DETECTIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS detections (
                            id                      VARCHAR(64) PRIMARY KEY,
                            kind                    VARCHAR(40) NOT NULL,
                            schedulable_kind        VARCHAR(16) NOT NULL,
                            schedulable_id          VARCHAR(64) NOT NULL,
                            execution_id            VARCHAR(64),
                            severity                VARCHAR(16) NOT NULL,
                            detected_at             TIMESTAMP WITH TIME ZONE NOT NULL,
                            resolved_at             TIMESTAMP WITH TIME ZONE,
                            resolved_by_id          VARCHAR(64),
                            resolves_id             VARCHAR(64),
                            schedule                VARCHAR(256),
                            expected_at             TIMESTAMP WITH TIME ZONE,
                            missing_execution_count INT,
                            last_heartbeat_at       TIMESTAMP WITH TIME ZONE,
                            interval_start          TIMESTAMP WITH TIME ZONE,
                            interval_end            TIMESTAMP WITH TIME ZONE,
                            detected_concurrency    INT,
                            required_concurrency    INT,
                            status                  VARCHAR(20),
                            postponed_until         TIMESTAMP WITH TIME ZONE,
                            triggered_at            TIMESTAMP WITH TIME ZONE,
                            same_status_count       INT,
                            success_count           INT
                        );
                    """);

            // ---------- ALERT RECORDS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS alert_records (
                            id                      VARCHAR(64) PRIMARY KEY,
                            detection_id            VARCHAR(64) NOT NULL,
                            target_id               VARCHAR(64) NOT NULL,
                            severity                VARCHAR(16),
                            grouping_key            VARCHAR(512),
                            created_at              TIMESTAMP WITH TIME ZONE,
                            send_status             VARCHAR(20) NOT NULL,
                            send_result             CLOB,
                            error_message           CLOB,
                            rate_limit_tier_index   INT,
                            completed_at            TIMESTAMP WITH TIME ZONE
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_executions_schedulable_started ON executions(schedulable_id, started_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_executions_status ON executions(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_detections_schedulable_kind ON detections(schedulable_id, kind, resolved_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_detections_postponed ON detections(kind, postponed_until);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_alert_records_detection ON alert_records(detection_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
