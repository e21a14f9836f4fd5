package watchtower.monitor.store;

import org.junit.jupiter.api.*;
import watchtower.monitor.MonitorFixture;
import watchtower.monitor.config.MonitorConfig;
import watchtower.monitor.model.Execution;
import watchtower.monitor.model.ExecutionStatus;
import watchtower.monitor.model.SchedulableKind;
import watchtower.monitor.model.StopReason;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcExecutionRepositoryTest {

    private static final Instant NOON = Instant.parse("2024-03-15T12:00:00Z");

    private static Database db;
    private static JdbcExecutionRepository repo;

    @BeforeAll
    static void setup() {
        MonitorConfig config = MonitorConfig.defaults()
                .withDatabaseUrl(MonitorFixture.inMemoryUrl("test-executions"));
        db = new Database(config);
        repo = new JdbcExecutionRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanExecutions() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM executions");
            conn.commit();
        }
    }

    @Test
    void saveAndFindById() {
        repo.save(running("exec-1", NOON).heartbeatIntervalSeconds(30).build());

        Optional<Execution> found = repo.findById("exec-1");
        assertTrue(found.isPresent());
        assertEquals("task-1", found.get().schedulableId());
        assertEquals(SchedulableKind.TASK, found.get().kind());
        assertEquals(ExecutionStatus.RUNNING, found.get().status());
        assertEquals(NOON, found.get().startedAt());
        assertEquals(30, found.get().heartbeatIntervalSeconds());
        assertNull(found.get().finishedAt());
        assertFalse(found.get().skipEventGeneration());
    }

    @Test
    void findByIdNotFound() {
        assertTrue(repo.findById("nonexistent").isEmpty());
    }

    @Test
    void updatePersistsStatusChange() {
        Execution execution = running("exec-1", NOON).build();
        repo.save(execution);

        repo.update(execution.toBuilder()
                .status(ExecutionStatus.ABANDONED)
                .stopReason(StopReason.MISSING_HEARTBEAT)
                .markedDoneAt(NOON.plusSeconds(600))
                .skipEventGeneration(true)
                .build());

        Execution found = repo.findById("exec-1").orElseThrow();
        assertEquals(ExecutionStatus.ABANDONED, found.status());
        assertEquals(StopReason.MISSING_HEARTBEAT, found.stopReason());
        assertEquals(NOON.plusSeconds(600), found.markedDoneAt());
        assertTrue(found.skipEventGeneration());
    }

    @Test
    void findInProgressSkipsTerminalExecutions() {
        repo.save(running("exec-1", NOON).build());
        repo.save(running("exec-2", NOON).status(ExecutionStatus.STOPPING).build());
        repo.save(running("exec-3", NOON).status(ExecutionStatus.SUCCEEDED).finishedAt(NOON).build());
        repo.save(Execution.builder()
                .id("exec-4")
                .kind(SchedulableKind.TASK)
                .schedulableId("task-1")
                .status(ExecutionStatus.MANUALLY_STARTED)
                .createdAt(NOON)
                .build());

        List<String> ids = repo.findInProgress().stream().map(Execution::id).sorted().toList();
        assertEquals(List.of("exec-1", "exec-2", "exec-4"), ids);
    }

    @Test
    void claimEventHandlingSucceedsOncePerStatus() {
        repo.save(running("exec-1", NOON).status(ExecutionStatus.FAILED).finishedAt(NOON).build());

        assertTrue(repo.claimEventHandling("exec-1", ExecutionStatus.FAILED));
        assertFalse(repo.claimEventHandling("exec-1", ExecutionStatus.FAILED));
        assertTrue(repo.claimEventHandling("exec-1", ExecutionStatus.ABANDONED));
        assertFalse(repo.claimEventHandling("nonexistent", ExecutionStatus.FAILED));
    }

    @Test
    void countStartedBetweenIncludesBothBounds() {
        repo.save(running("exec-1", NOON.minusSeconds(60)).build());
        repo.save(running("exec-2", NOON.plusSeconds(600)).build());
        repo.save(running("exec-3", NOON.plusSeconds(601)).build());

        assertEquals(2, repo.countStartedBetween("task-1", NOON.minusSeconds(60), NOON.plusSeconds(600)));
        assertEquals(0, repo.countStartedBetween("task-2", NOON.minusSeconds(60), NOON.plusSeconds(600)));
    }

    @Test
    void countConcurrentAtCanIncludeUnstartedExecutions() {
        repo.save(running("exec-1", NOON.minusSeconds(3600)).build());
        repo.save(running("exec-2", NOON.minusSeconds(3600))
                .status(ExecutionStatus.SUCCEEDED)
                .finishedAt(NOON.minusSeconds(60))
                .build());
        repo.save(Execution.builder()
                .id("exec-3")
                .kind(SchedulableKind.TASK)
                .schedulableId("task-1")
                .status(ExecutionStatus.MANUALLY_STARTED)
                .createdAt(NOON.minusSeconds(120))
                .build());

        assertEquals(1, repo.countConcurrentAt("task-1", NOON, false));
        assertEquals(2, repo.countConcurrentAt("task-1", NOON, true));
        // still running at the earlier instant
        assertEquals(2, repo.countConcurrentAt("task-1", NOON.minusSeconds(600), false));
    }

    @Test
    void findOverlappingUsesEarliestDoneTime() {
        repo.save(running("exec-1", NOON.minusSeconds(600)).build());
        repo.save(running("exec-2", NOON.minusSeconds(600))
                .status(ExecutionStatus.STOPPING)
                .markedDoneAt(NOON.minusSeconds(400))
                .build());
        repo.save(running("exec-3", NOON.minusSeconds(600))
                .status(ExecutionStatus.SUCCEEDED)
                .finishedAt(NOON.minusSeconds(100))
                .build());
        repo.save(running("exec-4", NOON.plusSeconds(60)).build());
        repo.save(running("exec-5", NOON.minusSeconds(600))
                .status(ExecutionStatus.SUCCEEDED)
                .finishedAt(NOON.minusSeconds(300))
                .build());

        List<String> ids = repo.findOverlapping("task-1", NOON.minusSeconds(300), NOON).stream()
                .map(Execution::id)
                .toList();

        assertEquals(List.of("exec-1", "exec-3"), ids);
    }

    @Test
    void recordHeartbeat() {
        repo.save(running("exec-1", NOON).build());

        assertTrue(repo.recordHeartbeat("exec-1", NOON.plusSeconds(30)));
        assertFalse(repo.recordHeartbeat("nonexistent", NOON));
        assertEquals(NOON.plusSeconds(30), repo.findById("exec-1").orElseThrow().lastHeartbeatAt());
    }

    @Test
    void lockForUpdateInsideTransaction() {
        repo.save(running("exec-1", NOON).build());

        Optional<Execution> locked = db.inTransaction(() -> repo.lockForUpdate("exec-1"));

        assertTrue(locked.isPresent());
        assertFalse(db.isInTransaction());
    }

    private static Execution.Builder running(String id, Instant startedAt) {
        return Execution.builder()
                .id(id)
                .kind(SchedulableKind.TASK)
                .schedulableId("task-1")
                .status(ExecutionStatus.RUNNING)
                .createdAt(startedAt)
                .startedAt(startedAt);
    }
}
