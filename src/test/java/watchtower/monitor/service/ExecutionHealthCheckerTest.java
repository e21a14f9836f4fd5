package watchtower.monitor.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import watchtower.monitor.MonitorFixture;
import watchtower.monitor.model.AlertCondition;
import watchtower.monitor.model.AlertTargetLink;
import watchtower.monitor.model.Detection;
import watchtower.monitor.model.DetectionKind;
import watchtower.monitor.model.Execution;
import watchtower.monitor.model.ExecutionStatus;
import watchtower.monitor.model.Schedulable;
import watchtower.monitor.model.SchedulableKind;
import watchtower.monitor.model.Severity;
import watchtower.monitor.model.StopReason;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionHealthCheckerTest {

    private static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");

    private MonitorFixture fixture;
    private ExecutionHealthChecker checker;

    @BeforeEach
    void setup() {
        fixture = MonitorFixture.create("execution-health", NOW);
        checker = fixture.deps.executionHealthChecker();
        fixture.target("ops");
    }

    @AfterEach
    void teardown() {
        fixture.close();
    }

    @Test
    void lateManualStartGetsOneDelayedStartDetection() {
        fixture.save(task().manualStartAlertSeconds(300).manualStartAbandonSeconds(1800).build());
        fixture.save(manual("exec-1", fixture.secondsAgo(400)));

        assertEquals(1, checker.checkAll());
        assertEquals(0, checker.checkAll());

        List<Detection> detections = detectionsOf(DetectionKind.DELAYED_START);
        assertEquals(1, detections.size());
        assertEquals("exec-1", detections.get(0).executionId());
        assertEquals(fixture.secondsAgo(100), detections.get(0).delayedStart().expectedStartBy());
        assertEquals(ExecutionStatus.MANUALLY_STARTED, reload("exec-1").status());
        assertEquals(1, fixture.sender.messagesTo("ops").size());
    }

    @Test
    void manualStartPastAbandonThresholdIsAbandoned() {
        fixture.save(task().manualStartAlertSeconds(300).manualStartAbandonSeconds(1800).build());
        fixture.save(manual("exec-1", fixture.secondsAgo(2000)));

        checker.checkAll();

        Execution execution = reload("exec-1");
        assertEquals(ExecutionStatus.ABANDONED, execution.status());
        assertEquals(StopReason.FAILED_TO_START, execution.stopReason());
        assertEquals(NOW, execution.markedDoneAt());
        assertTrue(detectionsOf(DetectionKind.DELAYED_START).isEmpty());
    }

    @Test
    void manualStartUsesConfiguredDefaultsWhenTaskHasNone() {
        fixture.save(task().build());
        fixture.save(manual("exec-1", fixture.secondsAgo(301)));

        checker.checkAll();

        assertEquals(1, detectionsOf(DetectionKind.DELAYED_START).size());
    }

    @Test
    void executionPastMaxAgeIsAskedToStop() {
        fixture.save(task().maxAgeSeconds(3600).build());
        fixture.save(running("exec-1", fixture.secondsAgo(3601)).build());

        checker.checkAll();

        Execution execution = reload("exec-1");
        assertEquals(ExecutionStatus.STOPPING, execution.status());
        assertEquals(StopReason.MAX_EXECUTION_TIME_EXCEEDED, execution.stopReason());
        assertEquals(NOW, execution.markedDoneAt());
        assertNull(execution.finishedAt());
    }

    @Test
    void executionWithinMaxAgeIsLeftAlone() {
        fixture.save(task().maxAgeSeconds(3600).build());
        fixture.save(running("exec-1", fixture.secondsAgo(3600)).build());

        assertEquals(0, checker.checkAll());
        assertEquals(ExecutionStatus.RUNNING, reload("exec-1").status());
    }

    @Test
    void stuckStoppingExecutionIsAbandoned() {
        fixture.save(task().build());
        fixture.save(running("exec-1", fixture.secondsAgo(601)).status(ExecutionStatus.STOPPING).build());

        checker.checkAll();

        Execution execution = reload("exec-1");
        assertEquals(ExecutionStatus.ABANDONED, execution.status());
        assertEquals(NOW, execution.markedDoneAt());
        assertEquals(NOW, execution.finishedAt());
    }

    @Test
    void stopRequestedThisPassIsNotAbandonedInTheSamePass() {
        fixture.save(task().maxAgeSeconds(60).build());
        fixture.save(running("exec-1", fixture.secondsAgo(7200)).build());

        checker.checkAll();

        assertEquals(ExecutionStatus.STOPPING, reload("exec-1").status());
    }

    @Test
    void overdueHeartbeatGetsAMissingHeartbeatDetection() {
        fixture.save(task().heartbeatAlertSeconds(120).heartbeatAbandonSeconds(600).build());
        fixture.save(running("exec-1", fixture.secondsAgo(1000))
                .heartbeatIntervalSeconds(60)
                .lastHeartbeatAt(fixture.secondsAgo(300))
                .build());

        assertEquals(1, checker.checkAll());
        assertEquals(0, checker.checkAll());

        List<Detection> detections = detectionsOf(DetectionKind.MISSING_HEARTBEAT);
        assertEquals(1, detections.size());
        assertEquals(fixture.secondsAgo(240), detections.get(0).missingHeartbeat().expectedHeartbeatAt());
        assertEquals(fixture.secondsAgo(300), detections.get(0).missingHeartbeat().lastHeartbeatAt());
        assertEquals(ExecutionStatus.RUNNING, reload("exec-1").status());
    }

    @Test
    void longOverdueHeartbeatIsStillDetected() {
        fixture.save(task().heartbeatAlertSeconds(4000).build());
        fixture.save(running("exec-1", fixture.secondsAgo(10_000))
                .heartbeatIntervalSeconds(60)
                .lastHeartbeatAt(fixture.secondsAgo(4160))
                .build());

        assertEquals(1, checker.checkAll());

        List<Detection> detections = detectionsOf(DetectionKind.MISSING_HEARTBEAT);
        assertEquals(1, detections.size());
        assertEquals(fixture.secondsAgo(4100), detections.get(0).missingHeartbeat().expectedHeartbeatAt());
        assertEquals(1, fixture.sender.messagesTo("ops").size());
        assertEquals(ExecutionStatus.RUNNING, reload("exec-1").status());
    }

    @Test
    void heartbeatMissingPastAbandonThresholdAbandonsTheExecution() {
        fixture.save(task().heartbeatAlertSeconds(120).heartbeatAbandonSeconds(600).build());
        fixture.save(running("exec-1", fixture.secondsAgo(1000))
                .heartbeatIntervalSeconds(60)
                .lastHeartbeatAt(fixture.secondsAgo(700))
                .build());

        checker.checkAll();

        Execution execution = reload("exec-1");
        assertEquals(ExecutionStatus.ABANDONED, execution.status());
        assertEquals(StopReason.MISSING_HEARTBEAT, execution.stopReason());
        assertFalse(execution.skipEventGeneration());
    }

    @Test
    void redeployMovesTheExpectedHeartbeatForward() {
        fixture.save(task()
                .heartbeatAlertSeconds(60)
                .heartbeatAbandonSeconds(600)
                .serviceUpdatedAt(fixture.secondsAgo(100))
                .build());
        fixture.save(running("exec-1", fixture.secondsAgo(2000))
                .heartbeatIntervalSeconds(60)
                .lastHeartbeatAt(fixture.secondsAgo(1900))
                .build());

        assertEquals(0, checker.checkAll());
        assertEquals(ExecutionStatus.RUNNING, reload("exec-1").status());
    }

    @Test
    void expectedHeartbeatIsNeverBeforeRedeployPlusInterval() {
        Instant redeploy = Instant.parse("2024-03-15T11:00:00Z");
        Schedulable service = task().serviceUpdatedAt(redeploy).build();

        Execution stale = running("exec-1", Instant.parse("2024-03-15T09:00:00Z"))
                .heartbeatIntervalSeconds(60)
                .lastHeartbeatAt(Instant.parse("2024-03-15T10:00:00Z"))
                .build();
        Execution fresh = stale.toBuilder().lastHeartbeatAt(Instant.parse("2024-03-15T11:30:00Z")).build();

        assertEquals(redeploy.plusSeconds(60), ExecutionHealthChecker.expectedHeartbeatAt(stale, service));
        assertEquals(Instant.parse("2024-03-15T11:31:00Z"), ExecutionHealthChecker.expectedHeartbeatAt(fresh, service));
        assertNull(ExecutionHealthChecker.expectedHeartbeatAt(
                stale.toBuilder().heartbeatIntervalSeconds(null).build(), service));
    }

    @Test
    void abandonmentCausedByRedeploySkipsEventGeneration() {
        fixture.save(task()
                .heartbeatAbandonSeconds(600)
                .serviceUpdatedAt(fixture.secondsAgo(800))
                .eventSeverity(AlertCondition.ABANDONED, Severity.ERROR)
                .build());
        fixture.save(running("exec-1", fixture.secondsAgo(2000))
                .heartbeatIntervalSeconds(60)
                .lastHeartbeatAt(fixture.secondsAgo(1900))
                .build());

        checker.checkAll();

        Execution execution = reload("exec-1");
        assertEquals(ExecutionStatus.ABANDONED, execution.status());
        assertTrue(execution.skipEventGeneration());
        assertTrue(detectionsOf(DetectionKind.STATUS_CHANGE).isEmpty());
        assertTrue(fixture.sender.deliveries().isEmpty());
    }

    @Test
    void abandonmentReportsAStatusChangeEvent() {
        fixture.save(task()
                .manualStartAbandonSeconds(600)
                .eventSeverity(AlertCondition.ABANDONED, Severity.ERROR)
                .build());
        fixture.save(manual("exec-1", fixture.secondsAgo(601)));

        checker.checkAll();

        List<Detection> events = detectionsOf(DetectionKind.STATUS_CHANGE);
        assertEquals(1, events.size());
        assertEquals(ExecutionStatus.ABANDONED, events.get(0).statusChange().status());
        assertEquals(NOW, events.get(0).statusChange().triggeredAt());
        assertEquals(1, fixture.sender.messagesTo("ops").size());
    }

    @Test
    void terminalExecutionsAreNotChecked() {
        fixture.save(task().maxAgeSeconds(60).build());
        fixture.save(running("exec-1", fixture.secondsAgo(7200))
                .status(ExecutionStatus.SUCCEEDED)
                .finishedAt(fixture.secondsAgo(100))
                .build());

        assertEquals(0, checker.checkAll());
        assertEquals(ExecutionStatus.SUCCEEDED, reload("exec-1").status());
    }

    @Test
    void executionOfUnknownSchedulableIsSkipped() {
        fixture.save(running("exec-1", fixture.secondsAgo(7200)).schedulableId("gone").build());

        assertEquals(0, checker.checkAll());
    }

    private Execution reload(String id) {
        return fixture.deps.executionRepository().findById(id).orElseThrow();
    }

    private List<Detection> detectionsOf(DetectionKind kind) {
        return fixture.deps.detectionRepository().findBySchedulable("task-1").stream()
                .filter(d -> d.kind() == kind)
                .toList();
    }

    private static Schedulable.Builder task() {
        return Schedulable.builder()
                .id("task-1")
                .kind(SchedulableKind.TASK)
                .name("worker")
                .createdAt(NOW.minusSeconds(86_400))
                .alertTargets(List.of(new AlertTargetLink("ops", Map.of(
                        AlertCondition.DELAYED_START, Severity.WARNING,
                        AlertCondition.MISSING_HEARTBEAT, Severity.ERROR,
                        AlertCondition.ABANDONED, Severity.ERROR))));
    }

    private static Execution manual(String id, Instant createdAt) {
        return Execution.builder()
                .id(id)
                .kind(SchedulableKind.TASK)
                .schedulableId("task-1")
                .status(ExecutionStatus.MANUALLY_STARTED)
                .createdAt(createdAt)
                .build();
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
