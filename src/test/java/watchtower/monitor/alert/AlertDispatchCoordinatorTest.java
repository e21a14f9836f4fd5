package watchtower.monitor.alert;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import watchtower.monitor.MonitorFixture;
import watchtower.monitor.config.MonitorConfig;
import watchtower.monitor.exception.StoreException;
import watchtower.monitor.model.AlertCondition;
import watchtower.monitor.model.AlertRecord;
import watchtower.monitor.model.AlertSendStatus;
import watchtower.monitor.model.AlertTarget;
import watchtower.monitor.model.AlertTargetLink;
import watchtower.monitor.model.Detection;
import watchtower.monitor.model.InsufficientInstancesDetails;
import watchtower.monitor.model.MissingExecutionDetails;
import watchtower.monitor.model.RateLimitTier;
import watchtower.monitor.model.Schedulable;
import watchtower.monitor.model.SchedulableKind;
import watchtower.monitor.model.Severity;
import watchtower.monitor.repository.AlertRecordRepository;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AlertDispatchCoordinatorTest {

    private static final Instant NOW = Instant.parse("2024-03-15T12:15:00Z");
    private static final Instant EXPECTED = Instant.parse("2024-03-15T12:00:00Z");

    private MonitorFixture fixture;

    @AfterEach
    void teardown() {
        if (fixture != null) {
            fixture.close();
        }
    }

    @Test
    void sendsToEveryEnabledTargetWithASeverityForTheCondition() {
        fixture = MonitorFixture.create("dispatch-targets", NOW);
        fixture.target("ops");
        fixture.target("audit");
        fixture.target("muted", false);
        Schedulable task = fixture.save(task("task-1", List.of(
                AlertTargetLink.of("ops", AlertCondition.MISSING_EXECUTION, Severity.CRITICAL),
                AlertTargetLink.of("audit", AlertCondition.MISSING_EXECUTION, Severity.WARNING),
                AlertTargetLink.of("muted", AlertCondition.MISSING_EXECUTION, Severity.ERROR),
                AlertTargetLink.of("audit-heartbeats", AlertCondition.MISSING_HEARTBEAT, Severity.ERROR))));

        List<AlertRecord> records = fixture.deps.dispatcher().dispatch(missing(task));

        assertEquals(2, records.size());
        assertTrue(records.stream().allMatch(r -> r.sendStatus() == AlertSendStatus.SUCCEEDED));
        assertEquals(Severity.CRITICAL, fixture.sender.messagesTo("ops").get(0).severity());
        assertEquals(Severity.WARNING, fixture.sender.messagesTo("audit").get(0).severity());
        assertTrue(fixture.sender.messagesTo("muted").isEmpty());
    }

    @Test
    void messageCarriesGroupingKeySummaryAndDetails() {
        fixture = MonitorFixture.create("dispatch-message", NOW);
        fixture.target("ops");
        Schedulable task = fixture.save(task("task-1",
                List.of(AlertTargetLink.of("ops", AlertCondition.MISSING_EXECUTION, Severity.ERROR))));

        fixture.deps.dispatcher().dispatch(missing(task));

        AlertMessage message = fixture.sender.messagesTo("ops").get(0);
        long minute = EXPECTED.getEpochSecond() / 60;
        assertEquals("missing_scheduled_task-task-1-" + minute, message.groupingKey());
        assertEquals("Task 'nightly-report' did not run as scheduled at 2024-03-15T12:00:00Z (1 missing)",
                message.summary());
        assertEquals("2024-03-15T12:00:00Z", message.details().get("expectedExecutionAt").asText());
        assertFalse(message.resolution());
    }

    @Test
    void failureForOneTargetDoesNotStopTheOthers() {
        fixture = MonitorFixture.create("dispatch-failure", NOW);
        fixture.target("broken");
        fixture.target("ops");
        fixture.sender.failFor("broken");
        Schedulable task = fixture.save(task("task-1", List.of(
                AlertTargetLink.of("broken", AlertCondition.MISSING_EXECUTION, Severity.ERROR),
                AlertTargetLink.of("ops", AlertCondition.MISSING_EXECUTION, Severity.ERROR))));
        Detection detection = missing(task);

        fixture.deps.dispatcher().dispatch(detection);

        List<AlertRecord> stored = fixture.deps.alertRecordRepository().findByDetectionId(detection.id());
        assertEquals(2, stored.size());
        AlertRecord broken = stored.stream().filter(r -> r.targetId().equals("broken")).findFirst().orElseThrow();
        AlertRecord ops = stored.stream().filter(r -> r.targetId().equals("ops")).findFirst().orElseThrow();
        assertEquals(AlertSendStatus.FAILED, broken.sendStatus());
        assertTrue(broken.errorMessage().contains("Connection refused by broken"));
        assertNotNull(broken.completedAt());
        assertEquals(AlertSendStatus.SUCCEEDED, ops.sendStatus());
        assertTrue(ops.sendResult().contains("\"reference\""));
        assertEquals(1, fixture.sender.deliveries().size());
    }

    @Test
    void recordStoreFailureForOneTargetDoesNotStopTheOthers() {
        fixture = MonitorFixture.create("dispatch-store-failure", NOW);
        fixture.target("unrecorded");
        fixture.target("ops");
        Schedulable task = fixture.save(task("task-1", List.of(
                AlertTargetLink.of("unrecorded", AlertCondition.MISSING_EXECUTION, Severity.ERROR),
                AlertTargetLink.of("ops", AlertCondition.MISSING_EXECUTION, Severity.ERROR))));
        AlertRecordRepository records = new FailingRecords(fixture.deps.alertRecordRepository(), "unrecorded");
        AlertDispatchCoordinator dispatcher = new AlertDispatchCoordinator(fixture.deps.schedulableRepository(),
                fixture.deps.alertTargetRepository(), fixture.deps.detectionRepository(), records,
                fixture.deps.rateLimiter(), fixture.deps.config(), fixture.clock);
        Detection detection = missing(task);

        List<AlertRecord> attempted = dispatcher.dispatch(detection);

        assertEquals(2, attempted.size());
        assertEquals(AlertSendStatus.FAILED, attempted.get(0).sendStatus());
        assertTrue(attempted.get(0).errorMessage().contains("Failed to save alert record"));
        assertEquals(AlertSendStatus.SUCCEEDED, attempted.get(1).sendStatus());
        assertTrue(fixture.sender.messagesTo("unrecorded").isEmpty());
        assertEquals(1, fixture.sender.messagesTo("ops").size());

        List<AlertRecord> stored = fixture.deps.alertRecordRepository().findByDetectionId(detection.id());
        assertEquals(1, stored.size());
        assertEquals("ops", stored.get(0).targetId());
        assertEquals(AlertSendStatus.SUCCEEDED, stored.get(0).sendStatus());
    }

    @Test
    void sendResultIsStoredAsJson() {
        fixture = MonitorFixture.create("dispatch-result", NOW);

        String json = fixture.deps.dispatcher().resultJson(new SendResult("msg-7", "queued"));

        assertEquals("{\"reference\":\"msg-7\",\"detail\":\"queued\"}", json);
    }

    @Test
    void failureMessageIsTruncated() {
        fixture = MonitorFixture.create("dispatch-truncate",
                MonitorConfig.defaults().withErrorMessageMaxLength(12), NOW);
        fixture.target("broken");
        fixture.sender.failFor("broken");
        Schedulable task = fixture.save(task("task-1",
                List.of(AlertTargetLink.of("broken", AlertCondition.MISSING_EXECUTION, Severity.ERROR))));

        AlertRecord record = fixture.deps.dispatcher().dispatch(missing(task)).get(0);

        assertEquals(AlertSendStatus.FAILED, record.sendStatus());
        assertEquals(12, record.errorMessage().length());
    }

    @Test
    void unknownTransportIsRecordedAsFailure() {
        fixture = MonitorFixture.create("dispatch-transport", NOW);
        fixture.deps.alertTargetRepository().save(new AlertTarget("pager", "pager", true, "pagerduty", List.of()));
        Schedulable task = fixture.save(task("task-1",
                List.of(AlertTargetLink.of("pager", AlertCondition.MISSING_EXECUTION, Severity.ERROR))));

        AlertRecord record = fixture.deps.dispatcher().dispatch(missing(task)).get(0);

        assertEquals(AlertSendStatus.FAILED, record.sendStatus());
        assertTrue(record.errorMessage().contains("pagerduty"));
    }

    @Test
    void rateLimitedSendIsRecordedWithTier() {
        fixture = MonitorFixture.create("dispatch-rate", NOW);
        fixture.target("ops", RateLimitTier.of(0, 1, 3600, null));
        Schedulable task = fixture.save(task("task-1",
                List.of(AlertTargetLink.of("ops", AlertCondition.MISSING_EXECUTION, Severity.ERROR))));

        fixture.deps.dispatcher().dispatch(missing(task));
        AlertRecord second = fixture.deps.dispatcher().dispatch(missing(task)).get(0);

        assertEquals(AlertSendStatus.RATE_LIMITED, second.sendStatus());
        assertEquals(0, second.rateLimitTierIndex());
        assertEquals(1, fixture.sender.deliveries().size());
    }

    @Test
    void resolutionUsesInfoSeverityAndTheOriginalGroupingKey() {
        fixture = MonitorFixture.create("dispatch-resolution", NOW);
        fixture.target("ops");
        Schedulable service = fixture.save(Schedulable.builder()
                .id("svc-1")
                .name("api")
                .minServiceInstanceCount(2)
                .alertTargets(List.of(AlertTargetLink.of("ops", AlertCondition.INSUFFICIENT_INSTANCES,
                        Severity.CRITICAL)))
                .build());
        Detection original = Detection.builder()
                .schedulable(service)
                .severity(Severity.ERROR)
                .detectedAt(NOW)
                .details(new InsufficientInstancesDetails(NOW.minusSeconds(300), NOW, 1, 2))
                .build();
        fixture.deps.detectionRepository().save(original);
        Instant later = NOW.plusSeconds(600);
        Detection resolving = original.resolution(
                new InsufficientInstancesDetails(later.minusSeconds(300), later, 2, 2), later);

        fixture.deps.dispatcher().dispatch(original);
        fixture.deps.dispatcher().dispatch(resolving);

        List<AlertMessage> messages = fixture.sender.messagesTo("ops");
        assertEquals(2, messages.size());
        assertEquals(Severity.CRITICAL, messages.get(0).severity());
        assertEquals(Severity.INFO, messages.get(1).severity());
        assertTrue(messages.get(1).resolution());
        assertEquals(messages.get(0).groupingKey(), messages.get(1).groupingKey());
        assertEquals("Task 'api' is back to 2 of 2 required instances", messages.get(1).summary());
    }

    @Test
    void truncateKeepsShortMessages() {
        fixture = MonitorFixture.create("dispatch-short", NOW);

        assertEquals("short", fixture.deps.dispatcher().truncate("short"));
        assertNull(fixture.deps.dispatcher().truncate(null));
    }

    private static final class FailingRecords implements AlertRecordRepository {

        private final AlertRecordRepository delegate;
        private final String failingTarget;

        FailingRecords(AlertRecordRepository delegate, String failingTarget) {
            this.delegate = delegate;
            this.failingTarget = failingTarget;
        }

        @Override
        public void save(AlertRecord record) {
            if (record.targetId().equals(failingTarget)) {
                throw new StoreException("Failed to save alert record: " + record.id(),
                        new SQLException("disk full"));
            }
            delegate.save(record);
        }

        @Override
        public void updateOutcome(AlertRecord record) {
            delegate.updateOutcome(record);
        }

        @Override
        public List<AlertRecord> findByDetectionId(String detectionId) {
            return delegate.findByDetectionId(detectionId);
        }
    }

    private static Schedulable task(String id, List<AlertTargetLink> links) {
        return Schedulable.builder()
                .id(id)
                .kind(SchedulableKind.TASK)
                .name("nightly-report")
                .schedule("cron(0 12 * * ? *)")
                .alertTargets(links)
                .eventSeverities(Map.of())
                .build();
    }

    private static Detection missing(Schedulable task) {
        return Detection.builder()
                .schedulable(task)
                .severity(Severity.ERROR)
                .detectedAt(NOW)
                .details(new MissingExecutionDetails(task.schedule(), EXPECTED, 1))
                .build();
    }
}
