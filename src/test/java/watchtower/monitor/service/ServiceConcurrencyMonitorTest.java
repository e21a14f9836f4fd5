package watchtower.monitor.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import watchtower.monitor.MonitorFixture;
import watchtower.monitor.alert.AlertMessage;
import watchtower.monitor.model.AlertCondition;
import watchtower.monitor.model.AlertTargetLink;
import watchtower.monitor.model.Detection;
import watchtower.monitor.model.DetectionKind;
import watchtower.monitor.model.Execution;
import watchtower.monitor.model.ExecutionStatus;
import watchtower.monitor.model.InsufficientInstancesDetails;
import watchtower.monitor.model.Schedulable;
import watchtower.monitor.model.SchedulableKind;
import watchtower.monitor.model.Severity;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ServiceConcurrencyMonitorTest {

    private static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");

    private MonitorFixture fixture;
    private ServiceConcurrencyMonitor monitor;

    @BeforeEach
    void setup() {
        fixture = MonitorFixture.create("service-concurrency", NOW);
        monitor = fixture.deps.serviceConcurrencyMonitor();
        fixture.target("ops");
    }

    @AfterEach
    void teardown() {
        fixture.close();
    }

    @Test
    void shortServiceGetsOneDetection() {
        fixture.save(service().build());
        fixture.save(live("exec-1", fixture.secondsAgo(600)));

        assertEquals(1, monitor.checkAll());
        assertEquals(0, monitor.checkAll());

        List<Detection> detections = detections();
        assertEquals(1, detections.size());
        InsufficientInstancesDetails details = detections.get(0).insufficientInstances();
        assertEquals(1, details.detectedConcurrency());
        assertEquals(2, details.requiredConcurrency());
        assertEquals(NOW, details.intervalEnd());
        assertEquals(NOW.minusSeconds(300), details.intervalStart());
        assertEquals(Severity.ERROR, detections.get(0).severity());
        assertEquals(1, fixture.sender.messagesTo("ops").size());
    }

    @Test
    void finishedAndStoppingExecutionsDoNotCount() {
        fixture.save(service().build());
        fixture.save(live("exec-1", fixture.secondsAgo(600)));
        fixture.save(live("exec-2", fixture.secondsAgo(600)).toBuilder()
                .status(ExecutionStatus.SUCCEEDED)
                .finishedAt(fixture.secondsAgo(60))
                .build());
        fixture.save(live("exec-3", fixture.secondsAgo(600)).toBuilder()
                .status(ExecutionStatus.STOPPING)
                .markedDoneAt(fixture.secondsAgo(60))
                .build());

        assertEquals(1, monitor.checkAll());
        assertEquals(1, detections().get(0).insufficientInstances().detectedConcurrency());
    }

    @Test
    void recoveredServiceResolvesItsDetection() {
        fixture.save(service().build());
        fixture.save(live("exec-1", fixture.secondsAgo(600)));
        monitor.checkAll();
        Detection original = detections().get(0);

        fixture.clock.advance(Duration.ofSeconds(60));
        fixture.save(live("exec-2", fixture.secondsAgo(30)));
        assertEquals(0, monitor.checkAll());

        // the replacement has to cover the whole lookback window
        fixture.clock.advance(Duration.ofSeconds(300));
        assertEquals(1, monitor.checkAll());

        Detection resolved = fixture.deps.detectionRepository().findById(original.id()).orElseThrow();
        assertEquals(fixture.now(), resolved.resolvedAt());
        Detection resolving = fixture.deps.detectionRepository().findById(resolved.resolvedById()).orElseThrow();
        assertEquals(original.id(), resolving.resolvesId());
        assertEquals(2, resolving.insufficientInstances().detectedConcurrency());

        List<AlertMessage> messages = fixture.sender.messagesTo("ops");
        assertEquals(2, messages.size());
        assertTrue(messages.get(1).resolution());
        assertEquals(Severity.INFO, messages.get(1).severity());
        assertEquals(messages.get(0).groupingKey(), messages.get(1).groupingKey());

        assertEquals(0, monitor.checkAll());
    }

    @Test
    void healthyServiceIsQuiet() {
        fixture.save(service().build());
        fixture.save(live("exec-1", fixture.secondsAgo(600)));
        fixture.save(live("exec-2", fixture.secondsAgo(600)));

        assertEquals(0, monitor.checkAll());
        assertTrue(detections().isEmpty());
    }

    @Test
    void serviceInStartupGraceIsNotChecked() {
        fixture.save(service().serviceUpdatedAt(fixture.secondsAgo(100)).build());

        assertEquals(0, monitor.checkAll());

        fixture.clock.advance(Duration.ofSeconds(20));
        assertEquals(0, monitor.checkAll());

        fixture.clock.advance(Duration.ofSeconds(1));
        assertEquals(1, monitor.checkAll());
        InsufficientInstancesDetails details = detections().get(0).insufficientInstances();
        assertEquals(0, details.detectedConcurrency());
        assertEquals(NOW.plusSeconds(20), details.intervalStart());
        assertEquals(NOW.plusSeconds(21), details.intervalEnd());
    }

    @Test
    void dipHiddenByReplacementIsDetected() {
        fixture.save(service().build());
        fixture.save(live("exec-a", fixture.secondsAgo(600)));
        fixture.save(live("exec-b", fixture.secondsAgo(600)).toBuilder()
                .status(ExecutionStatus.FAILED)
                .finishedAt(fixture.secondsAgo(120))
                .build());
        fixture.save(live("exec-c", fixture.secondsAgo(60)));

        assertEquals(1, monitor.checkAll());

        InsufficientInstancesDetails details = detections().get(0).insufficientInstances();
        assertEquals(1, details.detectedConcurrency());
        assertEquals(2, details.requiredConcurrency());
        assertEquals(fixture.secondsAgo(120), details.intervalStart());
        assertEquals(fixture.secondsAgo(60), details.intervalEnd());
    }

    @Test
    void minimumConcurrencyCountsAnExecutionDoneAtTheWindowEndOnlyBefore() {
        Instant from = NOW.minusSeconds(300);
        Execution steady = live("exec-1", NOW.minusSeconds(600));
        Execution stopped = live("exec-2", NOW.minusSeconds(600)).toBuilder()
                .status(ExecutionStatus.STOPPING)
                .markedDoneAt(NOW)
                .build();

        ServiceConcurrencyMonitor.MinimumConcurrency minimum =
                ServiceConcurrencyMonitor.minimumConcurrency(List.of(steady, stopped), from, NOW);

        assertEquals(1, minimum.count());
        assertEquals(NOW, minimum.start());
        assertEquals(NOW, minimum.end());

        minimum = ServiceConcurrencyMonitor.minimumConcurrency(List.of(steady), from, NOW);
        assertEquals(new ServiceConcurrencyMonitor.MinimumConcurrency(from, NOW, 1), minimum);
    }

    @Test
    void configuredGraceOverridesDefault() {
        fixture.save(service()
                .serviceUpdatedAt(fixture.secondsAgo(200))
                .serviceStartupGraceSeconds(600)
                .build());

        assertEquals(0, monitor.checkAll());
    }

    @Test
    void disabledServiceIsNotChecked() {
        fixture.save(service().enabled(false).build());

        assertEquals(0, monitor.checkAll());
        assertTrue(fixture.sender.deliveries().isEmpty());
    }

    private List<Detection> detections() {
        return fixture.deps.detectionRepository().findBySchedulable("svc-1").stream()
                .filter(d -> d.kind() == DetectionKind.INSUFFICIENT_INSTANCES)
                .filter(d -> !d.isResolution())
                .toList();
    }

    private static Schedulable.Builder service() {
        return Schedulable.builder()
                .id("svc-1")
                .kind(SchedulableKind.TASK)
                .name("api")
                .createdAt(NOW.minusSeconds(86_400))
                .minServiceInstanceCount(2)
                .alertTargets(List.of(AlertTargetLink.of("ops", AlertCondition.INSUFFICIENT_INSTANCES, Severity.ERROR)));
    }

    private static Execution live(String id, Instant startedAt) {
        return Execution.builder()
                .id(id)
                .kind(SchedulableKind.TASK)
                .schedulableId("svc-1")
                .status(ExecutionStatus.RUNNING)
                .createdAt(startedAt)
                .startedAt(startedAt)
                .build();
    }
}
