package watchtower.monitor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import watchtower.monitor.alert.AlertDispatchCoordinator;
import watchtower.monitor.config.MonitorConfig;
import watchtower.monitor.model.AlertCondition;
import watchtower.monitor.model.DelayedStartDetails;
import watchtower.monitor.model.Detection;
import watchtower.monitor.model.DetectionKind;
import watchtower.monitor.model.Execution;
import watchtower.monitor.model.ExecutionStatus;
import watchtower.monitor.model.MissingHeartbeatDetails;
import watchtower.monitor.model.Schedulable;
import watchtower.monitor.model.StopReason;
import watchtower.monitor.repository.DetectionRepository;
import watchtower.monitor.repository.ExecutionRepository;
import watchtower.monitor.repository.SchedulableRepository;
import watchtower.monitor.store.Database;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Background check over every in-progress execution.
 *
 * Per execution, in order:
 * 1. Stuck stopping: STOPPING for longer than the max stopping duration becomes ABANDONED
 * 2. Manual start: MANUALLY_STARTED too long becomes ABANDONED, or gets a delayed-start detection
 * 3. Max age: RUNNING or MANUALLY_STARTED past max age is asked to stop
 * 4. Heartbeat: a RUNNING execution with an overdue heartbeat becomes ABANDONED, or gets a
 * missing-heartbeat detection
 *
 * A step is skipped once an earlier step has made the execution terminal.
 */
public class ExecutionHealthChecker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionHealthChecker.class);

    private final Database db;
    private final SchedulableRepository schedulableRepository;
    private final ExecutionRepository executionRepository;
    private final DetectionRepository detectionRepository;
    private final EventPostponementCoordinator postponement;
    private final AlertDispatchCoordinator dispatcher;
    private final MonitorConfig config;
    private final Clock clock;

    public ExecutionHealthChecker(Database db,
            SchedulableRepository schedulableRepository,
            ExecutionRepository executionRepository,
            DetectionRepository detectionRepository,
            EventPostponementCoordinator postponement,
            AlertDispatchCoordinator dispatcher,
            MonitorConfig config,
            Clock clock) {
        this.db = db;
        this.schedulableRepository = schedulableRepository;
        this.executionRepository = executionRepository;
        this.detectionRepository = detectionRepository;
        this.postponement = postponement;
        this.dispatcher = dispatcher;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            checkAll();
        } catch (Exception e) {
            log.error("Execution health check error", e);
        }
    }

    /**
     * @return number of executions whose status changed or that got a new detection
     */
    public int checkAll() {
        return checkAll(clock.instant());
    }

    public int checkAll(Instant asOf) {
        List<Execution> inProgress = executionRepository.findInProgress();
        if (inProgress.isEmpty()) {
            log.debug("No executions in progress");
            return 0;
        }

        int affected = 0;
        for (Execution execution : inProgress) {
            try {
                if (check(execution, asOf)) {
                    affected++;
                }
            } catch (Exception e) {
                log.error("Failed to check health of execution {}", execution.id(), e);
            }
        }

        if (affected > 0) {
            log.info("Execution health: {} of {} in-progress execution(s) affected", affected, inProgress.size());
        }
        return affected;
    }

    /**
     * Check one execution.
     *
     * @return true if its status changed or a detection was created
     */
    public boolean check(Execution execution, Instant asOf) {
        Result result = db.inTransaction(() -> {
            Execution current = executionRepository.lockForUpdate(execution.id()).orElse(null);
            if (current == null || current.isTerminal()) {
                return Result.NONE;
            }
            Schedulable schedulable = schedulableRepository.findById(current.schedulableId()).orElse(null);
            if (schedulable == null) {
                log.warn("Execution {} belongs to unknown schedulable {}", current.id(), current.schedulableId());
                return Result.NONE;
            }

            List<Detection> detections = new ArrayList<>();
            Execution updated = checkStuckStopping(current, asOf);
            if (!updated.isTerminal()) {
                updated = checkManualStart(schedulable, updated, asOf, detections);
            }
            if (!updated.isTerminal()) {
                updated = checkMaxAge(schedulable, updated, asOf);
            }
            if (!updated.isTerminal()) {
                updated = checkHeartbeat(schedulable, updated, asOf, detections);
            }

            if (updated != current) {
                executionRepository.update(updated);
                log.info("Execution {} moved from {} to {} ({})", current.id(), current.status(),
                        updated.status(), updated.stopReason());
            }
            detections.forEach(detectionRepository::save);
            return new Result(updated != current ? updated : null, detections);
        });

        if (result.updated() != null && result.updated().isTerminal()) {
            postponement.handleStatusChange(result.updated(), asOf);
        }
        for (Detection detection : result.detections()) {
            dispatcher.dispatch(detection);
        }
        return result.updated() != null || !result.detections().isEmpty();
    }

    private Execution checkStuckStopping(Execution execution, Instant asOf) {
        if (execution.status() != ExecutionStatus.STOPPING || execution.startedAt() == null) {
            return execution;
        }
        if (Duration.between(execution.startedAt(), asOf).compareTo(config.maxStoppingDuration()) <= 0) {
            return execution;
        }
        return execution.toBuilder()
                .status(ExecutionStatus.ABANDONED)
                .markedDoneAt(asOf)
                .finishedAt(asOf)
                .build();
    }

    private Execution checkManualStart(Schedulable schedulable, Execution execution, Instant asOf,
            List<Detection> detections) {
        if (execution.status() != ExecutionStatus.MANUALLY_STARTED || execution.createdAt() == null) {
            return execution;
        }

        Duration waiting = Duration.between(execution.createdAt(), asOf);
        Duration abandonAfter = seconds(schedulable.manualStartAbandonSeconds(), config.defaultManualStartAbandon());
        if (waiting.compareTo(abandonAfter) > 0) {
            return execution.toBuilder()
                    .status(ExecutionStatus.ABANDONED)
                    .stopReason(StopReason.FAILED_TO_START)
                    .markedDoneAt(asOf)
                    .build();
        }

        Duration alertAfter = seconds(schedulable.manualStartAlertSeconds(), config.defaultManualStartAlert());
        if (waiting.compareTo(alertAfter) > 0
                && detectionRepository.findUnresolved(DetectionKind.DELAYED_START, schedulable.id(),
                        execution.id()).isEmpty()) {
            detections.add(Detection.builder()
                    .schedulable(schedulable)
                    .executionId(execution.id())
                    .severity(schedulable.detectionSeverity(AlertCondition.DELAYED_START))
                    .detectedAt(asOf)
                    .details(new DelayedStartDetails(execution.createdAt().plus(alertAfter)))
                    .build());
            log.info("Execution {} has not started {}s after creation", execution.id(), waiting.toSeconds());
        }
        return execution;
    }

    private Execution checkMaxAge(Schedulable schedulable, Execution execution, Instant asOf) {
        Integer maxAge = schedulable.maxAgeSeconds();
        if (maxAge == null) {
            return execution;
        }
        if (execution.status() != ExecutionStatus.RUNNING && execution.status() != ExecutionStatus.MANUALLY_STARTED) {
            return execution;
        }

        Instant since = execution.startedAt() != null ? execution.startedAt() : execution.createdAt();
        if (since == null || Duration.between(since, asOf).getSeconds() <= maxAge) {
            return execution;
        }
        return execution.toBuilder()
                .status(ExecutionStatus.STOPPING)
                .stopReason(StopReason.MAX_EXECUTION_TIME_EXCEEDED)
                .markedDoneAt(asOf)
                .build();
    }

    private Execution checkHeartbeat(Schedulable schedulable, Execution execution, Instant asOf,
            List<Detection> detections) {
        if (execution.status() != ExecutionStatus.RUNNING) {
            return execution;
        }
        Instant expected = expectedHeartbeatAt(execution, schedulable);
        if (expected == null || !asOf.isAfter(expected)) {
            return execution;
        }

        long overdue = Duration.between(expected, asOf).getSeconds();
        boolean startedBeforeRedeploy = startedBeforeRedeploy(execution, schedulable);

        Integer abandonAfter = schedulable.heartbeatAbandonSeconds();
        if (abandonAfter != null && overdue > abandonAfter) {
            return execution.toBuilder()
                    .status(ExecutionStatus.ABANDONED)
                    .stopReason(StopReason.MISSING_HEARTBEAT)
                    .markedDoneAt(asOf)
                    .skipEventGeneration(execution.skipEventGeneration() || startedBeforeRedeploy)
                    .build();
        }

        Integer alertAfter = schedulable.heartbeatAlertSeconds();
        if (alertAfter == null || overdue <= alertAfter || startedBeforeRedeploy) {
            return execution;
        }
        if (detectionRepository.findUnresolved(DetectionKind.MISSING_HEARTBEAT, schedulable.id(),
                execution.id()).isPresent()) {
            return execution;
        }

        detections.add(Detection.builder()
                .schedulable(schedulable)
                .executionId(execution.id())
                .severity(schedulable.detectionSeverity(AlertCondition.MISSING_HEARTBEAT))
                .detectedAt(asOf)
                .details(new MissingHeartbeatDetails(execution.lastHeartbeatAt(), expected))
                .build());
        log.info("Execution {} missed its heartbeat expected at {}", execution.id(), expected);
        return execution;
    }

    /**
     * When the next heartbeat of a running execution is due: one interval after its last heartbeat
     * (or its start), but never before one interval after the last redeploy.
     *
     * @return the due time, or null if the execution does not heartbeat or has not started
     */
    public static Instant expectedHeartbeatAt(Execution execution, Schedulable schedulable) {
        Integer interval = execution.heartbeatIntervalSeconds();
        if (interval == null) {
            return null;
        }
        Instant base = execution.lastHeartbeatAt() != null ? execution.lastHeartbeatAt() : execution.startedAt();
        if (base == null) {
            return null;
        }
        Instant redeploy = schedulable.serviceUpdatedAt();
        if (redeploy != null && redeploy.isAfter(base)) {
            base = redeploy;
        }
        return base.plusSeconds(interval);
    }

    private static boolean startedBeforeRedeploy(Execution execution, Schedulable schedulable) {
        Instant redeploy = schedulable.serviceUpdatedAt();
        return redeploy != null && execution.startedAt() != null && execution.startedAt().isBefore(redeploy);
    }

    private static Duration seconds(Integer configured, Duration fallback) {
        return configured != null ? Duration.ofSeconds(configured) : fallback;
    }

    private record Result(Execution updated, List<Detection> detections) {
        static final Result NONE = new Result(null, List.of());
    }
}
