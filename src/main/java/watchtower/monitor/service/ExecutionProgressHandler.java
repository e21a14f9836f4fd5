package watchtower.monitor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import watchtower.monitor.alert.AlertDispatchCoordinator;
import watchtower.monitor.config.MonitorConfig;
import watchtower.monitor.model.Detection;
import watchtower.monitor.model.DetectionDetails;
import watchtower.monitor.model.DetectionKind;
import watchtower.monitor.model.Execution;
import watchtower.monitor.model.MissingHeartbeatDetails;
import watchtower.monitor.repository.DetectionRepository;
import watchtower.monitor.repository.ExecutionRepository;
import watchtower.monitor.repository.SchedulableRepository;
import watchtower.monitor.store.Database;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Write-path hooks for execution progress: a start or a heartbeat can clear detections
 * made while the execution was late.
 */
public class ExecutionProgressHandler {

    private static final Logger log = LoggerFactory.getLogger(ExecutionProgressHandler.class);

    private final Database db;
    private final SchedulableRepository schedulableRepository;
    private final ExecutionRepository executionRepository;
    private final DetectionRepository detectionRepository;
    private final AlertDispatchCoordinator dispatcher;
    private final MonitorConfig config;
    private final Clock clock;

    public ExecutionProgressHandler(Database db,
            SchedulableRepository schedulableRepository,
            ExecutionRepository executionRepository,
            DetectionRepository detectionRepository,
            AlertDispatchCoordinator dispatcher,
            MonitorConfig config,
            Clock clock) {
        this.db = db;
        this.schedulableRepository = schedulableRepository;
        this.executionRepository = executionRepository;
        this.detectionRepository = detectionRepository;
        this.dispatcher = dispatcher;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Resolve missing-execution detections this start accounts for, and a delayed-start
     * detection of the execution itself.
     *
     * @param execution an execution whose start was just persisted
     * @return resolving detections created
     */
    public List<Detection> handleExecutionStarted(Execution execution) {
        Instant asOf = clock.instant();
        Instant startedAt = execution.startedAt() != null ? execution.startedAt() : asOf;

        List<Detection> resolutions = db.inTransaction(() -> {
            if (schedulableRepository.lockForUpdate(execution.schedulableId()).isEmpty()) {
                return List.<Detection>of();
            }

            List<Detection> created = new ArrayList<>();
            List<Detection> missing = detectionRepository.findUnresolvedMissingExecutionsBetween(
                    execution.schedulableId(),
                    startedAt.minus(config.maxScheduledLateness()),
                    startedAt.plus(config.maxEarlyStartup()));
            for (Detection detection : missing) {
                created.add(resolve(detection, detection.missingExecution(), asOf));
            }

            detectionRepository.findUnresolved(DetectionKind.DELAYED_START, execution.schedulableId(), execution.id())
                    .ifPresent(detection -> created.add(resolve(detection, detection.delayedStart(), asOf)));
            return created;
        });

        if (!resolutions.isEmpty()) {
            log.info("Start of execution {} resolved {} detection(s)", execution.id(), resolutions.size());
        }
        resolutions.forEach(dispatcher::dispatch);
        return resolutions;
    }

    /**
     * Record a heartbeat and resolve the execution's missing-heartbeat detection, if any.
     *
     * @return the resolving detection
     */
    public Optional<Detection> handleHeartbeat(String executionId, Instant at) {
        Instant asOf = clock.instant();

        Optional<Detection> resolution = db.inTransaction(() -> {
            Execution execution = executionRepository.lockForUpdate(executionId).orElse(null);
            if (execution == null) {
                log.warn("Heartbeat for unknown execution {}", executionId);
                return Optional.<Detection>empty();
            }
            executionRepository.recordHeartbeat(executionId, at);

            return detectionRepository.findUnresolved(DetectionKind.MISSING_HEARTBEAT,
                            execution.schedulableId(), executionId)
                    .map(detection -> resolve(detection,
                            new MissingHeartbeatDetails(at, detection.missingHeartbeat().expectedHeartbeatAt()),
                            asOf));
        });

        resolution.ifPresent(d -> {
            log.info("Heartbeat of execution {} resumed", executionId);
            dispatcher.dispatch(d);
        });
        return resolution;
    }

    private Detection resolve(Detection original, DetectionDetails observed, Instant asOf) {
        Detection resolving = original.resolution(observed, asOf);
        detectionRepository.save(resolving);
        detectionRepository.markResolved(original.id(), asOf, resolving.id());
        return resolving;
    }
}
