package watchtower.monitor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import watchtower.monitor.alert.AlertDispatchCoordinator;
import watchtower.monitor.config.MonitorConfig;
import watchtower.monitor.model.AlertCondition;
import watchtower.monitor.model.Detection;
import watchtower.monitor.model.DetectionKind;
import watchtower.monitor.model.Execution;
import watchtower.monitor.model.InsufficientInstancesDetails;
import watchtower.monitor.model.Schedulable;
import watchtower.monitor.repository.DetectionRepository;
import watchtower.monitor.repository.ExecutionRepository;
import watchtower.monitor.repository.SchedulableRepository;
import watchtower.monitor.store.Database;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Watches service tasks for running fewer instances than their configured minimum.
 *
 * <p>Each check takes the lowest instance count over the trailing lookback window, starting no
 * earlier than the end of the startup grace. At most one unresolved insufficient-instances
 * detection exists per service. It stays open while the shortfall lasts and is closed by a
 * resolving detection once the whole window has enough instances.
 */
public class ServiceConcurrencyMonitor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ServiceConcurrencyMonitor.class);

    private final Database db;
    private final SchedulableRepository schedulableRepository;
    private final ExecutionRepository executionRepository;
    private final DetectionRepository detectionRepository;
    private final AlertDispatchCoordinator dispatcher;
    private final MonitorConfig config;
    private final Clock clock;

    public ServiceConcurrencyMonitor(Database db,
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

    @Override
    public void run() {
        try {
            checkAll();
        } catch (Exception e) {
            log.error("Service concurrency check error", e);
        }
    }

    /**
     * @return number of detections created, resolving ones included
     */
    public int checkAll() {
        return checkAll(clock.instant());
    }

    public int checkAll(Instant asOf) {
        int changed = 0;
        for (Schedulable service : schedulableRepository.findEnabledServices()) {
            try {
                if (check(service, asOf).isPresent()) {
                    changed++;
                }
            } catch (Exception e) {
                log.error("Failed to check instances of service {}", service.id(), e);
            }
        }
        return changed;
    }

    /**
     * Check one service and dispatch what changed.
     *
     * @return the new detection, or the resolving detection if a shortfall ended
     */
    public Optional<Detection> check(Schedulable service, Instant asOf) {
        Instant from = asOf.minus(config.serviceLookback());
        Instant graceEnd = startupGraceEnd(service);
        if (graceEnd != null && graceEnd.isAfter(from)) {
            from = graceEnd;
        }
        if (!from.isBefore(asOf)) {
            log.debug("Service {} still in startup grace until {}", service.id(), graceEnd);
            return Optional.empty();
        }
        Instant windowStart = from;

        Optional<Detection> changed = db.inTransaction(() -> {
            Schedulable locked = schedulableRepository.lockForUpdate(service.id()).orElse(null);
            if (locked == null || !locked.enabled() || !locked.isService()) {
                return Optional.<Detection>empty();
            }

            int required = locked.minServiceInstanceCount();
            MinimumConcurrency minimum = minimumConcurrency(
                    executionRepository.findOverlapping(locked.id(), windowStart, asOf), windowStart, asOf);
            int observed = minimum.count();
            InsufficientInstancesDetails details = new InsufficientInstancesDetails(
                    minimum.start().truncatedTo(ChronoUnit.SECONDS),
                    minimum.end().truncatedTo(ChronoUnit.SECONDS),
                    observed, required);
            Optional<Detection> open = detectionRepository.findUnresolved(
                    DetectionKind.INSUFFICIENT_INSTANCES, locked.id(), null);

            if (observed < required) {
                if (open.isPresent()) {
                    log.debug("Service {} still short: {} of {}", locked.id(), observed, required);
                    return Optional.<Detection>empty();
                }
                Detection detection = Detection.builder()
                        .schedulable(locked)
                        .severity(locked.detectionSeverity(AlertCondition.INSUFFICIENT_INSTANCES))
                        .detectedAt(asOf)
                        .details(details)
                        .build();
                detectionRepository.save(detection);
                log.info("Service {} ran {} of {} required instance(s) between {} and {}", locked.id(), observed,
                        required, details.intervalStart(), details.intervalEnd());
                return Optional.of(detection);
            }

            if (open.isEmpty()) {
                return Optional.<Detection>empty();
            }
            Detection resolving = open.get().resolution(details, asOf);
            detectionRepository.save(resolving);
            detectionRepository.markResolved(open.get().id(), asOf, resolving.id());
            log.info("Service {} back to {} of {} required instance(s)", locked.id(), observed, required);
            return Optional.of(resolving);
        });

        changed.ifPresent(dispatcher::dispatch);
        return changed;
    }

    /**
     * Lowest number of executions running at once over a closed window, with the sub-interval
     * where it occurs. An execution runs from its start until it is done, exclusive.
     * Ties go to the latest sub-interval.
     */
    static MinimumConcurrency minimumConcurrency(List<Execution> executions, Instant from, Instant to) {
        TreeSet<Instant> points = new TreeSet<>();
        points.add(from);
        points.add(to);
        for (Execution execution : executions) {
            addInside(points, execution.startedAt(), from, to);
            addInside(points, doneAt(execution), from, to);
        }

        MinimumConcurrency minimum = null;
        Instant runStart = null;
        int runCount = -1;
        for (Instant point : points) {
            int count = runningAt(executions, point);
            if (runStart != null && count != runCount) {
                minimum = lower(minimum, new MinimumConcurrency(runStart, point, runCount));
                runStart = null;
            }
            if (runStart == null) {
                runStart = point;
                runCount = count;
            }
        }
        return lower(minimum, new MinimumConcurrency(runStart, to, runCount));
    }

    private static MinimumConcurrency lower(MinimumConcurrency current, MinimumConcurrency candidate) {
        return current == null || candidate.count() <= current.count() ? candidate : current;
    }

    private static int runningAt(List<Execution> executions, Instant at) {
        int count = 0;
        for (Execution execution : executions) {
            Instant done = doneAt(execution);
            if (execution.startedAt() != null && !execution.startedAt().isAfter(at)
                    && (done == null || done.isAfter(at))) {
                count++;
            }
        }
        return count;
    }

    private static Instant doneAt(Execution execution) {
        Instant finished = execution.finishedAt();
        Instant markedDone = execution.markedDoneAt();
        if (finished == null) {
            return markedDone;
        }
        return markedDone != null && markedDone.isBefore(finished) ? markedDone : finished;
    }

    private static void addInside(TreeSet<Instant> points, Instant at, Instant from, Instant to) {
        if (at != null && at.isAfter(from) && at.isBefore(to)) {
            points.add(at);
        }
    }

    /**
     * @return end of the startup grace, counted from the later of creation and the last redeploy
     */
    private Instant startupGraceEnd(Schedulable service) {
        Instant since = service.createdAt();
        Instant redeploy = service.serviceUpdatedAt();
        if (since == null || (redeploy != null && redeploy.isAfter(since))) {
            since = redeploy;
        }
        if (since == null) {
            return null;
        }
        Duration grace = service.serviceStartupGraceSeconds() != null
                ? Duration.ofSeconds(service.serviceStartupGraceSeconds())
                : config.defaultServiceStartupGrace();
        return since.plus(grace);
    }

    record MinimumConcurrency(Instant start, Instant end, int count) {
    }
}
