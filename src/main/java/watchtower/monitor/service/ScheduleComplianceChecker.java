package watchtower.monitor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import watchtower.monitor.alert.AlertDispatchCoordinator;
import watchtower.monitor.config.MonitorConfig;
import watchtower.monitor.exception.InvalidScheduleException;
import watchtower.monitor.model.Detection;
import watchtower.monitor.model.Schedulable;
import watchtower.monitor.repository.DetectionRepository;
import watchtower.monitor.repository.SchedulableRepository;
import watchtower.monitor.schedule.CronSchedule;
import watchtower.monitor.schedule.ParsedSchedule;
import watchtower.monitor.schedule.RateSchedule;
import watchtower.monitor.schedule.ScheduleExpressionEvaluator;
import watchtower.monitor.store.Database;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Detects scheduled occurrences that produced no execution.
 *
 * <p>Each schedulable is checked in its own transaction holding the schedulable's row lock, so two
 * passes racing on the same schedulable cannot both record the same occurrence.
 *
 * <p>Cron schedules look at the most recent fire time only, once it is at least
 * {@link MonitorConfig#minConfirmDelay()} old. Rate schedules chain forward from the last detection
 * instead of from the clock.
 */
public class ScheduleComplianceChecker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ScheduleComplianceChecker.class);

    private final Database db;
    private final SchedulableRepository schedulableRepository;
    private final DetectionRepository detectionRepository;
    private final List<SchedulableAdapter> adapters;
    private final ScheduleExpressionEvaluator evaluator;
    private final AlertDispatchCoordinator dispatcher;
    private final MonitorConfig config;
    private final Clock clock;

    public ScheduleComplianceChecker(Database db,
            SchedulableRepository schedulableRepository,
            DetectionRepository detectionRepository,
            List<SchedulableAdapter> adapters,
            ScheduleExpressionEvaluator evaluator,
            AlertDispatchCoordinator dispatcher,
            MonitorConfig config,
            Clock clock) {
        this.db = db;
        this.schedulableRepository = schedulableRepository;
        this.detectionRepository = detectionRepository;
        this.adapters = List.copyOf(adapters);
        this.evaluator = evaluator;
        this.dispatcher = dispatcher;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            checkAll();
        } catch (Exception e) {
            log.error("Schedule compliance check error", e);
        }
    }

    /**
     * Check every enabled, scheduled Task and Workflow.
     *
     * @return number of missing-execution detections created
     */
    public int checkAll() {
        return checkAll(clock.instant());
    }

    public int checkAll(Instant asOf) {
        int created = 0;
        int checked = 0;

        for (SchedulableAdapter adapter : adapters) {
            for (Schedulable schedulable : adapter.enumerateCheckable()) {
                checked++;
                try {
                    if (check(adapter, schedulable, asOf).isPresent()) {
                        created++;
                    }
                } catch (InvalidScheduleException e) {
                    log.warn("Skipping {} {}: {}", adapter.kind(), schedulable.id(), e.getMessage());
                } catch (Exception e) {
                    log.error("Failed to check schedule of {} {}", adapter.kind(), schedulable.id(), e);
                }
            }
        }

        if (created > 0) {
            log.info("Schedule compliance: {} missing execution(s) detected across {} schedulable(s)", created, checked);
        }
        return created;
    }

    /**
     * Check one schedulable and dispatch the detection, if one was created.
     *
     * @throws InvalidScheduleException if the schedule cannot be parsed
     */
    public Optional<Detection> check(SchedulableAdapter adapter, Schedulable schedulable, Instant asOf) {
        Optional<Detection> created = db.inTransaction(() -> {
            Schedulable locked = schedulableRepository.lockForUpdate(schedulable.id()).orElse(null);
            if (locked == null || !locked.enabled() || !locked.isScheduled()) {
                return Optional.<Detection>empty();
            }

            ParsedSchedule parsed = evaluator.parse(locked.schedule());
            Optional<Detection> detection = switch (parsed.form()) {
                case CRON -> checkCron(adapter, locked, (CronSchedule) parsed, asOf);
                case RATE -> checkRate(adapter, locked, (RateSchedule) parsed, asOf);
            };
            detection.ifPresent(detectionRepository::save);
            return detection;
        });

        created.ifPresent(d -> {
            log.info("Missing execution of {} {} expected at {} ({} missing)", adapter.kind(), schedulable.id(),
                    d.missingExecution().expectedExecutionAt(), d.missingExecution().missingExecutionCount());
            dispatcher.dispatch(d, adapter.summaryTemplate());
        });
        return created;
    }

    private Optional<Detection> checkCron(SchedulableAdapter adapter, Schedulable schedulable,
            CronSchedule cron, Instant asOf) {
        Optional<Duration> sinceFire = cron.sinceLastFire(asOf);
        if (sinceFire.isEmpty()) {
            log.debug("{} has no fire time before {}", schedulable.id(), asOf);
            return Optional.empty();
        }
        Duration ago = sinceFire.get();
        if (ago.compareTo(config.minConfirmDelay()) < 0) {
            log.debug("{} fired {}s ago, too recent to confirm", schedulable.id(), ago.toSeconds());
            return Optional.empty();
        }

        Instant expectedAt = roundToSecond(asOf.minus(ago));
        if (predatesSchedule(schedulable, expectedAt)) {
            return Optional.empty();
        }
        if (adapter.existingDetectionFor(schedulable, expectedAt).isPresent()) {
            log.debug("{} already has a detection for {}", schedulable.id(), expectedAt);
            return Optional.empty();
        }

        int required = schedulable.requiredInstanceCount();
        int found = adapter.executionsStartedBetween(schedulable,
                expectedAt.minus(config.earlyWindow()), expectedAt.plus(config.lateWindow()));
        if (found >= required) {
            return Optional.empty();
        }
        if (isConcurrencyLimited(adapter, schedulable, expectedAt)) {
            return Optional.empty();
        }

        return Optional.of(adapter.makeDetection(schedulable, expectedAt, required - found, asOf));
    }

    private Optional<Detection> checkRate(SchedulableAdapter adapter, Schedulable schedulable,
            RateSchedule rate, Instant asOf) {
        Instant expectedAt = rate.before(asOf).truncatedTo(ChronoUnit.MINUTES);
        if (predatesSchedule(schedulable, expectedAt)) {
            return Optional.empty();
        }

        Optional<Detection> last = adapter.latestDetectionFor(schedulable);
        if (last.isPresent()) {
            Instant nextDue = rate.after(last.get().missingExecution().expectedExecutionAt());
            if (!nextDue.isBefore(expectedAt)) {
                log.debug("{} not due before {}", schedulable.id(), nextDue);
                return Optional.empty();
            }
        }

        int required = schedulable.requiredInstanceCount();
        int found = adapter.executionsStartedBetween(schedulable, expectedAt.minus(config.earlyWindow()), asOf);
        if (found >= required) {
            return Optional.empty();
        }
        if (isConcurrencyLimited(adapter, schedulable, expectedAt)) {
            return Optional.empty();
        }

        return Optional.of(adapter.makeDetection(schedulable, expectedAt, required - found, asOf));
    }

    private boolean predatesSchedule(Schedulable schedulable, Instant expectedAt) {
        Instant updatedAt = schedulable.scheduleUpdatedAt();
        if (updatedAt != null && expectedAt.isBefore(updatedAt)) {
            log.debug("{} expected at {} predates schedule update {}", schedulable.id(), expectedAt, updatedAt);
            return true;
        }
        return false;
    }

    private boolean isConcurrencyLimited(SchedulableAdapter adapter, Schedulable schedulable, Instant expectedAt) {
        Integer max = schedulable.maxConcurrency();
        if (max == null) {
            return false;
        }
        int running = adapter.concurrencyAt(schedulable, expectedAt);
        if (running >= max) {
            log.debug("{} had {} of {} concurrent execution(s) at {}", schedulable.id(), running, max, expectedAt);
            return true;
        }
        return false;
    }

    static Instant roundToSecond(Instant instant) {
        Instant truncated = instant.truncatedTo(ChronoUnit.SECONDS);
        return instant.getNano() >= 500_000_000 ? truncated.plusSeconds(1) : truncated;
    }
}
