package watchtower.monitor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import watchtower.monitor.alert.AlertDispatchCoordinator;
import watchtower.monitor.model.AlertCondition;
import watchtower.monitor.model.Detection;
import watchtower.monitor.model.Execution;
import watchtower.monitor.model.ExecutionStatus;
import watchtower.monitor.model.PostponementPolicy;
import watchtower.monitor.model.Schedulable;
import watchtower.monitor.model.Severity;
import watchtower.monitor.model.StatusChangeDetails;
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
 * Turns terminal execution statuses into status-change events, postponing failures and timeouts
 * when the schedulable asks for it.
 *
 * <p>Called from the execution write path right after a terminal status is persisted. A postponed
 * event is outstanding until one of:
 * <ul>
 * <li>enough consecutive failures on the same track arrive, which triggers it early;</li>
 * <li>enough consecutive successes arrive, which resolves it without an alert;</li>
 * <li>its window elapses, handled by {@link PostponedEventChecker}.</li>
 * </ul>
 *
 * <p>Runs under the schedulable's row lock, and claims the execution's terminal status before
 * acting, so repeating the call for the same status is a no-op.
 */
public class EventPostponementCoordinator {

    private static final Logger log = LoggerFactory.getLogger(EventPostponementCoordinator.class);

    private final Database db;
    private final SchedulableRepository schedulableRepository;
    private final ExecutionRepository executionRepository;
    private final DetectionRepository detectionRepository;
    private final AlertDispatchCoordinator dispatcher;
    private final Clock clock;

    public EventPostponementCoordinator(Database db,
            SchedulableRepository schedulableRepository,
            ExecutionRepository executionRepository,
            DetectionRepository detectionRepository,
            AlertDispatchCoordinator dispatcher,
            Clock clock) {
        this.db = db;
        this.schedulableRepository = schedulableRepository;
        this.executionRepository = executionRepository;
        this.detectionRepository = detectionRepository;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    public Optional<Detection> handleStatusChange(Execution execution) {
        return handleStatusChange(execution, clock.instant());
    }

    /**
     * Process the persisted terminal status of an execution.
     *
     * @param execution the execution whose status was just written
     * @param asOf      evaluation time
     * @return the status-change event created for this status, postponed or triggered
     */
    public Optional<Detection> handleStatusChange(Execution execution, Instant asOf) {
        if (!execution.status().isTerminal()) {
            return Optional.empty();
        }

        Outcome outcome = db.inTransaction(() -> process(execution, asOf));

        for (Detection triggered : outcome.toDispatch()) {
            dispatcher.dispatch(triggered);
        }
        return Optional.ofNullable(outcome.created());
    }

    private Outcome process(Execution execution, Instant asOf) {
        Schedulable schedulable = schedulableRepository.lockForUpdate(execution.schedulableId()).orElse(null);
        if (schedulable == null) {
            log.warn("Execution {} belongs to unknown schedulable {}", execution.id(), execution.schedulableId());
            return Outcome.NONE;
        }

        Execution current = executionRepository.findById(execution.id()).orElse(execution);
        ExecutionStatus status = current.status();
        if (!status.isTerminal()) {
            return Outcome.NONE;
        }
        if (!executionRepository.claimEventHandling(current.id(), status)) {
            log.debug("Status {} of execution {} already handled", status, current.id());
            return Outcome.NONE;
        }

        if (current.skipEventGeneration()) {
            log.debug("Event generation skipped for execution {}", current.id());
            return Outcome.NONE;
        }
        if (!schedulable.enabled()) {
            return Outcome.NONE;
        }
        if (isRedeployAbort(schedulable, current)) {
            log.debug("Execution {} aborted by redeploy at {}", current.id(), schedulable.serviceUpdatedAt());
            return Outcome.NONE;
        }

        List<Detection> toDispatch = new ArrayList<>();
        boolean sameTrackOutstanding = updateOutstanding(schedulable, status, asOf, toDispatch);

        Detection created = createEvent(schedulable, current, sameTrackOutstanding, asOf);
        if (created != null) {
            detectionRepository.save(created);
            StatusChangeDetails details = created.statusChange();
            if (details.isTriggered()) {
                log.info("Status {} of execution {} reported", status, current.id());
                toDispatch.add(created);
            } else {
                log.info("Status {} of execution {} postponed until {}", status, current.id(),
                        details.postponedUntil());
            }
        }
        return new Outcome(created, toDispatch);
    }

    /**
     * Apply a new status to the schedulable's postponed events. Both counters are streaks: a
     * success breaks the failure streak, and any other terminal status breaks the success streak.
     *
     * @return true if a postponed event on the same track as {@code status} was outstanding
     */
    private boolean updateOutstanding(Schedulable schedulable, ExecutionStatus status, Instant asOf,
            List<Detection> toDispatch) {
        boolean sameTrack = false;

        for (Detection outstanding : detectionRepository.findOutstandingStatusChanges(schedulable.id())) {
            StatusChangeDetails details = outstanding.statusChange();
            PostponementPolicy policy = policyFor(schedulable, details.status());

            if (status == ExecutionStatus.SUCCEEDED) {
                StatusChangeDetails updated = details
                        .withSuccessCount(details.successCount() + 1)
                        .withSameStatusCount(0);
                detectionRepository.updateStatusChange(outstanding.id(), updated);
                Integer required = policy.requiredSuccessCount();
                if (required != null && updated.successCount() >= required) {
                    detectionRepository.markResolved(outstanding.id(), asOf, null);
                    log.info("Postponed {} event {} cleared after {} success(es)",
                            details.status(), outstanding.id(), updated.successCount());
                }
            } else if (isPostponable(status) && status == details.status()) {
                sameTrack = true;
                StatusChangeDetails updated = details
                        .withSameStatusCount(details.sameStatusCount() + 1)
                        .withSuccessCount(0);
                Integer max = policy.maxPostponedCount();
                if (max != null && updated.sameStatusCount() >= max) {
                    updated = updated.triggered(asOf);
                    toDispatch.add(outstanding.toBuilder().details(updated).build());
                    log.info("Postponed {} event {} triggered early after {} occurrence(s)",
                            details.status(), outstanding.id(), updated.sameStatusCount());
                }
                detectionRepository.updateStatusChange(outstanding.id(), updated);
            } else if (details.successCount() > 0) {
                detectionRepository.updateStatusChange(outstanding.id(), details.withSuccessCount(0));
            }
        }
        return sameTrack;
    }

    private Detection createEvent(Schedulable schedulable, Execution execution, boolean sameTrackOutstanding,
            Instant asOf) {
        ExecutionStatus status = execution.status();
        AlertCondition condition = AlertCondition.forStatus(status);
        Severity severity = condition != null ? schedulable.eventSeverity(condition) : null;
        if (severity == null) {
            return null;
        }

        PostponementPolicy policy = policyFor(schedulable, status);
        StatusChangeDetails details;
        if (policy.isConfigured()) {
            if (sameTrackOutstanding) {
                return null;
            }
            details = new StatusChangeDetails(status, asOf.plusSeconds(policy.windowSeconds()), null, 1, 0);
            if (policy.maxPostponedCount() <= 1) {
                details = details.triggered(asOf);
            }
        } else {
            details = new StatusChangeDetails(status, null, asOf, 1, 0);
        }

        return Detection.builder()
                .schedulable(schedulable)
                .executionId(execution.id())
                .severity(severity)
                .detectedAt(asOf)
                .details(details)
                .build();
    }

    static boolean isRedeployAbort(Schedulable schedulable, Execution execution) {
        Instant redeploy = schedulable.serviceUpdatedAt();
        return execution.status() == ExecutionStatus.ABORTED
                && redeploy != null
                && execution.startedAt() != null
                && redeploy.isAfter(execution.startedAt());
    }

    private static boolean isPostponable(ExecutionStatus status) {
        return status == ExecutionStatus.FAILED || status == ExecutionStatus.TIMED_OUT;
    }

    private static PostponementPolicy policyFor(Schedulable schedulable, ExecutionStatus status) {
        return switch (status) {
            case FAILED -> schedulable.failurePostponement();
            case TIMED_OUT -> schedulable.timeoutPostponement();
            default -> PostponementPolicy.NONE;
        };
    }

    private record Outcome(Detection created, List<Detection> toDispatch) {
        static final Outcome NONE = new Outcome(null, List.of());
    }
}
