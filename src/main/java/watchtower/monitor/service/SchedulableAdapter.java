package watchtower.monitor.service;

import watchtower.monitor.model.Detection;
import watchtower.monitor.model.Schedulable;
import watchtower.monitor.model.SchedulableKind;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * What {@link ScheduleComplianceChecker} needs to know about one kind of schedulable.
 * One implementation per kind; the checking algorithm itself is shared.
 */
public interface SchedulableAdapter {

    SchedulableKind kind();

    /** Enabled schedulables of this kind with a non-blank schedule. */
    List<Schedulable> enumerateCheckable();

    /** Unresolved missing-execution detection for exactly this expected time. */
    Optional<Detection> existingDetectionFor(Schedulable schedulable, Instant expectedAt);

    /** Missing-execution detection with the latest expected time, resolved or not. */
    Optional<Detection> latestDetectionFor(Schedulable schedulable);

    /** Executions started in the closed interval {@code [from, to]}. */
    int executionsStartedBetween(Schedulable schedulable, Instant from, Instant to);

    /** Executions that were occupying a concurrency slot at {@code at}. */
    int concurrencyAt(Schedulable schedulable, Instant at);

    /** Build, but do not persist, a missing-execution detection. */
    Detection makeDetection(Schedulable schedulable, Instant expectedAt, int missingCount, Instant detectedAt);

    /** Summary template for alerts about detections made through this adapter. */
    String summaryTemplate();
}
