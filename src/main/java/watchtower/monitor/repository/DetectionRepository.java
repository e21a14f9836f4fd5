package watchtower.monitor.repository;

import watchtower.monitor.model.Detection;
import watchtower.monitor.model.DetectionKind;
import watchtower.monitor.model.StatusChangeDetails;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for detections of every kind.
 * "Unresolved" always means: not resolved, and not itself a resolving detection.
 */
public interface DetectionRepository {

    /**
     * Save a new detection.
     *
     * @param detection the detection to save
     */
    void save(Detection detection);

    /**
     * Find a detection by ID.
     *
     * @param id the detection ID
     * @return the detection if found
     */
    Optional<Detection> findById(String id);

    /**
     * Find all detections of a schedulable.
     *
     * @param schedulableId the schedulable ID
     * @return detections ordered by detection time
     */
    List<Detection> findBySchedulable(String schedulableId);

    /**
     * Find the unresolved missing-execution detection for one expected occurrence.
     *
     * @param schedulableId the schedulable ID
     * @param expectedAt    the expected execution time
     * @return the detection if one exists
     */
    Optional<Detection> findUnresolvedMissingExecution(String schedulableId, Instant expectedAt);

    /**
     * Find the missing-execution detection with the latest expected time, resolved or not.
     *
     * @param schedulableId the schedulable ID
     * @return the latest detection if any
     */
    Optional<Detection> findLatestMissingExecution(String schedulableId);

    /**
     * Find unresolved missing-execution detections whose expected time lies in a closed interval.
     *
     * @param schedulableId the schedulable ID
     * @param from          inclusive lower bound
     * @param to            inclusive upper bound
     * @return matching detections, earliest expected time first
     */
    List<Detection> findUnresolvedMissingExecutionsBetween(String schedulableId, Instant from, Instant to);

    /**
     * Find the unresolved detection of a kind for a schedulable and, optionally, one execution.
     *
     * @param kind          detection kind
     * @param schedulableId the schedulable ID
     * @param executionId   the execution ID, or null for schedulable-level detections
     * @return the detection if one exists
     */
    Optional<Detection> findUnresolved(DetectionKind kind, String schedulableId, String executionId);

    /**
     * Find status-change detections of a schedulable that are still postponed
     * (neither triggered nor resolved).
     *
     * @param schedulableId the schedulable ID
     * @return outstanding detections, oldest first
     */
    List<Detection> findOutstandingStatusChanges(String schedulableId);

    /**
     * Find postponed status-change detections whose window has elapsed.
     *
     * @param now evaluation time
     * @return due detections, oldest first
     */
    List<Detection> findDuePostponed(Instant now);

    /**
     * Mark a detection resolved.
     *
     * @param id           the detection to resolve
     * @param resolvedAt   resolution time
     * @param resolvedById the resolving detection, or null when resolved silently
     * @return true if the detection was unresolved before this call
     */
    boolean markResolved(String id, Instant resolvedAt, String resolvedById);

    /**
     * Persist new postponement state of a status-change detection.
     *
     * @param id      the detection ID
     * @param details the new state
     */
    void updateStatusChange(String id, StatusChangeDetails details);
}
