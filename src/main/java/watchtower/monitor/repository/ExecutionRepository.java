package watchtower.monitor.repository;

import watchtower.monitor.model.Execution;
import watchtower.monitor.model.ExecutionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for executions.
 */
public interface ExecutionRepository {

    /**
     * Save a new execution.
     *
     * @param execution the execution to save
     */
    void save(Execution execution);

    /**
     * Persist status, timestamps, stop reason and the skip flag of an execution.
     *
     * @param execution the new state
     */
    void update(Execution execution);

    /**
     * Find an execution by ID.
     *
     * @param id the execution ID
     * @return the execution if found
     */
    Optional<Execution> findById(String id);

    /**
     * Load an execution and lock its row until the current transaction ends.
     *
     * @param id the execution ID
     * @return the locked execution if found
     */
    Optional<Execution> lockForUpdate(String id);

    /**
     * Find all executions in a non-terminal status.
     *
     * @return in-progress executions, oldest first
     */
    List<Execution> findInProgress();

    /**
     * Count executions of a schedulable started inside a closed interval.
     *
     * @param schedulableId the owning schedulable
     * @param from          inclusive lower bound
     * @param to            inclusive upper bound
     * @return number of executions
     */
    int countStartedBetween(String schedulableId, Instant from, Instant to);

    /**
     * Count executions of a schedulable that were running at an instant.
     *
     * @param schedulableId    the owning schedulable
     * @param at               the instant to test
     * @param includeUnstarted also count created-but-not-started executions that were not done yet
     * @return number of overlapping executions
     */
    int countConcurrentAt(String schedulableId, Instant at, boolean includeUnstarted);

    /**
     * Find executions of a schedulable that were started and not yet done at some point of a closed
     * interval. An execution is done from the earlier of its finish and marked-done times.
     *
     * @param schedulableId the owning schedulable
     * @param from          inclusive lower bound
     * @param to            inclusive upper bound
     * @return overlapping executions, ordered by start
     */
    List<Execution> findOverlapping(String schedulableId, Instant from, Instant to);

    /**
     * Record that the terminal-status event for {@code status} has been handled.
     * Succeeds at most once per execution and status.
     *
     * @param id     the execution ID
     * @param status the terminal status being handled
     * @return true if this call claimed the status, false if it was already handled
     */
    boolean claimEventHandling(String id, ExecutionStatus status);

    /**
     * Store a heartbeat time.
     *
     * @param id the execution ID
     * @param at heartbeat time
     * @return true if the execution exists
     */
    boolean recordHeartbeat(String id, Instant at);
}
