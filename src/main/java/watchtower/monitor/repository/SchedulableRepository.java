package watchtower.monitor.repository;

import watchtower.monitor.model.Schedulable;
import watchtower.monitor.model.SchedulableKind;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Tasks and Workflows as seen by the monitors.
 */
public interface SchedulableRepository {

    /**
     * Save a new schedulable together with its alert target links.
     *
     * @param schedulable the schedulable to save
     */
    void save(Schedulable schedulable);

    /**
     * Replace all settings of an existing schedulable, links included.
     *
     * @param schedulable the new state
     */
    void update(Schedulable schedulable);

    /**
     * Find a schedulable by ID.
     *
     * @param id the schedulable ID
     * @return the schedulable if found
     */
    Optional<Schedulable> findById(String id);

    /**
     * Load a schedulable and lock its row until the current transaction ends.
     * Serializes all detection decisions made for this schedulable.
     *
     * @param id the schedulable ID
     * @return the locked schedulable if found
     */
    Optional<Schedulable> lockForUpdate(String id);

    /**
     * Find enabled schedulables of one kind with a non-blank schedule.
     *
     * @param kind task or workflow
     * @return schedulables ordered by ID
     */
    List<Schedulable> findEnabledScheduled(SchedulableKind kind);

    /**
     * Find enabled tasks configured as services (minimum instance count set).
     *
     * @return service tasks ordered by ID
     */
    List<Schedulable> findEnabledServices();
}
