package watchtower.monitor.repository;

import watchtower.monitor.model.AlertTarget;
import watchtower.monitor.model.RateLimitTier;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for alert targets and their rate-limit tiers.
 */
public interface AlertTargetRepository {

    /**
     * Save a new target with its tiers.
     *
     * @param target the target to save
     */
    void save(AlertTarget target);

    /**
     * Find a target by ID.
     *
     * @param id the target ID
     * @return the target if found
     */
    Optional<AlertTarget> findById(String id);

    /**
     * Load a target and lock its row so tier counters can be read and written atomically.
     *
     * @param id the target ID
     * @return the locked target if found
     */
    Optional<AlertTarget> lockForUpdate(String id);

    /**
     * Persist period start and counter of each tier.
     *
     * @param targetId the target ID
     * @param tiers    tiers to write, matched by index
     */
    void updateTiers(String targetId, List<RateLimitTier> tiers);
}
