package watchtower.monitor.model;

/**
 * Postponement settings for one track (failures or timeouts) of a schedulable.
 * Any field may be null; the policy is active only when both the window and the max count are set.
 *
 * @param windowSeconds        how long to hold the first event back
 * @param maxPostponedCount    same-track repeats that force the event out early
 * @param requiredSuccessCount successes that clear the held event silently
 */
public record PostponementPolicy(Integer windowSeconds, Integer maxPostponedCount, Integer requiredSuccessCount) {

    public static final PostponementPolicy NONE = new PostponementPolicy(null, null, null);

    public boolean isConfigured() {
        return windowSeconds != null && maxPostponedCount != null;
    }
}
