package watchtower.monitor.exception;

/**
 * Signals that a send was refused by one of the target's rate-limit tiers.
 * The underlying transport was never invoked.
 *
 * <p>Checked on purpose: a refusal is a decision the caller has to act on, not a bug.
 */
public class RateLimitExceededException extends Exception {

    private final String targetId;
    private final String detectionId;
    private final int tierIndex;

    public RateLimitExceededException(String targetId, String detectionId, int tierIndex) {
        super("Alert target " + targetId + " rate limited by tier " + tierIndex + " for detection " + detectionId);
        this.targetId = targetId;
        this.detectionId = detectionId;
        this.tierIndex = tierIndex;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getDetectionId() {
        return detectionId;
    }

    public int getTierIndex() {
        return tierIndex;
    }
}
