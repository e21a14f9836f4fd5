package watchtower.monitor.model;

/**
 * Condition a severity can be configured for, either as the event severity of a
 * schedulable or as the per-target severity of an alert target link.
 */
public enum AlertCondition {
    MISSING_EXECUTION(Severity.ERROR),
    DELAYED_START(Severity.WARNING),
    MISSING_HEARTBEAT(Severity.WARNING),
    INSUFFICIENT_INSTANCES(Severity.ERROR),
    SUCCESS(Severity.INFO),
    FAILURE(Severity.ERROR),
    TIMEOUT(Severity.ERROR),
    ABORTED(Severity.WARNING),
    ABANDONED(Severity.ERROR);

    private final Severity defaultSeverity;

    AlertCondition(Severity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    /** Severity used for detections when the schedulable configures none. */
    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    /**
     * @return the condition reported for a terminal status, or null if the status never
     *         produces a status-change event
     */
    public static AlertCondition forStatus(ExecutionStatus status) {
        return switch (status) {
            case SUCCEEDED -> SUCCESS;
            case FAILED -> FAILURE;
            case TIMED_OUT -> TIMEOUT;
            case ABORTED -> ABORTED;
            case ABANDONED -> ABANDONED;
            default -> null;
        };
    }
}
